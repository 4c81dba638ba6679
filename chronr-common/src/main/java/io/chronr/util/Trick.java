package io.chronr.util;

import java.util.HashSet;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

public class Trick {

    public static <T> int indexFirst(List<T> list, Predicate<T> where) {
        int i = 0;
        for (T t : list) {
            if (where.test(t)) {
                return i;
            }
            i++;
        }
        return -1;
    }

    /**
     * Throw if any two elements of <code>list</code> map to the same key.
     */
    public static <T, K> void notRepeated(List<T> list, Function<T, K> f) {
        if (list == null || list.size() == 0) {
            return;
        }
        HashSet<K> set = new HashSet<>(list.size());
        for (T t : list) {
            K k = f.apply(t);
            if (!set.add(k)) {
                throw new IllegalStateException(String.format("Duplicated %s", k));
            }
        }
    }
}
