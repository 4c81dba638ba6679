package io.chronr.query.func;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import io.chronr.query.result.HistogramAggregate;
import io.chronr.query.result.Point;
import io.chronr.query.result.SeriesValues;

public class HistogramCombinerTest {

    private static SeriesValues<Double> value(String key, double v) {
        return SeriesValues.single(key, 0, v);
    }

    @Test
    public void testBuckets() {
        HistogramCombiner combiner = new HistogramCombiner(100, 2);
        Assert.assertEquals(2, combiner.bucketCount());
        Assert.assertEquals(0, combiner.bucketOf(0));
        Assert.assertEquals(0, combiner.bucketOf(9.99));
        Assert.assertEquals(1, combiner.bucketOf(10.01));
        Assert.assertEquals(1, combiner.bucketOf(99.99));
        Assert.assertEquals(-1, combiner.bucketOf(100));
        Assert.assertEquals(-1, combiner.bucketOf(-0.5));
        Assert.assertEquals(-1, combiner.bucketOf(Double.NaN));
        Assert.assertEquals(-1, combiner.bucketOf(Double.POSITIVE_INFINITY));
    }

    @Test
    public void testDefaultBuckets() {
        HistogramCombiner combiner = new HistogramCombiner(2000, HistogramCombiner.DEFAULT_BUCKETS);
        HistogramAggregate empty = (HistogramAggregate) combiner.newAccumulator().result();
        Assert.assertEquals(10, empty.bucketCount());
        Assert.assertEquals(2000.0, empty.bounds()[9], 0.0);

        // A value on a bound opens the next bucket.
        Assert.assertEquals(4, combiner.bucketOf(empty.bounds()[3]));
        Assert.assertEquals(4, combiner.bucketOf(33));
        Assert.assertEquals(5, combiner.bucketOf(45));
        Assert.assertEquals(9, combiner.bucketOf(1999.9));
    }

    @Test
    public void testAccumulate() {
        HistogramCombiner combiner = new HistogramCombiner(100, 2);
        Combiner.Accumulator acc = combiner.newAccumulator();
        acc.add(value("a", 1));
        acc.add(value("b", 50));
        acc.add(value("c", 500));
        acc.add(value("d", Double.NaN));
        acc.add(SeriesValues.empty("e"));
        acc.add(SeriesValues.single("f", 0, 3L));

        HistogramAggregate h = (HistogramAggregate) acc.result();
        Assert.assertArrayEquals(new int[]{2, 1}, h.counts());
        Assert.assertEquals(3, h.total());
    }

    @Test
    public void testOrderAndGrouping() {
        HistogramCombiner combiner = new HistogramCombiner(1000, 7);
        Random random = new Random(42);
        List<SeriesValues<Double>> values = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            values.add(value("s" + i, random.nextDouble() * 1200 - 100));
        }

        Combiner.Accumulator inOrder = combiner.newAccumulator();
        values.forEach(inOrder::add);
        HistogramAggregate expected = (HistogramAggregate) inOrder.result();

        Collections.shuffle(values, random);
        Combiner.Accumulator left = combiner.newAccumulator();
        Combiner.Accumulator right = combiner.newAccumulator();
        for (int i = 0; i < values.size(); i++) {
            (i < 77 ? left : right).add(values.get(i));
        }
        right.merge(left);
        Assert.assertEquals(expected, right.result());
    }

    @Test(expected = IllegalStateException.class)
    public void testMultiPoints() {
        Combiner.Accumulator acc = new HistogramCombiner(100, 2).newAccumulator();
        List<Point<Double>> points = new ArrayList<>();
        points.add(Point.of(1L, 1.0));
        points.add(Point.of(2L, 2.0));
        acc.add(new SeriesValues<>("s", points));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIllegalMax() {
        new HistogramCombiner(1, 10);
    }
}
