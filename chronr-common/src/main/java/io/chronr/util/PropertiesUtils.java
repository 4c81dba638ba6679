package io.chronr.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class PropertiesUtils {

    public static int getInt(Properties properties, String key, int defaultValue) {
        String v = properties.getProperty(key);
        if (v == null || v.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Illegal int value of [%s]: %s", key, v), e);
        }
    }

    /**
     * Load a properties file from the classpath. A missing resource gives an empty set.
     */
    public static Properties loadRs(String s) throws IOException {
        Properties p = new Properties();
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(s)) {
            if (in != null) {
                p.load(in);
            }
        }
        return p;
    }

    /**
     * Copy the system properties starting with <code>prefix</code> over <code>base</code>.
     */
    public static Properties overrideBySystem(Properties base, String prefix) {
        Properties p = new Properties();
        p.putAll(base);
        System.getProperties().forEach((k, v) -> {
            if (k.toString().startsWith(prefix)) {
                p.put(k, v);
            }
        });
        return p;
    }
}
