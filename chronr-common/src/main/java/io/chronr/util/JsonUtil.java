package io.chronr.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;

/**
 * Json helpers for schemas, query descriptors and debug output.
 * Not meant for the query hot path.
 */
public class JsonUtil {
    public static final ObjectMapper jsonMapper = new ObjectMapper();

    static {
        jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        jsonMapper.configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public static String toJson(Object v) {
        try {
            return jsonMapper.writeValueAsString(v);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return jsonMapper.readValue(json, clazz);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Load a json document from the classpath.
     */
    public static <T> T loadResource(String filePath, Class<T> clazz) throws IOException {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(filePath)) {
            if (in == null) {
                throw new IOException(String.format("json resource [%s] not found", filePath));
            }
            return jsonMapper.readValue(in, clazz);
        }
    }
}
