package com.demoClinic.diagnosisDemo.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for loading JSON documents from the classpath.
 * Used for bundled reference data such as the prediction label catalog.
 */
public class JsonFileLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Loads a classpath resource as a UTF-8 String.
     *
     * @param resourcePath Path of the resource (e.g., "labels/known-prediction-labels.json")
     * @return The file content
     * @throws IOException if the resource doesn't exist or cannot be read
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a classpath resource and binds it to the given type.
     *
     * @param resourcePath Path of the resource
     * @param clazz Target type
     * @param <T> Target type
     * @return The bound object
     * @throws IOException if the resource doesn't exist, cannot be read or is not valid JSON for the type
     */
    public static <T> T loadAsObject(String resourcePath, Class<T> clazz) throws IOException {
        return objectMapper.readValue(loadAsString(resourcePath), clazz);
    }

    /**
     * Same as {@link #loadAsObject(String, Class)} but returns null instead of throwing.
     * Useful for optional resources.
     *
     * @param resourcePath Path of the resource
     * @param clazz Target type
     * @param <T> Target type
     * @return The bound object, or null if the resource is missing or unreadable
     */
    public static <T> T loadAsObjectOrNull(String resourcePath, Class<T> clazz) {
        try {
            return loadAsObject(resourcePath, clazz);
        } catch (IOException e) {
            log.warn("Failed to load JSON file from classpath: {}", resourcePath, e);
            return null;
        }
    }
}
