package io.lingualearn.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code backend} is one of {@code sqlite}, {@code file} or {@code memory}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VectorStoreConfig(String backend, String path) {

    public static VectorStoreConfig defaults() {
        return new VectorStoreConfig("sqlite", "vectors.db");
    }
}
