package io.lingualearn.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Root of {@code config.json}. Relative paths are resolved against the directory holding the file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LinguaLearnConfig(
    CatalogConfig catalog,
    EmbeddingConfig embedding,
    @JsonAlias({"vector_store"}) VectorStoreConfig vectorStore,
    ExecutionConfig execution,
    RetryConfig retry,
    SearchConfig search,
    Map<String, String> capabilities
) {

    public static LinguaLearnConfig defaults() {
        return new LinguaLearnConfig(
            CatalogConfig.defaults(),
            EmbeddingConfig.defaults(),
            VectorStoreConfig.defaults(),
            ExecutionConfig.defaults(),
            RetryConfig.defaults(),
            SearchConfig.defaults(),
            Map.of()
        );
    }

    public LinguaLearnConfig withEmbedding(EmbeddingConfig replacement) {
        return new LinguaLearnConfig(catalog, replacement, vectorStore, execution, retry, search, capabilities);
    }
}
