package io.lingualearn.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code provider} is one of {@code openai}, {@code hashing} or {@code disabled}.
 * {@code dimensions} of {@code 0} keeps the provider's default vector length.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingConfig(
    String provider,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    String model,
    int dimensions,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig("openai", "", "https://api.openai.com/v1", "text-embedding-3-small", 0, 30);
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public EmbeddingConfig withApiKey(String key) {
        return new EmbeddingConfig(provider, key, apiBase, model, dimensions, timeoutSeconds);
    }
}
