package io.lingualearn.core.embedding;

import io.lingualearn.core.error.EmbeddingProviderException;

public final class DisabledEmbeddingProvider implements EmbeddingProvider {

    @Override
    public String name() {
        return "disabled";
    }

    @Override
    public float[] embed(String text) {
        throw new EmbeddingProviderException("Embedding provider is disabled. Set embedding.provider in the config.");
    }
}
