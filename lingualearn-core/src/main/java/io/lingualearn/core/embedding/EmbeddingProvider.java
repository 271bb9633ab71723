package io.lingualearn.core.embedding;

/**
 * Turns text into a fixed-length vector. Failures are raised as
 * {@link io.lingualearn.core.error.EmbeddingProviderException}.
 */
public interface EmbeddingProvider {
    String name();

    float[] embed(String text);
}
