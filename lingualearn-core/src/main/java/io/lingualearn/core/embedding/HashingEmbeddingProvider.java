package io.lingualearn.core.embedding;

import io.lingualearn.core.error.EmbeddingProviderException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Offline bag-of-words embedding: each token is hashed into one of {@code dimensions} buckets
 * and the result is L2-normalised. Texts sharing vocabulary land close together.
 */
public final class HashingEmbeddingProvider implements EmbeddingProvider {
    public static final int DEFAULT_DIMENSIONS = 256;

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "being", "as", "if", "but",
        "not", "no", "you", "your", "we", "our", "they", "their", "my", "me", "i", "keywords", "category"
    );

    private final int dimensions;

    public HashingEmbeddingProvider() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashingEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public String name() {
        return "hashing";
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        List<String> tokens = tokenize(text);
        if (tokens.isEmpty()) {
            throw new EmbeddingProviderException("Cannot embed text without any terms");
        }
        for (String token : tokens) {
            vector[Math.floorMod(token.hashCode(), dimensions)] += 1.0f;
        }

        double norm = 0.0;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
        return vector;
    }

    static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }
}
