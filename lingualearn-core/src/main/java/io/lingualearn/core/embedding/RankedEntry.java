package io.lingualearn.core.embedding;

public record RankedEntry(String entityId, double score) {
}
