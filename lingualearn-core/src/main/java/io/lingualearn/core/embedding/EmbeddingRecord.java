package io.lingualearn.core.embedding;

import java.util.Arrays;
import java.util.Objects;

/**
 * One stored vector per entity id.
 */
public record EmbeddingRecord(String entityId, float[] vector, String name, String descriptiveText) {

    public EmbeddingRecord {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(vector, "vector must not be null");
        if (vector.length == 0) {
            throw new IllegalArgumentException("vector must not be empty");
        }
        vector = vector.clone();
        name = name == null ? entityId : name;
        descriptiveText = descriptiveText == null ? "" : descriptiveText;
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    public int dimension() {
        return vector.length;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof EmbeddingRecord record
            && entityId.equals(record.entityId)
            && Arrays.equals(vector, record.vector)
            && name.equals(record.name)
            && descriptiveText.equals(record.descriptiveText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, Arrays.hashCode(vector), name, descriptiveText);
    }

    @Override
    public String toString() {
        return "EmbeddingRecord[entityId=" + entityId + ", dimension=" + vector.length + ", name=" + name + "]";
    }
}
