package io.lingualearn.core.embedding.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lingualearn.core.embedding.EmbeddingRecord;
import io.lingualearn.core.error.VectorStoreException;
import org.junit.jupiter.api.Test;

/**
 * Behaviour every {@link VectorStore} backend shares.
 */
abstract class VectorStoreContract {

    protected abstract VectorStore newStore();

    @Test
    void shouldStartEmpty() {
        VectorStore store = newStore();

        assertThat(store.count()).isZero();
        assertThat(store.dimension()).isEmpty();
        assertThat(store.scanAll()).isEmpty();
        assertThat(store.find("missing")).isEmpty();
    }

    @Test
    void shouldUpsertByEntityIdAndKeepFirstInsertionOrder() {
        VectorStore store = newStore();
        store.upsert(record("Board Capture", 1f, 0f, "board"));
        store.upsert(record("Speech Translator", 0f, 1f, "speech"));
        store.upsert(record("Board Capture", 0.5f, 0.5f, "board v2"));

        assertThat(store.count()).isEqualTo(2);
        assertThat(store.scanAll()).extracting(EmbeddingRecord::entityId)
            .containsExactly("Board Capture", "Speech Translator");
        assertThat(store.find("Board Capture")).hasValueSatisfying(found -> {
            assertThat(found.vector()).containsExactly(0.5f, 0.5f);
            assertThat(found.descriptiveText()).isEqualTo("board v2");
        });
        assertThat(store.dimension()).hasValue(2);
    }

    @Test
    void shouldTreatIdenticalUpsertAsNoOp() {
        VectorStore store = newStore();
        EmbeddingRecord record = record("Echo", 0.1f, 0.2f, "echo");

        store.upsert(record);
        store.upsert(record);

        assertThat(store.count()).isEqualTo(1);
        assertThat(store.find("Echo")).contains(record);
    }

    @Test
    void shouldRejectVectorsOfAnotherLength() {
        VectorStore store = newStore();
        store.upsert(record("Echo", 1f, 0f, "echo"));

        assertThatThrownBy(() -> store.upsert(new EmbeddingRecord("Other", new float[] {1f, 0f, 0f}, "Other", "other")))
            .isInstanceOf(VectorStoreException.class)
            .hasMessageContaining("does not match");
    }

    @Test
    void shouldClearEverything() {
        VectorStore store = newStore();
        store.upsert(record("Echo", 1f, 0f, "echo"));

        store.clear();

        assertThat(store.count()).isZero();
        assertThat(store.dimension()).isEmpty();
        store.upsert(new EmbeddingRecord("Wide", new float[] {1f, 0f, 0f}, "Wide", "wide"));
        assertThat(store.dimension()).hasValue(3);
    }

    private static EmbeddingRecord record(String id, float x, float y, String text) {
        return new EmbeddingRecord(id, new float[] {x, y}, id, text);
    }
}
