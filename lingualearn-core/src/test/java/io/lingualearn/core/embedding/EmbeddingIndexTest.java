package io.lingualearn.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lingualearn.core.catalog.AgentDescriptor;
import io.lingualearn.core.catalog.Catalog;
import io.lingualearn.core.concurrent.CancellationSignal;
import io.lingualearn.core.embedding.store.InMemoryVectorStore;
import io.lingualearn.core.error.EmbeddingProviderException;
import io.lingualearn.core.resilience.Jitter;
import io.lingualearn.core.resilience.RetryClassifier;
import io.lingualearn.core.resilience.RetryExecutor;
import io.lingualearn.core.resilience.RetryPolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

class EmbeddingIndexTest {

    private final KeywordAxisProvider provider = new KeywordAxisProvider();
    private final InMemoryVectorStore store = new InMemoryVectorStore();
    private final EmbeddingIndex index = new EmbeddingIndex(
        provider,
        store,
        new RetryExecutor(new RetryClassifier(), (delay, cancellation) -> { }, Jitter.none()),
        new RetryPolicy(2, Duration.ofMillis(1))
    );

    private final Catalog catalog = new Catalog(
        List.of(
            agent("Board Capture", "Photographs the whiteboard and extracts notes", "Vision"),
            agent("Speech Translator", "Translates speech audio into the target language", "Language")
        ),
        List.of(),
        List.of()
    );

    @Test
    void shouldRankSpeechTranslatorFirstForAudioIntent() {
        List<RankedEntry> ranked = index.rank(catalog, "translate the audio of my lecture", 2, CancellationSignal.none());

        assertThat(ranked).extracting(RankedEntry::entityId).containsExactly("Speech Translator", "Board Capture");
        assertThat(ranked.get(0).score()).isGreaterThanOrEqualTo(ranked.get(1).score());
    }

    @Test
    void shouldReturnAtMostTopKResults() {
        assertThat(index.rank(catalog, "whiteboard photo", 1, CancellationSignal.none()))
            .extracting(RankedEntry::entityId)
            .containsExactly("Board Capture");
        assertThat(index.rank(catalog, "whiteboard photo", 0, CancellationSignal.none())).isEmpty();
    }

    @Test
    void shouldComputeMissingEmbeddingsOnceAndReuseThem() {
        index.rank(catalog, "speech", 3, CancellationSignal.none());
        int callsAfterFirstRank = provider.calls.size();

        index.rank(catalog, "board", 3, CancellationSignal.none());

        assertThat(callsAfterFirstRank).isEqualTo(3);
        assertThat(provider.calls.size()).isEqualTo(4);
        assertThat(store.count()).isEqualTo(2);
    }

    @Test
    void shouldReembedEntriesWhoseDescriptionChanged() {
        index.ensureIndexed(catalog, CancellationSignal.none());
        Catalog updated = new Catalog(
            List.of(
                agent("Board Capture", "Photographs the whiteboard and extracts notes", "Vision"),
                agent("Speech Translator", "Reads whiteboard photos", "Vision")
            ),
            List.of(),
            List.of()
        );

        int recomputed = index.ensureIndexed(updated, CancellationSignal.none());

        assertThat(recomputed).isEqualTo(1);
        assertThat(store.find("Speech Translator")).hasValueSatisfying(record ->
            assertThat(record.descriptiveText()).contains("Reads whiteboard photos"));
    }

    @Test
    void shouldBreakTiesInCatalogOrder() {
        Catalog twins = new Catalog(
            List.of(agent("Alpha", "speech", ""), agent("Beta", "speech", "")),
            List.of(),
            List.of()
        );

        List<RankedEntry> ranked = index.rank(twins, "speech", 2, CancellationSignal.none());

        assertThat(ranked).extracting(RankedEntry::entityId).containsExactly("Alpha", "Beta");
        assertThat(ranked.get(0).score()).isEqualTo(ranked.get(1).score());
    }

    @Test
    void shouldIgnoreStoredIdsOutsideTheCatalog() {
        index.storeEmbedding("Retired Agent", new float[] {1f, 0f, 0f}, "speech");

        List<RankedEntry> ranked = index.rank(catalog, "speech", 5, CancellationSignal.none());

        assertThat(ranked).extracting(RankedEntry::entityId).doesNotContain("Retired Agent");
        assertThat(index.search(new float[] {1f, 0f, 0f}, 1)).containsExactly("Retired Agent");
    }

    @Test
    void shouldRebuildWhenProviderDimensionChanges() {
        index.storeEmbedding("Board Capture", new float[] {1f, 0f, 0f, 0f, 0f}, "old text");

        index.rank(catalog, "speech", 2, CancellationSignal.none());

        assertThat(store.dimension()).hasValue(3);
        assertThat(store.count()).isEqualTo(2);
    }

    @Test
    void shouldRoundTripStoredEmbedding() {
        index.storeEmbedding("Echo", new float[] {0.3f, 0.4f, 0.5f}, "echo");

        assertThat(index.retrieveEmbedding("Echo")).hasValueSatisfying(vector ->
            assertThat(vector).containsExactly(0.3f, 0.4f, 0.5f));
        assertThat(index.retrieveEmbedding("Nobody")).isEmpty();
    }

    @Test
    void shouldRetryTransientProviderFailures() {
        provider.failuresRemaining = 2;

        float[] vector = index.embed("speech");

        assertThat(vector).hasSize(3);
        assertThat(provider.calls).hasSize(3);
    }

    @Test
    void shouldStopIndexingWhenCancelled() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThatThrownBy(() -> index.ensureIndexed(catalog, signal)).isInstanceOf(CancellationException.class);
        assertThat(provider.calls).isEmpty();
    }

    private static AgentDescriptor agent(String name, String description, String category) {
        return new AgentDescriptor(name, description, "/bin/true", Path.of("."), Map.of(), List.of(), Set.of(), category);
    }

    /**
     * Three axes: speech/audio/translate, board/whiteboard/photo, everything else.
     */
    private static final class KeywordAxisProvider implements EmbeddingProvider {
        private final List<String> calls = new ArrayList<>();
        private int failuresRemaining;

        @Override
        public String name() {
            return "keyword-axis";
        }

        @Override
        public float[] embed(String text) {
            calls.add(text);
            if (failuresRemaining > 0) {
                failuresRemaining--;
                throw new EmbeddingProviderException("overloaded", 503, null, null);
            }
            String lower = text.toLowerCase(Locale.ROOT);
            float speech = count(lower, "speech", "audio", "translat");
            float board = count(lower, "board", "photo");
            return new float[] {speech, board, 0.1f};
        }

        private static float count(String text, String... words) {
            float total = 0;
            for (String word : words) {
                if (text.contains(word)) {
                    total++;
                }
            }
            return total;
        }
    }
}
