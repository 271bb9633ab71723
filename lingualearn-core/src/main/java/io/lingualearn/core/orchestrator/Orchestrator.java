package io.lingualearn.core.orchestrator;

import io.lingualearn.core.capability.CapabilityBindings;
import io.lingualearn.core.capability.CapabilityRegistry;
import io.lingualearn.core.catalog.AgentDescriptor;
import io.lingualearn.core.catalog.Catalog;
import io.lingualearn.core.catalog.CatalogDiscovery;
import io.lingualearn.core.catalog.CatalogEntry;
import io.lingualearn.core.catalog.DiscoveryError;
import io.lingualearn.core.catalog.LanguagePair;
import io.lingualearn.core.catalog.WorkflowDescriptor;
import io.lingualearn.core.concurrent.CancellationSignal;
import io.lingualearn.core.embedding.EmbeddingIndex;
import io.lingualearn.core.embedding.RankedEntry;
import io.lingualearn.core.error.CatalogException;
import io.lingualearn.core.error.EmbeddingProviderException;
import io.lingualearn.core.error.RetryExhaustedException;
import io.lingualearn.core.error.VectorStoreException;
import io.lingualearn.core.error.WorkflowAbortedException;
import io.lingualearn.core.execution.ExecutionEngine;
import io.lingualearn.core.execution.ExecutionOptions;
import io.lingualearn.core.execution.ExecutionResult;
import io.lingualearn.core.execution.ExecutionStatus;
import io.lingualearn.core.resilience.RetryExecutor;
import io.lingualearn.core.resilience.RetryPolicy;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for hosts: loads the catalog, resolves a selection (explicit name or ranked
 * intent) and hands the chosen entry to the execution engine. Holds only component references.
 */
public final class Orchestrator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Orchestrator.class);

    private final CatalogDiscovery discovery;
    private final EmbeddingIndex index;
    private final ExecutionEngine engine;
    private final KeywordMatcher keywordMatcher;
    private final RetryExecutor retryExecutor;

    public Orchestrator(CatalogDiscovery discovery, EmbeddingIndex index, ExecutionEngine engine) {
        this(discovery, index, engine, new KeywordMatcher(), new RetryExecutor());
    }

    public Orchestrator(
        CatalogDiscovery discovery,
        EmbeddingIndex index,
        ExecutionEngine engine,
        KeywordMatcher keywordMatcher,
        RetryExecutor retryExecutor
    ) {
        this.discovery = Objects.requireNonNull(discovery, "discovery must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.keywordMatcher = Objects.requireNonNull(keywordMatcher, "keywordMatcher must not be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
    }

    public CatalogDiscovery discovery() {
        return discovery;
    }

    public ExecutionEngine engine() {
        return engine;
    }

    public Catalog loadCatalog(LanguagePair languages) {
        Catalog catalog = discovery.discover(languages);
        for (DiscoveryError error : catalog.errors()) {
            LOG.warn("Catalog entry skipped: {} ({})", error.source(), error.message());
        }
        return catalog;
    }

    /**
     * Binds configured capability names to agents of {@code catalog}, run through this engine.
     */
    public CapabilityRegistry capabilities(Catalog catalog, Map<String, String> bindings) {
        return CapabilityBindings.bind(catalog, engine, bindings);
    }

    public RankingResult rank(Catalog catalog, String intent, int topK) {
        return rank(catalog, intent, topK, CancellationSignal.none());
    }

    /**
     * Semantic ranking, falling back to keyword matching when the embedding provider or vector
     * store fails.
     */
    public RankingResult rank(Catalog catalog, String intent, int topK, CancellationSignal cancellation) {
        Objects.requireNonNull(catalog, "catalog must not be null");
        if (intent == null || intent.isBlank()) {
            throw new IllegalArgumentException("intent must not be blank");
        }
        try {
            return new RankingResult(index.rank(catalog, intent, topK, cancellation), true);
        } catch (EmbeddingProviderException | RetryExhaustedException | VectorStoreException e) {
            LOG.warn("Semantic search unavailable, falling back to keyword matching: {}", e.getMessage());
            return new RankingResult(keywordMatcher.rank(catalog, intent, topK), false);
        }
    }

    public CatalogEntry resolve(Catalog catalog, Selection selection, CancellationSignal cancellation) {
        Objects.requireNonNull(selection, "selection must not be null");
        if (selection.explicit()) {
            return catalog.find(selection.name())
                .orElseThrow(() -> new CatalogException("No agent or workflow named '" + selection.name() + "'"));
        }
        RankingResult ranking = rank(catalog, selection.intent(), 1, cancellation);
        if (ranking.isEmpty()) {
            throw new CatalogException("Nothing in the catalog matches '" + selection.intent() + "'");
        }
        RankedEntry best = ranking.entries().get(0);
        LOG.info("Intent '{}' resolved to '{}' (score {}, {})",
            selection.intent(), best.entityId(), String.format(Locale.ROOT, "%.3f", best.score()), ranking.semantic() ? "semantic" : "keyword");
        return catalog.find(best.entityId())
            .orElseThrow(() -> new CatalogException("Ranked entry '" + best.entityId() + "' is not in the catalog"));
    }

    public CompletableFuture<ExecutionResult> run(
        Catalog catalog,
        Selection selection,
        Map<String, String> environment,
        CancellationSignal cancellation
    ) {
        return run(catalog, selection, environment, cancellation, engine.defaultOptions());
    }

    public CompletableFuture<ExecutionResult> run(
        Catalog catalog,
        Selection selection,
        Map<String, String> environment,
        CancellationSignal cancellation,
        ExecutionOptions options
    ) {
        CatalogEntry entry = resolve(catalog, selection, cancellation);
        return execute(entry, environment, cancellation, options);
    }

    /**
     * Runs the selection, re-running the whole invocation while it aborts and the policy allows.
     * Each attempt gets a fresh output namespace.
     */
    public ExecutionResult runWithRetry(
        Catalog catalog,
        Selection selection,
        Map<String, String> environment,
        RetryPolicy policy,
        CancellationSignal cancellation
    ) {
        return runWithRetry(catalog, selection, environment, policy, cancellation, engine.defaultOptions());
    }

    public ExecutionResult runWithRetry(
        Catalog catalog,
        Selection selection,
        Map<String, String> environment,
        RetryPolicy policy,
        CancellationSignal cancellation,
        ExecutionOptions options
    ) {
        CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;
        CatalogEntry entry = resolve(catalog, selection, signal);
        try {
            return retryExecutor.executeWithRetry(
                () -> join(execute(entry, environment, signal, options)).orThrow(),
                policy,
                error -> error instanceof WorkflowAbortedException aborted
                    && aborted.result().status() != ExecutionStatus.CANCELLED,
                signal
            );
        } catch (WorkflowAbortedException e) {
            return e.result();
        } catch (RetryExhaustedException e) {
            if (e.lastError() instanceof WorkflowAbortedException aborted) {
                LOG.warn("'{}' still failing after {} attempt(s)", entry.name(), e.attempts());
                return aborted.result();
            }
            throw e;
        }
    }

    @Override
    public void close() {
        engine.close();
    }

    private CompletableFuture<ExecutionResult> execute(
        CatalogEntry entry,
        Map<String, String> environment,
        CancellationSignal cancellation,
        ExecutionOptions options
    ) {
        Map<String, String> env = environment == null ? Map.of() : environment;
        if (entry instanceof AgentDescriptor agent) {
            return engine.executeAgentAsync(agent, env, cancellation, options);
        }
        return engine.executeWorkflowAsync((WorkflowDescriptor) entry, env, cancellation, options);
    }

    private static ExecutionResult join(CompletableFuture<ExecutionResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
