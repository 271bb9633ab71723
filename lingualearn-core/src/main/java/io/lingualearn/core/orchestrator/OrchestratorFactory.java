package io.lingualearn.core.orchestrator;

import io.lingualearn.core.catalog.CatalogDiscovery;
import io.lingualearn.core.config.ConfigService;
import io.lingualearn.core.config.model.EmbeddingConfig;
import io.lingualearn.core.config.model.ExecutionConfig;
import io.lingualearn.core.config.model.LinguaLearnConfig;
import io.lingualearn.core.embedding.DisabledEmbeddingProvider;
import io.lingualearn.core.embedding.EmbeddingIndex;
import io.lingualearn.core.embedding.EmbeddingProvider;
import io.lingualearn.core.embedding.HashingEmbeddingProvider;
import io.lingualearn.core.embedding.OpenAiEmbeddingProvider;
import io.lingualearn.core.embedding.store.FileVectorStore;
import io.lingualearn.core.embedding.store.InMemoryVectorStore;
import io.lingualearn.core.embedding.store.SqliteVectorStore;
import io.lingualearn.core.embedding.store.VectorStore;
import io.lingualearn.core.execution.DefaultProcessFactory;
import io.lingualearn.core.execution.ExecutionEngine;
import io.lingualearn.core.execution.ExecutionListener;
import io.lingualearn.core.execution.ExecutionOptions;
import io.lingualearn.core.resilience.RetryExecutor;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Wires an {@link Orchestrator} from configuration.
 */
public final class OrchestratorFactory {
    private final ConfigService configService;

    public OrchestratorFactory(ConfigService configService) {
        this.configService = configService;
    }

    public Orchestrator create(Path configPath, LinguaLearnConfig config, ExecutionListener listener) {
        RetryExecutor retryExecutor = new RetryExecutor();
        EmbeddingIndex index = new EmbeddingIndex(
            embeddingProvider(config.embedding()),
            vectorStore(configPath, config),
            retryExecutor,
            config.retry().toPolicy()
        );
        ExecutionConfig execution = config.execution();
        ExecutionOptions options = new ExecutionOptions(
            Duration.ofSeconds(execution.stepTimeoutSeconds()),
            configService.outputRoot(configPath, config),
            execution.maxParallelSteps()
        );
        ExecutionEngine engine = new ExecutionEngine(
            new DefaultProcessFactory(),
            options,
            listener,
            execution.maxConcurrentInvocations()
        );
        return new Orchestrator(
            new CatalogDiscovery(configService.catalogRoot(configPath, config)),
            index,
            engine,
            new KeywordMatcher(),
            retryExecutor
        );
    }

    public EmbeddingProvider embeddingProvider(EmbeddingConfig config) {
        String provider = config.provider() == null ? "" : config.provider().trim().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "openai" -> new OpenAiEmbeddingProvider(
                config.apiKey(),
                config.apiBase(),
                config.model(),
                config.dimensions(),
                Duration.ofSeconds(Math.max(1, config.timeoutSeconds()))
            );
            case "hashing" -> config.dimensions() > 0
                ? new HashingEmbeddingProvider(config.dimensions())
                : new HashingEmbeddingProvider();
            default -> new DisabledEmbeddingProvider();
        };
    }

    public VectorStore vectorStore(Path configPath, LinguaLearnConfig config) {
        String backend = config.vectorStore().backend() == null
            ? ""
            : config.vectorStore().backend().trim().toLowerCase(Locale.ROOT);
        Path path = configService.vectorStorePath(configPath, config);
        return switch (backend) {
            case "file" -> new FileVectorStore(path);
            case "memory" -> new InMemoryVectorStore();
            default -> new SqliteVectorStore(path);
        };
    }
}
