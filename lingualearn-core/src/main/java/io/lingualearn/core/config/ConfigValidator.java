package io.lingualearn.core.config;

import io.lingualearn.core.config.model.EmbeddingConfig;
import io.lingualearn.core.config.model.LinguaLearnConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Startup checks. Hosts refuse to execute anything while {@link ValidationReport#ok()} is false.
 */
public final class ConfigValidator {
    static final Set<String> PROVIDERS = Set.of("openai", "hashing", "disabled");
    static final Set<String> BACKENDS = Set.of("sqlite", "file", "memory");

    private final ConfigService configService;

    public ConfigValidator(ConfigService configService) {
        this.configService = configService;
    }

    public ValidationReport validate(Path configPath, LinguaLearnConfig config) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Path catalogRoot = configService.catalogRoot(configPath, config);
        if (!Files.isDirectory(catalogRoot)) {
            errors.add("Catalog root does not exist: " + catalogRoot + " (run 'lingualearn onboard')");
        }

        EmbeddingConfig embedding = config.embedding();
        String provider = normalize(embedding.provider());
        if (!PROVIDERS.contains(provider)) {
            errors.add("Unknown embedding provider '" + embedding.provider() + "'; expected one of " + PROVIDERS);
        } else if (provider.equals("openai")) {
            if (!embedding.configured()) {
                errors.add("Embedding provider 'openai' needs embedding.apiKey or " + ConfigService.API_KEY_ENV);
            }
            if (embedding.apiBase() == null || embedding.apiBase().isBlank()) {
                errors.add("embedding.apiBase must not be blank");
            }
        } else if (provider.equals("disabled")) {
            warnings.add("Embedding provider is disabled; intent search uses keyword matching");
        }
        if (embedding.dimensions() < 0) {
            errors.add("embedding.dimensions must not be negative");
        }
        if (embedding.timeoutSeconds() <= 0) {
            errors.add("embedding.timeoutSeconds must be positive");
        }

        if (!BACKENDS.contains(normalize(config.vectorStore().backend()))) {
            errors.add("Unknown vector store backend '" + config.vectorStore().backend() + "'; expected one of " + BACKENDS);
        }

        if (config.execution().stepTimeoutSeconds() <= 0) {
            errors.add("execution.stepTimeoutSeconds must be positive");
        }
        if (config.execution().maxParallelSteps() < 1) {
            errors.add("execution.maxParallelSteps must be at least 1");
        }
        if (config.execution().maxConcurrentInvocations() < 1) {
            errors.add("execution.maxConcurrentInvocations must be at least 1");
        }
        if (config.retry().maxRetries() < 0) {
            errors.add("retry.maxRetries must not be negative");
        }
        if (config.retry().initialDelayMs() < 0) {
            errors.add("retry.initialDelayMs must not be negative");
        }
        if (config.search().topK() < 1) {
            errors.add("search.topK must be at least 1");
        }
        return new ValidationReport(errors, warnings);
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
