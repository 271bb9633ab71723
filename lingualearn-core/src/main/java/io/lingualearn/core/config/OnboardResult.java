package io.lingualearn.core.config;

import java.nio.file.Path;

public record OnboardResult(
    Path configPath,
    Path catalogRoot,
    Path outputRoot,
    boolean createdConfig,
    boolean overwrittenConfig
) {
}
