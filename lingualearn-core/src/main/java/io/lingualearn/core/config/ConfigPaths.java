package io.lingualearn.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".lingualearn", "config.json");
    }

    /**
     * Expands {@code ~/} and resolves relative paths against {@code baseDirectory}.
     */
    public static Path resolve(String rawPath, Path baseDirectory) {
        if (rawPath == null || rawPath.isBlank()) {
            return baseDirectory;
        }
        if (rawPath.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        Path path = Path.of(rawPath);
        return path.isAbsolute() ? path : baseDirectory.resolve(path).normalize();
    }

    public static Path baseDirectory(Path configPath) {
        Path parent = configPath.toAbsolutePath().getParent();
        return parent == null ? Path.of("").toAbsolutePath() : parent;
    }
}
