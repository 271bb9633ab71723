package io.lingualearn.core.catalog;

import java.nio.file.Path;

/**
 * A manifest that was skipped during discovery. Never fatal.
 */
public record DiscoveryError(Path source, String message) {
}
