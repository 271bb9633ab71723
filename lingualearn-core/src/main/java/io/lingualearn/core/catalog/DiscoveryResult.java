package io.lingualearn.core.catalog;

import java.util.List;

public record DiscoveryResult<T>(List<T> entries, List<DiscoveryError> errors) {
    public DiscoveryResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
