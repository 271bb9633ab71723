package io.lingualearn.core.capability;

import io.lingualearn.core.error.CatalogException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capabilities looked up by interface type.
 */
public final class CapabilityRegistry {
    private final Map<Class<?>, Object> capabilities = new ConcurrentHashMap<>();

    public <T> void register(Class<T> type, T implementation) {
        capabilities.put(type, type.cast(implementation));
    }

    public <T> Optional<T> find(Class<T> type) {
        return Optional.ofNullable(capabilities.get(type)).map(type::cast);
    }

    public <T> T require(Class<T> type) {
        return find(type).orElseThrow(() -> new CatalogException("No agent provides " + type.getSimpleName()));
    }

    public Set<Class<?>> types() {
        return Set.copyOf(capabilities.keySet());
    }
}
