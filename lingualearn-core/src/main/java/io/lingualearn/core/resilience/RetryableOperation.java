package io.lingualearn.core.resilience;

@FunctionalInterface
public interface RetryableOperation<T> {
    T call() throws Exception;
}
