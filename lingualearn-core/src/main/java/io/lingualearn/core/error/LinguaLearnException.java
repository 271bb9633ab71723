package io.lingualearn.core.error;

/**
 * Base type for every typed failure raised by the orchestration core.
 * Callers that only need to distinguish "ours" from everything else catch this.
 */
public class LinguaLearnException extends RuntimeException {

    public LinguaLearnException(String message) {
        super(message);
    }

    public LinguaLearnException(String message, Throwable cause) {
        super(message, cause);
    }
}
