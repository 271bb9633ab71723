package io.lingualearn.core.error;

/**
 * Wraps the last underlying error once an operation has used up its retries.
 */
public class RetryExhaustedException extends LinguaLearnException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("Operation failed after " + attempts + " attempt(s): " + describe(lastError), lastError);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }

    public Throwable lastError() {
        return getCause();
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
