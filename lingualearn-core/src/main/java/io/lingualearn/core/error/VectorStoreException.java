package io.lingualearn.core.error;

/**
 * Read or write failure against the vector store.
 */
public class VectorStoreException extends LinguaLearnException {

    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
