package io.lingualearn.core.error;

/**
 * A selection could not be resolved against the session catalog.
 */
public class CatalogException extends LinguaLearnException {

    public CatalogException(String message) {
        super(message);
    }
}
