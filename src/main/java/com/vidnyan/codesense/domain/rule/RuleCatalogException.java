package com.vidnyan.codesense.domain.rule;

/**
 * Raised when the rule catalog cannot be built. Fatal at start-up.
 */
public class RuleCatalogException extends RuntimeException {

    public RuleCatalogException(String message) {
        super(message);
    }

    public RuleCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
