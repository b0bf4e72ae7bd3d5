package com.falkordb.cyphersat.facts;

/**
 * A fact-store backend could not answer a query.
 */
public class FactStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message description of the failure
     */
    public FactStoreException(final String message) {
        super(message);
    }

    /**
     * @param message description of the failure
     * @param cause the backend error
     */
    public FactStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
