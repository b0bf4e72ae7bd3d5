package com.falkordb.cyphersat.compiler;

/**
 * The pattern tree is internally inconsistent, for example a relationship
 * chain points at a node variable that no labeled node pattern declares.
 */
public class MalformedQueryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message description of the inconsistency
     */
    public MalformedQueryException(final String message) {
        super(message);
    }
}
