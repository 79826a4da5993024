package com.example.toolstore.core.error;

/**
 * Base type for every failure the core reports to its callers. Unchecked; the web layer maps
 * {@link #code()} onto a response status.
 */
public abstract class ToolStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected ToolStoreException(String message) {
        super(message);
    }

    protected ToolStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCode code();
}
