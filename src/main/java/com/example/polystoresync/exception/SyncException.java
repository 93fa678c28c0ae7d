package com.example.polystoresync.exception;

/**
 * Base of every failure the sync engine surfaces at its boundary.
 */
public abstract class SyncException extends RuntimeException {

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable kind, used by the tool layer and in result maps.
     */
    public abstract String getKind();
}
