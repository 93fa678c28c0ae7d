package com.example.polystoresync.exception;

import java.util.concurrent.CompletableFuture;

/**
 * A store call missed its deadline. Adapter-level: converted to a failed operation, never
 * surfaced past the coordinator.
 * <p>
 * The call may still be running and may still land its write. {@link #getSettled()} completes
 * once the store call has actually returned or thrown.
 */
public class StoreCallTimeoutException extends RuntimeException {

    private final transient CompletableFuture<Void> settled;

    public StoreCallTimeoutException(String storeName, long timeoutMs) {
        this(storeName, timeoutMs, CompletableFuture.completedFuture(null));
    }

    public StoreCallTimeoutException(String storeName, long timeoutMs, CompletableFuture<Void> settled) {
        super("Call to " + storeName + " store timed out after " + timeoutMs + "ms");
        this.settled = settled;
    }

    public CompletableFuture<Void> getSettled() {
        return settled;
    }
}
