package com.example.polystoresync.service;

import com.example.polystoresync.exception.StoreCallTimeoutException;
import com.example.polystoresync.model.StoreRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every store call on a dedicated pool under a hard deadline, so a hung store fails its
 * operation instead of stalling the phase.
 * <p>
 * Cancelling a timed-out call only interrupts it; JDBC and Mongo drivers may finish the write
 * anyway. The timeout therefore carries a handle that completes when the call really ends, and
 * {@link #awaitSettled} lets rollback wait for it before undoing.
 */
public class StoreCallExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StoreCallExecutor.class);

    private final ExecutorService executor;
    private final long timeoutMs;
    private final long settleTimeoutMs;

    public StoreCallExecutor(long timeoutMs, int maxThreads) {
        this(timeoutMs, timeoutMs * 5, maxThreads);
    }

    public StoreCallExecutor(long timeoutMs, long settleTimeoutMs, int maxThreads) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Store call timeout must be positive");
        }
        if (settleTimeoutMs < 0) {
            throw new IllegalArgumentException("Settle timeout must not be negative");
        }
        this.timeoutMs = timeoutMs;
        this.settleTimeoutMs = settleTimeoutMs;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(maxThreads, 1), r -> {
            Thread t = new Thread(r, "store-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public <T> T call(StoreRole role, Callable<T> storeCall) {
        CompletableFuture<Void> settled = new CompletableFuture<>();
        AtomicBoolean claimed = new AtomicBoolean();
        Future<T> future = executor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                throw new CancellationException(role.getStoreName() + " store call abandoned before it started");
            }
            try {
                return storeCall.call();
            } finally {
                settled.complete(null);
            }
        });
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (claimed.compareAndSet(false, true)) {
                // never reached the store
                settled.complete(null);
            }
            logger.warn("Call to {} store timed out after {}ms", role.getStoreName(), timeoutMs);
            throw new StoreCallTimeoutException(role.getStoreName(), timeoutMs, settled);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(role.getStoreName() + " store call failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calling " + role.getStoreName() + " store", e);
        }
    }

    /**
     * Wait for a timed-out call to actually finish.
     *
     * @return whether the call ended within the settle timeout
     */
    public boolean awaitSettled(StoreRole role, CompletableFuture<Void> settled) {
        if (settled == null || settled.isDone()) {
            return true;
        }
        try {
            settled.get(settleTimeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            logger.error("Timed-out call to {} store still running after {}ms", role.getStoreName(), settleTimeoutMs);
            return false;
        } catch (ExecutionException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public long getSettleTimeoutMs() {
        return settleTimeoutMs;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
