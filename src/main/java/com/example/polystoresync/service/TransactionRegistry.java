package com.example.polystoresync.service;

import com.example.polystoresync.model.SyncTransaction;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-flight transactions of one coordinator, keyed by transaction id.
 * Instance-owned so separate coordinators never share state.
 */
public class TransactionRegistry {

    private final Map<String, SyncTransaction> active = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public void register(SyncTransaction transaction) {
        lock.lock();
        try {
            if (active.putIfAbsent(transaction.getTransactionId(), transaction) != null) {
                throw new IllegalStateException("Transaction " + transaction.getTransactionId() + " already registered");
            }
        } finally {
            lock.unlock();
        }
    }

    public void deregister(String transactionId) {
        lock.lock();
        try {
            active.remove(transactionId);
        } finally {
            lock.unlock();
        }
    }

    public Optional<SyncTransaction> get(String transactionId) {
        lock.lock();
        try {
            return Optional.ofNullable(active.get(transactionId));
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return active.size();
        } finally {
            lock.unlock();
        }
    }
}
