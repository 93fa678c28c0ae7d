package com.example.polystoresync.store;

import com.example.polystoresync.model.DocumentRecord;
import com.example.polystoresync.model.StoreHealth;
import com.example.polystoresync.model.StoreRole;

/**
 * Contract every store must satisfy to take part in a synchronized write.
 * A {@code false} return means the store reports failure; implementations may also throw,
 * the coordinator converts either into a failed operation.
 */
public interface StoreAdapter {

    StoreRole getRole();

    boolean storeDocument(DocumentRecord document);

    /**
     * Deleting an id the store does not hold succeeds.
     */
    boolean deleteDocument(String docId);

    boolean documentExists(String docId);

    StoreHealth healthStatus();
}
