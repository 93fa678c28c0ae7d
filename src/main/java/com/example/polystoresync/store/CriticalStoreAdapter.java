package com.example.polystoresync.store;

import com.example.polystoresync.model.DocumentRecord;

import java.util.Optional;

/**
 * Critical stores can also hand the document back, which the coordinator uses for reads and
 * for journaling the pre-write image.
 */
public interface CriticalStoreAdapter extends StoreAdapter {

    Optional<DocumentRecord> retrieveDocument(String docId);
}
