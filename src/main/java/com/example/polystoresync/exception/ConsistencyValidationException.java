package com.example.polystoresync.exception;

/**
 * The validation itself could not run. Finding an inconsistency is not an error.
 */
public class ConsistencyValidationException extends SyncException {

    private final String docId;

    public ConsistencyValidationException(String message, String docId, Throwable cause) {
        super(message, cause);
        this.docId = docId;
    }

    public String getDocId() {
        return docId;
    }

    @Override
    public String getKind() {
        return "consistency_validation_failure";
    }
}
