package com.example.polystoresync.service;

import com.example.polystoresync.exception.ConsistencyValidationException;
import com.example.polystoresync.model.ConsistencyReport;
import com.example.polystoresync.model.StoreHealth;
import com.example.polystoresync.model.StoreRole;
import com.example.polystoresync.store.StoreAdapter;
import com.example.polystoresync.store.StoreTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Checks whether a document is present in every store. Read-only: repeated runs against
 * unchanged stores produce equal reports.
 */
public class ConsistencyValidator {

    private static final Logger logger = LoggerFactory.getLogger(ConsistencyValidator.class);

    private final StoreTopology topology;
    private final StoreCallExecutor storeCalls;

    public ConsistencyValidator(StoreTopology topology, StoreCallExecutor storeCalls) {
        this.topology = topology;
        this.storeCalls = storeCalls;
    }

    /**
     * @throws ConsistencyValidationException when every wired store's check errored
     */
    public ConsistencyReport validate(String docId) {
        ConsistencyReport report = new ConsistencyReport(docId);
        int wired = 0;
        int errored = 0;
        RuntimeException lastError = null;

        for (StoreRole role : StoreRole.values()) {
            StoreAdapter adapter = topology.adapterFor(role);
            if (adapter == null) {
                report.markStore(role, false);
                report.addInconsistency(role, "store not configured");
                report.setStoreState(role, Map.of("status", StoreHealth.NOT_CONFIGURED));
                continue;
            }
            wired++;
            try {
                boolean exists = storeCalls.call(role, () -> adapter.documentExists(docId));
                report.markStore(role, exists);
                report.setStoreState(role, Map.of("exists", exists));
                if (!exists) {
                    report.addInconsistency(role, "document missing");
                }
            } catch (RuntimeException e) {
                errored++;
                lastError = e;
                logger.warn("Consistency check against {} failed for {}: {}",
                        role.getStoreName(), docId, e.getMessage());
                report.markStore(role, false);
                report.addInconsistency(role, "validation error: " + e.getMessage());
                report.setStoreState(role, Map.of("error", String.valueOf(e.getMessage())));
            }
        }

        if (wired > 0 && errored == wired) {
            throw new ConsistencyValidationException(
                    "Consistency validation failed for " + docId + ": no store could be checked", docId, lastError);
        }
        if (!report.isOverallConsistent()) {
            logger.debug("Document {} inconsistent: {}", docId, report.getInconsistencies());
        }
        return report;
    }
}
