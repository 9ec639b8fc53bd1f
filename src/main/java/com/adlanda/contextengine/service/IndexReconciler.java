package com.adlanda.contextengine.service;

import com.adlanda.contextengine.model.IndexFailure;
import com.adlanda.contextengine.model.ReconciliationReport;
import com.adlanda.contextengine.model.VectorFilter;
import com.adlanda.contextengine.repository.ContextStore;
import com.adlanda.contextengine.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds and repairs divergence between the primary store and the vector index.
 */
@Service
public class IndexReconciler {

    private static final Logger log = LoggerFactory.getLogger(IndexReconciler.class);

    private final ContextStore contextStore;
    private final VectorIndex vectorIndex;
    private final ContextStorage contextStorage;
    private final IndexFailureTracker failureTracker;

    public IndexReconciler(ContextStore contextStore,
                           VectorIndex vectorIndex,
                           ContextStorage contextStorage,
                           IndexFailureTracker failureTracker) {
        this.contextStore = contextStore;
        this.vectorIndex = vectorIndex;
        this.contextStorage = contextStorage;
        this.failureTracker = failureTracker;
    }

    /**
     * Compares a workspace across both stores.
     *
     * Missing: indexable contexts with no vector point, or flagged as not indexed.
     * Orphaned: vector points with no indexable stored context. Contexts created
     * without indexing are never reported missing.
     */
    public ReconciliationReport findDivergence(String workspaceId) {
        Set<String> primaryIds = new HashSet<>(contextStore.findIndexableIds(workspaceId));
        Set<String> indexIds = new HashSet<>(vectorIndex.listIds(VectorFilter.forWorkspace(workspaceId)));

        Set<String> missing = new TreeSet<>(contextStore.findUnindexedIds(workspaceId));
        primaryIds.stream().filter(id -> !indexIds.contains(id)).forEach(missing::add);

        Set<String> orphaned = new TreeSet<>(indexIds);
        orphaned.removeAll(primaryIds);

        ReconciliationReport report = new ReconciliationReport(workspaceId, List.copyOf(missing), List.copyOf(orphaned));
        log.debug("Workspace {}: {} missing from index, {} orphaned in index",
                workspaceId, report.missingFromIndex().size(), report.orphanedInIndex().size());
        return report;
    }

    /**
     * Re-indexes missing contexts and deletes orphaned points.
     *
     * @return what was actually repaired
     */
    public ReconciliationReport repair(String workspaceId) {
        ReconciliationReport divergence = findDivergence(workspaceId);
        if (divergence.isConsistent()) {
            return divergence;
        }

        List<String> reindexed = divergence.missingFromIndex().isEmpty()
                ? List.of()
                : contextStorage.reindex(divergence.missingFromIndex());

        List<String> removed = List.of();
        if (!divergence.orphanedInIndex().isEmpty()) {
            try {
                vectorIndex.deleteBatch(divergence.orphanedInIndex());
                divergence.orphanedInIndex().forEach(failureTracker::resolve);
                removed = divergence.orphanedInIndex();
            } catch (RuntimeException e) {
                divergence.orphanedInIndex().forEach(
                        id -> failureTracker.record(id, IndexFailure.Operation.DELETE, e.getMessage()));
            }
        }

        log.info("Repaired workspace {}: re-indexed {} of {}, removed {} of {} orphans",
                workspaceId, reindexed.size(), divergence.missingFromIndex().size(),
                removed.size(), divergence.orphanedInIndex().size());
        return new ReconciliationReport(workspaceId, reindexed, removed);
    }
}
