package com.adlanda.contextengine.repository;

import com.adlanda.contextengine.entity.ContextEntity;
import com.adlanda.contextengine.model.ContextTier;
import com.adlanda.contextengine.model.ContextType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data repository for stored contexts.
 *
 * Workspace scans use keyset pagination on {@code id} so a sweep over a large
 * workspace never loads more than one page at a time.
 */
@Repository
public interface ContextRepository extends JpaRepository<ContextEntity, String> {

    /**
     * Next page of a workspace, ordered by id.
     *
     * @param workspaceId Workspace to scan
     * @param tier        Optional tier filter (null for all)
     * @param type        Optional type filter (null for all)
     * @param afterId     Exclusive lower bound; empty string for the first page
     * @param pageable    Page size (page number must be 0)
     */
    @Query("SELECT c FROM ContextEntity c WHERE c.workspaceId = :workspaceId "
            + "AND (:tier IS NULL OR c.tier = :tier) "
            + "AND (:type IS NULL OR c.type = :type) "
            + "AND c.id > :afterId ORDER BY c.id ASC")
    List<ContextEntity> findPage(String workspaceId, ContextTier tier, ContextType type,
                                 String afterId, Pageable pageable);

    @Query("SELECT COUNT(c) FROM ContextEntity c WHERE c.workspaceId = :workspaceId "
            + "AND (:tier IS NULL OR c.tier = :tier) "
            + "AND (:type IS NULL OR c.type = :type)")
    long countFiltered(String workspaceId, ContextTier tier, ContextType type);

    @Query("SELECT c.id FROM ContextEntity c WHERE c.workspaceId = :workspaceId AND c.indexable = true ORDER BY c.id ASC")
    List<String> findIndexableIds(String workspaceId);

    @Query("SELECT c.id FROM ContextEntity c WHERE c.workspaceId = :workspaceId "
            + "AND c.indexable = true AND c.indexed = false ORDER BY c.id ASC")
    List<String> findUnindexedIds(String workspaceId);

    @Query("SELECT DISTINCT c.workspaceId FROM ContextEntity c ORDER BY c.workspaceId ASC")
    List<String> findDistinctWorkspaceIds();

    /**
     * Atomically bumps the usage counter. Leaves {@code updatedAt} untouched.
     *
     * @return number of rows updated (0 if the context no longer exists)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ContextEntity c SET c.usageCount = c.usageCount + 1, c.lastAccessed = :accessedAt WHERE c.id = :id")
    int incrementUsage(String id, Instant accessedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ContextEntity c SET c.indexed = :indexed WHERE c.id = :id")
    int updateIndexed(String id, boolean indexed);
}
