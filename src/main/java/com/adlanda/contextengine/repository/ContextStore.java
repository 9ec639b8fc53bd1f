package com.adlanda.contextengine.repository;

import com.adlanda.contextengine.model.Context;
import com.adlanda.contextengine.model.ContextTier;
import com.adlanda.contextengine.model.ContextType;
import com.adlanda.contextengine.model.ContextVersion;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Primary store for contexts and their version history. Source of truth.
 *
 * Implementations throw {@link com.adlanda.contextengine.exception.StoreUnavailableException}
 * when the underlying store cannot be reached.
 */
public interface ContextStore {

    /**
     * Stores a new context and assigns its id.
     */
    Context insert(Context context);

    List<Context> insertAll(List<Context> contexts);

    Optional<Context> findById(String id);

    /**
     * Returns the contexts that exist; unknown ids are omitted.
     */
    List<Context> findAllByIds(Collection<String> ids);

    /**
     * Replaces the mutable fields of an existing context.
     *
     * {@code usageCount} and {@code lastAccessed} are owned by
     * {@link #incrementUsage(String, Instant)} and are not overwritten here.
     *
     * @return the stored context, or empty if the id is unknown
     */
    Optional<Context> update(Context context);

    /**
     * Like {@link #update(Context)}, but first snapshots the stored state as a
     * new version, keeping only the newest {@code retain}. Snapshot and update
     * commit together: an unknown id or a failed write leaves no version behind.
     *
     * @return the stored context, or empty if the id is unknown
     */
    Optional<Context> updateVersioned(Context context, Instant versionedAt, int retain);

    /**
     * Deletes a context and its versions.
     *
     * @return true if a context was deleted
     */
    boolean deleteById(String id);

    /**
     * @return number of contexts deleted
     */
    int deleteAllByIds(Collection<String> ids);

    /**
     * Keyset page over a workspace, ordered by id.
     *
     * @param afterId exclusive lower bound, null for the first page
     */
    List<Context> findByWorkspace(String workspaceId, ContextTier tier, ContextType type,
                                  String afterId, int limit);

    long countByWorkspace(String workspaceId, ContextTier tier, ContextType type);

    /**
     * Ids of the workspace's contexts that belong in the vector index.
     */
    List<String> findIndexableIds(String workspaceId);

    /**
     * Ids of indexable contexts whose vector index entry is known to be missing or out of date.
     */
    List<String> findUnindexedIds(String workspaceId);

    List<String> findWorkspaceIds();

    /**
     * Adds one to {@code usageCount} and sets {@code lastAccessed}.
     *
     * @return false if the context no longer exists
     */
    boolean incrementUsage(String id, Instant accessedAt);

    void markIndexed(String id, boolean indexed);

    /**
     * Stores a snapshot under the next version number and keeps only the newest {@code retain}.
     *
     * @return the snapshot with its assigned number
     */
    ContextVersion saveVersion(ContextVersion version, int retain);

    /**
     * Newest first.
     */
    List<ContextVersion> findVersions(String contextId, int limit);

    Optional<ContextVersion> findVersion(String contextId, int versionNumber);
}
