package com.adlanda.contextengine.repository;

import com.adlanda.contextengine.entity.ContextVersionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data repository for context version snapshots.
 */
@Repository
public interface ContextVersionRepository extends JpaRepository<ContextVersionEntity, String> {

    List<ContextVersionEntity> findByContextIdOrderByVersionNumberDesc(String contextId, Pageable pageable);

    Optional<ContextVersionEntity> findByContextIdAndVersionNumber(String contextId, int versionNumber);

    @Query("SELECT COALESCE(MAX(v.versionNumber), 0) FROM ContextVersionEntity v WHERE v.contextId = :contextId")
    int findMaxVersionNumber(String contextId);

    /**
     * Prunes every version of a context up to and including the given number.
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ContextVersionEntity v WHERE v.contextId = :contextId AND v.versionNumber <= :versionNumber")
    int deleteUpTo(String contextId, int versionNumber);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ContextVersionEntity v WHERE v.contextId IN :contextIds")
    int deleteByContextIdIn(Collection<String> contextIds);
}
