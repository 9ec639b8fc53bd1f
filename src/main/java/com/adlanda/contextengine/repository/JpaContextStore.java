package com.adlanda.contextengine.repository;

import com.adlanda.contextengine.entity.ContextEntity;
import com.adlanda.contextengine.entity.ContextVersionEntity;
import com.adlanda.contextengine.exception.StoreUnavailableException;
import com.adlanda.contextengine.model.Context;
import com.adlanda.contextengine.model.ContextMetadata;
import com.adlanda.contextengine.model.ContextTier;
import com.adlanda.contextengine.model.ContextType;
import com.adlanda.contextengine.model.ContextVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ContextStore} on Spring Data JPA.
 *
 * Every operation runs in its own transaction. Connection-level failures are
 * translated into {@link StoreUnavailableException}; other data access errors
 * propagate unchanged.
 */
@Repository
public class JpaContextStore implements ContextStore {

    private static final Logger log = LoggerFactory.getLogger(JpaContextStore.class);

    private final ContextRepository contextRepository;
    private final ContextVersionRepository versionRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaContextStore(ContextRepository contextRepository,
                           ContextVersionRepository versionRepository,
                           PlatformTransactionManager transactionManager) {
        this.contextRepository = contextRepository;
        this.versionRepository = versionRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Context insert(Context context) {
        return inTransaction("insert", () -> toContext(contextRepository.save(toNewEntity(context))));
    }

    @Override
    public List<Context> insertAll(List<Context> contexts) {
        if (contexts.isEmpty()) {
            return List.of();
        }
        return inTransaction("insertAll", () -> contextRepository
                .saveAll(contexts.stream().map(JpaContextStore::toNewEntity).toList())
                .stream()
                .map(JpaContextStore::toContext)
                .toList());
    }

    @Override
    public Optional<Context> findById(String id) {
        return inTransaction("findById", () -> contextRepository.findById(id).map(JpaContextStore::toContext));
    }

    @Override
    public List<Context> findAllByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return inTransaction("findAllByIds", () -> contextRepository.findAllById(ids).stream()
                .map(JpaContextStore::toContext)
                .toList());
    }

    @Override
    public Optional<Context> update(Context context) {
        return inTransaction("update", () -> contextRepository.findById(context.id())
                .map(entity -> {
                    applyMutableFields(entity, context);
                    return toContext(contextRepository.save(entity));
                }));
    }

    @Override
    public Optional<Context> updateVersioned(Context context, Instant versionedAt, int retain) {
        return inTransaction("updateVersioned", () -> contextRepository.findById(context.id())
                .map(entity -> {
                    ContextVersion version = appendVersion(ContextVersion.snapshotOf(toContext(entity), versionedAt), retain);
                    log.debug("Saved version {} of context {}", version.versionNumber(), context.id());
                    applyMutableFields(entity, context);
                    return toContext(contextRepository.save(entity));
                }));
    }

    @Override
    public boolean deleteById(String id) {
        return inTransaction("deleteById", () -> {
            if (!contextRepository.existsById(id)) {
                return false;
            }
            versionRepository.deleteByContextIdIn(List.of(id));
            contextRepository.deleteById(id);
            return true;
        });
    }

    @Override
    public int deleteAllByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return inTransaction("deleteAllByIds", () -> {
            List<ContextEntity> existing = contextRepository.findAllById(ids);
            if (existing.isEmpty()) {
                return 0;
            }
            versionRepository.deleteByContextIdIn(existing.stream().map(ContextEntity::getId).toList());
            contextRepository.deleteAll(existing);
            return existing.size();
        });
    }

    @Override
    public List<Context> findByWorkspace(String workspaceId, ContextTier tier, ContextType type,
                                         String afterId, int limit) {
        return inTransaction("findByWorkspace", () -> contextRepository
                .findPage(workspaceId, tier, type, afterId != null ? afterId : "", PageRequest.of(0, limit))
                .stream()
                .map(JpaContextStore::toContext)
                .toList());
    }

    @Override
    public long countByWorkspace(String workspaceId, ContextTier tier, ContextType type) {
        return inTransaction("countByWorkspace", () -> contextRepository.countFiltered(workspaceId, tier, type));
    }

    @Override
    public List<String> findIndexableIds(String workspaceId) {
        return inTransaction("findIndexableIds", () -> contextRepository.findIndexableIds(workspaceId));
    }

    @Override
    public List<String> findUnindexedIds(String workspaceId) {
        return inTransaction("findUnindexedIds", () -> contextRepository.findUnindexedIds(workspaceId));
    }

    @Override
    public List<String> findWorkspaceIds() {
        return inTransaction("findWorkspaceIds", contextRepository::findDistinctWorkspaceIds);
    }

    @Override
    public boolean incrementUsage(String id, Instant accessedAt) {
        return inTransaction("incrementUsage", () -> contextRepository.incrementUsage(id, accessedAt) > 0);
    }

    @Override
    public void markIndexed(String id, boolean indexed) {
        inTransaction("markIndexed", () -> contextRepository.updateIndexed(id, indexed));
    }

    @Override
    public ContextVersion saveVersion(ContextVersion version, int retain) {
        return inTransaction("saveVersion", () -> appendVersion(version, retain));
    }

    @Override
    public List<ContextVersion> findVersions(String contextId, int limit) {
        return inTransaction("findVersions", () -> versionRepository
                .findByContextIdOrderByVersionNumberDesc(contextId, PageRequest.of(0, limit))
                .stream()
                .map(JpaContextStore::toVersion)
                .toList());
    }

    @Override
    public Optional<ContextVersion> findVersion(String contextId, int versionNumber) {
        return inTransaction("findVersion", () -> versionRepository
                .findByContextIdAndVersionNumber(contextId, versionNumber)
                .map(JpaContextStore::toVersion));
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessResourceFailureException | TransientDataAccessException
                 | CannotCreateTransactionException e) {
            log.error("Primary store unavailable during {}: {}", operation, e.getMessage());
            throw new StoreUnavailableException("Primary store unavailable during " + operation, e);
        }
    }

    // Callers supply the transaction
    private ContextVersion appendVersion(ContextVersion version, int retain) {
        int next = versionRepository.findMaxVersionNumber(version.contextId()) + 1;
        ContextVersion saved = toVersion(versionRepository.save(toVersionEntity(version, next)));

        if (retain > 0 && next > retain) {
            int pruned = versionRepository.deleteUpTo(version.contextId(), next - retain);
            if (pruned > 0) {
                log.debug("Pruned {} old versions of context {}", pruned, version.contextId());
            }
        }
        return saved;
    }

    private static ContextEntity toNewEntity(Context context) {
        ContextEntity entity = new ContextEntity();
        entity.setWorkspaceId(context.workspaceId());
        entity.setCreatedAt(context.createdAt());
        entity.setUsageCount(context.metadata().usageCount());
        entity.setLastAccessed(context.lastAccessed());
        entity.setIndexable(context.indexable());
        applyMutableFields(entity, context);
        return entity;
    }

    private static void applyMutableFields(ContextEntity entity, Context context) {
        ContextMetadata metadata = context.metadata();
        entity.setTier(context.tier());
        entity.setType(context.type());
        entity.setContent(context.content());
        entity.setSource(metadata.source());
        entity.setTags(new ArrayList<>(metadata.tags()));
        entity.setConfidence(metadata.confidence());
        entity.setAttributes(new LinkedHashMap<>(metadata.attributes()));
        entity.setUpdatedAt(context.updatedAt());
        entity.setIndexed(context.indexed());
    }

    private static Context toContext(ContextEntity entity) {
        ContextMetadata metadata = new ContextMetadata(
                entity.getSource(),
                entity.getTags(),
                entity.getUsageCount(),
                entity.getConfidence(),
                entity.getAttributes()
        );
        return new Context(
                entity.getId(),
                entity.getWorkspaceId(),
                entity.getTier(),
                entity.getType(),
                entity.getContent(),
                metadata,
                null,
                entity.getCreatedAt(),
                entity.getUpdatedAt(),
                entity.getLastAccessed(),
                entity.isIndexed(),
                entity.isIndexable()
        );
    }

    private static ContextVersionEntity toVersionEntity(ContextVersion version, int versionNumber) {
        ContextMetadata metadata = version.metadata();
        ContextVersionEntity entity = new ContextVersionEntity();
        entity.setContextId(version.contextId());
        entity.setVersionNumber(versionNumber);
        entity.setContent(version.content());
        entity.setSource(metadata.source());
        entity.setTags(new ArrayList<>(metadata.tags()));
        entity.setUsageCount(metadata.usageCount());
        entity.setConfidence(metadata.confidence());
        entity.setAttributes(new LinkedHashMap<>(metadata.attributes()));
        entity.setCreatedAt(version.createdAt());
        return entity;
    }

    private static ContextVersion toVersion(ContextVersionEntity entity) {
        return new ContextVersion(
                entity.getContextId(),
                entity.getVersionNumber(),
                entity.getContent(),
                new ContextMetadata(entity.getSource(), entity.getTags(), entity.getUsageCount(),
                        entity.getConfidence(), entity.getAttributes()),
                entity.getCreatedAt()
        );
    }
}
