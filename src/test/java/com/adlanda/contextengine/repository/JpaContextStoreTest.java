package com.adlanda.contextengine.repository;

import com.adlanda.contextengine.model.Context;
import com.adlanda.contextengine.model.ContextMetadata;
import com.adlanda.contextengine.model.ContextTier;
import com.adlanda.contextengine.model.ContextType;
import com.adlanda.contextengine.model.ContextVersion;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaContextStore.class)
class JpaContextStoreTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private JpaContextStore store;

    @Test
    void insert_assignsIdAndRoundTripsMetadata() {
        ContextMetadata metadata = new ContextMetadata("src/Main.java", List.of("java", "entrypoint"), 0, 0.8,
                Map.of("language", "java", "lines", "120"));

        Context stored = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "class Main {}", metadata));

        Context found = store.findById(stored.id()).orElseThrow();
        assertThat(stored.id()).isNotBlank();
        assertThat(found.content()).isEqualTo("class Main {}");
        assertThat(found.metadata()).isEqualTo(metadata);
        assertThat(found.tier()).isEqualTo(ContextTier.WORKSPACE);
        assertThat(found.type()).isEqualTo(ContextType.FILE);
        assertThat(found.createdAt()).isEqualTo(CREATED);
        assertThat(found.indexed()).isFalse();
    }

    @Test
    void findAllByIds_unknownIds_areOmitted() {
        Context a = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "a", ContextMetadata.empty()));

        List<Context> found = store.findAllByIds(List.of(a.id(), "missing"));

        assertThat(found).extracting(Context::id).containsExactly(a.id());
    }

    @Test
    void update_unknownId_returnsEmpty() {
        Context ghost = context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "ghost", ContextMetadata.empty())
                .withId("does-not-exist");

        assertThat(store.update(ghost)).isEmpty();
    }

    @Test
    void update_keepsUsageCountOwnedByIncrementUsage() {
        Context stored = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "v1", ContextMetadata.empty()));
        store.incrementUsage(stored.id(), CREATED.plusSeconds(60));

        Context changed = new Context(stored.id(), stored.workspaceId(), ContextTier.GLOBAL, stored.type(), "v2",
                stored.metadata().withConfidence(0.4), null, stored.createdAt(), CREATED.plusSeconds(120), null, true);
        Context updated = store.update(changed).orElseThrow();

        assertThat(updated.content()).isEqualTo("v2");
        assertThat(updated.tier()).isEqualTo(ContextTier.GLOBAL);
        assertThat(updated.metadata().confidence()).isEqualTo(0.4);
        assertThat(updated.metadata().usageCount()).isEqualTo(1);
        assertThat(updated.lastAccessed()).isEqualTo(CREATED.plusSeconds(60));
        assertThat(updated.indexed()).isTrue();
    }

    @Test
    void incrementUsage_bumpsCountAndLastAccessedButNotUpdatedAt() {
        Context stored = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "a", ContextMetadata.empty()));
        Instant accessed = CREATED.plusSeconds(3600);

        assertThat(store.incrementUsage(stored.id(), accessed)).isTrue();
        assertThat(store.incrementUsage(stored.id(), accessed)).isTrue();

        Context found = store.findById(stored.id()).orElseThrow();
        assertThat(found.metadata().usageCount()).isEqualTo(2);
        assertThat(found.lastAccessed()).isEqualTo(accessed);
        assertThat(found.updatedAt()).isEqualTo(CREATED);
    }

    @Test
    void incrementUsage_unknownId_returnsFalse() {
        assertThat(store.incrementUsage("missing", CREATED)).isFalse();
    }

    @Test
    void findByWorkspace_keysetPages_visitEveryContextOnce() {
        for (int i = 0; i < 7; i++) {
            store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "c" + i, ContextMetadata.empty()));
        }
        store.insert(context("ws-2", ContextTier.WORKSPACE, ContextType.FILE, "other", ContextMetadata.empty()));

        List<String> seen = new ArrayList<>();
        String afterId = null;
        List<Context> page;
        do {
            page = store.findByWorkspace("ws-1", null, null, afterId, 3);
            page.forEach(c -> seen.add(c.id()));
            afterId = page.isEmpty() ? afterId : page.get(page.size() - 1).id();
        } while (page.size() == 3);

        assertThat(seen).hasSize(7).doesNotHaveDuplicates().isSorted();
    }

    @Test
    void countByWorkspace_tierAndTypeFilters() {
        store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "a", ContextMetadata.empty()));
        store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.SYMBOL, "b", ContextMetadata.empty()));
        store.insert(context("ws-1", ContextTier.GLOBAL, ContextType.FILE, "c", ContextMetadata.empty()));

        assertThat(store.countByWorkspace("ws-1", null, null)).isEqualTo(3);
        assertThat(store.countByWorkspace("ws-1", ContextTier.WORKSPACE, null)).isEqualTo(2);
        assertThat(store.countByWorkspace("ws-1", null, ContextType.FILE)).isEqualTo(2);
        assertThat(store.countByWorkspace("ws-1", ContextTier.GLOBAL, ContextType.SYMBOL)).isZero();
    }

    @Test
    void markIndexed_updatesUnindexedIds() {
        Context a = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "a", ContextMetadata.empty()));
        Context b = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "b", ContextMetadata.empty()));

        store.markIndexed(a.id(), true);

        assertThat(store.findUnindexedIds("ws-1")).containsExactly(b.id());
    }

    @Test
    void findWorkspaceIds_returnsDistinctSorted() {
        store.insert(context("ws-b", ContextTier.WORKSPACE, ContextType.FILE, "a", ContextMetadata.empty()));
        store.insert(context("ws-a", ContextTier.WORKSPACE, ContextType.FILE, "b", ContextMetadata.empty()));
        store.insert(context("ws-b", ContextTier.GLOBAL, ContextType.FILE, "c", ContextMetadata.empty()));

        assertThat(store.findWorkspaceIds()).containsExactly("ws-a", "ws-b");
    }

    @Test
    void saveVersion_assignsIncreasingNumbersAndPrunesOldest() {
        Context stored = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "v0", ContextMetadata.empty()));

        for (int i = 1; i <= 5; i++) {
            ContextVersion saved = store.saveVersion(new ContextVersion(stored.id(), 0, "v" + i,
                    ContextMetadata.of("src", List.of("t" + i)), CREATED.plusSeconds(i)), 3);
            assertThat(saved.versionNumber()).isEqualTo(i);
        }

        List<ContextVersion> versions = store.findVersions(stored.id(), 10);
        assertThat(versions).extracting(ContextVersion::versionNumber).containsExactly(5, 4, 3);
        assertThat(versions.get(0).content()).isEqualTo("v5");
        assertThat(versions.get(0).metadata().tags()).containsExactly("t5");
        assertThat(store.findVersion(stored.id(), 1)).isEmpty();
        assertThat(store.findVersion(stored.id(), 4)).hasValueSatisfying(v -> assertThat(v.content()).isEqualTo("v4"));
    }

    @Test
    void updateVersioned_snapshotsStoredStateThenApplies() {
        Context stored = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "before",
                ContextMetadata.of("a.md", List.of("old"))));
        Context changed = new Context(stored.id(), stored.workspaceId(), stored.tier(), stored.type(), "after",
                ContextMetadata.of("a.md", List.of("new")), null, stored.createdAt(), CREATED.plusSeconds(60),
                null, false);

        Context updated = store.updateVersioned(changed, CREATED.plusSeconds(60), 10).orElseThrow();

        assertThat(updated.content()).isEqualTo("after");
        List<ContextVersion> versions = store.findVersions(stored.id(), 10);
        assertThat(versions).hasSize(1);
        assertThat(versions.get(0).versionNumber()).isEqualTo(1);
        assertThat(versions.get(0).content()).isEqualTo("before");
        assertThat(versions.get(0).metadata().tags()).containsExactly("old");
    }

    @Test
    void updateVersioned_unknownId_leavesNoVersion() {
        Context ghost = context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "ghost", ContextMetadata.empty())
                .withId("does-not-exist");

        assertThat(store.updateVersioned(ghost, CREATED, 10)).isEmpty();
        assertThat(store.findVersions("does-not-exist", 10)).isEmpty();
    }

    @Test
    void findUnindexedIds_excludesContextsCreatedWithoutIndexing() {
        Context indexable = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "a",
                ContextMetadata.empty()));
        Context optedOut = store.insert(Context.draft("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "b",
                ContextMetadata.empty(), CREATED, false));

        assertThat(store.findById(optedOut.id())).hasValueSatisfying(c -> assertThat(c.indexable()).isFalse());
        assertThat(store.findUnindexedIds("ws-1")).containsExactly(indexable.id());
        assertThat(store.findIndexableIds("ws-1")).containsExactly(indexable.id());
    }

    @Test
    void deleteById_removesContextAndVersions() {
        Context stored = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "a", ContextMetadata.empty()));
        store.saveVersion(ContextVersion.snapshotOf(stored, CREATED), 10);

        assertThat(store.deleteById(stored.id())).isTrue();
        assertThat(store.deleteById(stored.id())).isFalse();
        assertThat(store.findById(stored.id())).isEmpty();
        assertThat(store.findVersions(stored.id(), 10)).isEmpty();
    }

    @Test
    void deleteAllByIds_countsOnlyExisting() {
        Context a = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "a", ContextMetadata.empty()));
        Context b = store.insert(context("ws-1", ContextTier.WORKSPACE, ContextType.FILE, "b", ContextMetadata.empty()));

        int deleted = store.deleteAllByIds(List.of(a.id(), b.id(), "missing"));

        assertThat(deleted).isEqualTo(2);
        assertThat(store.countByWorkspace("ws-1", null, null)).isZero();
    }

    private Context context(String workspaceId, ContextTier tier, ContextType type, String content,
                            ContextMetadata metadata) {
        return Context.draft(workspaceId, tier, type, content, metadata, CREATED);
    }
}
