package com.adlanda.contextengine.service;

import com.adlanda.contextengine.config.RetrievalProperties;
import com.adlanda.contextengine.exception.ContextValidationException;
import com.adlanda.contextengine.exception.IndexUnavailableException;
import com.adlanda.contextengine.model.Context;
import com.adlanda.contextengine.model.ContextMetadata;
import com.adlanda.contextengine.model.ContextTier;
import com.adlanda.contextengine.model.ContextType;
import com.adlanda.contextengine.model.IndexFailure;
import com.adlanda.contextengine.model.QueryEntity;
import com.adlanda.contextengine.model.RetrievalRequest;
import com.adlanda.contextengine.model.RetrievalResult;
import com.adlanda.contextengine.model.ScoredContext;
import com.adlanda.contextengine.model.VectorFilter;
import com.adlanda.contextengine.model.VectorHit;
import com.adlanda.contextengine.repository.InMemoryContextStore;
import com.adlanda.contextengine.repository.VectorIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContextRetrieverTest {

    private static final List<Double> QUERY_VECTOR = List.of(1.0, 0.0, 0.0);
    private static final Instant UPDATED = Instant.now().minus(Duration.ofHours(1));

    @Mock
    private EmbeddingProvider embeddingProvider;

    @Mock
    private VectorIndex vectorIndex;

    @Mock
    private UsageTracker usageTracker;

    private InMemoryContextStore contextStore;
    private IndexFailureTracker failureTracker;
    private RetrievalProperties properties;
    private ThreadPoolTaskExecutor executor;

    private final Map<ContextTier, List<VectorHit>> hitsByTier = new ConcurrentHashMap<>();
    private final Map<ContextTier, Long> delayByTier = new ConcurrentHashMap<>();
    private final List<ContextTier> searchedTiers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        contextStore = new InMemoryContextStore();
        failureTracker = new IndexFailureTracker();
        properties = new RetrievalProperties();
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setThreadNamePrefix("test-tier-search-");
        executor.initialize();

        when(embeddingProvider.embed(anyString())).thenReturn(QUERY_VECTOR);
        when(vectorIndex.search(anyList(), anyInt(), any(VectorFilter.class))).thenAnswer(invocation -> {
            VectorFilter filter = invocation.getArgument(2);
            synchronized (searchedTiers) {
                searchedTiers.add(filter.tier());
            }
            Long delay = delayByTier.get(filter.tier());
            if (delay != null) {
                Thread.sleep(delay);
            }
            return hitsByTier.getOrDefault(filter.tier(), List.of());
        });
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void retrieve_blankQuery_returnsEmptyWithoutEmbedding() {
        RetrievalResult result = retriever().retrieve(RetrievalRequest.of("ws-1", "   ", 5));

        assertThat(result.contexts()).isEmpty();
        assertThat(result.totalFound()).isZero();
        verify(embeddingProvider, never()).embed(anyString());
    }

    @Test
    void retrieve_noContexts_returnsEmptyAfterSearchingAllTiers() {
        RetrievalResult result = retriever().retrieve(RetrievalRequest.of("ws-1", "authentication", 5));

        assertThat(result.contexts()).isEmpty();
        assertThat(result.totalFound()).isZero();
        assertThat(result.degraded()).isFalse();
        assertThat(result.tiersSearched()).containsExactly(ContextTier.WORKSPACE, ContextTier.HYBRID, ContextTier.GLOBAL);
    }

    @Test
    void retrieve_withEntities_expandsQueryWithConfidentEntitiesOnly() {
        List<QueryEntity> entities = List.of(
                new QueryEntity("technology", "TypeScript", 0.8),
                new QueryEntity("technology", "React", 0.5),
                new QueryEntity("technology", "Angular", 0.7));

        retriever().retrieve(RetrievalRequest.of("ws-1", "build a form", 5).withEntities(entities));

        verify(embeddingProvider).embed("build a form TypeScript");
    }

    @Test
    void retrieve_resultsSortedByScoreDescending() {
        stored("low", ContextTier.WORKSPACE, "payment retry handler");
        stored("high", ContextTier.WORKSPACE, "login controller for users");
        stored("mid", ContextTier.WORKSPACE, "session cookie parsing");
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("low", 0.3), hit("high", 0.9), hit("mid", 0.6)));

        RetrievalResult result = retriever().retrieve(RetrievalRequest.of("ws-1", "login", 10));

        assertThat(result.contexts()).extracting(sc -> sc.context().id()).containsExactly("high", "mid", "low");
        assertThat(result.contexts()).extracting(ScoredContext::score).isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(result.totalFound()).isEqualTo(3);
    }

    @Test
    void retrieve_sameInputs_returnsSameOrder() {
        stored("b", ContextTier.WORKSPACE, "alpha one");
        stored("a", ContextTier.WORKSPACE, "beta two");
        stored("c", ContextTier.WORKSPACE, "gamma three");
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("b", 0.5), hit("a", 0.5), hit("c", 0.5)));
        ContextRetriever retriever = retriever();

        RetrievalResult first = retriever.retrieve(RetrievalRequest.of("ws-1", "query", 10));
        RetrievalResult second = retriever.retrieve(RetrievalRequest.of("ws-1", "query", 10));

        assertThat(first.contexts()).extracting(sc -> sc.context().id()).containsExactly("a", "b", "c");
        assertThat(second.contexts()).extracting(sc -> sc.context().id())
                .containsExactlyElementsOf(first.contexts().stream().map(sc -> sc.context().id()).toList());
    }

    @Test
    void retrieve_staleIndexEntry_isSkippedAndRecorded() {
        stored("live", ContextTier.WORKSPACE, "still here");
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("gone", 0.95), hit("live", 0.6)));

        RetrievalResult result = retriever().retrieve(RetrievalRequest.of("ws-1", "query", 5));

        assertThat(result.contexts()).extracting(sc -> sc.context().id()).containsExactly("live");
        assertThat(failureTracker.pending()).singleElement().satisfies(failure -> {
            assertThat(failure.contextId()).isEqualTo("gone");
            assertThat(failure.operation()).isEqualTo(IndexFailure.Operation.STALE_ENTRY);
        });
    }

    @Test
    void retrieve_enoughStrongHitsInWorkspace_stopsBeforeLaterTiers() {
        stored("w1", ContextTier.WORKSPACE, "one");
        stored("w2", ContextTier.WORKSPACE, "two");
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("w1", 0.9), hit("w2", 0.85)));

        RetrievalResult result = retriever().retrieve(RetrievalRequest.of("ws-1", "query", 2));

        assertThat(result.tiersSearched()).containsExactly(ContextTier.WORKSPACE);
        assertThat(searchedTiers).containsExactly(ContextTier.WORKSPACE);
    }

    @Test
    void retrieve_weakHits_searchesTiersInOrderAndMergesResults() {
        stored("w1", ContextTier.WORKSPACE, "workspace note");
        stored("h1", ContextTier.HYBRID, "hybrid note about caching");
        stored("g1", ContextTier.GLOBAL, "global guideline for logging");
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("w1", 0.5)));
        hitsByTier.put(ContextTier.HYBRID, List.of(hit("h1", 0.4)));
        hitsByTier.put(ContextTier.GLOBAL, List.of(hit("g1", 0.3)));

        RetrievalResult result = retriever().retrieve(RetrievalRequest.of("ws-1", "query", 5));

        assertThat(searchedTiers).containsExactly(ContextTier.WORKSPACE, ContextTier.HYBRID, ContextTier.GLOBAL);
        assertThat(result.contexts()).extracting(sc -> sc.context().id()).containsExactly("w1", "h1", "g1");
    }

    @Test
    void retrieve_singleTierRequested_searchesOnlyThatTier() {
        retriever().retrieve(RetrievalRequest.of("ws-1", "query", 5).withTier(ContextTier.GLOBAL));

        assertThat(searchedTiers).containsExactly(ContextTier.GLOBAL);
    }

    @Test
    void retrieve_slowTier_returnsPartialResultsMarkedDegraded() {
        stored("w1", ContextTier.WORKSPACE, "fast workspace hit");
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("w1", 0.5)));
        delayByTier.put(ContextTier.HYBRID, 5_000L);

        RetrievalResult result = retriever().retrieve(
                RetrievalRequest.of("ws-1", "query", 5).withTimeout(Duration.ofMillis(300)));

        assertThat(result.degraded()).isTrue();
        assertThat(result.tiersSearched()).containsExactly(ContextTier.WORKSPACE);
        assertThat(result.contexts()).extracting(sc -> sc.context().id()).containsExactly("w1");
        assertThat(result.latencyMs()).isLessThan(5_000L);
    }

    @Test
    void retrieve_deadlineAlreadyPassed_stillSearchesWorkspaceTier() {
        stored("w1", ContextTier.WORKSPACE, "workspace hit");
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("w1", 0.5)));

        RetrievalResult result = retriever().retrieve(
                RetrievalRequest.of("ws-1", "query", 5).withTimeout(Duration.ZERO));

        assertThat(result.tiersSearched()).containsExactly(ContextTier.WORKSPACE);
        assertThat(result.contexts()).extracting(sc -> sc.context().id()).containsExactly("w1");
        assertThat(result.degraded()).isTrue();
        assertThat(searchedTiers).containsExactly(ContextTier.WORKSPACE);
    }

    @Test
    void retrieve_searchPoolSaturated_returnsDegradedWithoutBlockingCaller() {
        ThreadPoolTaskExecutor saturated = new ThreadPoolTaskExecutor();
        saturated.setCorePoolSize(1);
        saturated.setMaxPoolSize(1);
        saturated.setQueueCapacity(0);
        saturated.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        saturated.initialize();
        CountDownLatch release = new CountDownLatch(1);
        try {
            saturated.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            delayByTier.put(ContextTier.WORKSPACE, 2_000L);
            ContextRetriever retriever = new ContextRetriever(embeddingProvider, vectorIndex, contextStore,
                    usageTracker, failureTracker, saturated, properties);

            RetrievalResult result = retriever.retrieve(
                    RetrievalRequest.of("ws-1", "query", 5).withTimeout(Duration.ofMillis(200)));

            assertThat(result.degraded()).isTrue();
            assertThat(result.contexts()).isEmpty();
            assertThat(result.latencyMs()).isLessThan(1_000L);
            verify(vectorIndex, never()).search(anyList(), anyInt(), any(VectorFilter.class));
        } finally {
            release.countDown();
            saturated.shutdown();
        }
    }

    @Test
    void retrieve_indexUnavailable_propagates() {
        doThrow(new IndexUnavailableException("Vector index unavailable during search", null))
                .when(vectorIndex).search(anyList(), anyInt(), any(VectorFilter.class));

        assertThatThrownBy(() -> retriever().retrieve(RetrievalRequest.of("ws-1", "query", 5)))
                .isInstanceOf(IndexUnavailableException.class);
    }

    @Test
    void retrieve_nearDuplicates_onlyHigherRankedReturned() {
        stored("a", ContextTier.WORKSPACE, "configure the retry policy for http clients");
        stored("b", ContextTier.WORKSPACE, "Configure the retry policy for HTTP clients.");
        stored("c", ContextTier.WORKSPACE, "database schema migrations");
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("a", 0.7), hit("b", 0.65), hit("c", 0.5)));

        RetrievalResult result = retriever().retrieve(RetrievalRequest.of("ws-1", "retry", 5));

        assertThat(result.contexts()).extracting(sc -> sc.context().id()).containsExactly("a", "c");
        assertThat(result.totalFound()).isEqualTo(3);
    }

    @Test
    void retrieve_belowMinSimilarity_isDropped() {
        stored("a", ContextTier.WORKSPACE, "relevant");
        stored("b", ContextTier.WORKSPACE, "barely related");
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("a", 0.7), hit("b", 0.2)));

        RetrievalRequest request = new RetrievalRequest("query", "ws-1", null, null, null, 5, 0.5, null);
        RetrievalResult result = retriever().retrieve(request);

        assertThat(result.contexts()).extracting(sc -> sc.context().id()).containsExactly("a");
    }

    @Test
    void retrieve_contextFromOtherWorkspace_isDropped() {
        stored("mine", ContextTier.WORKSPACE, "mine");
        contextStore.put(context("theirs", "ws-2", ContextTier.WORKSPACE, "theirs"));
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("mine", 0.6), hit("theirs", 0.7)));

        RetrievalResult result = retriever().retrieve(RetrievalRequest.of("ws-1", "query", 5));

        assertThat(result.contexts()).extracting(sc -> sc.context().id()).containsExactly("mine");
    }

    @Test
    @SuppressWarnings("unchecked")
    void retrieve_tracksUsageOfReturnedContexts() {
        stored("a", ContextTier.WORKSPACE, "first");
        stored("b", ContextTier.WORKSPACE, "second");
        hitsByTier.put(ContextTier.WORKSPACE, List.of(hit("a", 0.7), hit("b", 0.6)));

        retriever().retrieve(RetrievalRequest.of("ws-1", "query", 1));

        ArgumentCaptor<Collection<String>> ids = ArgumentCaptor.forClass(Collection.class);
        verify(usageTracker).trackUsage(ids.capture(), any(Instant.class));
        assertThat(ids.getValue()).containsExactly("a");
    }

    @Test
    void retrieve_missingWorkspace_throwsValidation() {
        assertThatThrownBy(() -> retriever().retrieve(RetrievalRequest.of(null, "query", 5)))
                .isInstanceOf(ContextValidationException.class)
                .hasMessageContaining("workspaceId");
    }

    @Test
    void retrieve_nonPositiveLimit_throwsValidation() {
        assertThatThrownBy(() -> retriever().retrieve(RetrievalRequest.of("ws-1", "query", 0)))
                .isInstanceOf(ContextValidationException.class);
    }

    @Test
    void retrieve_minSimilarityOutOfRange_throwsValidation() {
        RetrievalRequest request = new RetrievalRequest("query", "ws-1", null, null, null, 5, 1.5, null);

        assertThatThrownBy(() -> retriever().retrieve(request)).isInstanceOf(ContextValidationException.class);
    }

    @Test
    void constructor_invalidWeights_throws() {
        properties.setWeights(new RetrievalProperties.Weights(-1, 0, 0, 0));

        assertThatThrownBy(this::retriever).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void expandQuery_noConfidentEntities_returnsQueryUnchanged() {
        String expanded = retriever().expandQuery("query", List.of(new QueryEntity("file", "App.java", 0.7)));

        assertThat(expanded).isEqualTo("query");
    }

    private ContextRetriever retriever() {
        return new ContextRetriever(embeddingProvider, vectorIndex, contextStore, usageTracker,
                failureTracker, executor, properties);
    }

    private void stored(String id, ContextTier tier, String content) {
        contextStore.put(context(id, "ws-1", tier, content));
    }

    private static Context context(String id, String workspaceId, ContextTier tier, String content) {
        return new Context(id, workspaceId, tier, ContextType.FILE, content, ContextMetadata.empty(),
                null, UPDATED, UPDATED, null, true);
    }

    private static VectorHit hit(String id, double score) {
        return new VectorHit(id, score, Map.of(VectorFilter.WORKSPACE_ID, "ws-1"));
    }
}
