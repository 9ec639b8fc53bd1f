package com.adlanda.contextengine.service;

import com.adlanda.contextengine.config.RetrievalProperties.Weights;
import com.adlanda.contextengine.model.Context;
import com.adlanda.contextengine.model.ContextMetadata;
import com.adlanda.contextengine.model.ContextTier;
import com.adlanda.contextengine.model.ContextType;
import com.adlanda.contextengine.model.ScoredContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ContextReRankerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final ContextReRanker reRanker = new ContextReRanker(new Weights(0.6, 0.2, 0.1, 0.1), 0.01);

    @Test
    void freshness_recentContext_outscoresOldContext() {
        Context recent = context("a", 0, null, NOW.minus(Duration.ofDays(1)));
        Context old = context("b", 0, null, NOW.minus(Duration.ofDays(30)));

        assertThat(reRanker.freshness(recent, NOW)).isCloseTo(Math.exp(-0.01), within(1e-9));
        assertThat(reRanker.freshness(old, NOW)).isCloseTo(Math.exp(-0.3), within(1e-9));
        assertThat(reRanker.freshness(recent, NOW)).isGreaterThan(reRanker.freshness(old, NOW));
    }

    @Test
    void freshness_lastAccessedTakesPrecedenceOverUpdatedAt() {
        Context accessedToday = new Context("a", "ws-1", ContextTier.WORKSPACE, ContextType.FILE, "x",
                ContextMetadata.empty(), null, NOW.minus(Duration.ofDays(90)), NOW.minus(Duration.ofDays(90)),
                NOW, true);

        assertThat(reRanker.freshness(accessedToday, NOW)).isEqualTo(1.0);
    }

    @Test
    void rank_equalSimilarity_recentContextRanksFirst() {
        Context recent = context("b", 0, null, NOW.minus(Duration.ofDays(1)));
        Context old = context("a", 0, null, NOW.minus(Duration.ofDays(30)));

        List<ScoredContext> ranked = reRanker.rank(List.of(
                new ContextReRanker.Candidate(old, 0.8),
                new ContextReRanker.Candidate(recent, 0.8)), NOW);

        assertThat(ranked).extracting(sc -> sc.context().id()).containsExactly("b", "a");
    }

    @Test
    void rank_usageNormalizedWithinCandidatePool() {
        Context low = context("low", 10, null, NOW);
        Context mid = context("mid", 20, null, NOW);
        Context high = context("high", 30, null, NOW);

        List<ScoredContext> ranked = reRanker.rank(List.of(
                new ContextReRanker.Candidate(low, 0.5),
                new ContextReRanker.Candidate(mid, 0.5),
                new ContextReRanker.Candidate(high, 0.5)), NOW);

        assertThat(ranked).extracting(sc -> sc.scoreBreakdown().usage()).containsExactly(1.0, 0.5, 0.0);
    }

    @Test
    void rank_sameContext_scoresDependOnOtherCandidates() {
        Context x = context("x", 20, null, NOW);
        Context y = context("y", 10, null, NOW);
        Context heavilyUsed = context("z", 100, null, NOW);

        List<ScoredContext> poolA = reRanker.rank(List.of(
                new ContextReRanker.Candidate(x, 0.50),
                new ContextReRanker.Candidate(y, 0.52)), NOW);
        List<ScoredContext> poolB = reRanker.rank(List.of(
                new ContextReRanker.Candidate(x, 0.50),
                new ContextReRanker.Candidate(y, 0.52),
                new ContextReRanker.Candidate(heavilyUsed, 0.10)), NOW);

        ScoredContext xInA = poolA.stream().filter(sc -> sc.context().id().equals("x")).findFirst().orElseThrow();
        ScoredContext xInB = poolB.stream().filter(sc -> sc.context().id().equals("x")).findFirst().orElseThrow();
        assertThat(xInA.scoreBreakdown().usage()).isEqualTo(1.0);
        assertThat(xInB.scoreBreakdown().usage()).isCloseTo(10.0 / 90.0, within(1e-9));
        assertThat(xInA.score()).isGreaterThan(xInB.score());
        assertThat(poolA).extracting(sc -> sc.context().id()).containsExactly("x", "y");
        assertThat(poolB).extracting(sc -> sc.context().id()).containsExactly("y", "x", "z");
    }

    @Test
    void rank_allEqualUsage_normalizesToZero() {
        List<ScoredContext> ranked = reRanker.rank(List.of(
                new ContextReRanker.Candidate(context("a", 7, null, NOW), 0.5),
                new ContextReRanker.Candidate(context("b", 7, null, NOW), 0.5)), NOW);

        assertThat(ranked).allSatisfy(sc -> assertThat(sc.scoreBreakdown().usage()).isZero());
    }

    @Test
    void rank_missingConfidence_usesDefault() {
        List<ScoredContext> ranked = reRanker.rank(List.of(
                new ContextReRanker.Candidate(context("a", 0, null, NOW), 0.5)), NOW);

        assertThat(ranked.get(0).scoreBreakdown().confidence()).isEqualTo(ContextMetadata.DEFAULT_CONFIDENCE);
    }

    @Test
    void rank_scoreIsWeightedBlendOfSignals() {
        Context context = context("a", 0, 0.5, NOW.minus(Duration.ofDays(10)));

        ScoredContext scored = reRanker.rank(List.of(new ContextReRanker.Candidate(context, 0.9)), NOW).get(0);

        double expected = 0.6 * 0.9 + 0.2 * Math.exp(-0.1) + 0.1 * 0.0 + 0.1 * 0.5;
        assertThat(scored.score()).isCloseTo(expected, within(1e-9));
        assertThat(scored.similarity()).isEqualTo(0.9);
    }

    @Test
    void rank_similarityOutsideUnitRange_isClampedInBreakdown() {
        List<ScoredContext> ranked = reRanker.rank(List.of(
                new ContextReRanker.Candidate(context("a", 0, null, NOW), -0.3),
                new ContextReRanker.Candidate(context("b", 0, null, NOW), 1.2)), NOW);

        assertThat(ranked).extracting(sc -> sc.scoreBreakdown().semantic()).containsExactly(1.0, 0.0);
        assertThat(ranked).allSatisfy(sc -> assertThat(sc.score()).isBetween(0.0, 1.0));
    }

    @Test
    void rank_identicalScores_breaksTiesByLastAccessedThenId() {
        Instant updated = NOW.minus(Duration.ofDays(2));
        Context neverAccessed = new Context("a", "ws-1", ContextTier.WORKSPACE, ContextType.FILE, "x",
                ContextMetadata.empty(), null, updated, updated, null, true);
        Context accessedB = new Context("c", "ws-1", ContextTier.WORKSPACE, ContextType.FILE, "x",
                ContextMetadata.empty(), null, updated, updated, updated, true);
        Context accessedA = new Context("b", "ws-1", ContextTier.WORKSPACE, ContextType.FILE, "x",
                ContextMetadata.empty(), null, updated, updated, updated, true);

        List<ScoredContext> ranked = reRanker.rank(List.of(
                new ContextReRanker.Candidate(neverAccessed, 0.7),
                new ContextReRanker.Candidate(accessedB, 0.7),
                new ContextReRanker.Candidate(accessedA, 0.7)), NOW);

        assertThat(ranked).extracting(sc -> sc.context().id()).containsExactly("b", "c", "a");
    }

    @Test
    void rank_emptyCandidates_returnsEmpty() {
        assertThat(reRanker.rank(List.of(), NOW)).isEmpty();
    }

    @Test
    void constructor_negativeWeight_throws() {
        assertThatThrownBy(() -> new ContextReRanker(new Weights(0.6, -0.1, 0.1, 0.1), 0.01))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("freshness");
    }

    @Test
    void constructor_allZeroWeights_throws() {
        assertThatThrownBy(() -> new ContextReRanker(new Weights(0, 0, 0, 0), 0.01))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_nonFiniteDecayRate_throws() {
        assertThatThrownBy(() -> new ContextReRanker(new Weights(), Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ContextReRanker(new Weights(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Context context(String id, long usageCount, Double confidence, Instant updatedAt) {
        ContextMetadata metadata = new ContextMetadata("src", List.of(), usageCount, confidence, Map.of());
        return new Context(id, "ws-1", ContextTier.WORKSPACE, ContextType.FILE, "content " + id, metadata,
                null, updatedAt, updatedAt, null, true);
    }
}
