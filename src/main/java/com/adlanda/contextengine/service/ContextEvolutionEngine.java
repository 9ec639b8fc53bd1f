package com.adlanda.contextengine.service;

import com.adlanda.contextengine.config.EvolutionProperties;
import com.adlanda.contextengine.exception.ContextValidationException;
import com.adlanda.contextengine.model.Context;
import com.adlanda.contextengine.model.ContextUpdateRequest;
import com.adlanda.contextengine.model.EvolutionRequest;
import com.adlanda.contextengine.model.EvolutionResult;
import com.adlanda.contextengine.model.EvolutionStats;
import com.adlanda.contextengine.model.FeedbackEvent;
import com.adlanda.contextengine.repository.ContextStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Evolves context confidence from feedback and over time.
 *
 * Feedback moves confidence towards a signal in [0, 1] by exponential smoothing.
 * Temporal decay multiplies confidence by exp(-rate * ageDays), with age measured
 * from {@code updatedAt}. Confidence writes keep {@code updatedAt}, so each sweep
 * decays the already-decayed value again: repeated sweeps keep lowering confidence.
 *
 * All writes go through {@link ContextStorage#update} as metadata-only updates.
 */
@Service
public class ContextEvolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ContextEvolutionEngine.class);

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final ContextStore contextStore;
    private final ContextStorage contextStorage;
    private final EvolutionProperties properties;

    public ContextEvolutionEngine(ContextStore contextStore,
                                  ContextStorage contextStorage,
                                  EvolutionProperties properties) {
        if (!(properties.getFeedbackSmoothing() > 0.0 && properties.getFeedbackSmoothing() <= 1.0)) {
            throw new IllegalArgumentException("Feedback smoothing must be within (0, 1]: "
                    + properties.getFeedbackSmoothing());
        }
        if (!Double.isFinite(properties.getTemporalDecayRate()) || properties.getTemporalDecayRate() < 0.0) {
            throw new IllegalArgumentException("Temporal decay rate must be a non-negative number: "
                    + properties.getTemporalDecayRate());
        }
        this.contextStore = contextStore;
        this.contextStorage = contextStorage;
        this.properties = properties;
    }

    /**
     * Applies one feedback event to the referenced context's confidence.
     *
     * Unknown contexts are ignored.
     *
     * @throws ContextValidationException if the context id is missing or the rating is outside 1..5
     */
    public void processFeedback(FeedbackEvent event) {
        validate(event);

        Optional<Context> found = contextStore.findById(event.contextId());
        if (found.isEmpty()) {
            log.info("Feedback ignored, context {} not found", event.contextId());
            return;
        }

        double current = found.get().metadata().effectiveConfidence();
        double signal = signalOf(event);
        double alpha = properties.getFeedbackSmoothing();
        double updated = clamp(current * (1 - alpha) + signal * alpha);

        if (Math.abs(updated - current) <= properties.getChangeEpsilon()) {
            log.debug("Feedback for context {} left confidence at {}", event.contextId(), current);
            return;
        }

        contextStorage.update(confidenceUpdate(event.contextId(), updated));
        log.info("Feedback for context {}: confidence {} -> {} (signal={})",
                event.contextId(), round(current), round(updated), signal);
    }

    /**
     * Runs the requested evolution steps, stopping between batches if the thread is interrupted.
     */
    public EvolutionResult evolve(EvolutionRequest request) {
        return evolve(request, () -> Thread.currentThread().isInterrupted());
    }

    /**
     * Runs the requested evolution steps.
     *
     * Consolidation and conflict resolution are accepted but not performed.
     *
     * @param cancellation checked before each batch; the sweep stops when it returns true
     */
    public EvolutionResult evolve(EvolutionRequest request, BooleanSupplier cancellation) {
        long startTime = System.nanoTime();
        if (request == null || request.workspaceId() == null || request.workspaceId().isBlank()) {
            throw new ContextValidationException("workspaceId is required");
        }
        if (request.consolidateSimilar() || request.resolveConflicts()) {
            log.debug("Consolidation and conflict resolution are not supported, skipping for workspace {}",
                    request.workspaceId());
        }

        if (!request.applyTemporalDecay()) {
            return new EvolutionResult(0, 0, 0, List.of(), 0, false, elapsedMs(startTime),
                    "No evolution steps requested");
        }

        Sweep sweep = decayWorkspace(request.workspaceId(), cancellation);
        long latencyMs = elapsedMs(startTime);

        String summary = String.format("Decayed %d contexts, flagged %d below %.2f, removed %d%s",
                sweep.updated, sweep.flagged.size(), properties.getMinConfidenceThreshold(),
                sweep.removed, sweep.cancelled ? " (cancelled)" : "");
        log.info("Evolution of workspace {}: {} in {}ms", request.workspaceId(), summary, latencyMs);

        return new EvolutionResult(sweep.updated, 0, 0, sweep.flagged, sweep.removed,
                sweep.cancelled, latencyMs, summary);
    }

    /**
     * Confidence statistics for a workspace. Contexts without a confidence count as 1.0.
     */
    public EvolutionStats getEvolutionStats(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new ContextValidationException("workspaceId is required");
        }

        long total = 0;
        long low = 0;
        double sum = 0.0;
        String afterId = null;
        while (true) {
            List<Context> page = contextStore.findByWorkspace(workspaceId, null, null, afterId, properties.getBatchSize());
            for (Context context : page) {
                double confidence = context.metadata().effectiveConfidence();
                total++;
                sum += confidence;
                if (confidence < properties.getMinConfidenceThreshold()) {
                    low++;
                }
            }
            if (page.size() < properties.getBatchSize()) {
                break;
            }
            afterId = page.get(page.size() - 1).id();
        }

        return new EvolutionStats(total, total == 0 ? 0.0 : sum / total, low);
    }

    private Sweep decayWorkspace(String workspaceId, BooleanSupplier cancellation) {
        Sweep sweep = new Sweep();
        Instant now = Instant.now();
        String afterId = null;
        int batch = 0;

        while (true) {
            if (cancellation.getAsBoolean()) {
                log.warn("Decay sweep of workspace {} cancelled after {} batches", workspaceId, batch);
                sweep.cancelled = true;
                break;
            }

            List<Context> page = contextStore.findByWorkspace(workspaceId, null, null, afterId, properties.getBatchSize());
            if (page.isEmpty()) {
                break;
            }
            batch++;

            List<String> flaggedInBatch = new ArrayList<>();
            for (Context context : page) {
                double current = context.metadata().effectiveConfidence();
                double decayed = clamp(current * Math.exp(-properties.getTemporalDecayRate() * ageDays(context, now)));

                double confidence = current;
                if (current - decayed > properties.getChangeEpsilon()
                        && contextStorage.update(confidenceUpdate(context.id(), decayed)) != null) {
                    sweep.updated++;
                    confidence = decayed;
                }
                if (confidence < properties.getMinConfidenceThreshold()) {
                    flaggedInBatch.add(context.id());
                }
            }

            sweep.flagged.addAll(flaggedInBatch);
            if (properties.isDeleteBelowThreshold()) {
                for (String contextId : flaggedInBatch) {
                    if (contextStorage.delete(contextId)) {
                        sweep.removed++;
                    }
                }
            }
            log.debug("Decay batch {} of workspace {}: {} contexts, {} flagged",
                    batch, workspaceId, page.size(), flaggedInBatch.size());

            if (page.size() < properties.getBatchSize()) {
                break;
            }
            afterId = page.get(page.size() - 1).id();
        }
        return sweep;
    }

    /**
     * Maps feedback to a signal: rating 1..5 to 0..1, otherwise helpful to 1 and unhelpful to 0.
     */
    static double signalOf(FeedbackEvent event) {
        if (event.rating() != null) {
            return (event.rating() - 1) / 4.0;
        }
        return event.helpful() ? 1.0 : 0.0;
    }

    private static ContextUpdateRequest confidenceUpdate(String contextId, double confidence) {
        return ContextUpdateRequest.builder(contextId)
                .confidence(confidence)
                .regenerateEmbeddings(false)
                .preserveUpdatedAt(true)
                .build();
    }

    private static double ageDays(Context context, Instant now) {
        if (context.updatedAt() == null) {
            return 0.0;
        }
        return Math.max(0.0, (now.toEpochMilli() - context.updatedAt().toEpochMilli()) / MILLIS_PER_DAY);
    }

    private static void validate(FeedbackEvent event) {
        if (event == null) {
            throw new ContextValidationException("feedback event is required");
        }
        if (event.contextId() == null || event.contextId().isBlank()) {
            throw new ContextValidationException("contextId is required");
        }
        if (event.rating() != null && (event.rating() < 1 || event.rating() > 5)) {
            throw new ContextValidationException("rating must be within 1..5: " + event.rating());
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 10_000) / 10_000.0;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static final class Sweep {
        int updated;
        int removed;
        boolean cancelled;
        final List<String> flagged = new ArrayList<>();
    }
}
