package com.adlanda.contextengine;

import com.adlanda.contextengine.model.EvolutionRequest;
import com.adlanda.contextengine.model.EvolutionResult;
import com.adlanda.contextengine.repository.ContextStore;
import com.adlanda.contextengine.service.ContextEvolutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs temporal decay over every workspace on a fixed delay.
 *
 * Only active with {@code contextengine.evolution.auto-enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "contextengine.evolution", name = "auto-enabled", havingValue = "true")
public class EvolutionScheduler {

    private static final Logger log = LoggerFactory.getLogger(EvolutionScheduler.class);

    private final ContextStore contextStore;
    private final ContextEvolutionEngine evolutionEngine;

    public EvolutionScheduler(ContextStore contextStore, ContextEvolutionEngine evolutionEngine) {
        this.contextStore = contextStore;
        this.evolutionEngine = evolutionEngine;
    }

    @Scheduled(fixedDelayString = "${contextengine.evolution.interval:PT24H}",
            initialDelayString = "${contextengine.evolution.interval:PT24H}")
    public void runDecaySweep() {
        List<String> workspaces = contextStore.findWorkspaceIds();
        log.info("Starting scheduled decay sweep over {} workspaces", workspaces.size());

        int failed = 0;
        for (String workspaceId : workspaces) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Scheduled decay sweep interrupted");
                return;
            }
            try {
                EvolutionResult result = evolutionEngine.evolve(EvolutionRequest.temporalDecay(workspaceId));
                log.debug("Workspace {}: {}", workspaceId, result.summary());
            } catch (Exception e) {
                failed++;
                log.error("Decay sweep failed for workspace {}: {}", workspaceId, e.getMessage(), e);
            }
        }

        log.info("Scheduled decay sweep complete: {} workspaces, {} failed", workspaces.size(), failed);
    }
}
