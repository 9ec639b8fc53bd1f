package com.adlanda.contextengine;

import com.adlanda.contextengine.config.EvolutionProperties;
import com.adlanda.contextengine.config.RetrievalProperties;
import com.adlanda.contextengine.config.VectorIndexProperties;
import com.adlanda.contextengine.model.ContextTier;
import com.adlanda.contextengine.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final VectorIndex vectorIndex;
    private final VectorIndexProperties vectorIndexProperties;
    private final RetrievalProperties retrievalProperties;
    private final EvolutionProperties evolutionProperties;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(VectorIndex vectorIndex,
                             VectorIndexProperties vectorIndexProperties,
                             RetrievalProperties retrievalProperties,
                             EvolutionProperties evolutionProperties) {
        this.vectorIndex = vectorIndex;
        this.vectorIndexProperties = vectorIndexProperties;
        this.retrievalProperties = retrievalProperties;
        this.evolutionProperties = evolutionProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Context Engine v{}
            Vector index: {} ({} points)
            Tier order:   {}
            Weights:      {}
            Auto evolution: {} (every {})
            """,
            version,
            vectorIndexProperties.getType(), countPoints(),
            ContextTier.SEARCH_ORDER.stream().map(ContextTier::value).collect(Collectors.joining(" -> ")),
            retrievalProperties.getWeights(),
            evolutionProperties.isAutoEnabled() ? "on" : "off", evolutionProperties.getInterval()
        );
    }

    private String countPoints() {
        try {
            return String.valueOf(vectorIndex.count());
        } catch (RuntimeException e) {
            log.warn("Vector index not reachable at startup: {}", e.getMessage());
            return "unknown";
        }
    }
}
