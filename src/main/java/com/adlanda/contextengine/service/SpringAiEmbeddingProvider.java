package com.adlanda.contextengine.service;

import com.adlanda.contextengine.config.EmbeddingProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link EmbeddingProvider} on Spring AI's EmbeddingModel (OpenAI by default).
 *
 * Results are cached by the SHA-256 of the text. Batch calls only send the
 * uncached texts, split into sub-batches of {@code max-batch-size}.
 */
@Service
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;
    private final ContentHashService hashService;
    private final int maxBatchSize;
    private final Cache<String, List<Double>> cache;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel,
                                     ContentHashService hashService,
                                     EmbeddingProperties properties) {
        this.embeddingModel = embeddingModel;
        this.hashService = hashService;
        this.maxBatchSize = properties.getMaxBatchSize();
        this.cache = properties.isCacheEnabled()
                ? Caffeine.newBuilder()
                        .maximumSize(properties.getCacheMaxSize())
                        .expireAfterWrite(properties.getCacheTtl())
                        .build()
                : null;
    }

    /**
     * Generates an embedding vector for the given text.
     *
     * @param text The text to embed (must not be blank)
     * @return The embedding vector
     */
    @Override
    public List<Double> embed(String text) {
        requireText(text);
        String key = hashService.computeHash(text);
        List<Double> cached = cache != null ? cache.getIfPresent(key) : null;
        if (cached != null) {
            return cached;
        }

        EmbeddingResponse response = embeddingModel.embedForResponse(List.of(text));
        List<Double> embedding = toDoubleList(response.getResult().getOutput());
        if (cache != null) {
            cache.put(key, embedding);
        }
        return embedding;
    }

    @Override
    public List<List<Double>> embedBatch(List<String> texts) {
        texts.forEach(this::requireText);

        List<List<Double>> results = new ArrayList<>(texts.size());
        List<String> keys = new ArrayList<>(texts.size());
        List<Integer> missing = new ArrayList<>();

        for (int i = 0; i < texts.size(); i++) {
            String key = hashService.computeHash(texts.get(i));
            keys.add(key);
            List<Double> cached = cache != null ? cache.getIfPresent(key) : null;
            results.add(cached);
            if (cached == null) {
                missing.add(i);
            }
        }

        for (int from = 0; from < missing.size(); from += maxBatchSize) {
            List<Integer> slice = missing.subList(from, Math.min(from + maxBatchSize, missing.size()));
            List<String> batch = slice.stream().map(texts::get).toList();

            List<Embedding> embeddings = embeddingModel.embedForResponse(batch).getResults();
            if (embeddings.size() != batch.size()) {
                throw new IllegalStateException("Embedding model returned " + embeddings.size()
                        + " vectors for " + batch.size() + " texts");
            }

            for (int j = 0; j < slice.size(); j++) {
                int index = slice.get(j);
                List<Double> embedding = toDoubleList(embeddings.get(j).getOutput());
                results.set(index, embedding);
                if (cache != null) {
                    cache.put(keys.get(index), embedding);
                }
            }
        }

        log.debug("Embedded {} texts ({} from cache)", texts.size(), texts.size() - missing.size());
        return results;
    }

    private void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
    }

    private List<Double> toDoubleList(float[] floats) {
        Double[] doubles = new Double[floats.length];
        for (int i = 0; i < floats.length; i++) {
            doubles[i] = (double) floats[i];
        }
        return List.of(doubles);
    }
}
