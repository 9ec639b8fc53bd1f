package com.adlanda.contextengine.service;

import java.util.List;

/**
 * Turns text into fixed-length vectors.
 */
public interface EmbeddingProvider {

    List<Double> embed(String text);

    /**
     * Embeds several texts; the result has one vector per input, in input order.
     */
    List<List<Double>> embedBatch(List<String> texts);
}
