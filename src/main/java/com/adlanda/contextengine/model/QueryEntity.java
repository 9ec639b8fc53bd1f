package com.adlanda.contextengine.model;

/**
 * An entity extracted from the prompt by an upstream analyzer, used for query expansion.
 *
 * @param type       Entity kind (technology, file, symbol, ...)
 * @param value      Entity text appended to the query
 * @param confidence Extractor confidence in [0, 1]
 */
public record QueryEntity(
        String type,
        String value,
        double confidence
) {}
