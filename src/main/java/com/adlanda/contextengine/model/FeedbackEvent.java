package com.adlanda.contextengine.model;

import java.time.Instant;

/**
 * Feedback on a context that was offered to the model.
 *
 * @param contextId Context the feedback refers to
 * @param helpful   Whether the context helped
 * @param used      Whether the context was used in the response
 * @param rating    Optional 1..5 rating; takes precedence over {@code helpful}
 * @param timestamp When the feedback was given
 */
public record FeedbackEvent(
        String contextId,
        boolean helpful,
        boolean used,
        Integer rating,
        Instant timestamp
) {
    public FeedbackEvent {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static FeedbackEvent helpful(String contextId) {
        return new FeedbackEvent(contextId, true, true, null, Instant.now());
    }

    public static FeedbackEvent unhelpful(String contextId) {
        return new FeedbackEvent(contextId, false, false, null, Instant.now());
    }

    public static FeedbackEvent rated(String contextId, int rating) {
        return new FeedbackEvent(contextId, rating >= 3, true, rating, Instant.now());
    }
}
