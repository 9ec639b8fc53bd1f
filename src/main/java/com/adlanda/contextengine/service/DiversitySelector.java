package com.adlanda.contextengine.service;

import com.adlanda.contextengine.model.ScoredContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Greedy near-duplicate filter over a ranked list.
 *
 * Two contexts are near-duplicates when the Jaccard overlap of their content
 * token sets exceeds the threshold. Tokens are lower-cased runs of letters and digits.
 */
public class DiversitySelector {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final double duplicateThreshold;

    /**
     * @throws IllegalArgumentException if the threshold is outside [0, 1]
     */
    public DiversitySelector(double duplicateThreshold) {
        if (!(duplicateThreshold >= 0.0 && duplicateThreshold <= 1.0)) {
            throw new IllegalArgumentException("Duplicate threshold must be within [0, 1]: " + duplicateThreshold);
        }
        this.duplicateThreshold = duplicateThreshold;
    }

    /**
     * Walks {@code ranked} in order, accepting a context unless it is a
     * near-duplicate of one already accepted, until {@code limit} are accepted.
     */
    public List<ScoredContext> select(List<ScoredContext> ranked, int limit) {
        List<ScoredContext> accepted = new ArrayList<>();
        List<Set<String>> acceptedTokens = new ArrayList<>();

        for (ScoredContext candidate : ranked) {
            if (accepted.size() >= limit) {
                break;
            }
            Set<String> tokens = tokenize(candidate.context().content());
            boolean duplicate = acceptedTokens.stream()
                    .anyMatch(other -> jaccard(tokens, other) > duplicateThreshold);
            if (!duplicate) {
                accepted.add(candidate);
                acceptedTokens.add(tokens);
            }
        }
        return accepted;
    }

    /**
     * Token-overlap similarity in [0, 1]; two empty texts are identical.
     */
    public static double contentSimilarity(String a, String b) {
        return jaccard(tokenize(a), tokenize(b));
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        int union = a.size() + b.size() - intersection.size();
        return (double) intersection.size() / union;
    }

    private static Set<String> tokenize(String text) {
        Set<String> tokens = new HashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : NON_ALPHANUMERIC.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
