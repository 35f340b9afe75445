package com.raditha.cannibal.model;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Directional overlap between a source page and one of its candidates.
 * <p>
 * The ratio always uses the source page's keyword count as denominator, so
 * {@code match(A, B)} and {@code match(B, A)} share the same keywords but can
 * land on different sides of the threshold.
 *
 * @param from   Source page (the page being evaluated)
 * @param to     Candidate page found through the inverted index
 * @param shared Keywords present in both pages
 * @param ratio  {@code |shared| / |keywords(from)|}
 */
public record CandidateMatch(
        String from,
        String to,
        SortedSet<String> shared,
        double ratio) {

    public CandidateMatch {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to cannot be null");
        }
        if (from.equals(to)) {
            throw new IllegalArgumentException("a page cannot match itself: " + from);
        }
        shared = Collections.unmodifiableSortedSet(new TreeSet<>(shared));
    }

    public int sharedCount() {
        return shared.size();
    }

    /**
     * Check if the overlap ratio meets a threshold.
     */
    public boolean meetsThreshold(double threshold) {
        return ratio >= threshold;
    }

    /**
     * Format as "from -> to (n shared, 85.0%)" for display.
     */
    public String toDisplayString() {
        return String.format("%s -> %s (%d shared, %.1f%%)", from, to, sharedCount(), ratio * 100);
    }
}
