package com.raditha.cannibal.model;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Aggregated view of one landing page: every keyword it ranks for and its
 * total clicks. Immutable for the duration of a run.
 *
 * @param id       Normalized page identifier
 * @param keywords Distinct keywords the page ranks for (never empty)
 * @param clicks   Sum of clicks over all rows for the page
 */
public record PageProfile(
        String id,
        SortedSet<String> keywords,
        long clicks) {

    public PageProfile {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("keywords cannot be empty for page " + id);
        }
        if (clicks < 0) {
            throw new IllegalArgumentException("clicks must be >= 0 for page " + id + ", got: " + clicks);
        }
        keywords = Collections.unmodifiableSortedSet(new TreeSet<>(keywords));
    }

    /**
     * Convenience factory accepting any set of keywords.
     */
    public static PageProfile of(String id, Set<String> keywords, long clicks) {
        return new PageProfile(id, new TreeSet<>(keywords), clicks);
    }

    public int keywordCount() {
        return keywords.size();
    }

    /**
     * Check whether this page has enough keywords to start a comparison.
     */
    public boolean isEligibleSource(int minKeywords) {
        return keywords.size() >= minKeywords;
    }
}
