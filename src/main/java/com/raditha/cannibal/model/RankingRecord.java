package com.raditha.cannibal.model;

/**
 * One observed ranking: a landing page received clicks for a search query.
 *
 * @param page    Landing page identifier (URL)
 * @param keyword Search query the page ranked for
 * @param clicks  Clicks the page received for the query
 */
public record RankingRecord(
        String page,
        String keyword,
        long clicks) {

    public RankingRecord {
        if (page == null) {
            throw new IllegalArgumentException("page cannot be null");
        }
        if (keyword == null) {
            throw new IllegalArgumentException("keyword cannot be null");
        }
    }
}
