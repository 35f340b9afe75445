package com.raditha.cannibal.profile;

import com.raditha.cannibal.ingestion.SchemaException;
import com.raditha.cannibal.model.PageProfile;
import com.raditha.cannibal.model.RankingRecord;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Aggregates normalized records into one profile per page.
 * <p>
 * Keywords are collected as a set, so repeated observations of a keyword
 * collapse; clicks are summed over every row, repeats included.
 */
public class PageProfileBuilder {

    /**
     * Build profiles keyed by page id in ascending order.
     *
     * @param records normalized records
     * @return unmodifiable profile table, empty if there are no records
     * @throws SchemaException if a page's click total does not fit in a long
     */
    public SortedMap<String, PageProfile> build(List<RankingRecord> records) {
        Map<String, TreeSet<String>> keywords = new TreeMap<>();
        Map<String, Long> clicks = new TreeMap<>();

        for (RankingRecord record : records) {
            keywords.computeIfAbsent(record.page(), k -> new TreeSet<>()).add(record.keyword());
            try {
                clicks.merge(record.page(), record.clicks(), Math::addExact);
            } catch (ArithmeticException e) {
                throw new SchemaException("Click total overflows for page " + record.page(), e);
            }
        }

        SortedMap<String, PageProfile> profiles = new TreeMap<>();
        for (Map.Entry<String, TreeSet<String>> entry : keywords.entrySet()) {
            String page = entry.getKey();
            profiles.put(page, new PageProfile(page, entry.getValue(), clicks.get(page)));
        }
        return Collections.unmodifiableSortedMap(profiles);
    }
}
