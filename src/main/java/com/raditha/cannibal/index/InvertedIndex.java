package com.raditha.cannibal.index;

import com.raditha.cannibal.model.PageProfile;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Keyword to page inverted index.
 * Restricts each similarity query to pages sharing at least one keyword with
 * the source instead of scanning every page.
 * <p>
 * Built once per run and read-only afterwards, so it can be queried from
 * several threads at once. Invariant: {@code page in pagesFor(kw)} exactly
 * when {@code kw} is one of the page's keywords.
 */
public class InvertedIndex {

    private final Map<String, Set<String>> postings;
    private final int pageCount;

    private InvertedIndex(Map<String, Set<String>> postings, int pageCount) {
        this.postings = postings;
        this.pageCount = pageCount;
    }

    /**
     * Index every (keyword, page) pair of the given profiles.
     */
    public static InvertedIndex build(Collection<PageProfile> profiles) {
        Map<String, Set<String>> postings = new HashMap<>();
        for (PageProfile profile : profiles) {
            for (String keyword : profile.keywords()) {
                postings.computeIfAbsent(keyword, k -> new HashSet<>()).add(profile.id());
            }
        }

        Map<String, Set<String>> frozen = new HashMap<>(postings.size() * 4 / 3 + 1);
        for (Map.Entry<String, Set<String>> entry : postings.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
        }
        return new InvertedIndex(Collections.unmodifiableMap(frozen), profiles.size());
    }

    /**
     * Union of the pages indexed under any of the keywords.
     */
    public Set<String> candidates(Set<String> keywords) {
        Set<String> candidates = new HashSet<>();
        for (String keyword : keywords) {
            Set<String> pages = postings.get(keyword);
            if (pages != null) {
                candidates.addAll(pages);
            }
        }
        return candidates;
    }

    /**
     * Pages sharing at least one keyword with the source, the source excluded.
     */
    public Set<String> candidates(PageProfile source) {
        Set<String> candidates = candidates(source.keywords());
        candidates.remove(source.id());
        return candidates;
    }

    public Set<String> pagesFor(String keyword) {
        return postings.getOrDefault(keyword, Set.of());
    }

    public int keywordCount() {
        return postings.size();
    }

    public int pageCount() {
        return pageCount;
    }

    /**
     * Total number of (keyword, page) entries.
     */
    public long postingCount() {
        return postings.values().stream().mapToLong(Set::size).sum();
    }
}
