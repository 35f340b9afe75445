package com.raditha.cannibal.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A group of landing pages competing for the same queries.
 * <p>
 * The group was opened by {@code source}; {@code evidence} holds the source's
 * qualifying match against every other page of the group. The representative
 * is the page with the most clicks and is excluded from {@code members}.
 *
 * @param source               Page whose candidate search created the group
 * @param representative       Page to keep (highest clicks)
 * @param representativeClicks Total clicks of the representative
 * @param members              Other pages of the group, ascending
 * @param evidence             Source's match per candidate page, keyed by candidate id
 */
public record PageGroup(
        String source,
        String representative,
        long representativeClicks,
        SortedSet<String> members,
        Map<String, CandidateMatch> evidence) {

    public PageGroup {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("a group needs at least one member besides " + representative);
        }
        if (members.contains(representative)) {
            throw new IllegalArgumentException("representative cannot also be a member: " + representative);
        }
        members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
        evidence = Collections.unmodifiableMap(new TreeMap<>(evidence));
    }

    /**
     * Number of pages in the group, representative included.
     */
    public int size() {
        return members.size() + 1;
    }

    /**
     * Representative first, then members in ascending order.
     */
    public List<String> allPages() {
        List<String> pages = new ArrayList<>(size());
        pages.add(representative);
        pages.addAll(members);
        return pages;
    }

    public boolean contains(String page) {
        return representative.equals(page) || members.contains(page);
    }

    /**
     * Get the overlap evidence explaining why a page belongs to this group.
     * For candidates this is the source's match against them; the source
     * itself is explained by its match against the representative.
     *
     * @param page a page of this group other than the one it is measured against
     * @return the supporting match, or null if the page is not explained by one
     */
    public CandidateMatch evidenceFor(String page) {
        if (source.equals(page)) {
            return evidence.get(representative);
        }
        return evidence.get(page);
    }
}
