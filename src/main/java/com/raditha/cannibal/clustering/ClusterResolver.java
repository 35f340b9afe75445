package com.raditha.cannibal.clustering;

import com.raditha.cannibal.model.CandidateMatch;
import com.raditha.cannibal.model.PageGroup;
import com.raditha.cannibal.model.PageProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Turns per-page candidate lists into disjoint groups.
 * <p>
 * Pages are visited once in ascending id order. An unclaimed page with at
 * least one unclaimed qualifying candidate opens a group made of itself and
 * those candidates; every page of the group is then claimed and cannot join
 * a later group. There is no transitive merging: pages related only through
 * a chain A~B~C end up together only if the opening page qualifies each of
 * them directly.
 * <p>
 * The representative is the page with the most clicks; on a tie the page
 * that comes first in the visiting order (lowest id) wins. Runs on a single
 * thread, the claimed set is owned by one {@link #resolve} call.
 */
public class ClusterResolver {

    private static final Logger logger = LoggerFactory.getLogger(ClusterResolver.class);

    /**
     * Resolve groups.
     *
     * @param profiles profile table, iterated in its (ascending) key order
     * @param matches  qualifying candidates per source page; pages without an
     *                 entry have no outbound candidates
     * @return groups in the order they were opened
     */
    public List<PageGroup> resolve(SortedMap<String, PageProfile> profiles,
            Map<String, List<CandidateMatch>> matches) {
        if (profiles.isEmpty() || matches.isEmpty()) {
            return List.of();
        }

        Set<String> claimed = new HashSet<>();
        List<PageGroup> groups = new ArrayList<>();

        for (String page : profiles.keySet()) {
            if (claimed.contains(page)) {
                continue;
            }

            Map<String, CandidateMatch> available = new LinkedHashMap<>();
            for (CandidateMatch match : matches.getOrDefault(page, List.of())) {
                if (!claimed.contains(match.to())) {
                    available.put(match.to(), match);
                }
            }
            if (available.isEmpty()) {
                continue;
            }

            TreeSet<String> pages = new TreeSet<>(available.keySet());
            pages.add(page);

            String representative = pickRepresentative(pages, profiles);
            claimed.addAll(pages);

            pages.remove(representative);
            PageGroup group = new PageGroup(
                    page,
                    representative,
                    profiles.get(representative).clicks(),
                    pages,
                    available);
            groups.add(group);

            logger.debug("Group opened by {}: keep {} ({} pages)", page, representative, group.size());
        }

        logger.debug("Resolved {} groups, {} of {} pages claimed", groups.size(), claimed.size(), profiles.size());
        return groups;
    }

    /**
     * Highest clicks wins; among equal clicks the first page in ascending
     * order is kept.
     */
    static String pickRepresentative(TreeSet<String> pages, Map<String, PageProfile> profiles) {
        String best = null;
        long bestClicks = -1;
        for (String page : pages) {
            PageProfile profile = profiles.get(page);
            if (profile == null) {
                throw new IllegalStateException("Candidate refers to unknown page: " + page);
            }
            if (profile.clicks() > bestClicks) {
                best = page;
                bestClicks = profile.clicks();
            }
        }
        return best;
    }
}
