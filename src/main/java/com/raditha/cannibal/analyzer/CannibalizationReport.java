package com.raditha.cannibal.analyzer;

import com.raditha.cannibal.config.CannibalizationConfig;
import com.raditha.cannibal.model.PageGroup;
import com.raditha.cannibal.model.PageProfile;
import com.raditha.cannibal.normalization.NormalizationSummary;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of one analysis run: the groups found plus the figures needed to
 * explain them.
 *
 * @param groups           Disjoint groups in the order they were opened
 * @param profiles         Profile table the groups were computed from
 * @param eligibleSources  Pages with enough keywords to act as a source
 * @param candidateMatches Qualifying (source, candidate) pairs before resolution
 * @param indexedKeywords  Distinct keywords in the inverted index
 * @param normalization    Row counts from the cleaning step
 * @param config           Configuration used
 */
public record CannibalizationReport(
        List<PageGroup> groups,
        SortedMap<String, PageProfile> profiles,
        int eligibleSources,
        int candidateMatches,
        int indexedKeywords,
        NormalizationSummary normalization,
        CannibalizationConfig config) {

    public CannibalizationReport {
        groups = List.copyOf(groups);
        profiles = Collections.unmodifiableSortedMap(new TreeMap<>(profiles));
    }

    /**
     * Report for a run with nothing to analyze.
     */
    public static CannibalizationReport empty(NormalizationSummary normalization, CannibalizationConfig config) {
        return new CannibalizationReport(List.of(), new TreeMap<>(), 0, 0, 0, normalization, config);
    }

    public boolean hasGroups() {
        return !groups.isEmpty();
    }

    public int getGroupCount() {
        return groups.size();
    }

    public int getTotalPages() {
        return profiles.size();
    }

    /**
     * Pages that belong to some group, representatives included.
     */
    public int getGroupedPageCount() {
        return groups.stream().mapToInt(PageGroup::size).sum();
    }

    /**
     * Pages that would be merged into a representative.
     */
    public int getRedundantPageCount() {
        return groups.stream().mapToInt(g -> g.members().size()).sum();
    }

    public String getSummary() {
        return String.format(
                "Found %d groups covering %d pages from %d pages (%d sources, %d qualifying matches, threshold: %.0f%%)",
                groups.size(),
                getGroupedPageCount(),
                profiles.size(),
                eligibleSources,
                candidateMatches,
                config.threshold() * 100);
    }

    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("KEYWORD CANNIBALIZATION REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("Threshold: ").append(String.format("%.0f%%", config.threshold() * 100)).append("\n");
        sb.append("Min Keywords: ").append(config.minKeywords()).append("\n");
        sb.append("Rows: ").append(normalization).append("\n");
        sb.append("\n");

        sb.append(getSummary()).append("\n\n");

        if (groups.isEmpty()) {
            sb.append("No similar pages found.\n");
            return sb.toString();
        }

        for (int i = 0; i < groups.size(); i++) {
            PageGroup group = groups.get(i);
            sb.append(String.format("Group #%d - keep %s (%d clicks)\n",
                    i + 1, group.representative(), group.representativeClicks()));
            for (String member : group.members()) {
                PageProfile profile = profiles.get(member);
                var evidence = group.evidenceFor(member);
                sb.append(String.format("  %s: %d clicks, %d shared keywords\n",
                        member,
                        profile != null ? profile.clicks() : 0,
                        evidence != null ? evidence.sharedCount() : 0));
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
