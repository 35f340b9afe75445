package com.raditha.cannibal.report;

import java.util.List;

/**
 * Reporting shape of one group.
 *
 * @param similarPages    Every page of the group, the kept page first
 * @param sharedTerms     Keywords every page of the group ranks for
 * @param sharedTermCount Size of {@code sharedTerms}
 * @param keepPage        Page to keep
 * @param clicks          Total clicks of the kept page
 * @param members         Per-page overlap with the page that opened the group
 */
public record GroupReport(
        List<String> similarPages,
        List<String> sharedTerms,
        int sharedTermCount,
        String keepPage,
        long clicks,
        List<MemberEvidence> members) {

    public GroupReport {
        similarPages = List.copyOf(similarPages);
        sharedTerms = List.copyOf(sharedTerms);
        members = List.copyOf(members);
    }

    /**
     * Overlap evidence for one non-kept page.
     *
     * @param page            Member page
     * @param clicks          Its total clicks
     * @param sharedKeywords  Keywords it shares with the group's opening page
     * @param sharedCount     Size of {@code sharedKeywords}
     * @param ratio           Share of the opening page's keywords covered
     */
    public record MemberEvidence(
            String page,
            long clicks,
            List<String> sharedKeywords,
            int sharedCount,
            double ratio) {

        public MemberEvidence {
            sharedKeywords = List.copyOf(sharedKeywords);
        }
    }
}
