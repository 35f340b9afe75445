package com.raditha.cannibal.report;

import com.raditha.cannibal.analyzer.CannibalizationReport;
import com.raditha.cannibal.model.CandidateMatch;
import com.raditha.cannibal.model.PageGroup;
import com.raditha.cannibal.model.PageProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Shapes resolved groups into report rows.
 */
public class ResultProjector {

    public List<GroupReport> project(CannibalizationReport report) {
        return report.groups().stream()
                .map(group -> project(group, report.profiles()))
                .toList();
    }

    public GroupReport project(PageGroup group, Map<String, PageProfile> profiles) {
        List<String> pages = group.allPages();
        List<String> common = new ArrayList<>(commonKeywords(pages, profiles));

        List<GroupReport.MemberEvidence> members = new ArrayList<>();
        for (String member : group.members()) {
            CandidateMatch evidence = group.evidenceFor(member);
            members.add(new GroupReport.MemberEvidence(
                    member,
                    profile(member, profiles).clicks(),
                    evidence != null ? new ArrayList<>(evidence.shared()) : List.of(),
                    evidence != null ? evidence.sharedCount() : 0,
                    evidence != null ? evidence.ratio() : 0.0));
        }

        return new GroupReport(
                pages,
                common,
                common.size(),
                group.representative(),
                group.representativeClicks(),
                members);
    }

    /**
     * Intersection of the keyword sets of all pages.
     */
    static TreeSet<String> commonKeywords(List<String> pages, Map<String, PageProfile> profiles) {
        TreeSet<String> common = null;
        for (String page : pages) {
            if (common == null) {
                common = new TreeSet<>(profile(page, profiles).keywords());
            } else {
                common.retainAll(profile(page, profiles).keywords());
            }
        }
        return common != null ? common : new TreeSet<>();
    }

    private static PageProfile profile(String page, Map<String, PageProfile> profiles) {
        PageProfile profile = profiles.get(page);
        if (profile == null) {
            throw new IllegalStateException("Group refers to unknown page: " + page);
        }
        return profile;
    }
}
