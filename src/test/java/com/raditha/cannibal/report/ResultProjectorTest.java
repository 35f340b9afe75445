package com.raditha.cannibal.report;

import com.raditha.cannibal.model.CandidateMatch;
import com.raditha.cannibal.model.PageGroup;
import com.raditha.cannibal.model.PageProfile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class ResultProjectorTest {

    private final ResultProjector projector = new ResultProjector();

    @Test
    void testProjectsGroupWithCommonTermsAndEvidence() {
        Map<String, PageProfile> profiles = Map.of(
                "a", PageProfile.of("a", Set.of("x", "y", "z"), 5),
                "b", PageProfile.of("b", Set.of("x", "y", "w"), 9),
                "c", PageProfile.of("c", Set.of("x", "z"), 2));
        CandidateMatch ab = new CandidateMatch("a", "b", new TreeSet<>(Set.of("x", "y")), 2.0 / 3);
        CandidateMatch ac = new CandidateMatch("a", "c", new TreeSet<>(Set.of("x", "z")), 2.0 / 3);
        PageGroup group = new PageGroup("a", "b", 9, new TreeSet<>(Set.of("a", "c")), Map.of("b", ab, "c", ac));

        GroupReport report = projector.project(group, profiles);

        assertEquals(List.of("b", "a", "c"), report.similarPages());
        assertEquals(List.of("x"), report.sharedTerms());
        assertEquals(1, report.sharedTermCount());
        assertEquals("b", report.keepPage());
        assertEquals(9, report.clicks());

        assertEquals(2, report.members().size());
        GroupReport.MemberEvidence source = report.members().get(0);
        assertEquals("a", source.page());
        assertEquals(5, source.clicks());
        assertEquals(List.of("x", "y"), source.sharedKeywords());
        GroupReport.MemberEvidence other = report.members().get(1);
        assertEquals("c", other.page());
        assertEquals(2, other.sharedCount());
    }

    @Test
    void testUnknownPageRejected() {
        CandidateMatch ab = new CandidateMatch("a", "b", new TreeSet<>(Set.of("x")), 1.0);
        PageGroup group = new PageGroup("a", "b", 1, new TreeSet<>(Set.of("a")), Map.of("b", ab));

        assertThrows(IllegalStateException.class,
                () -> projector.project(group, Map.of("a", PageProfile.of("a", Set.of("x"), 1))));
    }
}
