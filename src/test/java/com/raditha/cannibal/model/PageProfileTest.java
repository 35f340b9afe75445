package com.raditha.cannibal.model;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class PageProfileTest {

    @Test
    void testKeywordsAreCopied() {
        TreeSet<String> keywords = new TreeSet<>(Set.of("a", "b"));
        PageProfile profile = new PageProfile("p", keywords, 3);

        keywords.add("c");

        assertEquals(2, profile.keywordCount());
        assertThrows(UnsupportedOperationException.class, () -> profile.keywords().add("d"));
    }

    @Test
    void testInvalidProfilesRejected() {
        assertThrows(IllegalArgumentException.class, () -> PageProfile.of("p", Set.of(), 1));
        assertThrows(IllegalArgumentException.class, () -> PageProfile.of("", Set.of("a"), 1));
        assertThrows(IllegalArgumentException.class, () -> PageProfile.of("p", Set.of("a"), -1));
    }

    @Test
    void testEligibleSource() {
        PageProfile profile = PageProfile.of("p", Set.of("a", "b", "c"), 0);
        assertTrue(profile.isEligibleSource(3));
        assertFalse(profile.isEligibleSource(4));
    }

    @Test
    void testCandidateMatchCannotPointAtItself() {
        assertThrows(IllegalArgumentException.class,
                () -> new CandidateMatch("p", "p", new TreeSet<>(Set.of("a")), 1.0));
    }
}
