package com.raditha.cannibal.profile;

import com.raditha.cannibal.ingestion.SchemaException;
import com.raditha.cannibal.model.PageProfile;
import com.raditha.cannibal.model.RankingRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

class PageProfileBuilderTest {

    private final PageProfileBuilder builder = new PageProfileBuilder();

    @Test
    void testKeywordsAreUnionedAndClicksSummed() {
        SortedMap<String, PageProfile> profiles = builder.build(List.of(
                new RankingRecord("b", "shoes", 3),
                new RankingRecord("a", "boots", 1),
                new RankingRecord("b", "shoes", 4),
                new RankingRecord("b", "trail", 2)));

        assertEquals(List.of("a", "b"), List.copyOf(profiles.keySet()));

        PageProfile b = profiles.get("b");
        assertEquals(Set.of("shoes", "trail"), b.keywords());
        // repeated keyword rows still count towards clicks
        assertEquals(9, b.clicks());
        assertEquals(2, b.keywordCount());
    }

    @Test
    void testEmptyInputGivesEmptyTable() {
        assertTrue(builder.build(List.of()).isEmpty());
    }

    @Test
    void testResultIsUnmodifiable() {
        SortedMap<String, PageProfile> profiles = builder.build(List.of(new RankingRecord("a", "x", 1)));
        assertThrows(UnsupportedOperationException.class, () -> profiles.remove("a"));
    }

    @Test
    void testClickTotalOverflowRaisesSchemaException() {
        List<RankingRecord> records = List.of(
                new RankingRecord("a", "shoes", Long.MAX_VALUE),
                new RankingRecord("a", "boots", 1));

        SchemaException ex = assertThrows(SchemaException.class, () -> builder.build(records));
        assertTrue(ex.getMessage().contains("a"));
    }
}
