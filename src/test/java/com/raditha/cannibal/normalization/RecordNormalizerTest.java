package com.raditha.cannibal.normalization;

import com.raditha.cannibal.model.RankingRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordNormalizerTest {

    private final RecordNormalizer normalizer = new RecordNormalizer();

    @Test
    void testTrailingSlashAndCaseAreNormalized() {
        RecordNormalizer.Result result = normalizer.normalize(List.of(
                new RankingRecord("https://example.com/shoes/", "Running SHOES", 4),
                new RankingRecord("https://example.com/shoes//", "trail", 1)));

        assertEquals(List.of(
                new RankingRecord("https://example.com/shoes", "running shoes", 4),
                new RankingRecord("https://example.com/shoes", "trail", 1)), result.records());
    }

    @Test
    void testFragmentUrlsDropped() {
        RecordNormalizer.Result result = normalizer.normalize(List.of(
                new RankingRecord("https://example.com/shoes#reviews", "shoes", 4),
                new RankingRecord("https://example.com/shoes", "shoes", 4)));

        assertEquals(1, result.records().size());
        assertEquals(1, result.summary().fragmentRows());
    }

    @Test
    void testFragmentUrlsKeptWhenDisabled() {
        RecordNormalizer.Result result = new RecordNormalizer(false).normalize(List.of(
                new RankingRecord("https://example.com/shoes#reviews", "shoes", 4)));

        assertEquals(1, result.records().size());
    }

    @Test
    void testExactDuplicatesDroppedBeforeCleaning() {
        // "a/" and "a" only become equal after cleaning, so both survive
        RecordNormalizer.Result result = normalizer.normalize(List.of(
                new RankingRecord("https://example.com/a", "shoes", 2),
                new RankingRecord("https://example.com/a", "shoes", 2),
                new RankingRecord("https://example.com/a/", "shoes", 2)));

        assertEquals(2, result.records().size());
        assertEquals(1, result.summary().duplicateRows());
    }

    @Test
    void testNegativeClicksDropped() {
        RecordNormalizer.Result result = normalizer.normalize(List.of(
                new RankingRecord("https://example.com/a", "shoes", -1),
                new RankingRecord("https://example.com/a", "boots", 0)));

        assertEquals(List.of(new RankingRecord("https://example.com/a", "boots", 0)), result.records());
        assertEquals(1, result.summary().negativeClickRows());
    }

    @Test
    void testValuesEmptyAfterCleaningDropped() {
        RecordNormalizer.Result result = normalizer.normalize(List.of(
                new RankingRecord("///", "shoes", 1),
                new RankingRecord("https://example.com/a", "   ", 1)));

        assertTrue(result.records().isEmpty());
        assertEquals(2, result.summary().emptyRows());
        assertEquals(2, result.summary().droppedRows());
    }

    @Test
    void testStripTrailingSlashes() {
        assertEquals("https://example.com", RecordNormalizer.stripTrailingSlashes("https://example.com/"));
        assertEquals("https://example.com/x", RecordNormalizer.stripTrailingSlashes("https://example.com/x"));
        assertEquals("", RecordNormalizer.stripTrailingSlashes("/"));
    }
}
