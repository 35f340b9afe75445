package com.raditha.cannibal.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CannibalizationSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultsWithoutYaml() {
        CannibalizationConfig config = CannibalizationSettings.defaults().toConfig(null, null, null, null);

        assertEquals(CannibalizationConfig.moderate(), config);
    }

    @Test
    void testYamlValuesApplied() {
        CannibalizationSettings settings = CannibalizationSettings.parse("""
                cannibalization:
                  threshold: 0.65
                  min_keywords: 4
                  parallelism: 3
                  exclude_fragment_urls: false
                """);

        CannibalizationConfig config = settings.toConfig(null, null, null, null);

        assertEquals(0.65, config.threshold());
        assertEquals(4, config.minKeywords());
        assertEquals(3, config.parallelism());
        assertFalse(config.excludeFragmentUrls());
    }

    @Test
    void testCliOverridesYaml() {
        CannibalizationSettings settings = CannibalizationSettings.parse("""
                cannibalization:
                  threshold: 0.65
                  min_keywords: 4
                """);

        CannibalizationConfig config = settings.toConfig(0.0, 12, 1, null);

        assertEquals(0.0, config.threshold());
        assertEquals(12, config.minKeywords());
        assertEquals(1, config.parallelism());
    }

    @Test
    void testYamlPresetIsBaseForOtherValues() {
        CannibalizationSettings settings = CannibalizationSettings.parse("""
                cannibalization:
                  preset: lenient
                  min_keywords: 6
                """);

        CannibalizationConfig config = settings.toConfig(null, null, null, null);

        assertEquals(0.60, config.threshold());
        assertEquals(6, config.minKeywords());
    }

    @Test
    void testCliPresetWins() {
        CannibalizationSettings settings = CannibalizationSettings.parse("""
                cannibalization:
                  threshold: 0.1
                """);

        assertEquals(CannibalizationConfig.strict(), settings.toConfig(0.3, null, null, "strict"));
    }

    @Test
    void testInvalidYamlValuesRejected() {
        CannibalizationSettings outOfRange = CannibalizationSettings.parse("""
                cannibalization:
                  threshold: 1.5
                """);
        CannibalizationSettings notANumber = CannibalizationSettings.parse("""
                cannibalization:
                  threshold: high
                """);

        assertThrows(IllegalArgumentException.class, () -> outOfRange.toConfig(null, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> notANumber.toConfig(null, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> CannibalizationSettings.parse("a: [b"));
    }

    @Test
    void testMissingSectionFallsBackToDefaults() {
        CannibalizationSettings settings = CannibalizationSettings.parse("other: {}");

        assertEquals(CannibalizationConfig.moderate(), settings.toConfig(null, null, null, null));
    }

    @Test
    void testLoadFromFile() throws IOException {
        Path file = tempDir.resolve("custom.yml");
        Files.writeString(file, "cannibalization:\n  threshold: 0.7\n");

        assertEquals(0.7, CannibalizationSettings.load(file).toConfig(null, null, null, null).threshold());
    }

    @Test
    void testFractionalWholeNumberFieldsRejected() {
        CannibalizationSettings fractional = CannibalizationSettings.parse(
                "cannibalization:\n  min_keywords: 10.7\n");
        CannibalizationSettings tooLarge = CannibalizationSettings.parse(
                "cannibalization:\n  parallelism: 9999999999\n");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> fractional.toConfig(null, null, null, null));
        assertTrue(ex.getMessage().contains("min_keywords"));
        assertThrows(IllegalArgumentException.class, () -> tooLarge.toConfig(null, null, null, null));
    }

    @Test
    void testNonBooleanFragmentFlagRejected() {
        CannibalizationSettings settings = CannibalizationSettings.parse(
                "cannibalization:\n  exclude_fragment_urls: maybe\n");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> settings.toConfig(null, null, null, null));
        assertTrue(ex.getMessage().contains("exclude_fragment_urls"));
    }
}
