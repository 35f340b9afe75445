package com.raditha.cannibal.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CannibalizationConfigTest {

    @Test
    void testPresets() {
        assertEquals(0.80, CannibalizationConfig.moderate().threshold());
        assertEquals(0.90, CannibalizationConfig.strict().threshold());
        assertEquals(0.60, CannibalizationConfig.lenient().threshold());
        assertEquals(10, CannibalizationConfig.moderate().minKeywords());
        assertTrue(CannibalizationConfig.moderate().parallelism() >= 1);
        assertTrue(CannibalizationConfig.moderate().excludeFragmentUrls());
    }

    @Test
    void testFromPreset() {
        assertEquals(CannibalizationConfig.strict(), CannibalizationConfig.fromPreset("STRICT"));
        assertThrows(IllegalArgumentException.class, () -> CannibalizationConfig.fromPreset("extreme"));
    }

    @Test
    void testBoundaryThresholdsAccepted() {
        assertEquals(0.0, CannibalizationConfig.moderate().withThreshold(0.0).threshold());
        assertEquals(1.0, CannibalizationConfig.moderate().withThreshold(1.0).threshold());
    }

    @Test
    void testInvalidValuesFailFast() {
        CannibalizationConfig base = CannibalizationConfig.moderate();
        assertThrows(IllegalArgumentException.class, () -> base.withThreshold(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> base.withThreshold(Double.NEGATIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> base.withThreshold(1.01));
        assertThrows(IllegalArgumentException.class, () -> base.withThreshold(-0.01));
        assertThrows(IllegalArgumentException.class, () -> base.withMinKeywords(-1));
        assertThrows(IllegalArgumentException.class, () -> base.withParallelism(0));
    }
}
