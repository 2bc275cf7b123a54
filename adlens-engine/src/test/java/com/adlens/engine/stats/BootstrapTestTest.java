package com.adlens.engine.stats;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BootstrapTestTest {

    private static final double[] BASELINE = {0.10, 0.10, 0.10, 0.10, 0.10};
    private static final double[] DROPPED = {0.01, 0.01, 0.01};

    @Test
    void pValue_isOneWhenSegmentsAreIdentical() {
        BootstrapTest test = new BootstrapTest(500, 42L);
        assertEquals(1.0, test.pValue(BASELINE, new double[]{0.10, 0.10}));
    }

    @Test
    void pValue_isSmallForClearDrop() {
        double p = new BootstrapTest(2000, 42L).pValue(BASELINE, DROPPED);
        assertTrue(p < 0.05, "p=" + p);
    }

    @Test
    void pValue_isReproducibleForSameSeed() {
        double[] baseline = {0.12, 0.09, 0.11, 0.10};
        double[] test = {0.08, 0.10, 0.07};
        double first = new BootstrapTest(1000, 7L).pValue(baseline, test);
        double second = new BootstrapTest(1000, 7L).pValue(baseline, test);
        assertEquals(first, second);
        assertTrue(first >= 0.0 && first <= 1.0);
    }

    @Test
    void rejectsEmptySegmentsAndNonPositiveIterations() {
        assertThrows(IllegalArgumentException.class, () -> new BootstrapTest(0, 1L));
        assertThrows(IllegalArgumentException.class, () -> new BootstrapTest(10, 1L).pValue(new double[0], DROPPED));
    }
}
