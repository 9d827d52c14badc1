package domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProgressEventTest {

    @Test
    void weightsSumToHundred() {
        int sum = 0;
        for (ConsolidationPhase p : ConsolidationPhase.values()) sum += p.getWeight();
        assertEquals(100, sum);
        assertEquals(0, ConsolidationPhase.VALIDATION.completedWeightBefore());
        assertEquals(20, ConsolidationPhase.PROCESSING.completedWeightBefore());
        assertEquals(90, ConsolidationPhase.SAVING.completedWeightBefore());
    }

    @Test
    void overallPercent_combinesEarlierPhasesAndFraction() {
        assertEquals(20d + 35d, new ProgressEvent(ConsolidationPhase.PROCESSING, 1, 2, "").overallPercent(), 1e-9);
        assertEquals(100d, new ProgressEvent(ConsolidationPhase.SAVING, 1, 1, "Saved").overallPercent(), 1e-9);
        assertEquals(10d, new ProgressEvent(ConsolidationPhase.CLEARING, 0, 3, "").overallPercent(), 1e-9);
    }

    @Test
    void overallPercent_zeroTotalAndOvershoot() {
        assertEquals(20d, new ProgressEvent(ConsolidationPhase.PROCESSING, 0, 0, "").overallPercent(), 1e-9);
        assertEquals(20d, new ProgressEvent(ConsolidationPhase.CLEARING, 9, 3, "").overallPercent(), 1e-9);
    }

    @Test
    void percentIsMonotoneAcrossAPhaseSequence() {
        ProgressEvent[] events = {
                new ProgressEvent(ConsolidationPhase.VALIDATION, 1, 3, ""),
                new ProgressEvent(ConsolidationPhase.VALIDATION, 3, 3, ""),
                new ProgressEvent(ConsolidationPhase.CLEARING, 0, 1, ""),
                new ProgressEvent(ConsolidationPhase.CLEARING, 1, 1, ""),
                new ProgressEvent(ConsolidationPhase.PROCESSING, 1, 4, ""),
                new ProgressEvent(ConsolidationPhase.PROCESSING, 4, 4, ""),
                new ProgressEvent(ConsolidationPhase.SAVING, 0, 1, ""),
                new ProgressEvent(ConsolidationPhase.SAVING, 1, 1, "")
        };
        double last = -1;
        for (ProgressEvent e : events) {
            assertTrue(e.overallPercent() >= last, e.toString());
            last = e.overallPercent();
        }
    }

    @Test
    void negativeCountsAreClamped() {
        ProgressEvent e = new ProgressEvent(ConsolidationPhase.SAVING, -1, -5, null);
        assertEquals(0, e.getCurrent());
        assertEquals(0, e.getTotal());
        assertEquals("", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> new ProgressEvent(null, 0, 0, ""));
    }
}
