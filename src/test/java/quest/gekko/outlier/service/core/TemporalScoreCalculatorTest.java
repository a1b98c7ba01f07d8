package quest.gekko.outlier.service.core;

import org.junit.jupiter.api.Test;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.BaselineSource;
import quest.gekko.outlier.domain.PerformanceTier;
import quest.gekko.outlier.util.Numerics;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class TemporalScoreCalculatorTest {
    private final TemporalScoreCalculator calculator =
            new TemporalScoreCalculator(new TrackerProperties.Score(null, null, null, null));

    @Test
    void testScore_ViewsOverBaseline() {
        assertEquals(new BigDecimal("3.000"), calculator.score(3_300, new BigDecimal("1100.000")));
    }

    @Test
    void testScore_NullWhenBaselineMissingOrZero() {
        assertNull(calculator.score(1_000, null));
        assertNull(calculator.score(1_000, new BigDecimal("0.000")));
    }

    @Test
    void testScore_Saturates() {
        assertEquals(Numerics.MAX_STORED_VALUE, calculator.score(150_000_000_000L, new BigDecimal("1.000")));
    }

    @Test
    void testClassify_InclusiveLowerBounds() {
        BaselineSource src = BaselineSource.CHANNEL_HISTORY;

        assertEquals(PerformanceTier.VIRAL, calculator.classify(new BigDecimal("3.000"), src));
        assertEquals(PerformanceTier.OUTPERFORMING, calculator.classify(new BigDecimal("2.999"), src));
        assertEquals(PerformanceTier.OUTPERFORMING, calculator.classify(new BigDecimal("1.500"), src));
        assertEquals(PerformanceTier.ON_TRACK, calculator.classify(new BigDecimal("0.500"), src));
        assertEquals(PerformanceTier.UNDERPERFORMING, calculator.classify(new BigDecimal("0.200"), src));
        assertEquals(PerformanceTier.POOR, calculator.classify(new BigDecimal("0.199"), src));
    }

    @Test
    void testClassify_UnratedWithoutChannelHistory() {
        assertEquals(PerformanceTier.UNRATED, calculator.classify(null, BaselineSource.CHANNEL_HISTORY));
        assertEquals(PerformanceTier.UNRATED,
                calculator.classify(new BigDecimal("5000.000"), BaselineSource.INSUFFICIENT_HISTORY));
    }

    @Test
    void testThresholds_MustBeDecreasing() {
        assertThrows(IllegalStateException.class, () -> new TrackerProperties.Score(1.0, 2.0, 0.5, 0.2));
    }
}
