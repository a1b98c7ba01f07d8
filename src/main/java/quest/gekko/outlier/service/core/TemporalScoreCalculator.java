package quest.gekko.outlier.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.BaselineSource;
import quest.gekko.outlier.domain.PerformanceTier;
import quest.gekko.outlier.util.Numerics;

import java.math.BigDecimal;

@Component
@RequiredArgsConstructor
public class TemporalScoreCalculator {
    private final TrackerProperties.Score thresholds;

    /**
     * @return views / baseline capped at {@link Numerics#MAX_STORED_VALUE}, or null without a positive baseline
     */
    public BigDecimal score(final long viewCount, final BigDecimal baseline) {
        return Numerics.saturatedRatio(viewCount, baseline);
    }

    public PerformanceTier classify(final BigDecimal score, final BaselineSource source) {
        if (score == null || source != BaselineSource.CHANNEL_HISTORY) {
            return PerformanceTier.UNRATED;
        }
        double s = score.doubleValue();
        if (s >= thresholds.viral()) return PerformanceTier.VIRAL;
        if (s >= thresholds.outperforming()) return PerformanceTier.OUTPERFORMING;
        if (s >= thresholds.onTrack()) return PerformanceTier.ON_TRACK;
        if (s >= thresholds.underperforming()) return PerformanceTier.UNDERPERFORMING;
        return PerformanceTier.POOR;
    }
}
