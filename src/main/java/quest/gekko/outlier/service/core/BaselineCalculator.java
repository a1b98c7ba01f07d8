package quest.gekko.outlier.service.core;

import org.springframework.stereotype.Component;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.BaselineSource;
import quest.gekko.outlier.util.Medians;
import quest.gekko.outlier.util.Numerics;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Channel baseline: the median Day-30-equivalent view count of the channel's most recent uploads
 * published before the target.
 * <p>
 * Each prior video is first placed at the age it had when the target went live, using its own
 * snapshot from that age (or the latest one before it) and the envelope to cover the gap. That value
 * is then projected to the reference day through the envelope.
 */
@Component
public class BaselineCalculator {
    private final int historySize;
    private final int minHistory;
    private final BigDecimal insufficientHistorySentinel;
    private final int referenceDay;

    public BaselineCalculator(final TrackerProperties.Baseline baseline, final TrackerProperties.Envelope envelope) {
        this.historySize = baseline.historySize();
        this.minHistory = baseline.minHistory();
        this.insufficientHistorySentinel = Numerics.saturate(baseline.insufficientHistorySentinel());
        this.referenceDay = envelope.referenceDay();
    }

    public BaselineEstimate estimate(Instant targetPublishedAt, List<HistoricalVideo> history,
                                     EnvelopeCurve curve, Instant asOf) {
        List<HistoricalVideo> prior = history.stream()
                .filter(h -> h.publishedAt().isBefore(targetPublishedAt))
                .filter(h -> h.viewCount() > 0)
                .sorted(Comparator.comparing(HistoricalVideo::publishedAt).reversed())
                .limit(historySize)
                .toList();

        if (prior.size() < minHistory) {
            return new BaselineEstimate(insufficientHistorySentinel, BaselineSource.INSUFFICIENT_HISTORY, prior.size());
        }

        List<Double> day30Estimates = new ArrayList<>(prior.size());
        for (HistoricalVideo h : prior) {
            int ageAtTarget = daysBetween(h.publishedAt(), targetPublishedAt);
            double viewsAtTarget = viewsAtAge(h, ageAtTarget, curve, asOf);
            day30Estimates.add(viewsAtTarget * curve.ratio(ageAtTarget, referenceDay));
        }
        BigDecimal baseline = Numerics.saturate(Medians.median(day30Estimates));
        return new BaselineEstimate(baseline, BaselineSource.CHANNEL_HISTORY, prior.size());
    }

    /** View count of {@code h} when it was {@code age} days old. */
    double viewsAtAge(HistoricalVideo h, int age, EnvelopeCurve curve, Instant asOf) {
        HistoricalVideo.Observation best = null;
        for (HistoricalVideo.Observation o : h.snapshots()) {
            if (o.daysSincePublished() <= age && o.viewCount() > 0
                    && (best == null || o.daysSincePublished() > best.daysSincePublished())) {
                best = o;
            }
        }
        if (best != null) {
            return best.viewCount() * curve.ratio(best.daysSincePublished(), age);
        }
        // no observation that early: scale the current count back
        int currentAge = daysBetween(h.publishedAt(), asOf);
        return h.viewCount() * curve.ratio(currentAge, age);
    }

    static int daysBetween(Instant from, Instant to) {
        return (int) Math.max(0, Duration.between(from, to).toDays());
    }
}
