package quest.gekko.outlier.domain;

import java.util.Locale;

/**
 * Ordered performance buckets, best first. Thresholds live in {@code tracker.score.*}.
 */
public enum PerformanceTier {
    VIRAL,
    OUTPERFORMING,
    ON_TRACK,
    UNDERPERFORMING,
    POOR,
    UNRATED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
