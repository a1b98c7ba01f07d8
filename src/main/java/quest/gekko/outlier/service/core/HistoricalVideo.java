package quest.gekko.outlier.service.core;

import java.time.Instant;
import java.util.List;

/**
 * A channel's earlier upload as the baseline estimator sees it.
 *
 * @param snapshots observations ordered by age, may be empty
 */
public record HistoricalVideo(String videoId, Instant publishedAt, long viewCount, List<Observation> snapshots) {

    public record Observation(int daysSincePublished, long viewCount) {}
}
