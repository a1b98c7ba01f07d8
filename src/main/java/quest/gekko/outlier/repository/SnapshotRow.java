package quest.gekko.outlier.repository;

import java.time.LocalDate;

public record SnapshotRow(String videoId, LocalDate snapshotDate, int daysSincePublished, long viewCount,
                          Long likeCount, Long commentCount, Long dailyViewsRate) {}
