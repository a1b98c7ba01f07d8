package quest.gekko.outlier.service.core;

import quest.gekko.outlier.domain.BaselineSource;
import quest.gekko.outlier.domain.PerformanceTier;

import java.math.BigDecimal;

/**
 * @param expectedViews the Day-30 baseline projected to the video's current age, null without a channel baseline
 */
public record ScoreClassification(String videoId, long viewCount, int daysSincePublished, BigDecimal baseline,
                                  BaselineSource baselineSource, BigDecimal expectedViews, BigDecimal ratio,
                                  PerformanceTier tier) {}
