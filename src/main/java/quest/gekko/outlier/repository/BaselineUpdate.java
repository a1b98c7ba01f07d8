package quest.gekko.outlier.repository;

import quest.gekko.outlier.domain.BaselineSource;

import java.math.BigDecimal;

/**
 * New baseline and score for one video, applied in bulk.
 */
public record BaselineUpdate(String videoId, BigDecimal baseline, BaselineSource source, BigDecimal score) {}
