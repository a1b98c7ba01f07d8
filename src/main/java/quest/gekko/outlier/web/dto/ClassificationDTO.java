package quest.gekko.outlier.web.dto;

import quest.gekko.outlier.service.core.ScoreClassification;

import java.math.BigDecimal;

public record ClassificationDTO(String videoId, long viewCount, int daysSincePublished, BigDecimal baseline,
                                String baselineSource, BigDecimal expectedViews, BigDecimal ratio, String tier) {

    public static ClassificationDTO from(ScoreClassification c) {
        return new ClassificationDTO(c.videoId(), c.viewCount(), c.daysSincePublished(), c.baseline(),
                c.baselineSource() != null ? c.baselineSource().name() : null,
                c.expectedViews(), c.ratio(), c.tier().code());
    }
}
