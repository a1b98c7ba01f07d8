package quest.gekko.outlier.web.dto;

import quest.gekko.outlier.service.core.OutlierSample;

import java.util.List;

public record OutlierSampleResponse(double cursor, int requested, int returned, List<String> videoIds) {

    public static OutlierSampleResponse from(OutlierSample sample) {
        return new OutlierSampleResponse(sample.cursor(), sample.requested(), sample.videoIds().size(),
                sample.videoIds());
    }
}
