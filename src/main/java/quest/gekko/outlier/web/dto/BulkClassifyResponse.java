package quest.gekko.outlier.web.dto;

import quest.gekko.outlier.service.core.BulkClassification;

import java.util.List;

public record BulkClassifyResponse(List<ClassificationDTO> results, List<String> missing, int recomputed) {

    public static BulkClassifyResponse from(BulkClassification bulk) {
        return new BulkClassifyResponse(bulk.results().stream().map(ClassificationDTO::from).toList(),
                bulk.missing(), bulk.recomputed());
    }
}
