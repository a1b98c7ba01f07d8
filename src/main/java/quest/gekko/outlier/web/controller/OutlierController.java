package quest.gekko.outlier.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import quest.gekko.outlier.repository.SampleCriteria;
import quest.gekko.outlier.service.core.OutlierSampler;
import quest.gekko.outlier.service.core.ScoreClassificationService;
import quest.gekko.outlier.web.dto.BulkClassifyRequest;
import quest.gekko.outlier.web.dto.BulkClassifyResponse;
import quest.gekko.outlier.web.dto.ClassificationDTO;
import quest.gekko.outlier.web.dto.OutlierSampleResponse;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class OutlierController {
    private final OutlierSampler outlierSampler;
    private final ScoreClassificationService classificationService;

    @GetMapping("/outliers/sample")
    public OutlierSampleResponse sample(@RequestParam(required = false) BigDecimal minScore,
                                        @RequestParam(required = false) Long minViews,
                                        @RequestParam(required = false) Integer maxAgeDays,
                                        @RequestParam(required = false) String topicDomain,
                                        @RequestParam(required = false) String category,
                                        @RequestParam(defaultValue = "true") boolean excludeInstitutional,
                                        @RequestParam(defaultValue = "50") int size) {
        SampleCriteria criteria = new SampleCriteria(minScore, minViews, maxAgeDays, topicDomain, category,
                excludeInstitutional, size);
        return OutlierSampleResponse.from(outlierSampler.sample(criteria));
    }

    @GetMapping("/performance/classify")
    public ClassificationDTO classify(@RequestParam String videoId) {
        return ClassificationDTO.from(classificationService.classify(videoId));
    }

    // read-only; recomputing baselines while classifying lives under /admin
    @PostMapping("/performance/classify")
    public BulkClassifyResponse classifyBulk(@Valid @RequestBody BulkClassifyRequest request) {
        return BulkClassifyResponse.from(classificationService.classifyAll(request.videoIds(), false));
    }
}
