package quest.gekko.outlier.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import quest.gekko.outlier.domain.MaintenanceRun;
import quest.gekko.outlier.service.core.BaselineEstimator;
import quest.gekko.outlier.service.core.BaselineRunResult;
import quest.gekko.outlier.service.core.ChannelService;
import quest.gekko.outlier.service.core.EnvelopeBuildResult;
import quest.gekko.outlier.service.core.EnvelopeBuilder;
import quest.gekko.outlier.service.core.QuotaLedger;
import quest.gekko.outlier.service.core.QuotaStatus;
import quest.gekko.outlier.service.core.ScoreClassificationService;
import quest.gekko.outlier.service.maintenance.MaintenanceRunResult;
import quest.gekko.outlier.service.maintenance.MaintenanceRunner;
import quest.gekko.outlier.service.refresh.RefreshJobTracker;
import quest.gekko.outlier.service.refresh.RefreshLauncher;
import quest.gekko.outlier.service.refresh.RefreshRun;
import quest.gekko.outlier.web.dto.BulkClassifyRequest;
import quest.gekko.outlier.web.dto.BulkClassifyResponse;
import quest.gekko.outlier.web.dto.MaintenanceOperationDTO;
import quest.gekko.outlier.web.dto.RefreshJobDTO;
import quest.gekko.outlier.web.dto.RefreshStartedResponse;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {
    private final RefreshLauncher refreshLauncher;
    private final RefreshJobTracker jobTracker;
    private final QuotaLedger quotaLedger;
    private final EnvelopeBuilder envelopeBuilder;
    private final BaselineEstimator baselineEstimator;
    private final MaintenanceRunner maintenanceRunner;
    private final ChannelService channelService;
    private final ScoreClassificationService classificationService;

    // Starts a refresh in the background; 409 if one is already running
    @PostMapping("/refresh")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public RefreshStartedResponse startRefresh() {
        RefreshRun run = refreshLauncher.launch();
        return new RefreshStartedResponse(run.total(), run.snapshotDate());
    }

    @PostMapping("/refresh/cancel")
    public Map<String, Boolean> cancelRefresh() {
        return Map.of("cancelled", jobTracker.requestCancel());
    }

    @GetMapping("/refresh/status")
    public RefreshJobDTO refreshStatus() {
        return RefreshJobDTO.from(jobTracker.current());
    }

    @GetMapping("/quota")
    public QuotaStatus quota() {
        return quotaLedger.getStatus();
    }

    @PostMapping("/envelope/rebuild")
    public EnvelopeBuildResult rebuildEnvelope() {
        return envelopeBuilder.rebuild();
    }

    @PostMapping("/baselines/recompute")
    public BaselineRunResult recomputeBaselines(@RequestParam(defaultValue = "missing") String mode,
                                                @RequestParam(defaultValue = "100") int limit) {
        return switch (mode) {
            case "missing" -> baselineEstimator.recomputeMissing(limit);
            case "all" -> baselineEstimator.recomputeAll();
            default -> throw new IllegalArgumentException("mode must be 'missing' or 'all': " + mode);
        };
    }

    // offline backfill: re-estimates the listed videos' baselines, writes them, then classifies
    @PostMapping("/baselines/classify")
    public BulkClassifyResponse recomputeAndClassify(@Valid @RequestBody BulkClassifyRequest request) {
        return BulkClassifyResponse.from(classificationService.classifyAll(request.videoIds(), true));
    }

    @GetMapping("/maintenance")
    public List<MaintenanceOperationDTO> maintenanceOperations() {
        return maintenanceRunner.operations().stream().map(MaintenanceOperationDTO::from).toList();
    }

    @GetMapping("/maintenance/history")
    public List<MaintenanceRun> maintenanceHistory() {
        return maintenanceRunner.history();
    }

    @PostMapping("/maintenance/run")
    public List<MaintenanceRunResult> runMaintenance() {
        return maintenanceRunner.runPending();
    }

    @PostMapping("/maintenance/{name}/replay")
    public MaintenanceRunResult replayMaintenance(@PathVariable String name) {
        return maintenanceRunner.replay(name);
    }

    @PutMapping("/channels/{channelId}/institutional")
    public Map<String, Object> markInstitutional(@PathVariable String channelId,
                                                 @RequestParam boolean value) {
        int videos = channelService.markInstitutional(channelId, value);
        return Map.of("channelId", channelId, "institutional", value, "videosUpdated", videos);
    }
}
