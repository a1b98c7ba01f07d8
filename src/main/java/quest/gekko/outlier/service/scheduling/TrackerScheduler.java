package quest.gekko.outlier.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.outlier.service.core.BaselineEstimator;
import quest.gekko.outlier.service.core.EnvelopeBuilder;
import quest.gekko.outlier.service.maintenance.MaintenanceRunner;
import quest.gekko.outlier.service.refresh.ViewSnapshotRefresher;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(value = "tracker.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class TrackerScheduler {
    private final ViewSnapshotRefresher refresher;
    private final EnvelopeBuilder envelopeBuilder;
    private final BaselineEstimator baselineEstimator;
    private final MaintenanceRunner maintenanceRunner;

    // hourly by default; a run that finds nothing stale finishes at once
    @Scheduled(cron = "${tracker.refresh.cron:0 15 * * * *}", zone = "UTC")
    public void refreshViews() {
        refresher.begin().ifPresentOrElse(
                refresher::execute,
                () -> log.info("Scheduled refresh skipped: a run is already in progress"));
    }

    @Scheduled(cron = "${tracker.envelope.cron:0 30 3 * * *}", zone = "UTC")
    public void rebuildEnvelope() {
        envelopeBuilder.rebuild();
    }

    // after the envelope rebuild, so new videos are normalized against the fresh curve
    @Scheduled(cron = "${tracker.baseline.cron:0 0 4 * * *}", zone = "UTC")
    public void backfillBaselines() {
        baselineEstimator.recomputeMissing(Integer.MAX_VALUE);
    }

    @Scheduled(cron = "${tracker.maintenance.cron:0 45 4 * * *}", zone = "UTC")
    public void runMaintenance() {
        maintenanceRunner.runPending();
    }
}
