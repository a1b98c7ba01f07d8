package quest.gekko.outlier.service.refresh;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Starts a refresh from a request thread: the job is claimed synchronously, so a caller learns at
 * once that another run is active, and the batches run on the maintenance executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshLauncher {
    private final ViewSnapshotRefresher refresher;

    public RefreshRun launch() {
        RefreshRun run = refresher.begin().orElseThrow(RefreshAlreadyRunningException::new);
        refresher.executeAsync(run);
        log.info("Refresh of {} videos handed to the maintenance executor", run.total());
        return run;
    }
}
