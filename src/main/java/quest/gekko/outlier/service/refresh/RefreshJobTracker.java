package quest.gekko.outlier.service.refresh;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.JobStatus;
import quest.gekko.outlier.domain.RefreshJob;
import quest.gekko.outlier.repository.RefreshJobRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Reads and writes the single refresh job row. Two processes racing to claim the row are separated
 * by its version column: the loser's flush fails with an optimistic locking error.
 * <p>
 * Every write made on behalf of a running loop names the run by its start instant, so a loop whose
 * row has since been taken over can neither report progress into nor finish the newer run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshJobTracker {
    private final RefreshJobRepository jobRepository;
    private final TrackerProperties.Refresh props;
    private final Clock clock;

    /**
     * Claims the job row for a new run. A run with a pending cancel still holds the row until its
     * loop finishes.
     *
     * @return the claimed job, or empty when another run is active and still reporting
     */
    @Transactional
    public Optional<RefreshJob> tryStart() {
        // row timestamps are stored with microsecond precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        RefreshJob job = jobRepository.findById(RefreshJob.CURRENT_JOB_ID)
                .orElseGet(() -> new RefreshJob(RefreshJob.CURRENT_JOB_ID));
        if (job.isRunning()) {
            if (!job.isAbandoned(now, props.heartbeatTimeout())) {
                return Optional.empty();
            }
            log.warn("Taking over refresh job abandoned since {}", job.getHeartbeatAt());
        }
        job.markStarted(now);
        return Optional.of(jobRepository.saveAndFlush(job));
    }

    @Transactional(readOnly = true)
    public RefreshJob current() {
        return jobRepository.findById(RefreshJob.CURRENT_JOB_ID)
                .orElseGet(() -> new RefreshJob(RefreshJob.CURRENT_JOB_ID));
    }

    /**
     * @return true when the run was asked to stop, or when the row no longer belongs to it
     */
    @Transactional(readOnly = true)
    public boolean isCancelRequested(final Instant runStartedAt) {
        return jobRepository.findById(RefreshJob.CURRENT_JOB_ID)
                .map(job -> !job.isOwnedBy(runStartedAt) || !job.isRunning() || job.isCancelRequested())
                .orElse(true);
    }

    @Transactional
    public void recordProgress(final Instant runStartedAt, final long processed, final long failed, final long total,
                               final String lastKey, final Long etaSeconds) {
        jobRepository.findById(RefreshJob.CURRENT_JOB_ID)
                .filter(job -> job.isRunning() && job.isOwnedBy(runStartedAt))
                .ifPresent(job -> job.recordProgress(processed, failed, total, lastKey, etaSeconds, clock.instant()));
    }

    @Transactional
    public void finish(final Instant runStartedAt, final JobStatus status, final String message) {
        jobRepository.findById(RefreshJob.CURRENT_JOB_ID)
                .filter(job -> job.isOwnedBy(runStartedAt))
                .ifPresentOrElse(
                        job -> job.markFinished(status, message, clock.instant()),
                        () -> log.warn("Refresh started at {} no longer owns the job row; {} not recorded",
                                runStartedAt, status));
    }

    /**
     * Asks the running loop to stop after its current batch. The row stays RUNNING until that
     * loop finishes it.
     *
     * @return false when no run is active
     */
    @Transactional
    public boolean requestCancel() {
        return jobRepository.findById(RefreshJob.CURRENT_JOB_ID)
                .filter(RefreshJob::isRunning)
                .map(job -> {
                    job.setCancelRequested(true);
                    job.setMessage("Cancellation requested");
                    log.info("Cancellation requested for refresh started at {}", job.getStartedAt());
                    return true;
                })
                .orElse(false);
    }
}
