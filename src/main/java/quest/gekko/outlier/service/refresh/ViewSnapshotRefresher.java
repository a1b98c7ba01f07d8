package quest.gekko.outlier.service.refresh;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import quest.gekko.outlier.config.AsyncConfig;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.JobStatus;
import quest.gekko.outlier.domain.RefreshJob;
import quest.gekko.outlier.repository.RefreshCandidate;
import quest.gekko.outlier.repository.SnapshotRow;
import quest.gekko.outlier.repository.VideoRepository;
import quest.gekko.outlier.repository.ViewSnapshotRepository;
import quest.gekko.outlier.service.core.BaselineEstimator;
import quest.gekko.outlier.service.core.QuotaLedger;
import quest.gekko.outlier.service.integration.connector.VideoMetadataClient;
import quest.gekko.outlier.service.integration.connector.VideoMetadataException;
import quest.gekko.outlier.service.integration.connector.VideoStatistics;

import java.sql.Date;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Keeps view counts fresh: one snapshot per video per UTC day.
 * <p>
 * A run walks the stale videos in batches of the API's id limit, one batch at a time. Before each
 * call it checks the quota ledger; when today's units cannot cover the call the run pauses and
 * reports what is left. Each batch commits on its own, so a failed write loses only that batch.
 * Between batches the loop checks the job row for cancellation and sleeps long enough to stay
 * inside the IOPS budget.
 */
@Slf4j
@Service
public class ViewSnapshotRefresher {
    static final int MAX_REPORTED_ERRORS = 200;

    private final VideoMetadataClient metadataClient;
    private final QuotaLedger quotaLedger;
    private final RefreshJobTracker jobTracker;
    private final VideoRepository videoRepository;
    private final ViewSnapshotRepository snapshotRepository;
    private final BaselineEstimator baselineEstimator;
    private final TransactionTemplate transactionTemplate;
    private final TrackerProperties.Refresh props;
    private final Clock clock;
    private final IopsBudget iopsBudget;

    private final Counter batchesCommitted;
    private final Counter batchesAborted;
    private final Counter itemErrors;
    private final Counter quotaDenials;

    public ViewSnapshotRefresher(final VideoMetadataClient metadataClient,
                                 final QuotaLedger quotaLedger,
                                 final RefreshJobTracker jobTracker,
                                 final VideoRepository videoRepository,
                                 final ViewSnapshotRepository snapshotRepository,
                                 final BaselineEstimator baselineEstimator,
                                 final TransactionTemplate transactionTemplate,
                                 final TrackerProperties.Refresh props,
                                 final Clock clock,
                                 final MeterRegistry meterRegistry) {
        this.metadataClient = metadataClient;
        this.quotaLedger = quotaLedger;
        this.jobTracker = jobTracker;
        this.videoRepository = videoRepository;
        this.snapshotRepository = snapshotRepository;
        this.baselineEstimator = baselineEstimator;
        this.transactionTemplate = transactionTemplate;
        this.props = props;
        this.clock = clock;
        this.iopsBudget = new IopsBudget(props);

        this.batchesCommitted = Counter.builder("refresh.batches").tag("outcome", "committed").register(meterRegistry);
        this.batchesAborted = Counter.builder("refresh.batches").tag("outcome", "aborted").register(meterRegistry);
        this.itemErrors = Counter.builder("refresh.item.errors").register(meterRegistry);
        this.quotaDenials = Counter.builder("refresh.quota.denials").register(meterRegistry);
    }

    /**
     * Claims the job row and selects today's candidates.
     *
     * @return empty when another run holds the job
     */
    public Optional<RefreshRun> begin() {
        Optional<RefreshJob> claimed;
        try {
            claimed = jobTracker.tryStart();
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            log.info("Refresh job claimed concurrently by another process");
            return Optional.empty();
        }
        if (claimed.isEmpty()) {
            return Optional.empty();
        }

        LocalDate today = quotaLedger.today();
        List<RefreshCandidate> candidates = videoRepository.findRefreshCandidates(today, props.excludeShorts());
        log.info("Refresh started: {} videos without a snapshot for {}", candidates.size(), today);
        return Optional.of(new RefreshRun(candidates, today, claimed.get().getStartedAt()));
    }

    @Async(AsyncConfig.MAINTENANCE_EXECUTOR)
    public CompletableFuture<RefreshResult> executeAsync(final RefreshRun run) {
        return CompletableFuture.completedFuture(execute(run));
    }

    public RefreshResult execute(final RefreshRun run) {
        List<RefreshCandidate> candidates = run.candidates();
        int batchSize = Math.max(1, metadataClient.maxIdsPerCall());
        int unitsPerCall = metadataClient.unitsPerCall();

        List<RefreshItemError> errors = new ArrayList<>();
        int processed = 0;
        int failed = 0;
        int index = 0;
        int consecutiveAborts = 0;
        boolean deferred = false;
        JobStatus status = JobStatus.COMPLETED;
        String message = null;

        try {
            while (index < candidates.size()) {
                if (jobTracker.isCancelRequested(run.startedAt())) {
                    status = JobStatus.CANCELLED;
                    message = "Cancelled after " + (processed + failed) + " videos";
                    log.info("Refresh cancelled with {} videos left", candidates.size() - index);
                    break;
                }
                if (!quotaLedger.checkAvailable(unitsPerCall)) {
                    quotaDenials.increment();
                    deferred = true;
                    status = JobStatus.PAUSED_QUOTA;
                    message = "Daily quota exhausted";
                    log.warn("Quota cannot cover {} units; pausing with {} videos left", unitsPerCall,
                            candidates.size() - index);
                    break;
                }

                List<RefreshCandidate> batch = candidates.subList(index, Math.min(candidates.size(), index + batchSize));
                Instant batchStarted = clock.instant();
                BatchOutcome outcome = processBatch(batch, unitsPerCall, run.snapshotDate());
                index += batch.size();

                if (outcome.aborted()) {
                    batchesAborted.increment();
                    consecutiveAborts++;
                    failed += batch.size();
                    for (RefreshCandidate c : batch) {
                        addError(errors, new RefreshItemError(c.videoId(), "database write failed"));
                    }
                    if (consecutiveAborts >= props.maxConsecutiveBatchFailures()) {
                        status = JobStatus.FAILED;
                        message = consecutiveAborts + " consecutive batches failed to write";
                        log.error("Refresh stopped after {} consecutive failed batches", consecutiveAborts);
                        break;
                    }
                } else {
                    batchesCommitted.increment();
                    consecutiveAborts = 0;
                    processed += outcome.written();
                    failed += outcome.errors().size();
                    outcome.errors().forEach(e -> addError(errors, e));
                }
                itemErrors.increment(outcome.aborted() ? batch.size() : outcome.errors().size());

                reportProgress(run, processed, failed, batch.get(batch.size() - 1).videoId());

                if (index < candidates.size()) {
                    Duration elapsed = Duration.between(batchStarted, clock.instant());
                    if (!pause(iopsBudget.delayAfter(outcome.written(), elapsed))) {
                        status = JobStatus.CANCELLED;
                        message = "Interrupted";
                        break;
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("Refresh aborted after {} videos", processed + failed, e);
            jobTracker.finish(run.startedAt(), JobStatus.FAILED, e.getMessage());
            throw e;
        }

        if (processed > 0) {
            rescore();
        }

        int remaining = candidates.size() - index;
        long quotaRemaining = quotaLedger.getStatus().remaining();
        jobTracker.finish(run.startedAt(), status, message);
        log.info("Refresh {}: {} processed, {} failed, {} remaining, {} quota units left",
                status, processed, failed, remaining, quotaRemaining);
        return new RefreshResult(status, candidates.size(), processed, failed, remaining, quotaRemaining,
                deferred, List.copyOf(errors));
    }

    /** Sleeps between batches. Returns false when interrupted. */
    protected boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private BatchOutcome processBatch(List<RefreshCandidate> batch, int unitsPerCall, LocalDate snapshotDate) {
        List<String> ids = batch.stream().map(RefreshCandidate::videoId).toList();
        // units are spent when the call is made, whatever it returns
        quotaLedger.increment(unitsPerCall);

        Map<String, VideoStatistics> stats;
        try {
            stats = metadataClient.fetchStatistics(ids);
        } catch (VideoMetadataException e) {
            log.warn("Statistics call failed for {} videos: {}", ids.size(), e.getMessage());
            List<RefreshItemError> callErrors = ids.stream()
                    .map(id -> new RefreshItemError(id, e.getMessage()))
                    .toList();
            return new BatchOutcome(0, callErrors, false);
        }

        List<RefreshItemError> batchErrors = new ArrayList<>();
        List<RefreshCandidate> returned = new ArrayList<>();
        for (RefreshCandidate c : batch) {
            if (stats.containsKey(c.videoId())) {
                returned.add(c);
            } else {
                batchErrors.add(new RefreshItemError(c.videoId(), "not returned by the API"));
            }
        }
        if (returned.isEmpty()) {
            return new BatchOutcome(0, batchErrors, false);
        }

        try {
            Integer written = transactionTemplate.execute(tx -> writeSnapshots(returned, stats, snapshotDate));
            return new BatchOutcome(written != null ? written : 0, batchErrors, false);
        } catch (DataAccessException e) {
            log.error("Snapshot write failed for batch starting at {}", ids.get(0), e);
            return new BatchOutcome(0, List.of(), true);
        }
    }

    private int writeSnapshots(List<RefreshCandidate> returned, Map<String, VideoStatistics> stats,
                               LocalDate snapshotDate) {
        List<String> ids = returned.stream().map(RefreshCandidate::videoId).toList();
        Map<String, PreviousSnapshot> previous = new HashMap<>();
        for (Object[] row : snapshotRepository.findLatestBeforeRaw(ids, snapshotDate)) {
            previous.put((String) row[0], new PreviousSnapshot(toLocalDate(row[1]), ((Number) row[2]).longValue()));
        }

        List<SnapshotRow> rows = new ArrayList<>(returned.size());
        Map<String, Long> viewCounts = new LinkedHashMap<>();
        for (RefreshCandidate c : returned) {
            VideoStatistics s = stats.get(c.videoId());
            rows.add(new SnapshotRow(c.videoId(), snapshotDate, daysSincePublished(c.publishedAt(), snapshotDate),
                    s.viewCount(), s.likeCount(), s.commentCount(),
                    dailyViewsRate(previous.get(c.videoId()), s.viewCount(), snapshotDate)));
            viewCounts.put(c.videoId(), s.viewCount());
        }
        snapshotRepository.upsertAll(rows);
        videoRepository.updateViewCounts(viewCounts);
        return rows.size();
    }

    private void reportProgress(RefreshRun run, int processed, int failed, String lastKey) {
        int done = processed + failed;
        Long eta = null;
        if (done > 0) {
            long elapsedSeconds = Duration.between(run.startedAt(), clock.instant()).toSeconds();
            eta = elapsedSeconds * (run.total() - done) / done;
        }
        try {
            jobTracker.recordProgress(run.startedAt(), processed, failed, run.total(), lastKey, eta);
        } catch (OptimisticLockingFailureException e) {
            // the row changed underneath us, typically a cancel; the next loop iteration reads it
            log.debug("Progress update skipped: {}", e.getMessage());
        }
    }

    private void rescore() {
        try {
            baselineEstimator.rescoreAll();
        } catch (DataAccessException e) {
            log.error("Rescoring after refresh failed; scores will catch up on the next run", e);
        }
    }

    static int daysSincePublished(Instant publishedAt, LocalDate snapshotDate) {
        LocalDate published = publishedAt.atZone(ZoneOffset.UTC).toLocalDate();
        return (int) Math.max(0, ChronoUnit.DAYS.between(published, snapshotDate));
    }

    static Long dailyViewsRate(PreviousSnapshot previous, long viewCount, LocalDate snapshotDate) {
        if (previous == null) {
            return null;
        }
        long days = ChronoUnit.DAYS.between(previous.date(), snapshotDate);
        if (days <= 0) {
            return null;
        }
        return Math.round((viewCount - previous.viewCount()) / (double) days);
    }

    private static LocalDate toLocalDate(Object o) {
        return o instanceof Date d ? d.toLocalDate() : (LocalDate) o;
    }

    private static void addError(List<RefreshItemError> errors, RefreshItemError error) {
        if (errors.size() < MAX_REPORTED_ERRORS) {
            errors.add(error);
        }
    }

    record PreviousSnapshot(LocalDate date, long viewCount) {}

    private record BatchOutcome(int written, List<RefreshItemError> errors, boolean aborted) {}
}
