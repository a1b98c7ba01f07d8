package quest.gekko.outlier.service.refresh;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.JobStatus;
import quest.gekko.outlier.domain.RefreshJob;
import quest.gekko.outlier.repository.RefreshJobRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RefreshJobTrackerTest {
    private static final Instant NOW = Instant.parse("2024-06-10T06:00:00Z");

    @Mock
    private RefreshJobRepository jobRepository;

    private RefreshJobTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = trackerAt(NOW);
    }

    private RefreshJobTracker trackerAt(Instant now) {
        return new RefreshJobTracker(jobRepository,
                new TrackerProperties.Refresh(null, null, null, null, null, null, Duration.ofMinutes(30), null),
                Clock.fixed(now, ZoneOffset.UTC));
    }

    private static RefreshJob runningSince(Instant heartbeat) {
        RefreshJob job = new RefreshJob(RefreshJob.CURRENT_JOB_ID);
        job.markStarted(heartbeat);
        return job;
    }

    @Test
    void testTryStart_CreatesJobRowOnFirstRun() {
        // Given
        when(jobRepository.findById(RefreshJob.CURRENT_JOB_ID)).thenReturn(Optional.empty());
        when(jobRepository.saveAndFlush(any(RefreshJob.class))).thenAnswer(returnsFirstArg());

        // When
        Optional<RefreshJob> job = tracker.tryStart();

        // Then
        assertTrue(job.isPresent());
        assertEquals(JobStatus.RUNNING, job.get().getStatus());
        assertEquals(NOW, job.get().getStartedAt());
    }

    @Test
    void testTryStart_RefusesWhileAnotherRunReports() {
        // Given a run that reported five minutes ago
        when(jobRepository.findById(RefreshJob.CURRENT_JOB_ID))
                .thenReturn(Optional.of(runningSince(NOW.minus(Duration.ofMinutes(5)))));

        // Then
        assertTrue(tracker.tryStart().isEmpty());
        verify(jobRepository, never()).saveAndFlush(any());
    }

    @Test
    void testTryStart_TakesOverAbandonedRun() {
        // Given a run silent for longer than the heartbeat timeout
        RefreshJob stale = runningSince(NOW.minus(Duration.ofMinutes(31)));
        stale.recordProgress(40, 2, 100, "vid40", 60L, NOW.minus(Duration.ofMinutes(31)));
        when(jobRepository.findById(RefreshJob.CURRENT_JOB_ID)).thenReturn(Optional.of(stale));
        when(jobRepository.saveAndFlush(stale)).thenReturn(stale);

        // When
        Optional<RefreshJob> job = tracker.tryStart();

        // Then progress starts over
        assertTrue(job.isPresent());
        assertEquals(0, job.get().getProcessedCount());
        assertEquals(NOW, job.get().getHeartbeatAt());
    }

    @Test
    void testRequestCancel_FlagsRunningJob() {
        RefreshJob job = runningSince(NOW);
        when(jobRepository.findById(RefreshJob.CURRENT_JOB_ID)).thenReturn(Optional.of(job));

        assertTrue(tracker.requestCancel());
        assertEquals(JobStatus.RUNNING, job.getStatus());
        assertTrue(job.isCancelRequested());
        assertTrue(tracker.isCancelRequested(NOW));
    }

    @Test
    void testRequestCancel_RowStaysClaimedUntilOwningLoopFinishes() {
        // Given one row shared by every call
        AtomicReference<RefreshJob> row = new AtomicReference<>();
        when(jobRepository.findById(RefreshJob.CURRENT_JOB_ID)).thenAnswer(inv -> Optional.ofNullable(row.get()));
        when(jobRepository.saveAndFlush(any(RefreshJob.class))).thenAnswer(inv -> {
            row.set(inv.getArgument(0));
            return row.get();
        });
        Instant firstRun = tracker.tryStart().orElseThrow().getStartedAt();
        RefreshJobTracker later = trackerAt(NOW.plus(Duration.ofMinutes(2)));

        // When the operator cancels while the first loop is still inside a batch
        assertTrue(later.requestCancel());

        // Then nobody else can claim the row, and the first loop sees the cancel
        assertTrue(later.tryStart().isEmpty());
        assertTrue(tracker.isCancelRequested(firstRun));

        // When the first loop finishes, the row is free again
        tracker.finish(firstRun, JobStatus.CANCELLED, "Cancelled after 50 videos");
        assertEquals(JobStatus.CANCELLED, row.get().getStatus());
        Optional<RefreshJob> second = later.tryStart();
        assertTrue(second.isPresent());
        assertFalse(second.get().isCancelRequested());
        assertFalse(later.isCancelRequested(second.get().getStartedAt()));
    }

    @Test
    void testTakeOver_StaleLoopCannotTouchNewRun() {
        // Given a loop silent for 40 minutes whose row is taken over
        Instant staleRun = NOW.minus(Duration.ofMinutes(40));
        RefreshJob job = runningSince(staleRun);
        when(jobRepository.findById(RefreshJob.CURRENT_JOB_ID)).thenReturn(Optional.of(job));
        when(jobRepository.saveAndFlush(job)).thenReturn(job);
        assertTrue(tracker.tryStart().isPresent());

        // When the old loop wakes up and reports
        tracker.recordProgress(staleRun, 10, 0, 20, "vid10", 5L);
        tracker.finish(staleRun, JobStatus.COMPLETED, null);

        // Then the new run is untouched and the old loop is told to stop
        assertEquals(JobStatus.RUNNING, job.getStatus());
        assertEquals(NOW, job.getStartedAt());
        assertEquals(0, job.getProcessedCount());
        assertTrue(tracker.isCancelRequested(staleRun));
        assertFalse(tracker.isCancelRequested(NOW));
    }

    @Test
    void testRequestCancel_NothingToCancel() {
        when(jobRepository.findById(RefreshJob.CURRENT_JOB_ID))
                .thenReturn(Optional.of(new RefreshJob(RefreshJob.CURRENT_JOB_ID)));

        assertFalse(tracker.requestCancel());
    }

    @Test
    void testRecordProgress_UpdatesPercentageAndHeartbeat() {
        // Given
        RefreshJob job = runningSince(NOW.minus(Duration.ofMinutes(10)));
        when(jobRepository.findById(RefreshJob.CURRENT_JOB_ID)).thenReturn(Optional.of(job));

        // When
        tracker.recordProgress(job.getStartedAt(), 45, 5, 200, "vid50", 120L);

        // Then
        assertEquals(25, job.getPercentage());
        assertEquals("vid50", job.getLastProcessedKey());
        assertEquals(NOW, job.getHeartbeatAt());
    }

    @Test
    void testRecordProgress_IgnoredAfterCancel() {
        RefreshJob job = runningSince(NOW.minus(Duration.ofMinutes(10)));
        job.setStatus(JobStatus.CANCELLED);
        when(jobRepository.findById(RefreshJob.CURRENT_JOB_ID)).thenReturn(Optional.of(job));

        tracker.recordProgress(job.getStartedAt(), 45, 5, 200, "vid50", 120L);

        assertEquals(0, job.getProcessedCount());
        assertEquals(JobStatus.CANCELLED, job.getStatus());
    }
}
