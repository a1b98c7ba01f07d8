package quest.gekko.outlier.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

/**
 * The single "current job" row of the view refresher. A run claims it by moving it to
 * {@link JobStatus#RUNNING}. An operator cancel only raises {@code cancelRequested}; the row stays
 * RUNNING until the loop that owns it observes the flag between batches and finishes it.
 * A run is identified by its {@code startedAt}.
 */
@Entity
@Table(name = "refresh_job")
@Getter @Setter
@NoArgsConstructor
public class RefreshJob {
    public static final long CURRENT_JOB_ID = 1L;

    @Id
    Long id;

    @Version
    Long version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    JobStatus status = JobStatus.IDLE;

    long processedCount;
    long failedCount;
    long totalCount;
    int percentage;
    Long etaSeconds;

    @Column(name = "last_processed_key", length = 32)
    String lastProcessedKey;

    @Column(length = 500)
    String message;

    @Column(name = "cancel_requested", nullable = false)
    boolean cancelRequested;

    Instant startedAt;
    Instant heartbeatAt;
    Instant finishedAt;

    public RefreshJob(Long id) {
        this.id = id;
    }

    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }

    /** A running job whose loop stopped reporting, e.g. because the process died. */
    public boolean isAbandoned(Instant now, Duration heartbeatTimeout) {
        Instant last = heartbeatAt != null ? heartbeatAt : startedAt;
        return isRunning() && (last == null || last.plus(heartbeatTimeout).isBefore(now));
    }

    /** True while this row still belongs to the run that started at {@code runStartedAt}. */
    public boolean isOwnedBy(Instant runStartedAt) {
        return runStartedAt != null && runStartedAt.equals(startedAt);
    }

    public void markStarted(Instant now) {
        this.status = JobStatus.RUNNING;
        this.processedCount = 0;
        this.failedCount = 0;
        this.totalCount = 0;
        this.percentage = 0;
        this.etaSeconds = null;
        this.lastProcessedKey = null;
        this.message = null;
        this.cancelRequested = false;
        this.startedAt = now;
        this.heartbeatAt = now;
        this.finishedAt = null;
    }

    public void recordProgress(long processed, long failed, long total, String lastKey, Long eta, Instant now) {
        this.processedCount = processed;
        this.failedCount = failed;
        this.totalCount = total;
        this.percentage = total == 0 ? 100 : (int) Math.min(100, ((processed + failed) * 100) / total);
        this.lastProcessedKey = lastKey;
        this.etaSeconds = eta;
        this.heartbeatAt = now;
    }

    public void markFinished(JobStatus finalStatus, String message, Instant now) {
        this.status = finalStatus;
        this.message = message != null && message.length() > 500 ? message.substring(0, 500) : message;
        this.finishedAt = now;
        this.heartbeatAt = now;
        this.etaSeconds = null;
    }
}
