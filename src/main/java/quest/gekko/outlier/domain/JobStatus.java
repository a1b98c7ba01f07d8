package quest.gekko.outlier.domain;

public enum JobStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    // stopped because the daily API quota ran out; the next invocation resumes
    PAUSED_QUOTA,
    CANCELLED,
    FAILED
}
