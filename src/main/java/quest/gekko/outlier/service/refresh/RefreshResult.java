package quest.gekko.outlier.service.refresh;

import quest.gekko.outlier.domain.JobStatus;

import java.util.List;

/**
 * Summary of one refresh run.
 *
 * @param remaining      candidates not attempted in this run
 * @param quotaRemaining units left today when the run stopped
 * @param deferred       the run stopped early because today's quota could not cover the next call
 * @param errors         per-video failures, truncated to the first few hundred
 */
public record RefreshResult(JobStatus status, int total, int processed, int failed, int remaining,
                            long quotaRemaining, boolean deferred, List<RefreshItemError> errors) {}
