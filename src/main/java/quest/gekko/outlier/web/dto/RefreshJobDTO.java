package quest.gekko.outlier.web.dto;

import quest.gekko.outlier.domain.RefreshJob;

import java.time.Instant;

public record RefreshJobDTO(String status, long processed, long failed, long total, int percentage,
                            Long etaSeconds, String lastProcessedKey, String message, boolean cancelRequested,
                            Instant startedAt, Instant heartbeatAt, Instant finishedAt) {

    public static RefreshJobDTO from(RefreshJob job) {
        return new RefreshJobDTO(job.getStatus().name(), job.getProcessedCount(), job.getFailedCount(),
                job.getTotalCount(), job.getPercentage(), job.getEtaSeconds(), job.getLastProcessedKey(),
                job.getMessage(), job.isCancelRequested(), job.getStartedAt(), job.getHeartbeatAt(), job.getFinishedAt());
    }
}
