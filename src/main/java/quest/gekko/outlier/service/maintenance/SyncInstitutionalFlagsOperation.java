package quest.gekko.outlier.service.maintenance;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.outlier.repository.VideoRepository;

/**
 * One-off reconciliation for rows written before flags went through ChannelService.
 */
@Component
@RequiredArgsConstructor
public class SyncInstitutionalFlagsOperation implements MaintenanceOperation {
    private final VideoRepository videoRepository;

    @Override
    public String name() {
        return "sync-institutional-flags";
    }

    @Override
    public int version() {
        return 1;
    }

    @Override
    public String description() {
        return "Copy each channel's institutional flag onto its videos where they disagree";
    }

    @Override
    public long apply() {
        return videoRepository.syncInstitutionalFlags();
    }
}
