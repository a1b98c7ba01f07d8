package quest.gekko.outlier.service.maintenance;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.outlier.repository.VideoRepository;

@Component
@RequiredArgsConstructor
public class BackfillRandomSortOperation implements MaintenanceOperation {
    private final VideoRepository videoRepository;

    @Override
    public String name() {
        return "backfill-random-sort";
    }

    @Override
    public int version() {
        return 1;
    }

    @Override
    public String description() {
        return "Assign a random sort key to videos that have none; existing keys are kept";
    }

    @Override
    public long apply() {
        return videoRepository.backfillRandomSort();
    }
}
