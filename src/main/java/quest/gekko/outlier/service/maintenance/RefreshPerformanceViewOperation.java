package quest.gekko.outlier.service.maintenance;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.outlier.repository.VideoRepository;

@Component
@RequiredArgsConstructor
public class RefreshPerformanceViewOperation implements MaintenanceOperation {
    private final VideoRepository videoRepository;

    @Override
    public String name() {
        return "refresh-performance-view";
    }

    @Override
    public int version() {
        return 1;
    }

    @Override
    public String description() {
        return "Rebuild the video_performance_view materialized view";
    }

    @Override
    public long apply() {
        videoRepository.refreshPerformanceView();
        return 0;
    }
}
