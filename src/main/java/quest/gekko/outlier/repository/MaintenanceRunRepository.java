package quest.gekko.outlier.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.outlier.domain.MaintenanceRun;

import java.util.List;

public interface MaintenanceRunRepository extends JpaRepository<MaintenanceRun, Long> {
    boolean existsByOperationNameAndVersionAndSucceededTrue(final String operationName, final Integer version);
    List<MaintenanceRun> findTop50ByOrderByStartedAtDesc();
}
