package quest.gekko.outlier.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.outlier.domain.RefreshJob;

public interface RefreshJobRepository extends JpaRepository<RefreshJob, Long> {
}
