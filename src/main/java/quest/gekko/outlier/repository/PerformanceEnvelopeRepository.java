package quest.gekko.outlier.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.outlier.domain.PerformanceEnvelope;

import java.util.List;

public interface PerformanceEnvelopeRepository extends JpaRepository<PerformanceEnvelope, Integer> {
    List<PerformanceEnvelope> findAllByOrderByDaySincePublishedAsc();
}
