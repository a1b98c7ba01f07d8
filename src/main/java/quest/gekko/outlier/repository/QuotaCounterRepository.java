package quest.gekko.outlier.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.outlier.domain.QuotaCounter;

import java.time.LocalDate;

public interface QuotaCounterRepository extends JpaRepository<QuotaCounter, LocalDate>, QuotaCounterOperations {

    @Modifying
    @Query("delete from QuotaCounter q where q.usageDate < :cutoff")
    int deleteOlderThan(@Param("cutoff") final LocalDate cutoff);
}
