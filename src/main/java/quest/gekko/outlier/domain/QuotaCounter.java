package quest.gekko.outlier.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * External API units spent on one UTC calendar day. Written only through
 * {@code QuotaCounterRepository#addUnits}, never by loading and saving the entity.
 */
@Entity
@Table(name = "quota_counter")
@Getter @Setter
public class QuotaCounter {
    @Id
    @Column(name = "usage_date")
    LocalDate usageDate;

    @Column(name = "units_used", nullable = false)
    Long unitsUsed;

    @Column(name = "max_daily_units", nullable = false)
    Long maxDailyUnits;

    @Column(name = "updated_at")
    Instant updatedAt;
}
