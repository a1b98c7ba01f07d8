package quest.gekko.outlier.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Global view-count percentiles at one age. The whole table is replaced on every rebuild.
 */
@Entity
@Table(name = "performance_envelope")
@Getter @Setter
@NoArgsConstructor
public class PerformanceEnvelope implements Persistable<Integer> {
    @Id
    @Column(name = "day_since_published")
    Integer daySincePublished;

    Double p10Views;
    Double p25Views;

    @Column(name = "p50_views", nullable = false)
    Double p50Views;

    Double p75Views;
    Double p90Views;

    @Column(name = "sample_count", nullable = false)
    Long sampleCount;

    // day whose percentiles were copied here; equals daySincePublished unless the day was too sparse
    @Column(name = "source_day", nullable = false)
    Integer sourceDay;

    @Column(name = "updated_at", nullable = false)
    Instant updatedAt;

    // rows are only ever inserted into an emptied table, so skip the merge lookup
    @Transient
    boolean fresh = true;

    @Override
    public Integer getId() {
        return daySincePublished;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    void markLoaded() {
        fresh = false;
    }
}
