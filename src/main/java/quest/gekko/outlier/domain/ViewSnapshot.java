package quest.gekko.outlier.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Generated;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "view_snapshot",
        uniqueConstraints = @UniqueConstraint(columnNames = { "video_id", "snapshot_date" }),
        indexes = @Index(name = "idx_view_snapshot_days", columnList = "days_since_published"))
@Getter @Setter
public class ViewSnapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "video_id", nullable = false, length = 32)
    String videoId;

    @Column(name = "snapshot_date", nullable = false)
    LocalDate snapshotDate;

    @Column(name = "days_since_published", nullable = false)
    Integer daysSincePublished;

    @Column(name = "view_count", nullable = false)
    Long viewCount;

    Long likeCount;
    Long commentCount;

    // views gained per day since the previous snapshot, null for the first one
    Long dailyViewsRate;

    // filled by the column default on insert
    @Generated
    @Column(name = "created_at", insertable = false, updatable = false)
    Instant createdAt;
}
