package quest.gekko.outlier.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Generated;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

@Entity
@Table(name = "video", indexes = {
        @Index(name = "idx_video_channel_published", columnList = "channel_id, published_at"),
        @Index(name = "idx_video_random_sort", columnList = "random_sort")
})
@Getter @Setter
public class Video {
    @Id
    @Column(length = 32)
    String id;

    @Column(name = "channel_id", nullable = false)
    String channelId;

    @Column(name = "published_at", nullable = false)
    Instant publishedAt;

    @Column(name = "view_count", nullable = false)
    Long viewCount = 0L;

    @Column(name = "is_short", nullable = false)
    boolean shortVideo;

    // copy of Channel.institutional, written by ChannelService in the same transaction
    @Column(name = "is_institutional", nullable = false)
    boolean institutional;

    @Column(name = "topic_domain")
    String topicDomain;

    @Column(name = "format_type")
    String formatType;

    @Column(name = "channel_baseline_at_publish", precision = 11, scale = 3)
    BigDecimal channelBaselineAtPublish;

    @Enumerated(EnumType.STRING)
    @Column(name = "baseline_source", length = 32)
    BaselineSource baselineSource;

    @Column(name = "temporal_performance_score", precision = 11, scale = 3)
    BigDecimal temporalPerformanceScore;

    @Setter(AccessLevel.NONE)
    @Column(name = "random_sort", updatable = false)
    Double randomSort;

    // filled by the column default on insert
    @Generated
    @Column(name = "created_at", insertable = false, updatable = false)
    Instant createdAt;

    @PrePersist
    void assignRandomSort() {
        if (randomSort == null) {
            randomSort = ThreadLocalRandom.current().nextDouble();
        }
    }
}
