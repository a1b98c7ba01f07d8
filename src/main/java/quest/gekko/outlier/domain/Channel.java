package quest.gekko.outlier.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Generated;

import java.time.Instant;

@Entity
@Table(name = "channel")
@Getter @Setter
public class Channel {
    @Id
    @Column(length = 64)
    String id;

    @Column(nullable = false)
    String title;

    @Column(name = "is_institutional", nullable = false)
    boolean institutional;

    // filled by the column default on insert
    @Generated
    @Column(name = "created_at", insertable = false, updatable = false)
    Instant createdAt;

    @Column(name = "updated_at")
    Instant updatedAt;
}
