package quest.gekko.outlier.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "maintenance_run", indexes = @Index(name = "idx_maintenance_run_op", columnList = "operation_name, version"))
@Getter @Setter
public class MaintenanceRun {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "operation_name", nullable = false, length = 64)
    String operationName;

    @Column(nullable = false)
    Integer version;

    @Column(nullable = false)
    boolean succeeded;

    Long affectedRows;

    @Column(length = 500)
    String message;

    @Column(nullable = false)
    Instant startedAt;

    Instant finishedAt;
}
