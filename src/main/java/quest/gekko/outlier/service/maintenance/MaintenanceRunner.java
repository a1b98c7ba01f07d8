package quest.gekko.outlier.service.maintenance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import quest.gekko.outlier.domain.MaintenanceRun;
import quest.gekko.outlier.repository.MaintenanceRunRepository;
import quest.gekko.outlier.repository.StatementTimeouts;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies registered {@link MaintenanceOperation}s and keeps a log of every attempt in
 * {@code maintenance_run}. Each operation runs in its own transaction; a failure is recorded and
 * does not stop the others.
 */
@Slf4j
@Service
public class MaintenanceRunner {
    private final Map<String, MaintenanceOperation> operations = new LinkedHashMap<>();
    private final MaintenanceRunRepository runRepository;
    private final StatementTimeouts statementTimeouts;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public MaintenanceRunner(final List<MaintenanceOperation> operations,
                             final MaintenanceRunRepository runRepository,
                             final StatementTimeouts statementTimeouts,
                             final TransactionTemplate transactionTemplate,
                             final Clock clock) {
        operations.stream()
                .sorted(Comparator.comparing(MaintenanceOperation::name))
                .forEach(op -> {
                    if (this.operations.putIfAbsent(op.name(), op) != null) {
                        throw new IllegalStateException("Duplicate maintenance operation " + op.name());
                    }
                });
        this.runRepository = runRepository;
        this.statementTimeouts = statementTimeouts;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public List<MaintenanceOperation> operations() {
        return List.copyOf(operations.values());
    }

    public List<MaintenanceRun> history() {
        return runRepository.findTop50ByOrderByStartedAtDesc();
    }

    /** Applies every recurring operation and every one whose current version has not succeeded yet. */
    public List<MaintenanceRunResult> runPending() {
        List<MaintenanceRunResult> results = new ArrayList<>();
        for (MaintenanceOperation op : operations.values()) {
            if (!op.recurring() && runRepository.existsByOperationNameAndVersionAndSucceededTrue(op.name(), op.version())) {
                results.add(MaintenanceRunResult.skipped(op));
            } else {
                results.add(apply(op));
            }
        }
        return results;
    }

    /** Applies one operation again regardless of earlier runs. */
    public MaintenanceRunResult replay(final String name) {
        MaintenanceOperation op = operations.get(name);
        if (op == null) {
            throw new UnknownMaintenanceOperationException(name);
        }
        return apply(op);
    }

    private MaintenanceRunResult apply(MaintenanceOperation op) {
        Instant started = clock.instant();
        MaintenanceRun run = new MaintenanceRun();
        run.setOperationName(op.name());
        run.setVersion(op.version());
        run.setStartedAt(started);

        try {
            Long affected = transactionTemplate.execute(status -> {
                statementTimeouts.relax();
                return op.apply();
            });
            run.setSucceeded(true);
            run.setAffectedRows(affected);
            log.info("Maintenance {} v{} applied: {} rows", op.name(), op.version(), affected);
        } catch (RuntimeException e) {
            run.setSucceeded(false);
            run.setMessage(truncate(describe(e)));
            log.error("Maintenance {} v{} failed", op.name(), op.version(), e);
        }
        run.setFinishedAt(clock.instant());
        runRepository.save(run);

        return new MaintenanceRunResult(op.name(), op.version(), run.isSucceeded(), false,
                run.getAffectedRows() != null ? run.getAffectedRows() : 0, run.getMessage());
    }

    private static String describe(RuntimeException e) {
        if (e instanceof DataAccessException dae) {
            return dae.getMostSpecificCause().getMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() > 500 ? message.substring(0, 500) : message;
    }
}
