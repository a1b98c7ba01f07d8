package quest.gekko.outlier.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Transaction-scoped PostgreSQL statement timeouts. Both calls only take effect inside a transaction
 * and end with it.
 */
@Component
@RequiredArgsConstructor
public class StatementTimeouts {
    private final JdbcTemplate jdbcTemplate;

    /** Offline batch work: no limit. */
    public void relax() {
        jdbcTemplate.execute("SET LOCAL statement_timeout = 0");
    }

    /** Read path: fail fast instead of queueing behind a slow plan. */
    public void bound(Duration timeout) {
        long millis = Math.max(1, timeout.toMillis());
        jdbcTemplate.execute("SET LOCAL statement_timeout = " + millis);
    }
}
