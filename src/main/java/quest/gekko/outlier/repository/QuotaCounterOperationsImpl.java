package quest.gekko.outlier.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.LocalDate;

@RequiredArgsConstructor
public class QuotaCounterOperationsImpl implements QuotaCounterOperations {
    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public long addUnits(LocalDate day, long units, long maxDailyUnits) {
        Long total = jdbcTemplate.queryForObject("""
            INSERT INTO quota_counter (usage_date, units_used, max_daily_units, updated_at)
            VALUES (:day, :units, :max, now())
            ON CONFLICT (usage_date) DO UPDATE SET
                units_used = quota_counter.units_used + EXCLUDED.units_used,
                max_daily_units = EXCLUDED.max_daily_units,
                updated_at = now()
            RETURNING units_used
            """, new MapSqlParameterSource()
                .addValue("day", day)
                .addValue("units", units)
                .addValue("max", maxDailyUnits), Long.class);
        return total != null ? total : 0L;
    }
}
