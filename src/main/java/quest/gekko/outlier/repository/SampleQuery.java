package quest.gekko.outlier.repository;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * One pass of the sampler: rows on one side of the cursor, ascending by random_sort.
 */
public record SampleQuery(String sql, MapSqlParameterSource params, Pass pass, double cursor, int limit) {

    public enum Pass {
        /** random_sort &gt;= cursor */
        FROM_CURSOR,
        /** random_sort &lt; cursor, the wrap-around */
        BEFORE_CURSOR
    }
}
