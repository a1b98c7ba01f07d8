package quest.gekko.outlier.repository;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import quest.gekko.outlier.domain.BaselineSource;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * Builds the sampler's SQL. Every predicate is on a column of {@code video} so the planner can
 * walk the random_sort index; the institutional exclusion reads the denormalized flag and never
 * joins or subqueries the channel table.
 */
public final class SampleQueryBuilder {

    private SampleQueryBuilder() {}

    public static SampleQuery build(SampleCriteria criteria, Instant publishedAfter, double cursor,
                                    SampleQuery.Pass pass, int limit) {
        StringBuilder sql = new StringBuilder("""
            SELECT v.id, v.random_sort
            FROM video v
            WHERE v.baseline_source = :baselineSource
              AND v.temporal_performance_score IS NOT NULL""");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("baselineSource", BaselineSource.CHANNEL_HISTORY.name());

        if (criteria.minScore() != null) {
            sql.append("\n  AND v.temporal_performance_score >= :minScore");
            params.addValue("minScore", criteria.minScore());
        }
        if (criteria.minViews() != null) {
            sql.append("\n  AND v.view_count >= :minViews");
            params.addValue("minViews", criteria.minViews());
        }
        if (publishedAfter != null) {
            sql.append("\n  AND v.published_at >= :publishedAfter");
            params.addValue("publishedAfter", Timestamp.from(publishedAfter));
        }
        if (criteria.topicDomain() != null) {
            sql.append("\n  AND v.topic_domain = :topicDomain");
            params.addValue("topicDomain", criteria.topicDomain());
        }
        if (criteria.category() != null) {
            sql.append("\n  AND v.format_type = :category");
            params.addValue("category", criteria.category());
        }
        if (criteria.excludeInstitutional()) {
            sql.append("\n  AND v.is_institutional = false");
        }

        sql.append(pass == SampleQuery.Pass.FROM_CURSOR
                ? "\n  AND v.random_sort >= :cursor"
                : "\n  AND v.random_sort < :cursor");
        sql.append("\nORDER BY v.random_sort ASC\nLIMIT :limit");
        params.addValue("cursor", cursor).addValue("limit", limit);

        return new SampleQuery(sql.toString(), params, pass, cursor, limit);
    }
}
