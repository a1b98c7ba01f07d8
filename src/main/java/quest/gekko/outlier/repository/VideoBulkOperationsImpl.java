package quest.gekko.outlier.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import quest.gekko.outlier.util.Numerics;

import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
public class VideoBulkOperationsImpl implements VideoBulkOperations {
    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public int updateBaselines(List<BaselineUpdate> updates) {
        if (updates.isEmpty()) return 0;

        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder values = new StringBuilder();
        for (int i = 0; i < updates.size(); i++) {
            BaselineUpdate u = updates.get(i);
            if (i > 0) values.append(',');
            values.append("(:id").append(i)
                    .append(", CAST(:baseline").append(i).append(" AS numeric)")
                    .append(", CAST(:source").append(i).append(" AS varchar)")
                    .append(", CAST(:score").append(i).append(" AS numeric))");
            params.addValue("id" + i, u.videoId());
            params.addValue("baseline" + i, u.baseline());
            params.addValue("source" + i, u.source() != null ? u.source().name() : null);
            params.addValue("score" + i, u.score());
        }

        String sql = """
            UPDATE video v
            SET channel_baseline_at_publish = u.baseline,
                baseline_source = u.source,
                temporal_performance_score = u.score
            FROM (VALUES %s) AS u(id, baseline, source, score)
            WHERE v.id = u.id
            """.formatted(values);
        return jdbcTemplate.update(sql, params);
    }

    @Override
    public int updateViewCounts(Map<String, Long> viewCounts) {
        if (viewCounts.isEmpty()) return 0;

        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder values = new StringBuilder();
        int i = 0;
        for (Map.Entry<String, Long> e : viewCounts.entrySet()) {
            if (i > 0) values.append(',');
            values.append("(:id").append(i).append(", CAST(:views").append(i).append(" AS bigint))");
            params.addValue("id" + i, e.getKey());
            params.addValue("views" + i, e.getValue());
            i++;
        }

        String sql = """
            UPDATE video v
            SET view_count = u.views
            FROM (VALUES %s) AS u(id, views)
            WHERE v.id = u.id
            """.formatted(values);
        return jdbcTemplate.update(sql, params);
    }

    @Override
    public int rescoreAll() {
        return jdbcTemplate.update("""
            UPDATE video
            SET temporal_performance_score = LEAST(ROUND(view_count::numeric / channel_baseline_at_publish, 3), :cap)
            WHERE channel_baseline_at_publish > 0
              AND temporal_performance_score IS DISTINCT FROM
                  LEAST(ROUND(view_count::numeric / channel_baseline_at_publish, 3), :cap)
            """, new MapSqlParameterSource("cap", Numerics.MAX_STORED_VALUE));
    }

    @Override
    public int backfillRandomSort() {
        return jdbcTemplate.update("UPDATE video SET random_sort = random() WHERE random_sort IS NULL",
                new MapSqlParameterSource());
    }

    @Override
    public int syncInstitutionalFlags() {
        return jdbcTemplate.update("""
            UPDATE video v
            SET is_institutional = c.is_institutional
            FROM channel c
            WHERE c.id = v.channel_id
              AND v.is_institutional <> c.is_institutional
            """, new MapSqlParameterSource());
    }

    @Override
    public void refreshPerformanceView() {
        jdbcTemplate.getJdbcOperations().execute("REFRESH MATERIALIZED VIEW CONCURRENTLY video_performance_view");
    }
}
