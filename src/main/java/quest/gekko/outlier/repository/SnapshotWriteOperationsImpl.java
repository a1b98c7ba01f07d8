package quest.gekko.outlier.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.Arrays;
import java.util.List;

@RequiredArgsConstructor
public class SnapshotWriteOperationsImpl implements SnapshotWriteOperations {
    private static final String UPSERT = """
        INSERT INTO view_snapshot (video_id, snapshot_date, days_since_published, view_count,
                                   like_count, comment_count, daily_views_rate, created_at)
        VALUES (:videoId, :snapshotDate, :days, :views, :likes, :comments, :rate, now())
        ON CONFLICT (video_id, snapshot_date) DO UPDATE SET
            view_count = EXCLUDED.view_count,
            like_count = EXCLUDED.like_count,
            comment_count = EXCLUDED.comment_count,
            daily_views_rate = EXCLUDED.daily_views_rate
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public int upsertAll(List<SnapshotRow> rows) {
        if (rows.isEmpty()) return 0;

        MapSqlParameterSource[] batch = rows.stream()
                .map(r -> new MapSqlParameterSource()
                        .addValue("videoId", r.videoId())
                        .addValue("snapshotDate", r.snapshotDate())
                        .addValue("days", r.daysSincePublished())
                        .addValue("views", r.viewCount())
                        .addValue("likes", r.likeCount())
                        .addValue("comments", r.commentCount())
                        .addValue("rate", r.dailyViewsRate()))
                .toArray(MapSqlParameterSource[]::new);
        return Arrays.stream(jdbcTemplate.batchUpdate(UPSERT, batch)).sum();
    }
}
