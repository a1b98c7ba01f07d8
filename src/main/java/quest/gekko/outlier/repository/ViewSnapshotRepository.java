package quest.gekko.outlier.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.outlier.domain.ViewSnapshot;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ViewSnapshotRepository extends JpaRepository<ViewSnapshot, Long>, SnapshotWriteOperations {
    List<ViewSnapshot> findByVideoIdOrderBySnapshotDateAsc(final String videoId);
    Optional<ViewSnapshot> findByVideoIdAndSnapshotDate(final String videoId, final LocalDate snapshotDate);

    @Query("select s from ViewSnapshot s where s.videoId in :ids order by s.videoId, s.daysSincePublished")
    List<ViewSnapshot> findAllForVideos(@Param("ids") final Collection<String> videoIds);

    // Most recent snapshot strictly before :date for each video: video_id, snapshot_date, view_count
    @Query(value = """
        SELECT DISTINCT ON (s.video_id) s.video_id, s.snapshot_date, s.view_count
        FROM view_snapshot s
        WHERE s.video_id IN (:ids) AND s.snapshot_date < :date
        ORDER BY s.video_id, s.snapshot_date DESC
        """, nativeQuery = true)
    List<Object[]> findLatestBeforeRaw(@Param("ids") final Collection<String> videoIds,
                                       @Param("date") final LocalDate date);

    // Per-age distribution over non-short videos:
    // days_since_published, sample_count, p10, p25, p50, p75, p90
    @Query(value = """
        SELECT s.days_since_published,
               COUNT(*),
               percentile_cont(0.10) WITHIN GROUP (ORDER BY s.view_count),
               percentile_cont(0.25) WITHIN GROUP (ORDER BY s.view_count),
               percentile_cont(0.50) WITHIN GROUP (ORDER BY s.view_count),
               percentile_cont(0.75) WITHIN GROUP (ORDER BY s.view_count),
               percentile_cont(0.90) WITHIN GROUP (ORDER BY s.view_count)
        FROM view_snapshot s
        JOIN video v ON v.id = s.video_id
        WHERE v.is_short = false
          AND s.view_count > 0
          AND s.days_since_published BETWEEN 0 AND :horizon
        GROUP BY s.days_since_published
        ORDER BY s.days_since_published
        """, nativeQuery = true)
    List<Object[]> aggregateByDayRaw(@Param("horizon") final int horizonDays);
}
