package quest.gekko.outlier.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.outlier.domain.Video;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public interface VideoRepository extends JpaRepository<Video, String>, VideoBulkOperations {

    List<Video> findByChannelIdAndShortVideoFalseOrderByPublishedAtAsc(final String channelId);

    // Prior uploads of a channel, newest first; only these may inform a baseline
    @Query("""
        select v from Video v
        where v.channelId = :channelId
          and v.publishedAt < :before
          and v.shortVideo = false
          and v.viewCount > 0
        order by v.publishedAt desc
        """)
    List<Video> findPriorChannelHistory(@Param("channelId") final String channelId,
                                        @Param("before") final Instant before,
                                        final Pageable pageable);

    @Query("""
        select distinct v.channelId from Video v
        where v.shortVideo = false and v.channelBaselineAtPublish is null
        order by v.channelId
        """)
    List<String> findChannelsMissingBaseline(final Pageable pageable);

    @Query("select distinct v.channelId from Video v where v.shortVideo = false order by v.channelId")
    List<String> findAllChannelIds();

    @Modifying
    @Query("update Video v set v.institutional = :flag where v.channelId = :channelId")
    int updateInstitutionalFlag(@Param("channelId") final String channelId, @Param("flag") final boolean flag);

    // Videos whose latest snapshot predates :today (or that have none), least recently refreshed first
    @Query(value = """
        SELECT v.id, v.published_at, ls.last_date
        FROM video v
        LEFT JOIN (
            SELECT s.video_id, MAX(s.snapshot_date) AS last_date
            FROM view_snapshot s
            GROUP BY s.video_id
        ) ls ON ls.video_id = v.id
        WHERE (:includeShorts = true OR v.is_short = false)
          AND (ls.last_date IS NULL OR ls.last_date < :today)
        ORDER BY ls.last_date ASC NULLS FIRST, v.id
        """, nativeQuery = true)
    List<Object[]> findRefreshCandidatesRaw(@Param("today") final LocalDate today,
                                            @Param("includeShorts") final boolean includeShorts);

    default List<RefreshCandidate> findRefreshCandidates(LocalDate today, boolean excludeShorts) {
        return findRefreshCandidatesRaw(today, !excludeShorts).stream()
                .map(RefreshCandidate::new)
                .toList();
    }
}
