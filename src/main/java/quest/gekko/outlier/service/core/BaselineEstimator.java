package quest.gekko.outlier.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.Video;
import quest.gekko.outlier.domain.ViewSnapshot;
import quest.gekko.outlier.repository.BaselineUpdate;
import quest.gekko.outlier.repository.StatementTimeouts;
import quest.gekko.outlier.repository.VideoRepository;
import quest.gekko.outlier.repository.ViewSnapshotRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes channel baselines and temporal scores onto video rows.
 * <p>
 * Backfills work one channel at a time: the channel's uploads and snapshots are loaded once, every
 * upload is estimated in memory against the uploads before it, and the results are flushed with
 * chunked set-based updates inside one transaction per channel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineEstimator {
    private static final int SNAPSHOT_LOOKUP_CHUNK = 1_000;

    private final VideoRepository videoRepository;
    private final ViewSnapshotRepository snapshotRepository;
    private final EnvelopeCurveProvider curveProvider;
    private final BaselineCalculator calculator;
    private final TemporalScoreCalculator scoreCalculator;
    private final StatementTimeouts statementTimeouts;
    private final TransactionTemplate transactionTemplate;
    private final TrackerProperties.Baseline props;
    private final Clock clock;

    /** Baseline for a single video from the channel's uploads before it. Does not write anything. */
    public BaselineEstimate estimateFor(final Video video) {
        List<Video> prior = videoRepository.findPriorChannelHistory(
                video.getChannelId(), video.getPublishedAt(), PageRequest.of(0, props.historySize()));
        List<HistoricalVideo> history = toHistory(prior, loadObservations(prior.stream().map(Video::getId).toList()));
        return calculator.estimate(video.getPublishedAt(), history, curveProvider.current(), clock.instant());
    }

    /** Backfills channels that still have videos without a baseline, up to {@code channelLimit} channels. */
    public BaselineRunResult recomputeMissing(final int channelLimit) {
        List<String> channels = videoRepository.findChannelsMissingBaseline(PageRequest.of(0, Math.max(1, channelLimit)));
        return recompute(channels, true);
    }

    /** Recomputes every non-short video of every channel. */
    public BaselineRunResult recomputeAll() {
        return recompute(videoRepository.findAllChannelIds(), false);
    }

    /** Recomputes scores from current view counts and stored baselines, then refreshes the read view. */
    public int rescoreAll() {
        Integer updated = transactionTemplate.execute(status -> {
            statementTimeouts.relax();
            return videoRepository.rescoreAll();
        });
        log.info("Rescored {} videos", updated);
        refreshPerformanceView();
        return updated != null ? updated : 0;
    }

    /** The materialized view is not maintained by PostgreSQL; call after any bulk baseline or score write. */
    public void refreshPerformanceView() {
        transactionTemplate.executeWithoutResult(status -> {
            statementTimeouts.relax();
            videoRepository.refreshPerformanceView();
        });
        log.debug("Performance view refreshed");
    }

    private BaselineRunResult recompute(List<String> channelIds, boolean onlyMissing) {
        Instant started = clock.instant();
        EnvelopeCurve curve = curveProvider.current();
        int updated = 0;
        int insufficient = 0;
        int failed = 0;

        for (String channelId : channelIds) {
            try {
                int[] counts = transactionTemplate.execute(status -> {
                    statementTimeouts.relax();
                    return recomputeChannel(channelId, curve, onlyMissing);
                });
                if (counts != null) {
                    updated += counts[0];
                    insufficient += counts[1];
                }
            } catch (DataAccessException e) {
                failed++;
                log.error("Baseline recompute failed for channel {}", channelId, e);
            }
        }

        if (updated > 0) {
            refreshPerformanceView();
        }
        Duration elapsed = Duration.between(started, clock.instant());
        log.info("Baselines recomputed for {} channels: {} videos updated, {} with insufficient history, {} channels failed ({} ms)",
                channelIds.size(), updated, insufficient, failed, elapsed.toMillis());
        return new BaselineRunResult(channelIds.size(), updated, insufficient, failed, elapsed);
    }

    // returns {videos updated, of which insufficient history}
    private int[] recomputeChannel(String channelId, EnvelopeCurve curve, boolean onlyMissing) {
        List<Video> videos = videoRepository.findByChannelIdAndShortVideoFalseOrderByPublishedAtAsc(channelId);
        if (videos.isEmpty()) {
            return new int[] {0, 0};
        }
        List<HistoricalVideo> timeline = toHistory(videos, loadObservations(videos.stream().map(Video::getId).toList()));
        Instant asOf = clock.instant();

        List<BaselineUpdate> pending = new ArrayList<>();
        int updated = 0;
        int insufficient = 0;
        for (int i = 0; i < videos.size(); i++) {
            Video target = videos.get(i);
            if (onlyMissing && target.getChannelBaselineAtPublish() != null) {
                continue;
            }
            BaselineEstimate estimate = calculator.estimate(
                    target.getPublishedAt(), priorWindow(timeline, i, target.getPublishedAt()), curve, asOf);
            if (!estimate.fromChannelHistory()) {
                insufficient++;
            }
            long views = target.getViewCount() != null ? target.getViewCount() : 0L;
            pending.add(new BaselineUpdate(target.getId(), estimate.baseline(), estimate.source(),
                    scoreCalculator.score(views, estimate.baseline())));

            if (pending.size() >= props.updateChunkSize()) {
                updated += videoRepository.updateBaselines(pending);
                pending = new ArrayList<>();
            }
        }
        if (!pending.isEmpty()) {
            updated += videoRepository.updateBaselines(pending);
        }
        log.debug("Channel {}: {} baselines written", channelId, updated);
        return new int[] {updated, insufficient};
    }

    // Uploads before index i, newest first, enough to fill the history window
    private List<HistoricalVideo> priorWindow(List<HistoricalVideo> timeline, int index, Instant targetPublishedAt) {
        List<HistoricalVideo> window = new ArrayList<>(props.historySize());
        for (int j = index - 1; j >= 0 && window.size() < props.historySize(); j--) {
            HistoricalVideo h = timeline.get(j);
            if (h.publishedAt().isBefore(targetPublishedAt) && h.viewCount() > 0) {
                window.add(h);
            }
        }
        return window;
    }

    private Map<String, List<HistoricalVideo.Observation>> loadObservations(List<String> videoIds) {
        Map<String, List<HistoricalVideo.Observation>> byVideo = new HashMap<>();
        for (Collection<String> chunk : chunks(videoIds, SNAPSHOT_LOOKUP_CHUNK)) {
            for (ViewSnapshot s : snapshotRepository.findAllForVideos(chunk)) {
                byVideo.computeIfAbsent(s.getVideoId(), k -> new ArrayList<>())
                        .add(new HistoricalVideo.Observation(s.getDaysSincePublished(), s.getViewCount()));
            }
        }
        return byVideo;
    }

    private static List<HistoricalVideo> toHistory(List<Video> videos,
                                                   Map<String, List<HistoricalVideo.Observation>> observations) {
        return videos.stream()
                .map(v -> new HistoricalVideo(v.getId(), v.getPublishedAt(),
                        v.getViewCount() != null ? v.getViewCount() : 0L,
                        observations.getOrDefault(v.getId(), List.of())))
                .toList();
    }

    private static <T> List<List<T>> chunks(List<T> items, int size) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            out.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return out;
    }
}
