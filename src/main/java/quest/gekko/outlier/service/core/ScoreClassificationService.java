package quest.gekko.outlier.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.BaselineSource;
import quest.gekko.outlier.domain.Video;
import quest.gekko.outlier.repository.BaselineUpdate;
import quest.gekko.outlier.repository.VideoRepository;
import quest.gekko.outlier.util.Numerics;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScoreClassificationService {
    private final VideoRepository videoRepository;
    private final BaselineEstimator baselineEstimator;
    private final TemporalScoreCalculator scoreCalculator;
    private final EnvelopeCurveProvider curveProvider;
    private final TrackerProperties.Envelope envelopeProps;
    private final TrackerProperties.Baseline baselineProps;
    private final Clock clock;

    @Transactional(readOnly = true)
    public ScoreClassification classify(final String videoId) {
        Video video = videoRepository.findById(videoId).orElseThrow(() -> new VideoNotFoundException(videoId));
        return toClassification(video, curveProvider.current());
    }

    /**
     * Classifies many videos at once. With {@code recompute} set, baselines of the requested videos are
     * estimated again first and written back in bulk, which is what offline backfills use.
     */
    @Transactional
    public BulkClassification classifyAll(final List<String> videoIds, final boolean recompute) {
        List<String> requested = List.copyOf(new LinkedHashSet<>(videoIds));
        Map<String, Video> found = videoRepository.findAllById(requested).stream()
                .collect(Collectors.toMap(Video::getId, Function.identity()));
        List<String> missing = requested.stream().filter(id -> !found.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            log.debug("Classification skipped {} unknown videos", missing.size());
        }

        int recomputed = 0;
        if (recompute) {
            recomputed = recomputeBaselines(found.values());
            if (recomputed > 0) {
                baselineEstimator.refreshPerformanceView();
            }
        }

        EnvelopeCurve curve = curveProvider.current();
        List<ScoreClassification> results = requested.stream()
                .filter(found::containsKey)
                .map(id -> toClassification(found.get(id), curve))
                .toList();
        return new BulkClassification(results, missing, recomputed);
    }

    private int recomputeBaselines(Iterable<Video> videos) {
        List<BaselineUpdate> pending = new ArrayList<>();
        int written = 0;
        for (Video video : videos) {
            if (video.isShortVideo()) continue;
            BaselineEstimate estimate = baselineEstimator.estimateFor(video);
            BigDecimal score = scoreCalculator.score(viewsOf(video), estimate.baseline());
            pending.add(new BaselineUpdate(video.getId(), estimate.baseline(), estimate.source(), score));
            // keep the in-memory rows consistent with what is written
            video.setChannelBaselineAtPublish(estimate.baseline());
            video.setBaselineSource(estimate.source());
            video.setTemporalPerformanceScore(score);
            if (pending.size() >= baselineProps.updateChunkSize()) {
                written += videoRepository.updateBaselines(pending);
                pending = new ArrayList<>();
            }
        }
        if (!pending.isEmpty()) {
            written += videoRepository.updateBaselines(pending);
        }
        return written;
    }

    private ScoreClassification toClassification(Video video, EnvelopeCurve curve) {
        int age = BaselineCalculator.daysBetween(video.getPublishedAt(), clock.instant());
        BigDecimal baseline = video.getChannelBaselineAtPublish();
        BigDecimal ratio = scoreCalculator.score(viewsOf(video), baseline);

        BigDecimal expected = null;
        if (ratio != null && video.getBaselineSource() == BaselineSource.CHANNEL_HISTORY) {
            expected = Numerics.saturate(baseline.doubleValue() * curve.ratio(envelopeProps.referenceDay(), age));
        }
        return new ScoreClassification(video.getId(), viewsOf(video), age, baseline, video.getBaselineSource(),
                expected, ratio, scoreCalculator.classify(ratio, video.getBaselineSource()));
    }

    private static long viewsOf(Video video) {
        return video.getViewCount() != null ? video.getViewCount() : 0L;
    }
}
