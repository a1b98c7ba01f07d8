package quest.gekko.outlier.service.core;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;
import quest.gekko.outlier.config.CacheConfig;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.repository.OutlierSampleRepository;
import quest.gekko.outlier.repository.SampleCriteria;
import quest.gekko.outlier.repository.SampleQuery;
import quest.gekko.outlier.repository.SampleQueryBuilder;
import quest.gekko.outlier.repository.SampledVideo;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Random samples of scored videos without ORDER BY random().
 * <p>
 * Every video holds a fixed random_sort in [0, 1). A cursor derived from the current minute picks a
 * starting point; the sample is the next {@code size} matching rows in random_sort order, wrapping
 * around to the start of the range when the tail runs out. The cursor visits every slot of the
 * rotation period once per period.
 * <p>
 * Full reachability needs the matching set to be small enough: with P slots per period and a sample
 * size S, a row is reachable only if it is among the first S matches at or above some slot. With
 * roughly uniform random_sort values that holds while N &lt;= P * S for the filtered set of N rows.
 * Beyond that, rows falling deeper than S past every slot are never sampled for those criteria.
 */
@Slf4j
@Service
public class OutlierSampler {
    private static final long MILLIS_PER_MINUTE = 60_000L;

    private final OutlierSampleRepository sampleRepository;
    private final TrackerProperties.Sampler props;
    private final Clock clock;
    private final CacheManager cacheManager;
    private final Timer latency;

    public OutlierSampler(final OutlierSampleRepository sampleRepository,
                          final TrackerProperties.Sampler props,
                          final Clock clock,
                          final CacheManager cacheManager,
                          final MeterRegistry meterRegistry) {
        this.sampleRepository = sampleRepository;
        this.props = props;
        this.clock = clock;
        this.cacheManager = cacheManager;
        this.latency = Timer.builder("outlier.sampler.latency")
                .description("Time spent querying outlier samples")
                .register(meterRegistry);
    }

    public OutlierSample sample(final SampleCriteria criteria) {
        validate(criteria);
        Instant now = clock.instant();
        long slot = slotAt(now);
        double cursor = slot / (double) props.rotationPeriodMinutes();

        Cache cache = cacheManager.getCache(CacheConfig.OUTLIER_SAMPLES);
        if (cache == null) {
            return query(criteria, cursor, now);
        }
        return cache.get(new SampleKey(criteria, slot), () -> query(criteria, cursor, now));
    }

    /** Cursor position for the given instant, in [0, 1). */
    public double cursorAt(final Instant instant) {
        return slotAt(instant) / (double) props.rotationPeriodMinutes();
    }

    private long slotAt(Instant instant) {
        long epochMinute = Math.floorDiv(instant.toEpochMilli(), MILLIS_PER_MINUTE);
        return Math.floorMod(epochMinute, (long) props.rotationPeriodMinutes());
    }

    private OutlierSample query(SampleCriteria criteria, double cursor, Instant now) {
        return latency.record(() -> {
            Instant publishedAfter = criteria.maxAgeDays() != null
                    ? now.minus(Duration.ofDays(criteria.maxAgeDays()))
                    : null;
            int size = criteria.size();

            List<SampledVideo> first = sampleRepository.findPass(SampleQueryBuilder.build(
                    criteria, publishedAfter, cursor, SampleQuery.Pass.FROM_CURSOR, size));
            List<SampledVideo> rows = new ArrayList<>(first);
            if (rows.size() < size) {
                rows.addAll(sampleRepository.findPass(SampleQueryBuilder.build(
                        criteria, publishedAfter, cursor, SampleQuery.Pass.BEFORE_CURSOR, size - rows.size())));
            }

            log.debug("Sampled {}/{} videos at cursor {} ({} wrapped)", rows.size(), size, cursor,
                    rows.size() - first.size());
            return new OutlierSample(cursor, size, rows.stream().map(SampledVideo::videoId).toList(),
                    first.size(), rows.size() - first.size());
        });
    }

    private void validate(SampleCriteria criteria) {
        if (criteria.size() < 1 || criteria.size() > props.maxSampleSize()) {
            throw new InvalidSampleRequestException(
                    "size must be between 1 and " + props.maxSampleSize() + ": " + criteria.size());
        }
        if (criteria.minScore() != null && criteria.minScore().compareTo(BigDecimal.ZERO) < 0) {
            throw new InvalidSampleRequestException("minScore must not be negative");
        }
        if (criteria.minViews() != null && criteria.minViews() < 0) {
            throw new InvalidSampleRequestException("minViews must not be negative");
        }
        if (criteria.maxAgeDays() != null && criteria.maxAgeDays() < 1) {
            throw new InvalidSampleRequestException("maxAgeDays must be at least 1");
        }
    }

    private record SampleKey(SampleCriteria criteria, long slot) {}
}
