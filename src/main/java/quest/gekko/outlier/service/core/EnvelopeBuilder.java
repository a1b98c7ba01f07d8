package quest.gekko.outlier.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.outlier.config.CacheConfig;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.PerformanceEnvelope;
import quest.gekko.outlier.repository.PerformanceEnvelopeRepository;
import quest.gekko.outlier.repository.StatementTimeouts;
import quest.gekko.outlier.repository.ViewSnapshotRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Recomputes the global "views by age" curve from every snapshot and replaces the envelope table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnvelopeBuilder {
    private final ViewSnapshotRepository snapshotRepository;
    private final PerformanceEnvelopeRepository envelopeRepository;
    private final StatementTimeouts statementTimeouts;
    private final TrackerProperties.Envelope props;
    private final Clock clock;

    @Transactional
    @CacheEvict(value = CacheConfig.ENVELOPE_CURVE, allEntries = true)
    public EnvelopeBuildResult rebuild() {
        Instant started = clock.instant();
        statementTimeouts.relax();

        List<DayPercentiles> observed = snapshotRepository.aggregateByDayRaw(props.horizonDays()).stream()
                .map(EnvelopeBuilder::toPercentiles)
                .toList();
        long samples = observed.stream().mapToLong(DayPercentiles::sampleCount).sum();
        List<DayPercentiles> filled = EnvelopeFallback.fill(observed, props.horizonDays(), props.minSamples());

        envelopeRepository.deleteAllInBatch();
        if (filled.isEmpty()) {
            log.warn("No day has {} or more snapshots; envelope left empty ({} samples total)",
                    props.minSamples(), samples);
            return new EnvelopeBuildResult(0, 0, samples, Duration.between(started, clock.instant()));
        }

        Instant now = clock.instant();
        envelopeRepository.saveAll(filled.stream().map(d -> toEntity(d, now)).toList());

        int filledDays = (int) filled.stream().filter(d -> d.sourceDay() != d.day()).count();
        Duration elapsed = Duration.between(started, clock.instant());
        log.info("Envelope rebuilt: {} days ({} borrowed from neighbours) from {} snapshots in {} ms",
                filled.size(), filledDays, samples, elapsed.toMillis());
        return new EnvelopeBuildResult(filled.size(), filledDays, samples, elapsed);
    }

    // day, count, p10, p25, p50, p75, p90
    private static DayPercentiles toPercentiles(Object[] row) {
        return DayPercentiles.observed(
                ((Number) row[0]).intValue(),
                ((Number) row[1]).longValue(),
                ((Number) row[2]).doubleValue(),
                ((Number) row[3]).doubleValue(),
                ((Number) row[4]).doubleValue(),
                ((Number) row[5]).doubleValue(),
                ((Number) row[6]).doubleValue());
    }

    private static PerformanceEnvelope toEntity(DayPercentiles d, Instant now) {
        PerformanceEnvelope e = new PerformanceEnvelope();
        e.setDaySincePublished(d.day());
        e.setSampleCount(d.sampleCount());
        e.setP10Views(d.p10());
        e.setP25Views(d.p25());
        e.setP50Views(d.p50());
        e.setP75Views(d.p75());
        e.setP90Views(d.p90());
        e.setSourceDay(d.sourceDay());
        e.setUpdatedAt(now);
        return e;
    }
}
