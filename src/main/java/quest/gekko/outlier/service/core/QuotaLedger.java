package quest.gekko.outlier.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.QuotaCounter;
import quest.gekko.outlier.repository.QuotaCounterRepository;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Daily spend of external API units. Days roll over at midnight UTC; a day without a row has
 * spent nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaLedger {
    private final QuotaCounterRepository quotaCounterRepository;
    private final TrackerProperties.Quota props;
    private final Clock clock;

    public LocalDate today() {
        return clock.instant().atZone(ZoneOffset.UTC).toLocalDate();
    }

    @Transactional(readOnly = true)
    public boolean checkAvailable(final long unitsNeeded) {
        return usedOn(today()) + unitsNeeded <= props.maxDailyUnits();
    }

    /**
     * Atomically adds units to today's counter.
     *
     * @return units used today after the addition
     */
    @Transactional
    public long increment(final long units) {
        if (units <= 0) {
            throw new IllegalArgumentException("units must be positive: " + units);
        }
        long total = quotaCounterRepository.addUnits(today(), units, props.maxDailyUnits());
        log.debug("Quota +{} -> {}/{}", units, total, props.maxDailyUnits());
        return total;
    }

    @Transactional(readOnly = true)
    public QuotaStatus getStatus() {
        LocalDate today = today();
        long used = usedOn(today);
        long total = props.maxDailyUnits();
        return new QuotaStatus(today, used, Math.max(0, total - used), total);
    }

    /** Drops audit rows older than the retention window. */
    @Transactional
    public int purgeHistory() {
        LocalDate cutoff = today().minusDays(props.retentionDays());
        int deleted = quotaCounterRepository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            log.info("Purged {} quota rows before {}", deleted, cutoff);
        }
        return deleted;
    }

    private long usedOn(LocalDate day) {
        return quotaCounterRepository.findById(day).map(QuotaCounter::getUnitsUsed).orElse(0L);
    }
}
