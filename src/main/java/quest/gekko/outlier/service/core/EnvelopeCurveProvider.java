package quest.gekko.outlier.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.outlier.config.CacheConfig;
import quest.gekko.outlier.repository.PerformanceEnvelopeRepository;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnvelopeCurveProvider {
    private final PerformanceEnvelopeRepository envelopeRepository;

    // evicted by EnvelopeBuilder#rebuild
    @Cacheable(CacheConfig.ENVELOPE_CURVE)
    @Transactional(readOnly = true)
    public EnvelopeCurve current() {
        EnvelopeCurve curve = EnvelopeCurve.of(envelopeRepository.findAllByOrderByDaySincePublishedAsc());
        if (curve.isEmpty()) {
            log.warn("Performance envelope is empty; baselines will not be age-normalized");
        }
        return curve;
    }
}
