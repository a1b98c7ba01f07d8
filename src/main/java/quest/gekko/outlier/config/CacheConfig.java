package quest.gekko.outlier.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.transaction.TransactionAwareCacheManagerProxy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableCaching
public class CacheConfig {
    public static final String OUTLIER_SAMPLES = "outlierSamples";
    public static final String ENVELOPE_CURVE = "envelopeCurve";

    @Bean
    public Caffeine<Object, Object> caffeine() {
        return Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofMinutes(15));
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(caffeine);
        // the sampling cursor moves once a minute, so nothing older than that is worth serving
        cacheManager.registerCustomCache(OUTLIER_SAMPLES,
                Caffeine.newBuilder().maximumSize(5_000).expireAfterWrite(Duration.ofMinutes(1)).build());
        cacheManager.registerCustomCache(ENVELOPE_CURVE,
                Caffeine.newBuilder().maximumSize(1).expireAfterWrite(Duration.ofHours(1)).build());
        // evictions issued inside a transaction wait for its commit
        return new TransactionAwareCacheManagerProxy(cacheManager);
    }
}
