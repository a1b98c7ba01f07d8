package quest.gekko.outlier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for view tracking, baselines and sampling
 */
@Configuration
@EnableConfigurationProperties({
        TrackerProperties.YouTube.class,
        TrackerProperties.Quota.class,
        TrackerProperties.Refresh.class,
        TrackerProperties.Envelope.class,
        TrackerProperties.Baseline.class,
        TrackerProperties.Score.class,
        TrackerProperties.Sampler.class,
        TrackerProperties.Security.class
})
public class TrackerProperties {

    @ConfigurationProperties("tracker.youtube")
    public record YouTube(String apiKey, String baseUrl, Integer idsPerCall, Integer unitsPerCall,
                          Integer maxConcurrentCalls, Integer retryAttempts, Duration retryBackoff) {
        public YouTube {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://www.googleapis.com";
            if (idsPerCall == null) idsPerCall = 50;
            if (unitsPerCall == null) unitsPerCall = 1;
            if (maxConcurrentCalls == null) maxConcurrentCalls = 5;
            if (retryAttempts == null) retryAttempts = 3;
            if (retryBackoff == null) retryBackoff = Duration.ofMillis(800);
        }
    }

    @ConfigurationProperties("tracker.quota")
    public record Quota(Long maxDailyUnits, Integer retentionDays) {
        public Quota {
            if (maxDailyUnits == null) maxDailyUnits = 10_000L;
            if (retentionDays == null) retentionDays = 30;
        }
    }

    @ConfigurationProperties("tracker.refresh")
    public record Refresh(String cron, Boolean excludeShorts, Duration minBatchDelay, Integer provisionedIops,
                          Double targetIopsUtilization, Integer writesPerRow, Duration heartbeatTimeout,
                          Integer maxConsecutiveBatchFailures) {
        public Refresh {
            if (cron == null || cron.isBlank()) cron = "0 15 * * * *";
            if (excludeShorts == null) excludeShorts = true;
            if (minBatchDelay == null) minBatchDelay = Duration.ofMillis(100);
            if (provisionedIops == null) provisionedIops = 3000;
            if (targetIopsUtilization == null) targetIopsUtilization = 0.8;
            if (writesPerRow == null) writesPerRow = 3;
            if (heartbeatTimeout == null) heartbeatTimeout = Duration.ofMinutes(30);
            if (maxConsecutiveBatchFailures == null) maxConsecutiveBatchFailures = 3;
        }
    }

    @ConfigurationProperties("tracker.envelope")
    public record Envelope(Integer horizonDays, Integer minSamples, Integer referenceDay, String cron) {
        public Envelope {
            if (horizonDays == null) horizonDays = 3650;
            if (minSamples == null) minSamples = 30;
            if (referenceDay == null) referenceDay = 30;
            if (cron == null || cron.isBlank()) cron = "0 30 3 * * *";
        }
    }

    @ConfigurationProperties("tracker.baseline")
    public record Baseline(Integer historySize, Integer minHistory, Double insufficientHistorySentinel,
                           Integer updateChunkSize, String cron) {
        public Baseline {
            if (historySize == null) historySize = 10;
            if (minHistory == null) minHistory = 3;
            if (insufficientHistorySentinel == null) insufficientHistorySentinel = 1.0;
            if (updateChunkSize == null) updateChunkSize = 500;
            if (cron == null || cron.isBlank()) cron = "0 0 4 * * *";
        }
    }

    /** Inclusive lower bounds of each tier; anything under {@code underperforming} is poor. */
    @ConfigurationProperties("tracker.score")
    public record Score(Double viral, Double outperforming, Double onTrack, Double underperforming) {
        public Score {
            if (viral == null) viral = 3.0;
            if (outperforming == null) outperforming = 1.5;
            if (onTrack == null) onTrack = 0.5;
            if (underperforming == null) underperforming = 0.2;
            if (!(viral > outperforming && outperforming > onTrack && onTrack > underperforming && underperforming > 0)) {
                throw new IllegalStateException("tracker.score thresholds must be strictly decreasing and positive");
            }
        }
    }

    @ConfigurationProperties("tracker.sampler")
    public record Sampler(Integer rotationPeriodMinutes, Integer maxSampleSize, Duration statementTimeout) {
        public Sampler {
            if (rotationPeriodMinutes == null) rotationPeriodMinutes = 1000;
            if (maxSampleSize == null) maxSampleSize = 500;
            if (statementTimeout == null) statementTimeout = Duration.ofMillis(800);
        }
    }

    @ConfigurationProperties("security.admin")
    public record Security(String username, String password) {}
}
