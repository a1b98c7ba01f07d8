package quest.gekko.outlier.util;

import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.service.integration.connector.VideoMetadataException;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Bounds concurrent calls to the video metadata API and retries transient failures.
 */
@Component
public class RateLimiter {
    private final Semaphore sem;
    private final RetryTemplate retry;

    public RateLimiter(final TrackerProperties.YouTube youTube) {
        this.sem = new Semaphore(youTube.maxConcurrentCalls());
        this.retry = RetryTemplate.builder()
                .maxAttempts(youTube.retryAttempts())
                .fixedBackoff(youTube.retryBackoff().toMillis())
                .build();
    }

    public <T> T call(Callable<T> c) {
        try {
            sem.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VideoMetadataException("Interrupted while waiting for an API slot", e);
        }
        try {
            return retry.execute(ctx -> c.call());
        } catch (VideoMetadataException e) {
            throw e;
        } catch (Exception e) {
            throw new VideoMetadataException("Video metadata call failed: " + e.getMessage(), e);
        } finally {
            sem.release();
        }
    }
}
