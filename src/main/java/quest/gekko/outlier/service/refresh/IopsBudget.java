package quest.gekko.outlier.service.refresh;

import quest.gekko.outlier.config.TrackerProperties;

import java.time.Duration;

/**
 * Inter-batch backpressure: after writing a batch, wait until the batch's writes fit inside the
 * target share of the provisioned IOPS, and never less than the configured minimum delay.
 */
public class IopsBudget {
    private final double writesPerSecond;
    private final int writesPerRow;
    private final Duration minDelay;

    public IopsBudget(final TrackerProperties.Refresh props) {
        this.writesPerSecond = props.provisionedIops() * props.targetIopsUtilization();
        this.writesPerRow = props.writesPerRow();
        this.minDelay = props.minBatchDelay();
    }

    public Duration delayAfter(final int rowsWritten, final Duration batchElapsed) {
        if (writesPerSecond <= 0) {
            return minDelay;
        }
        long budgetMillis = (long) Math.ceil(rowsWritten * writesPerRow * 1000.0 / writesPerSecond);
        Duration remaining = Duration.ofMillis(budgetMillis).minus(batchElapsed);
        return remaining.compareTo(minDelay) > 0 ? remaining : minDelay;
    }
}
