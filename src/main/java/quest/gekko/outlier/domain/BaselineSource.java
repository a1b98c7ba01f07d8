package quest.gekko.outlier.domain;

/**
 * How a video's channel baseline was obtained.
 */
public enum BaselineSource {
    /** Median Day-30 estimate over the channel's prior videos. */
    CHANNEL_HISTORY,
    /** Too few prior videos; the baseline holds the sentinel multiplier and is not a view count. */
    INSUFFICIENT_HISTORY
}
