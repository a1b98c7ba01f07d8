package quest.gekko.outlier.service.core;

/**
 * View-count distribution at one age. {@code sourceDay} is the day the percentiles were taken from.
 */
public record DayPercentiles(int day, long sampleCount, double p10, double p25, double p50, double p75,
                             double p90, int sourceDay) {

    public static DayPercentiles observed(int day, long sampleCount, double p10, double p25, double p50,
                                          double p75, double p90) {
        return new DayPercentiles(day, sampleCount, p10, p25, p50, p75, p90, day);
    }

    DayPercentiles copiedTo(int targetDay, long targetSampleCount) {
        return new DayPercentiles(targetDay, targetSampleCount, p10, p25, p50, p75, p90, day);
    }
}
