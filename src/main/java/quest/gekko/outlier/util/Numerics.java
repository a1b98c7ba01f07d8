package quest.gekko.outlier.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions into the NUMERIC(11,3) columns that hold baselines and scores.
 * Values past the column range saturate instead of failing the write.
 */
public final class Numerics {
    public static final int SCALE = 3;
    public static final BigDecimal MAX_STORED_VALUE = new BigDecimal("99999999.999");

    private Numerics() {}

    /**
     * @return {@code value} rounded to three decimals and clamped to [0, {@link #MAX_STORED_VALUE}];
     *         positive infinity saturates, NaN yields null
     */
    public static BigDecimal saturate(double value) {
        if (Double.isNaN(value)) {
            return null;
        }
        if (value <= 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        if (Double.isInfinite(value) || value >= MAX_STORED_VALUE.doubleValue()) {
            return MAX_STORED_VALUE;
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).min(MAX_STORED_VALUE);
    }

    /**
     * {@code numerator / denominator}, saturated. Null when the denominator is missing or not positive.
     */
    public static BigDecimal saturatedRatio(long numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() <= 0) {
            return null;
        }
        BigDecimal ratio = BigDecimal.valueOf(numerator).divide(denominator, SCALE, RoundingMode.HALF_UP);
        return ratio.min(MAX_STORED_VALUE);
    }
}
