package quest.gekko.outlier.util;

import java.util.List;

/**
 * Median helper used by the baseline estimator.
 */
public final class Medians {

    private Medians() {}

    /**
     * Median of the values: the middle element of an odd-length list, the mean of the two
     * middle elements of an even-length one.
     *
     * @param values non-empty list, order does not matter
     * @return the median
     * @throws IllegalArgumentException if the list is null or empty
     */
    public static double median(List<? extends Number> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("median of an empty list is undefined");
        }
        double[] sorted = values.stream().mapToDouble(Number::doubleValue).sorted().toArray();
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return sorted[mid];
    }
}
