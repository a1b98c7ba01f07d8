package quest.gekko.outlier.service.core;

import quest.gekko.outlier.domain.PerformanceEnvelope;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * In-memory view of the p50 column of the performance envelope.
 * <p>
 * Ages are clamped to the covered range. A day missing from the table resolves to the nearest
 * present day, the lower one on a tie. An empty curve scales nothing: every ratio is 1.
 */
public final class EnvelopeCurve {
    private static final EnvelopeCurve EMPTY = new EnvelopeCurve(new TreeMap<>());

    private final NavigableMap<Integer, Double> p50ByDay;

    private EnvelopeCurve(NavigableMap<Integer, Double> p50ByDay) {
        this.p50ByDay = p50ByDay;
    }

    public static EnvelopeCurve empty() {
        return EMPTY;
    }

    public static EnvelopeCurve of(List<PerformanceEnvelope> rows) {
        NavigableMap<Integer, Double> map = new TreeMap<>();
        for (PerformanceEnvelope row : rows) {
            if (row.getP50Views() != null) {
                map.put(row.getDaySincePublished(), row.getP50Views());
            }
        }
        return map.isEmpty() ? EMPTY : new EnvelopeCurve(map);
    }

    public static EnvelopeCurve of(Map<Integer, Double> p50ByDay) {
        return p50ByDay.isEmpty() ? EMPTY : new EnvelopeCurve(new TreeMap<>(p50ByDay));
    }

    public boolean isEmpty() {
        return p50ByDay.isEmpty();
    }

    public int maxDay() {
        return isEmpty() ? 0 : p50ByDay.lastKey();
    }

    public OptionalDouble p50At(int day) {
        if (isEmpty()) {
            return OptionalDouble.empty();
        }
        int clamped = Math.max(0, Math.min(day, maxDay()));
        Map.Entry<Integer, Double> floor = p50ByDay.floorEntry(clamped);
        Map.Entry<Integer, Double> ceiling = p50ByDay.ceilingEntry(clamped);
        if (floor == null) return OptionalDouble.of(ceiling.getValue());
        if (ceiling == null) return OptionalDouble.of(floor.getValue());
        return clamped - floor.getKey() <= ceiling.getKey() - clamped
                ? OptionalDouble.of(floor.getValue())
                : OptionalDouble.of(ceiling.getValue());
    }

    /**
     * Multiplier that moves a view count observed at {@code fromDay} to its equivalent at {@code toDay}.
     * Falls back to 1 when either end has no usable value.
     */
    public double ratio(int fromDay, int toDay) {
        if (fromDay == toDay) {
            return 1.0;
        }
        OptionalDouble from = p50At(fromDay);
        OptionalDouble to = p50At(toDay);
        if (from.isEmpty() || to.isEmpty() || from.getAsDouble() <= 0 || to.getAsDouble() <= 0) {
            return 1.0;
        }
        return to.getAsDouble() / from.getAsDouble();
    }
}
