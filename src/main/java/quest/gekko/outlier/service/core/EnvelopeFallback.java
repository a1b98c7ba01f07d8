package quest.gekko.outlier.service.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Fills the envelope for every day from 0 to the last observed day.
 * <p>
 * A day with fewer than {@code minSamples} observations, or none at all, takes the percentiles of the
 * nearest day that has enough; at equal distance the earlier day wins. Days past the last observed
 * day are not emitted because curve lookups clamp to the last row.
 */
public final class EnvelopeFallback {

    private EnvelopeFallback() {}

    public static List<DayPercentiles> fill(List<DayPercentiles> observed, int horizonDays, int minSamples) {
        Map<Integer, DayPercentiles> byDay = new HashMap<>();
        NavigableMap<Integer, DayPercentiles> sufficient = new TreeMap<>();
        int lastDay = -1;
        for (DayPercentiles d : observed) {
            if (d.day() < 0 || d.day() > horizonDays) continue;
            byDay.put(d.day(), d);
            lastDay = Math.max(lastDay, d.day());
            if (d.sampleCount() >= minSamples) {
                sufficient.put(d.day(), d);
            }
        }
        if (sufficient.isEmpty()) {
            return List.of();
        }

        List<DayPercentiles> filled = new ArrayList<>(lastDay + 1);
        for (int day = 0; day <= lastDay; day++) {
            DayPercentiles own = byDay.get(day);
            if (own != null && own.sampleCount() >= minSamples) {
                filled.add(own);
                continue;
            }
            DayPercentiles source = nearest(sufficient, day);
            filled.add(source.copiedTo(day, own != null ? own.sampleCount() : 0L));
        }
        return filled;
    }

    private static DayPercentiles nearest(NavigableMap<Integer, DayPercentiles> sufficient, int day) {
        Map.Entry<Integer, DayPercentiles> below = sufficient.floorEntry(day);
        Map.Entry<Integer, DayPercentiles> above = sufficient.ceilingEntry(day);
        if (below == null) return above.getValue();
        if (above == null) return below.getValue();
        return day - below.getKey() <= above.getKey() - day ? below.getValue() : above.getValue();
    }
}
