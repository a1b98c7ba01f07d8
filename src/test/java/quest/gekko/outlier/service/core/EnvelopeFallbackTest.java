package quest.gekko.outlier.service.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeFallbackTest {

    private static DayPercentiles day(int day, long count, double p50) {
        return DayPercentiles.observed(day, count, p50 / 2, p50 * 0.75, p50, p50 * 1.5, p50 * 3);
    }

    @Test
    void testFill_SufficientDaysKeepOwnValues() {
        List<DayPercentiles> filled = EnvelopeFallback.fill(
                List.of(day(0, 50, 10), day(1, 40, 20)), 3650, 30);

        assertEquals(2, filled.size());
        assertEquals(0, filled.get(0).sourceDay());
        assertEquals(20.0, filled.get(1).p50());
        assertEquals(1, filled.get(1).sourceDay());
    }

    @Test
    void testFill_SparseDayCopiesNearestSufficientDay() {
        // Given day 2 too sparse, day 3 absent; nearest sufficient days are 0 and 5
        List<DayPercentiles> observed = List.of(
                day(0, 100, 10), day(2, 3, 999), day(5, 100, 50));

        // When
        List<DayPercentiles> filled = EnvelopeFallback.fill(observed, 3650, 30);

        // Then
        assertEquals(6, filled.size());
        assertEquals(0, filled.get(1).sourceDay());
        assertEquals(0, filled.get(2).sourceDay());
        assertEquals(3, filled.get(2).sampleCount());
        assertEquals(5, filled.get(3).sourceDay());
        assertEquals(50.0, filled.get(4).p50());
    }

    @Test
    void testFill_TieGoesToEarlierDay() {
        List<DayPercentiles> filled = EnvelopeFallback.fill(
                List.of(day(0, 100, 10), day(2, 100, 30)), 3650, 30);

        assertEquals(0, filled.get(1).sourceDay());
        assertEquals(10.0, filled.get(1).p50());
    }

    @Test
    void testFill_NoSufficientDayYieldsEmpty() {
        assertTrue(EnvelopeFallback.fill(List.of(day(0, 5, 10), day(1, 2, 20)), 3650, 30).isEmpty());
    }

    @Test
    void testFill_DaysPastHorizonIgnored() {
        List<DayPercentiles> filled = EnvelopeFallback.fill(
                List.of(day(0, 100, 10), day(9, 100, 90)), 5, 30);

        assertEquals(1, filled.size());
    }
}
