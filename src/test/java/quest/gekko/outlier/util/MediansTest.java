package quest.gekko.outlier.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MediansTest {

    @Test
    void testMedian_OddLengthTakesMiddleElement() {
        assertEquals(1100.0, Medians.median(List.of(1000, 1200, 50000, 1100, 900)));
    }

    @Test
    void testMedian_EvenLengthAveragesMiddlePair() {
        assertEquals(2.5, Medians.median(List.of(4, 1, 3, 2)));
    }

    @Test
    void testMedian_SingleElement() {
        assertEquals(42.0, Medians.median(List.of(42L)));
    }

    @Test
    void testMedian_UnaffectedByOneHugeValue() {
        // Given a list where the mean is dominated by one value
        List<Double> values = List.of(1000.0, 1200.0, 50000.0, 1100.0, 900.0);
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();

        // When
        double median = Medians.median(values);

        // Then
        assertEquals(10840.0, mean, 0.001);
        assertEquals(1100.0, median);
    }

    @Test
    void testMedian_EmptyListRejected() {
        assertThrows(IllegalArgumentException.class, () -> Medians.median(List.of()));
        assertThrows(IllegalArgumentException.class, () -> Medians.median(null));
    }
}
