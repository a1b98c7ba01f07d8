package quest.gekko.outlier.service.refresh;

import org.junit.jupiter.api.Test;
import quest.gekko.outlier.config.TrackerProperties;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class IopsBudgetTest {
    // 3000 IOPS at 80% = 2400 writes/s, 3 writes per row
    private final IopsBudget budget = new IopsBudget(
            new TrackerProperties.Refresh(null, null, Duration.ofMillis(100), 3000, 0.8, 3, null, null));

    @Test
    void testDelayAfter_WaitsOutTheWriteBudget() {
        // 1000 rows = 3000 writes = 1250 ms of budget
        assertEquals(Duration.ofMillis(1000), budget.delayAfter(1000, Duration.ofMillis(250)));
    }

    @Test
    void testDelayAfter_NeverBelowMinimum() {
        assertEquals(Duration.ofMillis(100), budget.delayAfter(2, Duration.ZERO));
        assertEquals(Duration.ofMillis(100), budget.delayAfter(1000, Duration.ofSeconds(5)));
    }
}
