package quest.gekko.outlier.repository;

import java.time.LocalDate;

public interface QuotaCounterOperations {

    /**
     * Adds units to the day's counter in a single upsert, creating the row on first use.
     *
     * @return units used on that day after the addition
     */
    long addUnits(LocalDate day, long units, long maxDailyUnits);
}
