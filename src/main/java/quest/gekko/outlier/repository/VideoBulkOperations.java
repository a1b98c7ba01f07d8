package quest.gekko.outlier.repository;

import java.util.List;
import java.util.Map;

/**
 * Set-based writes on the video table. Each method issues one statement per call
 * (or per chunk handed in by the caller), never one round trip per row.
 */
public interface VideoBulkOperations {

    int updateBaselines(List<BaselineUpdate> updates);

    int updateViewCounts(Map<String, Long> viewCounts);

    /** Recomputes {@code view_count / baseline} for every video that has a positive baseline. */
    int rescoreAll();

    /** Gives every video without a random sort key one; existing keys are never touched. */
    int backfillRandomSort();

    /** Copies the channel institutional flag onto videos where the two disagree. */
    int syncInstitutionalFlags();

    void refreshPerformanceView();
}
