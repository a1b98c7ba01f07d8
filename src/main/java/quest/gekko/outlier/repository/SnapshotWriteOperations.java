package quest.gekko.outlier.repository;

import java.util.List;

public interface SnapshotWriteOperations {

    /**
     * Inserts one snapshot per row keyed by (video_id, snapshot_date); a row that already exists for
     * that key takes the new counts instead of being duplicated.
     */
    int upsertAll(List<SnapshotRow> rows);
}
