package quest.gekko.outlier.service.refresh;

import quest.gekko.outlier.repository.RefreshCandidate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A claimed refresh: the candidates selected when the job row was taken, and the date their
 * snapshots are recorded under.
 */
public record RefreshRun(List<RefreshCandidate> candidates, LocalDate snapshotDate, Instant startedAt) {

    public int total() {
        return candidates.size();
    }
}
