package quest.gekko.outlier.repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * A video due for a view-count refresh.
 */
public record RefreshCandidate(String videoId, Instant publishedAt, LocalDate lastSnapshotDate) {

    // Constructor for SQL result mapping
    public RefreshCandidate(Object[] row) {
        this((String) row[0], toInstant(row[1]), toLocalDate(row[2]));
    }

    private static Instant toInstant(Object o) {
        if (o == null) return null;
        if (o instanceof Instant i) return i;
        if (o instanceof Timestamp t) return t.toInstant();
        if (o instanceof OffsetDateTime odt) return odt.toInstant();
        throw new IllegalArgumentException("Unsupported timestamp type " + o.getClass());
    }

    private static LocalDate toLocalDate(Object o) {
        if (o == null) return null;
        if (o instanceof LocalDate d) return d;
        if (o instanceof Date d) return d.toLocalDate();
        throw new IllegalArgumentException("Unsupported date type " + o.getClass());
    }
}
