package quest.gekko.outlier.service.maintenance;

/**
 * A named, idempotent bulk operation. {@link MaintenanceRunner} applies each (name, version) once
 * and records it; bumping the version makes it pending again. Recurring operations are applied on
 * every pass. Operations run with the statement timeout relaxed.
 */
public interface MaintenanceOperation {

    /** Stable identifier, used in URLs and in the run log. */
    String name();

    int version();

    String description();

    default boolean recurring() {
        return false;
    }

    /** @return rows affected */
    long apply();
}
