package quest.gekko.outlier.service.maintenance;

public record MaintenanceRunResult(String operation, int version, boolean succeeded, boolean skipped,
                                   long affectedRows, String message) {

    static MaintenanceRunResult skipped(MaintenanceOperation op) {
        return new MaintenanceRunResult(op.name(), op.version(), true, true, 0, "already applied");
    }
}
