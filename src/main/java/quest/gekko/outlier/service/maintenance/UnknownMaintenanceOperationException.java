package quest.gekko.outlier.service.maintenance;

public class UnknownMaintenanceOperationException extends RuntimeException {
    public UnknownMaintenanceOperationException(String name) {
        super("Unknown maintenance operation: " + name);
    }
}
