package quest.gekko.outlier.web.dto;

import quest.gekko.outlier.service.maintenance.MaintenanceOperation;

public record MaintenanceOperationDTO(String name, int version, boolean recurring, String description) {

    public static MaintenanceOperationDTO from(MaintenanceOperation op) {
        return new MaintenanceOperationDTO(op.name(), op.version(), op.recurring(), op.description());
    }
}
