package quest.gekko.outlier.service.refresh;

public record RefreshItemError(String videoId, String reason) {}
