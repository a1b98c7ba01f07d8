package quest.gekko.outlier.service.refresh;

public class RefreshAlreadyRunningException extends RuntimeException {
    public RefreshAlreadyRunningException() {
        super("A view refresh is already running");
    }
}
