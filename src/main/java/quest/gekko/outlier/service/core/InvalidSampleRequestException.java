package quest.gekko.outlier.service.core;

public class InvalidSampleRequestException extends IllegalArgumentException {
    public InvalidSampleRequestException(String message) {
        super(message);
    }
}
