package quest.gekko.outlier.service.integration.connector;

public class VideoMetadataException extends RuntimeException {

    public VideoMetadataException(String message) {
        super(message);
    }

    public VideoMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
