package quest.gekko.outlier.service.core;

public class VideoNotFoundException extends RuntimeException {
    public VideoNotFoundException(String videoId) {
        super("Video not found: " + videoId);
    }
}
