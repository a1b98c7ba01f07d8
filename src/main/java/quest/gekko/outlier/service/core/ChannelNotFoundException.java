package quest.gekko.outlier.service.core;

public class ChannelNotFoundException extends RuntimeException {
    public ChannelNotFoundException(String channelId) {
        super("Channel not found: " + channelId);
    }
}
