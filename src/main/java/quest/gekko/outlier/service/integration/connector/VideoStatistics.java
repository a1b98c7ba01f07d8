package quest.gekko.outlier.service.integration.connector;

public record VideoStatistics(String videoId, long viewCount, Long likeCount, Long commentCount) {}
