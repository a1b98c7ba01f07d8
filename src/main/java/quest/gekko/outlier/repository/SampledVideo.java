package quest.gekko.outlier.repository;

public record SampledVideo(String videoId, double randomSort) {}
