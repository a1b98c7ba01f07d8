package quest.gekko.outlier.service.core;

import java.time.Duration;

public record BaselineRunResult(int channels, int videosUpdated, int insufficientHistory, int failedChannels,
                                Duration elapsed) {}
