package quest.gekko.outlier.service.core;

import java.time.Duration;

public record EnvelopeBuildResult(int days, int filledDays, long samples, Duration elapsed) {}
