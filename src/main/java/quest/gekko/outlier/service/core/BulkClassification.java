package quest.gekko.outlier.service.core;

import java.util.List;

public record BulkClassification(List<ScoreClassification> results, List<String> missing, int recomputed) {}
