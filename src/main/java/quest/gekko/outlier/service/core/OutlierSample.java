package quest.gekko.outlier.service.core;

import java.util.List;

/**
 * @param fromCursor rows taken at or after the cursor; the rest wrapped around to the start
 */
public record OutlierSample(double cursor, int requested, List<String> videoIds, int fromCursor, int wrapped) {}
