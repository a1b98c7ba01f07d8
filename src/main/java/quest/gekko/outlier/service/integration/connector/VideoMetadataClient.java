package quest.gekko.outlier.service.integration.connector;

import java.util.List;
import java.util.Map;

public interface VideoMetadataClient {

    /** Upper bound on ids accepted by a single {@link #fetchStatistics} call. */
    int maxIdsPerCall();

    /** Quota units one call costs, independent of how many ids it carries. */
    int unitsPerCall();

    /**
     * Current statistics for up to {@link #maxIdsPerCall()} videos in one API call.
     * Ids the platform does not return (deleted, private) are absent from the map.
     *
     * @throws VideoMetadataException if the call as a whole fails
     */
    Map<String, VideoStatistics> fetchStatistics(List<String> videoIds);
}
