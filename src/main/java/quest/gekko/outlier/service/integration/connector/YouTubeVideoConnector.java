package quest.gekko.outlier.service.integration.connector;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.util.RateLimiter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class YouTubeVideoConnector implements VideoMetadataClient {
    private final WebClient http;
    private final RateLimiter rateLimiter;
    private final TrackerProperties.YouTube youTube;

    public YouTubeVideoConnector(final WebClient youTubeWebClient, final RateLimiter rateLimiter,
                                 final TrackerProperties.YouTube youTube) {
        this.http = youTubeWebClient;
        this.rateLimiter = rateLimiter;
        this.youTube = youTube;
    }

    @Override
    public int maxIdsPerCall() {
        return youTube.idsPerCall();
    }

    @Override
    public int unitsPerCall() {
        return youTube.unitsPerCall();
    }

    @Override
    public Map<String, VideoStatistics> fetchStatistics(List<String> videoIds) {
        if (videoIds == null || videoIds.isEmpty()) return Map.of();
        if (videoIds.size() > maxIdsPerCall()) {
            throw new IllegalArgumentException("At most " + maxIdsPerCall() + " ids per call, got " + videoIds.size());
        }
        if (youTube.apiKey() == null || youTube.apiKey().isBlank()) {
            throw new VideoMetadataException("tracker.youtube.api-key is not configured");
        }

        String idParam = String.join(",", videoIds);
        Map<?, ?> resp = rateLimiter.call(() -> http.get()
                .uri(uri -> uri.path("/youtube/v3/videos")
                        .queryParam("part", "statistics")
                        .queryParam("id", idParam)
                        .queryParam("maxResults", String.valueOf(videoIds.size()))
                        .queryParam("key", youTube.apiKey())
                        .build())
                .retrieve()
                .bodyToMono(Map.class)
                .block());

        List<Map<String, Object>> items = safeItems(resp);
        Map<String, VideoStatistics> result = new LinkedHashMap<>();
        for (Map<String, Object> item : items) {
            VideoStatistics stats = mapStatistics(item);
            if (stats != null) result.put(stats.videoId(), stats);
        }
        log.debug("videos.list returned {} of {} requested ids", result.size(), videoIds.size());
        return result;
    }

    // ---- Helpers ----

    @SuppressWarnings("unchecked")
    private VideoStatistics mapStatistics(Map<String, Object> item) {
        if (item == null) return null;
        Object id = item.get("id");
        Map<String, Object> stats = (Map<String, Object>) item.get("statistics");
        if (!(id instanceof String videoId) || stats == null) return null;

        // hidden like/comment counts are simply missing from the payload
        return new VideoStatistics(videoId,
                parseLong(stats.get("viewCount")),
                stats.containsKey("likeCount") ? parseLong(stats.get("likeCount")) : null,
                stats.containsKey("commentCount") ? parseLong(stats.get("commentCount")) : null);
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> safeItems(Map<?, ?> resp) {
        if (resp == null) return List.of();
        Object items = resp.get("items");
        return items instanceof List ? (List<Map<String, Object>>) items : List.of();
    }

    private long parseLong(Object o) {
        if (o == null) return 0L;
        try {
            return Long.parseLong(o.toString());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
