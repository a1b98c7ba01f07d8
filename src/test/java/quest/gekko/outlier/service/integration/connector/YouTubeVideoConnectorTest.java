package quest.gekko.outlier.service.integration.connector;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.util.RateLimiter;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class YouTubeVideoConnectorTest {

    private final TrackerProperties.YouTube props =
            new TrackerProperties.YouTube("key", "https://example.test", 3, 1, 2, 2, Duration.ofMillis(1));

    @Test
    void testFetchStatistics_MapsCountsAndHiddenFields() {
        // Given
        List<ClientRequest> requests = new ArrayList<>();
        WebClient client = WebClient.builder()
                .baseUrl(props.baseUrl())
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(json(HttpStatus.OK, """
                        {"items": [
                          {"id": "a", "statistics": {"viewCount": "1200", "likeCount": "40", "commentCount": "3"}},
                          {"id": "b", "statistics": {"viewCount": "77"}}
                        ]}
                        """));
                })
                .build();
        YouTubeVideoConnector connector = new YouTubeVideoConnector(client, new RateLimiter(props), props);

        // When
        Map<String, VideoStatistics> stats = connector.fetchStatistics(List.of("a", "b", "gone"));

        // Then
        assertEquals(2, stats.size());
        assertEquals(new VideoStatistics("a", 1200, 40L, 3L), stats.get("a"));
        assertNull(stats.get("b").likeCount());
        assertFalse(stats.containsKey("gone"));
        assertEquals(1, requests.size());
        assertEquals("/youtube/v3/videos", requests.get(0).url().getPath());
        assertTrue(requests.get(0).url().getQuery().contains("id=a,b,gone"));
    }

    @Test
    void testFetchStatistics_ServerErrorRetriedThenWrapped() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        WebClient client = WebClient.builder()
                .baseUrl(props.baseUrl())
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    return Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));
                })
                .build();
        YouTubeVideoConnector connector = new YouTubeVideoConnector(client, new RateLimiter(props), props);

        // When / Then
        assertThrows(VideoMetadataException.class, () -> connector.fetchStatistics(List.of("a")));
        assertEquals(2, calls.get());
    }

    @Test
    void testFetchStatistics_TooManyIdsRejected() {
        YouTubeVideoConnector connector = new YouTubeVideoConnector(WebClient.create(), new RateLimiter(props), props);

        assertThrows(IllegalArgumentException.class,
                () -> connector.fetchStatistics(List.of("a", "b", "c", "d")));
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
