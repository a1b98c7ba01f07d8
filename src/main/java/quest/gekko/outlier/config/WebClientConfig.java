package quest.gekko.outlier.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient youTubeWebClient(final WebClient.Builder builder, final TrackerProperties.YouTube youTube) {
        return builder.baseUrl(youTube.baseUrl()).build();
    }
}
