package quest.gekko.outlier.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // day boundaries, quota rows and the sampling cursor are all UTC
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
