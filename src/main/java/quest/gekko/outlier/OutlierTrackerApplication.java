package quest.gekko.outlier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OutlierTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OutlierTrackerApplication.class, args);
    }

}
