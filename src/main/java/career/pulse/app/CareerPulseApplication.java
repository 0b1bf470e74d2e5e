package career.pulse.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.PropertySource;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@EnableScheduling
@PropertySource(value = "file:./secrets.properties", ignoreResourceNotFound = true)
@SpringBootApplication
public class CareerPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareerPulseApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
