package quest.gekko.pulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PulseApplication {

    public static void main(final String[] args) {
        SpringApplication.run(PulseApplication.class, args);
    }
}
