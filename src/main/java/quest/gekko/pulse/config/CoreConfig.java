package quest.gekko.pulse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.random.RandomGenerator;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // shared by concurrent reads
    @Bean
    public RandomGenerator pulseRandom() {
        return new Random();
    }
}
