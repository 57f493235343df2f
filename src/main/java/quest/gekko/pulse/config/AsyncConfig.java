package quest.gekko.pulse.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import quest.gekko.pulse.util.ChunkedLookup;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "lookupExecutor")
    public ThreadPoolTaskExecutor lookupExecutor(final PulseProperties.Lookup lookup) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, lookup.threads()));
        executor.setMaxPoolSize(Math.max(1, lookup.threads()));
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("lookup-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "feedbackExecutor")
    public ThreadPoolTaskExecutor feedbackExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("feedback-");
        executor.initialize();
        return executor;
    }

    @Bean
    public ChunkedLookup chunkedLookup(@Qualifier("lookupExecutor") final ThreadPoolTaskExecutor lookupExecutor,
                                        final PulseProperties.Lookup lookup) {
        return new ChunkedLookup(lookupExecutor, lookup.chunkSize());
    }
}
