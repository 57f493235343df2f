package quest.gekko.pulse.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableCaching
public class CacheConfig {
    public static final String SNAPSHOTS = "snapshots";
    public static final String SNAPSHOT_HOURS = "snapshotHours";

    // snapshots are replaced at most hourly and evicted on write
    @Bean
    public Caffeine<Object, Object> caffeine() {
        return Caffeine.newBuilder().maximumSize(500).expireAfterWrite(Duration.ofMinutes(15));
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(SNAPSHOTS, SNAPSHOT_HOURS);
        cacheManager.setCaffeine(caffeine);
        return cacheManager;
    }

    @Bean
    public Cache<String, float[]> interestEmbeddingCache(final PulseProperties.Interests interests) {
        return Caffeine.newBuilder().maximumSize(interests.cacheSize()).build();
    }
}
