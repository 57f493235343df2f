package quest.gekko.pulse.service.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Greedy top-N selection under per-source and per-bucket caps. Items must arrive in descending
 * score order. A primary pass admits an item only while both caps hold; a secondary pass fills
 * any remaining room in score order, ignoring the caps.
 */
public final class DiversitySelector {

    private DiversitySelector() {}

    public static <T> List<T> select(List<T> ordered, int target, int perSourceCap, int perBucketCap,
                                     Function<T, String> source, Function<T, String> bucket) {
        List<T> chosen = new ArrayList<>(Math.min(target, ordered.size()));
        if (target <= 0) return chosen;
        Set<T> taken = Collections.newSetFromMap(new IdentityHashMap<>());
        Map<String, Integer> bySource = new HashMap<>();
        Map<String, Integer> byBucket = new HashMap<>();

        for (T item : ordered) {
            if (chosen.size() >= target) break;
            String s = key(source.apply(item), "source");
            String b = key(bucket.apply(item), TopicBuckets.MISC);
            if (bySource.getOrDefault(s, 0) >= perSourceCap) continue;
            if (byBucket.getOrDefault(b, 0) >= perBucketCap) continue;
            chosen.add(item);
            taken.add(item);
            bySource.merge(s, 1, Integer::sum);
            byBucket.merge(b, 1, Integer::sum);
        }

        for (T item : ordered) {
            if (chosen.size() >= target) break;
            if (taken.add(item)) chosen.add(item);
        }
        return chosen;
    }

    private static String key(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.toLowerCase(Locale.ROOT);
    }
}
