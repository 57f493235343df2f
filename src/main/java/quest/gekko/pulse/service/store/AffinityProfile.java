package quest.gekko.pulse.service.store;

import quest.gekko.pulse.domain.FeatureAffinity;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * The learned feature scores of one user in one mood, indexed by type then key.
 */
public final class AffinityProfile {
    private static final AffinityProfile EMPTY = new AffinityProfile(Map.of());

    private final Map<String, Map<String, Double>> byType;

    private AffinityProfile(Map<String, Map<String, Double>> byType) {
        this.byType = byType;
    }

    public static AffinityProfile empty() {
        return EMPTY;
    }

    public static AffinityProfile of(Collection<FeatureAffinity> affinities) {
        if (affinities == null || affinities.isEmpty()) return EMPTY;
        Map<String, Map<String, Double>> map = new HashMap<>();
        for (FeatureAffinity a : affinities) {
            if (a.getFeatureType() == null || a.getFeatureKey() == null) continue;
            map.computeIfAbsent(a.getFeatureType(), t -> new HashMap<>()).put(a.getFeatureKey(), a.getScore());
        }
        return new AffinityProfile(map);
    }

    public double lookup(String type, String key) {
        Map<String, Double> m = byType.get(type);
        if (m == null) return 0.0;
        return m.getOrDefault(key, 0.0);
    }

    public boolean isEmpty() {
        return byType.isEmpty();
    }
}
