package quest.gekko.pulse.service.personal;

import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.service.core.TopicBuckets;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Softmax sampling without replacement over the best personal scores, under per-source and
 * per-bucket caps, followed by a bucket diversity pass and a plain fill up to {@code k}.
 */
public final class WeightedSampler {
    static final double TEMPERATURE = 0.9;

    private WeightedSampler() {}

    public record Weighted(RankedItem item, double score, List<String> reasons) {
        String source() {
            String s = item.getSourceId();
            return s == null || s.isBlank() ? "source" : s.toLowerCase(Locale.ROOT);
        }

        String bucket() {
            return TopicBuckets.bucketOf(item.getTopics());
        }
    }

    public static List<Weighted> sample(List<Weighted> scored, int k, int perSourceCap, int perBucketCap,
                                        int minBuckets, RandomGenerator rng) {
        if (k <= 0 || scored.isEmpty()) return List.of();
        List<Weighted> pool = scored.stream()
                .sorted(Comparator.comparingDouble(Weighted::score).reversed())
                .limit(Math.max(k * 4L, 24))
                .toList();

        Selection sel = new Selection(perSourceCap, perBucketCap);

        double max = pool.get(0).score();
        List<Integer> active = new ArrayList<>(pool.size());
        double[] weights = new double[pool.size()];
        for (int i = 0; i < pool.size(); i++) {
            weights[i] = Math.exp((pool.get(i).score() - max) / TEMPERATURE);
            active.add(i);
        }

        while (sel.size() < k && !active.isEmpty()) {
            double total = 0;
            for (int idx : active) total += weights[idx];
            if (total <= 1e-12) break;

            double r = rng.nextDouble() * total;
            int pick = active.size() - 1;
            double cum = 0;
            for (int a = 0; a < active.size(); a++) {
                cum += weights[active.get(a)];
                if (r <= cum) {
                    pick = a;
                    break;
                }
            }
            Weighted cand = pool.get(active.remove(pick));
            if (sel.fits(cand)) sel.add(cand);
        }

        diversify(pool, sel, k, minBuckets);

        for (Weighted cand : pool) {
            if (sel.size() >= k) break;
            if (!sel.contains(cand)) sel.add(cand);
        }
        return sel.chosen;
    }

    // brings in unseen buckets, swapping out the weakest item of a repeated bucket once full
    private static void diversify(List<Weighted> pool, Selection sel, int k, int minBuckets) {
        for (Weighted cand : pool) {
            if (sel.distinctBuckets() >= minBuckets) return;
            if (sel.contains(cand) || sel.hasBucket(cand.bucket())) continue;
            if (sel.size() < k) {
                if (sel.fitsSource(cand, null)) sel.add(cand);
                continue;
            }
            Weighted victim = sel.weakestInRepeatedBucket();
            if (victim == null) return;
            if (!sel.fitsSource(cand, victim)) continue;
            sel.remove(victim);
            sel.add(cand);
        }
    }

    private static final class Selection {
        private final int perSourceCap;
        private final int perBucketCap;
        private final List<Weighted> chosen = new ArrayList<>();
        private final Set<String> ids = new HashSet<>();
        private final Map<String, Integer> bySource = new HashMap<>();
        private final Map<String, Integer> byBucket = new HashMap<>();

        Selection(int perSourceCap, int perBucketCap) {
            this.perSourceCap = perSourceCap;
            this.perBucketCap = perBucketCap;
        }

        int size() {
            return chosen.size();
        }

        boolean contains(Weighted w) {
            return ids.contains(w.item().getArticleId());
        }

        boolean fits(Weighted w) {
            return !contains(w)
                    && bySource.getOrDefault(w.source(), 0) < perSourceCap
                    && byBucket.getOrDefault(w.bucket(), 0) < perBucketCap;
        }

        boolean fitsSource(Weighted w, Weighted leaving) {
            int count = bySource.getOrDefault(w.source(), 0);
            if (leaving != null && leaving.source().equals(w.source())) count--;
            return count < perSourceCap;
        }

        boolean hasBucket(String bucket) {
            return byBucket.getOrDefault(bucket, 0) > 0;
        }

        int distinctBuckets() {
            return (int) byBucket.values().stream().filter(c -> c > 0).count();
        }

        Weighted weakestInRepeatedBucket() {
            Weighted weakest = null;
            for (Weighted w : chosen) {
                if (byBucket.getOrDefault(w.bucket(), 0) < 2) continue;
                if (weakest == null || w.score() < weakest.score()) weakest = w;
            }
            return weakest;
        }

        void add(Weighted w) {
            chosen.add(w);
            ids.add(w.item().getArticleId());
            bySource.merge(w.source(), 1, Integer::sum);
            byBucket.merge(w.bucket(), 1, Integer::sum);
        }

        void remove(Weighted w) {
            chosen.remove(w);
            ids.remove(w.item().getArticleId());
            bySource.merge(w.source(), -1, Integer::sum);
            byBucket.merge(w.bucket(), -1, Integer::sum);
        }
    }
}
