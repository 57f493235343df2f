package quest.gekko.pulse.service.core;

import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.domain.Trend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Labels each item by comparing its 1-indexed rank with its rank in the previous hour.
 */
public final class TrendTracker {
    static final int MOVE_THRESHOLD = 3;

    private TrendTracker() {}

    public static List<RankedItem> label(List<RankedItem> current, List<RankedItem> previous) {
        Map<String, Integer> prevRank = new HashMap<>();
        if (previous != null) {
            for (int i = 0; i < previous.size(); i++) {
                prevRank.putIfAbsent(previous.get(i).getArticleId(), i + 1);
            }
        }
        List<RankedItem> out = new ArrayList<>(current.size());
        for (int i = 0; i < current.size(); i++) {
            RankedItem it = current.get(i);
            out.add(it.toBuilder().trend(trendOf(prevRank.get(it.getArticleId()), i + 1)).build());
        }
        return out;
    }

    static Trend trendOf(Integer previousRank, int rank) {
        if (previousRank == null) return Trend.NEW;
        int delta = previousRank - rank;
        if (delta >= MOVE_THRESHOLD) return Trend.UP;
        if (delta <= -MOVE_THRESHOLD) return Trend.DOWN;
        return Trend.STEADY;
    }
}
