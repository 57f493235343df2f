package quest.gekko.pulse.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.domain.HourSnapshot;
import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.service.store.SnapshotStore;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Builds the Global snapshot for the current local hour: candidate pool, heuristic scores,
 * optional oracle rerank, diversity caps and trend labels. One cycle runs at a time.
 */
@Slf4j
@Service
public class PulseGenerationService {
    private final CandidatePoolBuilder candidatePoolBuilder;
    private final ImportanceScorer importanceScorer;
    private final RerankerAdapter rerankerAdapter;
    private final SnapshotStore snapshotStore;
    private final PulseProperties.General general;
    private final PulseProperties.Snapshot snapshot;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();

    public PulseGenerationService(CandidatePoolBuilder candidatePoolBuilder,
                                  ImportanceScorer importanceScorer,
                                  RerankerAdapter rerankerAdapter,
                                  SnapshotStore snapshotStore,
                                  PulseProperties.General general,
                                  PulseProperties.Snapshot snapshot,
                                  Clock clock) {
        this.candidatePoolBuilder = candidatePoolBuilder;
        this.importanceScorer = importanceScorer;
        this.rerankerAdapter = rerankerAdapter;
        this.snapshotStore = snapshotStore;
        this.general = general;
        this.snapshot = snapshot;
        this.clock = clock;
    }

    /**
     * Scheduled cycle. Skipped when another cycle holds the lock.
     */
    public Optional<HourSnapshot> generateScheduled() {
        if (!cycleLock.tryLock()) {
            log.info("⏭️ Pulse cycle already running, skipping scheduled run");
            return Optional.empty();
        }
        try {
            return generateLocked(general.clampedTake(), false, false);
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Runs a cycle, waiting for any cycle in progress. Returns empty when {@code onlyIfMissing} is set
     * and the hour already exists.
     */
    public Optional<HourSnapshot> generateHour(int take, boolean heuristicsOnly, boolean onlyIfMissing) {
        cycleLock.lock();
        try {
            return generateLocked(take, heuristicsOnly, onlyIfMissing);
        } finally {
            cycleLock.unlock();
        }
    }

    private Optional<HourSnapshot> generateLocked(int take, boolean heuristicsOnly, boolean onlyIfMissing) {
        Instant now = clock.instant();
        ZonedDateTime local = now.atZone(general.zone());
        LocalDate date = local.toLocalDate();
        int hour = local.getHour();

        if (onlyIfMissing && snapshotStore.exists(date, hour)) {
            log.debug("Snapshot {} {}:00 already present", date, hour);
            return Optional.empty();
        }

        Instant start = date.atStartOfDay(general.zone()).toInstant();
        List<CandidateCluster> clusters = candidatePoolBuilder.build(start, now);
        if (clusters.isEmpty()) {
            log.info("No candidates for {} {}:00, writing empty snapshot", date, hour);
            HourSnapshot empty = HourSnapshot.empty(date, hour, now);
            snapshotStore.set(empty);
            return Optional.of(empty);
        }

        List<ScoredCandidate> scored = clusters.stream().map(c -> importanceScorer.score(c, now)).toList();
        List<RankedItem> ranked = rerankerAdapter.rank(scored, take, heuristicsOnly).stream()
                .map(it -> it.toBuilder()
                        .topics(TopicBuckets.resolve(it.getTopics(), it.getTitle(), it.getSummary()))
                        .build())
                .sorted(Comparator.comparingDouble(RankedItem::getHeat).reversed())
                .toList();

        List<RankedItem> diversified = DiversitySelector.select(ranked, snapshot.clampedStoreCount(),
                snapshot.clampedPerSourceCap(), snapshot.clampedPerBucketCap(),
                RankedItem::getSourceId, it -> TopicBuckets.bucketOf(it.getTopics()));

        // the first hour of a day starts with no prior ranks
        List<RankedItem> previous = hour == 0 ? List.of() : snapshotStore.get(date, hour - 1)
                .map(HourSnapshot::items)
                .orElse(List.of());
        HourSnapshot result = new HourSnapshot(date, hour, now, TrendTracker.label(diversified, previous));
        snapshotStore.set(result);
        log.info("📈 Pulse {} {}:00 written: {} items from {} clusters{}", date, hour, result.items().size(),
                clusters.size(), heuristicsOnly ? " (heuristics only)" : "");
        return Optional.of(result);
    }
}
