package quest.gekko.pulse.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.domain.HourSnapshot;
import quest.gekko.pulse.domain.Mood;
import quest.gekko.pulse.domain.MoodCentroid;
import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.domain.UserMood;
import quest.gekko.pulse.dto.PulseItemDTO;
import quest.gekko.pulse.dto.PulseTodayDTO;
import quest.gekko.pulse.dto.TimelineHourDTO;
import quest.gekko.pulse.exception.PulseException;
import quest.gekko.pulse.exception.StoreUnavailableException;
import quest.gekko.pulse.service.personal.MoodProfiles;
import quest.gekko.pulse.service.personal.PersonalizationOverlay;
import quest.gekko.pulse.service.personal.PersonalizationRequest;
import quest.gekko.pulse.service.personal.UserPreferences;
import quest.gekko.pulse.service.store.AffinityProfile;
import quest.gekko.pulse.service.store.AffinityStore;
import quest.gekko.pulse.service.store.ArticleStore;
import quest.gekko.pulse.service.store.SavedArticleLookup;
import quest.gekko.pulse.service.store.SnapshotStore;
import quest.gekko.pulse.util.TextTokens;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.random.RandomGenerator;
import java.util.stream.Stream;

/**
 * Read side of Pulse. Serves committed snapshots, backfilling a missing current hour from the
 * previous one during warmup or generating it (heuristics only) after the on-demand threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PulseReadService {
    static final int MIN_ON_DEMAND_TAKE = 12;

    private final SnapshotStore snapshotStore;
    private final PulseGenerationService generationService;
    private final PersonalizationOverlay personalizationOverlay;
    private final MoodProfiles moodProfiles;
    private final AffinityStore affinityStore;
    private final ArticleStore articleStore;
    private final SavedArticleLookup savedArticleLookup;
    private final UserPreferences userPreferences;
    private final PulseProperties.General general;
    private final PulseProperties.Read read;
    private final PulseProperties.Personal personal;
    private final Clock clock;
    private final RandomGenerator pulseRandom;

    /**
     * Top {@code take} items by heat. {@code date} null means today; past dates read their latest
     * non-empty hour.
     */
    public List<RankedItem> getGlobal(LocalDate date, int take) {
        ZonedDateTime now = now();
        if (date != null && !date.equals(now.toLocalDate())) {
            return topByHeat(latestNonEmpty(date, 24).map(HourSnapshot::items).orElse(List.of()), take);
        }
        return topByHeat(resolveToday(take).items(), take);
    }

    /**
     * Personal list for a user. {@code mood} and {@code blend} override the user's saved setting when given.
     */
    public List<RankedItem> getPersonal(String userId, String mood, Double blend, int take) {
        HourSnapshot current = resolveToday(take);
        return personalize(userId, mood, blend, take, current, topByHeat(current.items(), take));
    }

    public PulseTodayDTO getToday(String userId, String mood, Double blend, int take) {
        HourSnapshot current = resolveToday(take);
        List<RankedItem> global = topByHeat(current.items(), take);
        boolean signedIn = userId != null && !userId.isBlank();
        List<RankedItem> personalItems = signedIn ? personalize(userId, mood, blend, take, current, global) : List.of();

        Set<String> saved = signedIn
                ? savedArticleLookup.savedAmong(userId,
                        Stream.concat(global.stream(), personalItems.stream()).map(RankedItem::getArticleId).toList())
                : Set.of();

        List<TimelineHourDTO> timeline;
        try {
            timeline = snapshotStore.listHours(current.date()).stream()
                    .map(h -> new TimelineHourDTO(h.hour(), h.count(), h.updatedAt()))
                    .toList();
        } catch (StoreUnavailableException e) {
            log.warn("Timeline unavailable for {}: {}", current.date(), e.getMessage());
            timeline = List.of();
        }

        return new PulseTodayDTO(current.date(), current.hour(), current.updatedAt(),
                global.stream().map(it -> PulseItemDTO.from(it, saved.contains(it.getArticleId()))).toList(),
                personalItems.stream().map(it -> PulseItemDTO.from(it, saved.contains(it.getArticleId()))).toList(),
                timeline);
    }

    private List<RankedItem> personalize(String userId, String moodOverride, Double blendOverride, int take,
                                         HourSnapshot current, List<RankedItem> global) {
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");

        Optional<UserMood> saved = userPreferences.mood(userId);
        String rawMood = moodOverride != null && !moodOverride.isBlank()
                ? moodOverride
                : saved.map(UserMood::getMood).orElse(null);
        Mood mood = rawMood == null || rawMood.isBlank() ? null : Mood.normalize(rawMood);
        double blend = TextTokens.clamp(blendOverride != null
                ? blendOverride
                : saved.map(UserMood::getBlend).orElse(personal.defaultBlend()), 0, 1);

        int target = Math.max(3, Math.min(10, take - 5));
        List<RankedItem> pool = pool(current, moodProfiles.lookbackHours(mood, blend));
        if (pool.size() < target * 2) pool = current.items();
        if (pool.isEmpty()) return List.of();

        Set<String> exclude = new HashSet<>();
        global.forEach(it -> exclude.add(it.getArticleId()));

        AffinityProfile profile = AffinityProfile.empty();
        double[] userCentroid = null;
        double[] globalCentroid = null;
        Map<String, Article> articles = Map.of();
        if (mood != null) {
            try {
                profile = affinityStore.profile(userId, mood);
                userCentroid = affinityStore.findCentroid(MoodCentroid.userScopeId(userId, mood)).map(MoodCentroid::getVector).orElse(null);
                globalCentroid = affinityStore.findCentroid(MoodCentroid.globalScopeId(mood)).map(MoodCentroid::getVector).orElse(null);
                if (userCentroid != null || globalCentroid != null || !profile.isEmpty()) {
                    articles = new HashMap<>();
                    for (Article a : articleStore.getByIds(pool.stream().map(RankedItem::getArticleId).toList())) {
                        articles.put(a.getId(), a);
                    }
                }
            } catch (StoreUnavailableException e) {
                log.warn("Learned state unavailable for {}, personalizing without it: {}", userId, e.getMessage());
            }
        }

        PersonalizationRequest req = PersonalizationRequest.builder()
                .pool(pool)
                .excludeIds(exclude)
                .interests(userPreferences.interestNames(userId))
                .mood(mood)
                .blend(blend)
                .target(target)
                .profile(profile)
                .userCentroid(userCentroid)
                .globalCentroid(globalCentroid)
                .articles(articles)
                .now(clock.instant())
                .build();
        return personalizationOverlay.personalize(req, pulseRandom);
    }

    // newest hour first, first occurrence of an article wins
    private List<RankedItem> pool(HourSnapshot current, int lookbackHours) {
        Map<String, RankedItem> byId = new LinkedHashMap<>();
        current.items().forEach(it -> byId.putIfAbsent(it.getArticleId(), it));
        for (int h = current.hour() - 1; h > current.hour() - lookbackHours && h >= 0; h--) {
            safeGet(current.date(), h).ifPresent(s -> s.items().forEach(it -> byId.putIfAbsent(it.getArticleId(), it)));
        }
        return new ArrayList<>(byId.values());
    }

    /**
     * Snapshot to serve for today. Falls back to the latest earlier non-empty hour of the day when the
     * current hour is missing; after the on-demand threshold the hour is generated first.
     */
    HourSnapshot resolveToday(int take) {
        ZonedDateTime now = now();
        LocalDate date = now.toLocalDate();
        int hour = now.getHour();
        int minute = now.getMinute();

        Optional<HourSnapshot> current = safeGet(date, hour).filter(s -> !s.isEmpty());
        if (current.isPresent()) return current.get();

        if (minute >= read.clampedOnDemandAfterMinutes() && minute >= read.clampedWarmupMinutes()) {
            log.info("Snapshot {} {}:00 missing at minute {}, generating on demand", date, hour, minute);
            try {
                Optional<HourSnapshot> generated = generationService.generateHour(Math.max(take, MIN_ON_DEMAND_TAKE), true, true);
                current = generated.or(() -> safeGet(date, hour)).filter(s -> !s.isEmpty());
                if (current.isPresent()) return current.get();
            } catch (PulseException e) {
                log.warn("On-demand generation for {} {}:00 failed, serving the last good hour: {}", date, hour, e.getMessage());
            }
        }

        return latestNonEmpty(date, hour)
                .orElseGet(() -> HourSnapshot.empty(date, hour, null));
    }

    private Optional<HourSnapshot> latestNonEmpty(LocalDate date, int beforeHour) {
        List<SnapshotStore.HourSummary> hours;
        try {
            hours = snapshotStore.listHours(date);
        } catch (StoreUnavailableException e) {
            log.warn("Snapshot hours unavailable for {}: {}", date, e.getMessage());
            return Optional.empty();
        }
        return hours.stream()
                .filter(h -> h.hour() < beforeHour && h.count() > 0)
                .sorted(Comparator.comparingInt(SnapshotStore.HourSummary::hour).reversed())
                .map(h -> safeGet(date, h.hour()))
                .flatMap(Optional::stream)
                .filter(s -> !s.isEmpty())
                .findFirst();
    }

    private Optional<HourSnapshot> safeGet(LocalDate date, int hour) {
        try {
            return snapshotStore.get(date, hour);
        } catch (StoreUnavailableException e) {
            log.warn("Snapshot {} {}:00 unavailable: {}", date, hour, e.getMessage());
            return Optional.empty();
        }
    }

    private ZonedDateTime now() {
        return clock.instant().atZone(general.zone());
    }

    static List<RankedItem> topByHeat(List<RankedItem> items, int take) {
        return items.stream()
                .sorted(Comparator.comparingDouble(RankedItem::getHeat).reversed())
                .limit(Math.max(0, take))
                .toList();
    }
}
