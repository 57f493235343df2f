package quest.gekko.pulse.service.learning;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.config.PulseProperties;
import quest.gekko.pulse.domain.Interest;
import quest.gekko.pulse.repository.InterestRepository;
import quest.gekko.pulse.service.integration.embedding.TextEmbedder;
import quest.gekko.pulse.util.VectorMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches an article against the interest catalog by embedding similarity plus lexical hints.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InterestMatcher {
    private static final Pattern WORD = Pattern.compile("[a-z0-9+#]+");
    private static final double TOKEN_HIT = 0.10;
    private static final double BOUNDARY_HIT = 0.10;

    private final InterestRepository interestRepository;
    private final TextEmbedder textEmbedder;
    private final Cache<String, float[]> interestEmbeddingCache;
    private final PulseProperties.Interests settings;

    public List<String> match(String title, String text) {
        List<Interest> interests = interestRepository.findAllByOrderBySortOrderAsc();
        if (interests.isEmpty()) return List.of();

        String doc = title == null ? "" : title;
        if (text != null && !text.isBlank()) doc += "\n" + text;
        String hay = doc.toLowerCase(Locale.ROOT);
        Set<String> tokens = new HashSet<>();
        Matcher m = WORD.matcher(hay);
        while (m.find()) tokens.add(m.group());

        double[] docVec = VectorMath.toDoubles(textEmbedder.embed(doc));

        List<Scored> scored = new ArrayList<>();
        for (Interest it : interests) {
            String name = it.getName() == null ? "" : it.getName().trim();
            if (name.isEmpty()) continue;
            String key = name.toLowerCase(Locale.ROOT);

            double boost = 0;
            if (tokens.contains(key)) boost += TOKEN_HIT;
            if (Pattern.compile("\\b" + Pattern.quote(key) + "\\b").matcher(hay).find()) boost += BOUNDARY_HIT;

            double cos = VectorMath.cosine(docVec, VectorMath.toDoubles(interestVector(it.getId(), name)));
            double score = (Double.isNaN(cos) ? 0 : Math.max(0, cos)) + boost;
            if (score >= settings.threshold()) scored.add(new Scored(it.getId(), score));
        }

        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        Set<String> ids = new LinkedHashSet<>();
        for (Scored s : scored) {
            if (ids.size() >= settings.maxMatches()) break;
            ids.add(s.id());
        }
        log.debug("Matched {} interests for '{}'", ids.size(), title);
        return new ArrayList<>(ids);
    }

    private float[] interestVector(String interestId, String name) {
        float[] cached = interestEmbeddingCache.getIfPresent(interestId);
        if (cached != null) return cached;
        float[] vec = textEmbedder.embed(name);
        // failed embeddings are retried on the next match
        if (vec.length > 0) interestEmbeddingCache.put(interestId, vec);
        return vec;
    }

    private record Scored(String id, double score) {}
}
