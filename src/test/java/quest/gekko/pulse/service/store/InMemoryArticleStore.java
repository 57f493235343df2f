package quest.gekko.pulse.service.store;

import quest.gekko.pulse.domain.Article;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

public class InMemoryArticleStore implements ArticleStore {
    private final Map<String, Article> articles = new LinkedHashMap<>();

    public InMemoryArticleStore add(Article... as) {
        for (Article a : as) articles.put(a.getId(), a);
        return this;
    }

    @Override
    public List<Article> queryByPublishedWindow(Instant start, Instant end, int limit) {
        return window(Article::getPublishedAt, start, end, limit);
    }

    @Override
    public List<Article> queryByCreatedWindow(Instant start, Instant end, int limit) {
        return window(Article::getCreatedAt, start, end, limit);
    }

    @Override
    public Optional<Article> getById(String id) {
        return Optional.ofNullable(articles.get(id));
    }

    @Override
    public List<Article> getByIds(Collection<String> ids) {
        return ids.stream().distinct().map(articles::get).filter(Objects::nonNull).toList();
    }

    private List<Article> window(Function<Article, Instant> time, Instant start, Instant end, int limit) {
        return articles.values().stream()
                .filter(a -> time.apply(a) != null && !time.apply(a).isBefore(start) && !time.apply(a).isAfter(end))
                .sorted(Comparator.comparing(time).reversed())
                .limit(limit)
                .toList();
    }
}
