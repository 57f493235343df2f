package quest.gekko.pulse.service.store;

import quest.gekko.pulse.domain.Article;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to ingested articles.
 */
public interface ArticleStore {

    /** Articles published in {@code [start, end]}, newest first. */
    List<Article> queryByPublishedWindow(Instant start, Instant end, int limit);

    /** Articles ingested in {@code [start, end]}, newest first. */
    List<Article> queryByCreatedWindow(Instant start, Instant end, int limit);

    Optional<Article> getById(String id);

    /** Batched lookup; missing ids are skipped and order is not guaranteed. */
    List<Article> getByIds(Collection<String> ids);
}
