package quest.gekko.pulse.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.pulse.domain.Article;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface ArticleRepository extends JpaRepository<Article, String> {
    List<Article> findByPublishedAtGreaterThanEqualAndPublishedAtLessThanEqualOrderByPublishedAtDesc(
            final Instant start, final Instant end, final Pageable pageable);

    List<Article> findByCreatedAtGreaterThanEqualAndCreatedAtLessThanEqualOrderByCreatedAtDesc(
            final Instant start, final Instant end, final Pageable pageable);

    List<Article> findByIdIn(final Collection<String> ids);
}
