package quest.gekko.pulse.service.store;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.domain.Article;
import quest.gekko.pulse.exception.StoreUnavailableException;
import quest.gekko.pulse.repository.ArticleRepository;
import quest.gekko.pulse.util.ChunkedLookup;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaArticleStore implements ArticleStore {
    private final ArticleRepository articleRepository;
    private final ChunkedLookup chunkedLookup;

    @Override
    public List<Article> queryByPublishedWindow(Instant start, Instant end, int limit) {
        try {
            return articleRepository.findByPublishedAtGreaterThanEqualAndPublishedAtLessThanEqualOrderByPublishedAtDesc(
                    start, end, PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Article query by publish time failed", e);
        }
    }

    @Override
    public List<Article> queryByCreatedWindow(Instant start, Instant end, int limit) {
        try {
            return articleRepository.findByCreatedAtGreaterThanEqualAndCreatedAtLessThanEqualOrderByCreatedAtDesc(
                    start, end, PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Article query by ingestion time failed", e);
        }
    }

    @Override
    public Optional<Article> getById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        try {
            return articleRepository.findById(id);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Article lookup failed for " + id, e);
        }
    }

    @Override
    public List<Article> getByIds(Collection<String> ids) {
        try {
            return chunkedLookup.fetch(ids, articleRepository::findByIdIn);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Batched article lookup failed", e);
        }
    }
}
