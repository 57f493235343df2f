package quest.gekko.pulse.service.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.domain.UserSave;
import quest.gekko.pulse.repository.UserSaveRepository;
import quest.gekko.pulse.util.ChunkedLookup;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class SavedArticleLookup {
    private final UserSaveRepository userSaveRepository;
    private final ChunkedLookup chunkedLookup;

    /** Ids among {@code articleIds} that the user has saved. Lookup failures read as nothing saved. */
    public Set<String> savedAmong(String userId, Collection<String> articleIds) {
        if (userId == null || userId.isBlank() || articleIds == null || articleIds.isEmpty()) return Set.of();
        try {
            Set<String> out = new HashSet<>();
            for (UserSave s : chunkedLookup.fetch(articleIds, chunk -> userSaveRepository.findByUserIdAndArticleIdIn(userId, chunk))) {
                out.add(s.getArticleId());
            }
            return out;
        } catch (DataAccessException e) {
            log.warn("Saved lookup failed for user {}: {}", userId, e.getMessage());
            return Set.of();
        }
    }
}
