package quest.gekko.pulse.service.personal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.domain.UserInterest;
import quest.gekko.pulse.domain.UserMood;
import quest.gekko.pulse.repository.UserInterestRepository;
import quest.gekko.pulse.repository.UserMoodRepository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of a user's saved mood and interests. Lookup failures read as "not set".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserPreferences {
    private final UserMoodRepository userMoodRepository;
    private final UserInterestRepository userInterestRepository;

    public Optional<UserMood> mood(String userId) {
        try {
            return userMoodRepository.findById(userId);
        } catch (DataAccessException e) {
            log.warn("Mood lookup failed for {}: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    public List<String> interestNames(String userId) {
        try {
            return userInterestRepository.findByUserId(userId).stream()
                    .map(UserInterest::getName)
                    .filter(Objects::nonNull)
                    .toList();
        } catch (DataAccessException e) {
            log.warn("Interest lookup failed for {}: {}", userId, e.getMessage());
            return List.of();
        }
    }
}
