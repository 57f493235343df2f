package quest.gekko.pulse.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.cache.annotation.Caching;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.pulse.config.CacheConfig;
import quest.gekko.pulse.domain.HourSnapshot;
import quest.gekko.pulse.domain.PulseSnapshot;
import quest.gekko.pulse.domain.RankedItem;
import quest.gekko.pulse.exception.StoreUnavailableException;
import quest.gekko.pulse.repository.PulseSnapshotRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaSnapshotStore implements SnapshotStore {
    private static final TypeReference<List<RankedItem>> ITEMS = new TypeReference<>() {};

    private final PulseSnapshotRepository snapshotRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    @Cacheable(value = CacheConfig.SNAPSHOTS, key = "#date.toString() + ':' + #hour")
    public Optional<HourSnapshot> get(LocalDate date, int hour) {
        try {
            return snapshotRepository.findBySnapshotDateAndSnapshotHour(date, hour).map(this::toSnapshot);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Snapshot read failed for " + date + " " + hour + ":00", e);
        }
    }

    @Override
    @Transactional
    @Caching(evict = {
            @CacheEvict(value = CacheConfig.SNAPSHOTS, key = "#snapshot.date().toString() + ':' + #snapshot.hour()"),
            @CacheEvict(value = CacheConfig.SNAPSHOT_HOURS, key = "#snapshot.date().toString()")
    })
    public void set(HourSnapshot snapshot) {
        try {
            PulseSnapshot row = snapshotRepository
                    .findBySnapshotDateAndSnapshotHour(snapshot.date(), snapshot.hour())
                    .orElseGet(PulseSnapshot::new);
            row.setSnapshotDate(snapshot.date());
            row.setSnapshotHour(snapshot.hour());
            row.setUpdatedAt(snapshot.updatedAt());
            row.setItemCount(snapshot.items().size());
            row.setItemsJson(objectMapper.writeValueAsString(snapshot.items()));
            snapshotRepository.save(row);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Snapshot could not be serialized for " + snapshot.date(), e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Snapshot write failed for " + snapshot.date() + " " + snapshot.hour() + ":00", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(LocalDate date, int hour) {
        try {
            return snapshotRepository.existsBySnapshotDateAndSnapshotHour(date, hour);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Snapshot lookup failed for " + date, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    @Cacheable(value = CacheConfig.SNAPSHOT_HOURS, key = "#date.toString()")
    public List<HourSummary> listHours(LocalDate date) {
        try {
            return snapshotRepository.findBySnapshotDateOrderBySnapshotHourAsc(date).stream()
                    .map(s -> new HourSummary(s.getSnapshotHour(), s.getItemCount(), s.getUpdatedAt()))
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Snapshot hours lookup failed for " + date, e);
        }
    }

    private HourSnapshot toSnapshot(PulseSnapshot row) {
        List<RankedItem> items = List.of();
        if (row.getItemsJson() != null && !row.getItemsJson().isBlank()) {
            try {
                items = objectMapper.readValue(row.getItemsJson(), ITEMS);
            } catch (JsonProcessingException e) {
                // a corrupt document reads as an empty hour
                log.warn("Snapshot {} {}:00 has unreadable items: {}", row.getSnapshotDate(), row.getSnapshotHour(), e.getMessage());
            }
        }
        return new HourSnapshot(row.getSnapshotDate(), row.getSnapshotHour(), row.getUpdatedAt(), items);
    }
}
