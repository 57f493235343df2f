package quest.gekko.pulse.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.pulse.exception.PulseException;
import quest.gekko.pulse.service.core.PulseGenerationService;

import java.util.concurrent.CancellationException;

@Slf4j
@Service
@RequiredArgsConstructor
public class PulseScheduler {
    private final PulseGenerationService generationService;

    // top of every hour, local time of the configured zone
    @Scheduled(cron = "${pulse.schedule.cron:0 0 * * * *}", zone = "${pulse.timezone:America/New_York}")
    public void runHourlySnapshot() {
        try {
            generationService.generateScheduled();
        } catch (CancellationException e) {
            log.info("Pulse cycle cancelled");
        } catch (PulseException e) {
            log.error("❌ Pulse cycle failed: {}", e.getMessage(), e);
        }
    }
}
