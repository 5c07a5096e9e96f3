package uk.gegc.reelstudio.features.segment.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.reelstudio.features.segment.application.SegmentReconciliationService;

/**
 * Background poller for segments nobody is watching. Uses the same engine as request-driven polling,
 * so it can safely overlap with it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "reelstudio.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationScheduler {

    private final SegmentReconciliationService reconciliationService;

    @Scheduled(fixedDelayString = "${reelstudio.reconciliation.sweep-interval-ms:30000}")
    public void sweep() {
        log.debug("Running scheduled segment reconciliation");
        try {
            reconciliationService.sweep();
        } catch (Exception e) {
            log.error("Error during scheduled segment reconciliation", e);
        }
    }
}
