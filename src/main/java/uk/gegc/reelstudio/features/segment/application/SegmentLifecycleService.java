package uk.gegc.reelstudio.features.segment.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reelstudio.features.billing.application.LedgerService;
import uk.gegc.reelstudio.features.segment.domain.model.SegmentStatus;
import uk.gegc.reelstudio.features.segment.domain.repository.VideoSegmentRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Status changes that move money. Each public method is one transaction: the guarded status update and the
 * ledger call it triggers commit together or not at all. Provider calls never happen in here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentLifecycleService {

    private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final VideoSegmentRepository segmentRepository;
    private final LedgerService ledgerService;
    private final Clock clock;

    /**
     * Claims a pending segment for submission and reserves its cost. If the reservation is refused the claim
     * rolls back and the segment stays pending.
     *
     * @throws IllegalStateException if the segment is no longer pending
     */
    @Transactional
    public void claimForSubmission(UUID segmentId, UUID ownerId, long tokenCost) {
        int claimed = segmentRepository.claimPending(segmentId, tokenCost,
                SegmentStatus.PENDING, SegmentStatus.SUBMITTED, now());
        if (claimed == 0) {
            throw new IllegalStateException("Segment " + segmentId + " is not pending");
        }
        if (tokenCost > 0) {
            ledgerService.reserve(ownerId, tokenCost, segmentId.toString());
        }
        log.info("Segment {} claimed for submission at {} tokens", segmentId, tokenCost);
    }

    @Transactional
    public boolean recordProviderTask(UUID segmentId, String taskId) {
        int updated = segmentRepository.recordProviderTask(segmentId, taskId, now());
        if (updated == 0) {
            log.warn("Provider task {} could not be attached to segment {}; it was removed or already has a task",
                    taskId, segmentId);
            return false;
        }
        return true;
    }

    /**
     * Moves the segment to {@code target} if it is currently in one of the target's allowed predecessor
     * states, then settles the reservation once for terminal targets.
     *
     * @param ownerId owner to settle against; when {@code null} the transition is applied without settlement
     * @return {@code true} if this call performed the transition
     */
    @Transactional
    public boolean transition(UUID segmentId, UUID ownerId, SegmentStatus target, String resultUrl, String errorMessage) {
        LocalDateTime now = now();
        int won = segmentRepository.transitionStatus(
                segmentId,
                target.allowedPredecessors(),
                target,
                resultUrl,
                truncate(errorMessage),
                target.isTerminal() ? now : null,
                now);

        if (won == 0) {
            log.debug("Segment {} -> {} already applied by another caller or not allowed", segmentId, target);
            return false;
        }

        log.info("Segment {} moved to {}", segmentId, target);
        if (target.isTerminal()) {
            settle(segmentId, ownerId, target, errorMessage);
        }
        return true;
    }

    /**
     * Fails an in-flight segment (cancellation, submission error) and refunds its reservation if this call
     * won the move.
     */
    @Transactional
    public boolean failInFlight(UUID segmentId, UUID ownerId, String reason) {
        return transition(segmentId, ownerId, SegmentStatus.FAILED, null, reason);
    }

    private void settle(UUID segmentId, UUID ownerId, SegmentStatus target, String reason) {
        Long tokenCost = segmentRepository.findTokenCostById(segmentId).orElse(null);
        if (tokenCost == null || tokenCost <= 0) {
            log.debug("Segment {} carries no cost; nothing to settle", segmentId);
            return;
        }
        if (ownerId == null) {
            log.error("Segment {} reached {} but its owner could not be resolved; {} tokens left reserved",
                    segmentId, target, tokenCost);
            return;
        }

        String ref = segmentId.toString();
        if (target == SegmentStatus.DONE) {
            ledgerService.confirmDeduction(ownerId, tokenCost, ref);
        } else {
            ledgerService.refundReservation(ownerId, tokenCost, ref,
                    reason != null ? "Segment failed: " + reason : "Segment failed");
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH - 3) + "...";
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
