package uk.gegc.reelstudio.features.segment.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import uk.gegc.reelstudio.features.provider.application.ProviderTaskStatus;
import uk.gegc.reelstudio.features.provider.application.VideoGenerationProvider;
import uk.gegc.reelstudio.features.provider.domain.exception.ProviderException;
import uk.gegc.reelstudio.features.provider.domain.model.ProviderTaskState;
import uk.gegc.reelstudio.features.segment.application.ReconciliationProperties;
import uk.gegc.reelstudio.features.segment.application.ReconciliationResult;
import uk.gegc.reelstudio.features.segment.application.SegmentLifecycleService;
import uk.gegc.reelstudio.features.segment.application.SegmentReconciliationService;
import uk.gegc.reelstudio.features.segment.domain.model.SegmentStatus;
import uk.gegc.reelstudio.features.segment.domain.model.VideoSegment;
import uk.gegc.reelstudio.features.segment.domain.repository.VideoSegmentRepository;
import uk.gegc.reelstudio.features.work.application.WorkAccessService;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Not transactional: provider calls run with no transaction open, and each
 * won transition commits on its own through {@link SegmentLifecycleService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentReconciliationServiceImpl implements SegmentReconciliationService {

    private final VideoSegmentRepository segmentRepository;
    private final VideoGenerationProvider provider;
    private final SegmentLifecycleService lifecycleService;
    private final WorkAccessService workAccessService;
    private final ReconciliationProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public ReconciliationResult reconcile(Collection<VideoSegment> segments) {
        Map<UUID, Optional<UUID>> ownersByWork = new HashMap<>();
        int polled = 0;
        int transitioned = 0;
        int superseded = 0;
        int failed = 0;

        for (VideoSegment segment : segments) {
            if (!segment.isPollable()) {
                continue;
            }
            polled++;
            try {
                ProviderTaskStatus reported = provider.queryStatus(segment.getModel(), segment.getProviderTaskId());
                SegmentStatus target = toSegmentStatus(reported.state());

                if (target == segment.getStatus()) {
                    continue;
                }
                if (!target.allowedPredecessors().contains(segment.getStatus())) {
                    log.debug("Ignoring backwards report {} for segment {} in {}", target, segment.getId(), segment.getStatus());
                    continue;
                }

                UUID ownerId = ownersByWork
                        .computeIfAbsent(segment.getWorkId(), workAccessService::findOwner)
                        .orElse(null);
                boolean won = lifecycleService.transition(
                        segment.getId(), ownerId, target, reported.resultUrl(), reported.errorMessage());
                if (won) {
                    transitioned++;
                    count("transitioned", target);
                } else {
                    superseded++;
                    count("superseded", target);
                }
            } catch (ProviderException e) {
                failed++;
                count("provider_error", segment.getStatus());
                log.warn("Provider poll for segment {} (task {}) failed, will retry: {}",
                        segment.getId(), segment.getProviderTaskId(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                count("error", segment.getStatus());
                log.error("Reconciliation of segment {} failed, will retry", segment.getId(), e);
            }
        }

        ReconciliationResult result = new ReconciliationResult(polled, transitioned, superseded, failed);
        if (polled > 0) {
            log.debug("Reconciliation pass: {}", result);
        }
        return result;
    }

    @Override
    public ReconciliationResult sweep() {
        List<VideoSegment> candidates = segmentRepository.findPollable(
                SegmentStatus.IN_FLIGHT, PageRequest.of(0, properties.getBatchSize()));
        if (candidates.isEmpty()) {
            return ReconciliationResult.EMPTY;
        }
        ReconciliationResult result = reconcile(candidates);
        log.info("Reconciliation sweep polled {} segments: {} transitioned, {} superseded, {} failed",
                result.polled(), result.transitioned(), result.superseded(), result.failed());
        return result;
    }

    static SegmentStatus toSegmentStatus(ProviderTaskState state) {
        return switch (state) {
            case QUEUED -> SegmentStatus.SUBMITTED;
            case RUNNING -> SegmentStatus.GENERATING;
            case SUCCEEDED -> SegmentStatus.DONE;
            case FAILED -> SegmentStatus.FAILED;
        };
    }

    private void count(String outcome, SegmentStatus status) {
        meterRegistry.counter("segments.reconciliation", "outcome", outcome, "status", status.name()).increment();
    }
}
