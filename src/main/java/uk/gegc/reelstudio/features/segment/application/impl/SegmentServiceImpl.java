package uk.gegc.reelstudio.features.segment.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.reelstudio.features.billing.application.EstimationService;
import uk.gegc.reelstudio.features.billing.application.LedgerService;
import uk.gegc.reelstudio.features.billing.domain.exception.InsufficientTokensException;
import uk.gegc.reelstudio.features.provider.application.ProviderSubmission;
import uk.gegc.reelstudio.features.provider.application.VideoGenerationProvider;
import uk.gegc.reelstudio.features.provider.domain.exception.ProviderException;
import uk.gegc.reelstudio.features.segment.api.dto.CreateSegmentRequest;
import uk.gegc.reelstudio.features.segment.api.dto.PlannedSegment;
import uk.gegc.reelstudio.features.segment.api.dto.PositionAssignment;
import uk.gegc.reelstudio.features.segment.api.dto.ReplacePlanRequest;
import uk.gegc.reelstudio.features.segment.api.dto.ReplacePlanResult;
import uk.gegc.reelstudio.features.segment.api.dto.ResetScopeResult;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentBatchRequest;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentBatchResult;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentDto;
import uk.gegc.reelstudio.features.segment.api.dto.UpdateSegmentRequest;
import uk.gegc.reelstudio.features.segment.application.SegmentLifecycleService;
import uk.gegc.reelstudio.features.segment.application.SegmentReconciliationService;
import uk.gegc.reelstudio.features.segment.application.SegmentService;
import uk.gegc.reelstudio.features.segment.application.SequenceReindexer;
import uk.gegc.reelstudio.features.segment.domain.model.SegmentStatus;
import uk.gegc.reelstudio.features.segment.domain.model.VideoSegment;
import uk.gegc.reelstudio.features.segment.domain.repository.VideoSegmentRepository;
import uk.gegc.reelstudio.features.segment.infra.mapping.SegmentMapper;
import uk.gegc.reelstudio.features.work.application.WorkAccessService;
import uk.gegc.reelstudio.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
public class SegmentServiceImpl implements SegmentService {

    /**
     * Statuses in which a segment holds no reservation and can be removed directly.
     */
    private static final Set<SegmentStatus> SETTLED = EnumSet.of(
            SegmentStatus.PENDING, SegmentStatus.DONE, SegmentStatus.FAILED);

    private static final String CANCELLED = "Cancelled";

    private final VideoSegmentRepository segmentRepository;
    private final SegmentMapper segmentMapper;
    private final SequenceReindexer reindexer;
    private final SegmentLifecycleService lifecycleService;
    private final SegmentReconciliationService reconciliationService;
    private final WorkAccessService workAccessService;
    private final EstimationService estimationService;
    private final LedgerService ledgerService;
    private final VideoGenerationProvider provider;
    private final Clock clock;
    private final TransactionTemplate inTransaction;

    public SegmentServiceImpl(VideoSegmentRepository segmentRepository,
                              SegmentMapper segmentMapper,
                              SequenceReindexer reindexer,
                              SegmentLifecycleService lifecycleService,
                              SegmentReconciliationService reconciliationService,
                              WorkAccessService workAccessService,
                              EstimationService estimationService,
                              LedgerService ledgerService,
                              VideoGenerationProvider provider,
                              Clock clock,
                              PlatformTransactionManager transactionManager) {
        this.segmentRepository = segmentRepository;
        this.segmentMapper = segmentMapper;
        this.reindexer = reindexer;
        this.lifecycleService = lifecycleService;
        this.reconciliationService = reconciliationService;
        this.workAccessService = workAccessService;
        this.estimationService = estimationService;
        this.ledgerService = ledgerService;
        this.provider = provider;
        this.clock = clock;
        this.inTransaction = new TransactionTemplate(transactionManager);
    }

    @Override
    public SegmentDto createJob(UUID workId, Integer episodeNum, CreateSegmentRequest request) {
        // Rejects unpriced model/resolution pairs before anything is written
        long cost = estimationService.estimateCost(request.model(), request.resolution(), request.durationSec());

        VideoSegment draft = VideoSegment.draft(workId, episodeNum, now());
        draft.setPrompt(request.prompt());
        draft.setShotType(request.shotType());
        draft.setCameraMove(request.cameraMove());
        draft.setSceneNum(request.sceneNum());
        draft.setModel(request.model());
        draft.setResolution(request.resolution());
        draft.setDurationSec(request.durationSec());

        if (!request.submit()) {
            return segmentMapper.toDto(reindexer.insertAfter(draft, request.afterPosition()));
        }

        UUID ownerId = requireOwnerOf(workId);
        VideoSegment claimed = inTransaction.execute(status -> {
            VideoSegment inserted = reindexer.insertAfter(draft, request.afterPosition());
            lifecycleService.claimForSubmission(inserted.getId(), ownerId, cost);
            return inserted;
        });
        dispatch(claimed, ownerId);
        return segmentMapper.toDto(loadSegment(claimed.getId()));
    }

    @Override
    public SegmentBatchResult submitBatch(UUID workId, Integer episodeNum, SegmentBatchRequest request) {
        List<Long> costs = request.segments().stream()
                .map(planned -> estimationService.estimateCost(request.model(), request.resolution(), planned.durationSec()))
                .toList();
        long totalCost = costs.stream().mapToLong(Long::longValue).sum();
        UUID ownerId = requireOwnerOf(workId);

        List<VideoSegment> claimed;
        try {
            claimed = inTransaction.execute(status -> {
                List<VideoSegment> inserted = new ArrayList<>();
                Integer after = request.afterPosition();
                for (PlannedSegment planned : request.segments()) {
                    VideoSegment saved = reindexer.insertAfter(
                            plannedDraft(workId, episodeNum, request.model(), request.resolution(), planned), after);
                    after = saved.getPosition();
                    inserted.add(saved);
                }
                for (int i = 0; i < inserted.size(); i++) {
                    lifecycleService.claimForSubmission(inserted.get(i).getId(), ownerId, costs.get(i));
                }
                return inserted;
            });
        } catch (InsufficientTokensException e) {
            // Rolled back as a whole; report the batch total rather than the segment that ran out
            long available = ledgerService.getBalance(ownerId).available();
            log.info("Batch of {} segments for work {} episode {} refused: {} tokens needed, {} available",
                    request.segments().size(), workId, episodeNum, totalCost, available);
            throw new InsufficientTokensException(totalCost, available);
        }

        for (VideoSegment segment : claimed) {
            dispatch(segment, ownerId);
        }
        log.info("Submitted batch of {} segments for work {} episode {} at {} tokens",
                claimed.size(), workId, episodeNum, totalCost);

        List<VideoSegment> reloaded = segmentRepository.findAllById(claimed.stream().map(VideoSegment::getId).toList())
                .stream()
                .sorted(Comparator.comparing(VideoSegment::getPosition))
                .toList();
        return new SegmentBatchResult(segmentMapper.toDtos(reloaded), totalCost);
    }

    @Override
    public SegmentDto getJob(UUID segmentId) {
        VideoSegment segment = loadSegment(segmentId);
        if (segment.isPollable()) {
            reconciliationService.reconcile(List.of(segment));
            segment = loadSegment(segmentId);
        }
        return segmentMapper.toDto(segment);
    }

    @Override
    public List<SegmentDto> listJobs(UUID workId, Integer episodeNum) {
        List<VideoSegment> segments = loadScope(workId, episodeNum);
        if (segments.stream().anyMatch(VideoSegment::isPollable)) {
            reconciliationService.reconcile(segments);
            segments = loadScope(workId, episodeNum);
        }
        return segmentMapper.toDtos(segments);
    }

    @Override
    @Transactional
    public SegmentDto updateJobFields(UUID segmentId, UpdateSegmentRequest request) {
        VideoSegment segment = loadSegment(segmentId);

        if (request.touchesCost()) {
            if (segment.getStatus() != SegmentStatus.PENDING) {
                throw new IllegalStateException("Model, resolution and duration can only change while the segment is pending (current: "
                        + segment.getStatus().getDisplayName() + ")");
            }
            String model = request.model() != null ? request.model() : segment.getModel();
            String resolution = request.resolution() != null ? request.resolution() : segment.getResolution();
            int durationSec = request.durationSec() != null ? request.durationSec() : segment.getDurationSec();
            estimationService.estimateCost(model, resolution, durationSec);

            segment.setModel(model);
            segment.setResolution(resolution);
            segment.setDurationSec(durationSec);
        }

        if (request.prompt() != null) {
            segment.setPrompt(request.prompt());
        }
        if (request.shotType() != null) {
            segment.setShotType(request.shotType());
        }
        if (request.cameraMove() != null) {
            segment.setCameraMove(request.cameraMove());
        }
        if (request.sceneNum() != null) {
            segment.setSceneNum(request.sceneNum());
        }

        segment.setUpdatedAt(now());
        VideoSegment saved = segmentRepository.saveAndFlush(segment);
        log.info("Updated fields of segment {}", segmentId);
        return segmentMapper.toDto(saved);
    }

    @Override
    public SegmentDto submit(UUID segmentId) {
        VideoSegment segment = loadSegment(segmentId);
        if (segment.getStatus() != SegmentStatus.PENDING) {
            throw new IllegalStateException("Segment " + segmentId + " is already "
                    + segment.getStatus().getDisplayName().toLowerCase());
        }
        UUID ownerId = requireOwnerOf(segment.getWorkId());
        long cost = estimationService.estimateCost(segment.getModel(), segment.getResolution(), segment.getDurationSec());

        lifecycleService.claimForSubmission(segmentId, ownerId, cost);
        dispatch(segment, ownerId);
        return segmentMapper.toDto(loadSegment(segmentId));
    }

    @Override
    @Transactional
    public void deleteJob(UUID segmentId) {
        VideoSegment segment = loadSegment(segmentId);
        if (segment.getStatus().isInFlight()) {
            UUID ownerId = workAccessService.findOwner(segment.getWorkId()).orElse(null);
            lifecycleService.failInFlight(segmentId, ownerId, CANCELLED);
        }

        int deleted = segmentRepository.deleteByIdAndStatusIn(segmentId, SETTLED);
        if (deleted == 0) {
            throw new OptimisticLockingFailureException(
                    "Segment " + segmentId + " changed state while being deleted; retry");
        }
        log.info("Deleted segment {} from work {} episode {}", segmentId, segment.getWorkId(), segment.getEpisodeNum());
    }

    @Override
    @Transactional
    public ResetScopeResult resetScope(UUID workId, Integer episodeNum) {
        workAccessService.lockForReindex(workId);
        ResetScopeResult result = clearScope(workId, episodeNum);
        if (result.skipped() > 0) {
            log.warn("Reset of work {} episode {} left {} segments that changed state concurrently",
                    workId, episodeNum, result.skipped());
        }
        return result;
    }

    @Override
    @Transactional
    public ReplacePlanResult replacePlan(UUID workId, Integer episodeNum, ReplacePlanRequest request) {
        for (PlannedSegment planned : request.segments()) {
            estimationService.estimateCost(request.model(), request.resolution(), planned.durationSec());
        }

        workAccessService.lockForReindex(workId);
        ResetScopeResult cleared = clearScope(workId, episodeNum);
        if (cleared.skipped() > 0) {
            throw new OptimisticLockingFailureException("Episode " + episodeNum + " of work " + workId
                    + " had " + cleared.skipped() + " segments change state while its plan was replaced; retry");
        }

        List<VideoSegment> plan = new ArrayList<>();
        for (int position = 0; position < request.segments().size(); position++) {
            VideoSegment draft = plannedDraft(workId, episodeNum, request.model(), request.resolution(),
                    request.segments().get(position));
            draft.setPosition(position);
            plan.add(draft);
        }
        List<VideoSegment> saved = segmentRepository.saveAllAndFlush(plan);
        log.info("Replaced plan of work {} episode {}: {} old segments removed, {} new", workId, episodeNum,
                cleared.deleted(), saved.size());
        return new ReplacePlanResult(cleared, segmentMapper.toDtos(saved));
    }

    @Override
    public List<SegmentDto> reorder(UUID workId, Integer episodeNum, List<PositionAssignment> assignments) {
        SequenceReindexer.validateAssignments(assignments);
        reindexer.reorder(workId, episodeNum, assignments);
        return segmentMapper.toDtos(segmentRepository.findByWorkIdAndEpisodeNumOrderByPositionAsc(workId, episodeNum));
    }

    @Override
    public UUID workIdOf(UUID segmentId) {
        return segmentRepository.findWorkIdById(segmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Segment " + segmentId + " not found"));
    }

    private VideoSegment loadSegment(UUID segmentId) {
        return segmentRepository.findById(segmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Segment " + segmentId + " not found"));
    }

    private List<VideoSegment> loadScope(UUID workId, Integer episodeNum) {
        return episodeNum == null
                ? segmentRepository.findByWorkIdOrderByEpisodeNumAscPositionAsc(workId)
                : segmentRepository.findByWorkIdAndEpisodeNumOrderByPositionAsc(workId, episodeNum);
    }

    private UUID requireOwnerOf(UUID workId) {
        return workAccessService.findOwner(workId)
                .orElseThrow(() -> new ResourceNotFoundException("Work " + workId + " not found"));
    }

    /**
     * Cancels in-flight segments of the scope with a refund, then deletes every segment holding no
     * reservation. Runs inside the caller's transaction.
     */
    private ResetScopeResult clearScope(UUID workId, Integer episodeNum) {
        List<VideoSegment> scope = segmentRepository.findByWorkIdAndEpisodeNumOrderByPositionAsc(workId, episodeNum);
        if (scope.isEmpty()) {
            return new ResetScopeResult(0, 0, 0L, 0);
        }

        UUID ownerId = workAccessService.findOwner(workId).orElse(null);
        int cancelled = 0;
        long refunded = 0L;
        for (VideoSegment segment : scope) {
            if (!segment.getStatus().isInFlight()) {
                continue;
            }
            if (lifecycleService.failInFlight(segment.getId(), ownerId, CANCELLED)) {
                cancelled++;
                if (segment.isBillable() && ownerId != null) {
                    refunded += segment.getTokenCost();
                }
            }
        }

        int deleted = segmentRepository.deleteScopeInStatuses(workId, episodeNum, SETTLED);
        int skipped = Math.max(scope.size() - deleted, 0);
        log.info("Cleared work {} episode {}: {} deleted, {} cancelled, {} tokens refunded",
                workId, episodeNum, deleted, cancelled, refunded);
        return new ResetScopeResult(deleted, cancelled, refunded, skipped);
    }

    /**
     * Hands a claimed segment to the provider. Runs with no transaction open.
     */
    private void dispatch(VideoSegment segment, UUID ownerId) {
        UUID segmentId = segment.getId();
        ProviderSubmission submission = new ProviderSubmission(
                segment.getModel(),
                segment.getResolution(),
                segment.getDurationSec(),
                segment.getPrompt(),
                segment.getShotType(),
                segment.getCameraMove());

        String taskId;
        try {
            taskId = provider.submit(submission);
        } catch (ProviderException e) {
            log.warn("Provider rejected segment {}: {}", segmentId, e.getMessage());
            lifecycleService.failInFlight(segmentId, ownerId, "Submission failed: " + e.getMessage());
            return;
        }

        try {
            lifecycleService.recordProviderTask(segmentId, taskId);
        } catch (RuntimeException e) {
            // Submitted without a task id is never polled; deleting the segment cancels it and refunds
            log.error("Provider accepted segment {} as task {} but the task id could not be stored; "
                    + "the segment keeps its reservation until the task id is restored or the segment is deleted",
                    segmentId, taskId, e);
            throw e;
        }
        log.info("Segment {} submitted as provider task {}", segmentId, taskId);
    }

    private VideoSegment plannedDraft(UUID workId, Integer episodeNum, String model, String resolution,
                                      PlannedSegment planned) {
        VideoSegment draft = VideoSegment.draft(workId, episodeNum, now());
        draft.setPrompt(planned.prompt());
        draft.setShotType(planned.shotType());
        draft.setCameraMove(planned.cameraMove());
        draft.setSceneNum(planned.sceneNum());
        draft.setModel(model);
        draft.setResolution(resolution);
        draft.setDurationSec(planned.durationSec());
        return draft;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
