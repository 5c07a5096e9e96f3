package uk.gegc.reelstudio.features.segment.application;

import uk.gegc.reelstudio.features.segment.api.dto.CreateSegmentRequest;
import uk.gegc.reelstudio.features.segment.api.dto.PositionAssignment;
import uk.gegc.reelstudio.features.segment.api.dto.ReplacePlanRequest;
import uk.gegc.reelstudio.features.segment.api.dto.ReplacePlanResult;
import uk.gegc.reelstudio.features.segment.api.dto.ResetScopeResult;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentBatchRequest;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentBatchResult;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentDto;
import uk.gegc.reelstudio.features.segment.api.dto.UpdateSegmentRequest;

import java.util.List;
import java.util.UUID;

/**
 * Segment operations used by the API layer. Callers must have checked work ownership first.
 */
public interface SegmentService {

    /**
     * Creates a pending segment. With {@code submit} set, the segment is inserted and its cost reserved in
     * one transaction, so a refused reservation leaves no segment behind.
     */
    SegmentDto createJob(UUID workId, Integer episodeNum, CreateSegmentRequest request);

    /**
     * Creates every segment of the batch and reserves the cost of each in one transaction, then hands
     * them to the provider one after another.
     */
    SegmentBatchResult submitBatch(UUID workId, Integer episodeNum, SegmentBatchRequest request);

    /**
     * Reconciles the segment with the provider, then returns its current state.
     */
    SegmentDto getJob(UUID segmentId);

    /**
     * Reconciles every pollable segment in the scope, then returns the scope in position order.
     *
     * @param episodeNum {@code null} lists all episodes of the work
     */
    List<SegmentDto> listJobs(UUID workId, Integer episodeNum);

    SegmentDto updateJobFields(UUID segmentId, UpdateSegmentRequest request);

    /**
     * Reserves the segment's cost and hands it to the provider.
     */
    SegmentDto submit(UUID segmentId);

    void deleteJob(UUID segmentId);

    ResetScopeResult resetScope(UUID workId, Integer episodeNum);

    /**
     * Clears the episode as {@link #resetScope} does and writes the new plan as pending segments, all in one
     * transaction. Fails without changes if any old segment changes state during the clear.
     */
    ReplacePlanResult replacePlan(UUID workId, Integer episodeNum, ReplacePlanRequest request);

    List<SegmentDto> reorder(UUID workId, Integer episodeNum, List<PositionAssignment> assignments);

    UUID workIdOf(UUID segmentId);
}
