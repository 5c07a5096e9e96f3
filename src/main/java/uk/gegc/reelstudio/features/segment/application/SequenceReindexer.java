package uk.gegc.reelstudio.features.segment.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reelstudio.features.segment.api.dto.PositionAssignment;
import uk.gegc.reelstudio.features.segment.domain.exception.ReindexConflictException;
import uk.gegc.reelstudio.features.segment.domain.model.VideoSegment;
import uk.gegc.reelstudio.features.segment.domain.repository.VideoSegmentRepository;
import uk.gegc.reelstudio.features.work.application.WorkAccessService;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Rewrites segment positions inside one (work, episode) scope without ever tripping the unique
 * (work, episode, position) constraint.
 *
 * <p>Every move goes through two phases inside one transaction: first each moving segment is parked on a
 * distinct negative scratch position, then each is written to its final position. Real positions are
 * never negative, so no parked value can collide with a real one. The work row is locked for the whole
 * transaction so two reindex operations on the same work run one after the other.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SequenceReindexer {

    /**
     * Scratch offset for shifts: position {@code p} is parked at {@code -(p + SHIFT_SCRATCH_OFFSET)}.
     */
    static final int SHIFT_SCRATCH_OFFSET = 1_000_000;

    private final VideoSegmentRepository segmentRepository;
    private final WorkAccessService workAccessService;

    /**
     * Places {@code draft} right after {@code afterPosition}, shifting every segment at or beyond the target
     * position up by one. A {@code null} position appends after the current last segment; {@code -1}
     * inserts at the head (position 0).
     *
     * @return the persisted segment
     */
    @Transactional
    public VideoSegment insertAfter(VideoSegment draft, Integer afterPosition) {
        UUID workId = draft.getWorkId();
        Integer episodeNum = draft.getEpisodeNum();
        workAccessService.lockForReindex(workId);

        int target;
        if (afterPosition == null) {
            target = segmentRepository.findMaxPosition(workId, episodeNum).map(SequenceReindexer::nextPosition).orElse(0);
        } else {
            if (afterPosition < -1) {
                throw new ReindexConflictException("Cannot insert after position " + afterPosition);
            }
            target = nextPosition(afterPosition);
            List<VideoSegment> tail = segmentRepository.findTailDescending(workId, episodeNum, target);
            shiftUpByOne(tail);
        }

        draft.setPosition(target);
        VideoSegment saved = segmentRepository.saveAndFlush(draft);
        log.info("Inserted segment {} at position {} of work {} episode {}", saved.getId(), target, workId, episodeNum);
        return saved;
    }

    /**
     * Applies an explicit id-to-position mapping. Segments not named keep their position. The mapping must
     * leave every segment of the scope on a distinct position; an empty mapping changes nothing.
     *
     * @throws ReindexConflictException before any write if the mapping is invalid for the scope
     */
    @Transactional
    public void reorder(UUID workId, Integer episodeNum, List<PositionAssignment> assignments) {
        validateAssignments(assignments);
        if (assignments.isEmpty()) {
            return;
        }

        workAccessService.lockForReindex(workId);
        List<VideoSegment> scope = segmentRepository.findByWorkIdAndEpisodeNumOrderByPositionAsc(workId, episodeNum);

        Map<UUID, Integer> finalPositions = new HashMap<>();
        for (VideoSegment segment : scope) {
            finalPositions.put(segment.getId(), segment.getPosition());
        }
        Map<UUID, Integer> currentPositions = Map.copyOf(finalPositions);

        for (PositionAssignment assignment : assignments) {
            if (!currentPositions.containsKey(assignment.segmentId())) {
                throw new ReindexConflictException("Segment " + assignment.segmentId()
                        + " does not belong to work " + workId + " episode " + episodeNum);
            }
            finalPositions.put(assignment.segmentId(), assignment.position());
        }

        Set<Integer> taken = new HashSet<>();
        for (Integer position : finalPositions.values()) {
            if (!taken.add(position)) {
                throw new ReindexConflictException("Position " + position + " would be held by more than one segment");
            }
        }

        List<PositionMove> moves = new ArrayList<>();
        for (PositionAssignment assignment : assignments) {
            int from = currentPositions.get(assignment.segmentId());
            if (from != assignment.position()) {
                moves.add(new PositionMove(assignment.segmentId(), from, assignment.position()));
            }
        }
        if (moves.isEmpty()) {
            log.debug("Reorder of work {} episode {} is already in effect", workId, episodeNum);
            return;
        }

        // Phase 1: park by rank, -1, -2, ...
        for (int rank = 0; rank < moves.size(); rank++) {
            segmentRepository.updatePosition(moves.get(rank).segmentId(), -(rank + 1));
        }
        // Phase 2: final positions
        for (PositionMove move : moves) {
            segmentRepository.updatePosition(move.segmentId(), move.to());
        }
        log.info("Reordered {} segments of work {} episode {}", moves.size(), workId, episodeNum);
    }

    /**
     * Checks that need no database: no null or duplicate ids, no duplicate targets, every target within
     * {@code [0, MAX_POSITION]}.
     */
    public static void validateAssignments(List<PositionAssignment> assignments) {
        if (assignments == null) {
            throw new ReindexConflictException("Reorder mapping is required");
        }
        Set<UUID> ids = new HashSet<>();
        Set<Integer> positions = new HashSet<>();
        for (PositionAssignment assignment : assignments) {
            if (assignment == null || assignment.segmentId() == null || assignment.position() == null) {
                throw new ReindexConflictException("Every reorder entry needs a segment id and a position");
            }
            if (assignment.position() < 0) {
                throw new ReindexConflictException("Position " + assignment.position() + " is negative");
            }
            if (assignment.position() > VideoSegment.MAX_POSITION) {
                throw new ReindexConflictException("Position " + assignment.position()
                        + " is above the maximum of " + VideoSegment.MAX_POSITION);
            }
            if (!ids.add(assignment.segmentId())) {
                throw new ReindexConflictException("Segment " + assignment.segmentId() + " appears more than once");
            }
            if (!positions.add(assignment.position())) {
                throw new ReindexConflictException("Position " + assignment.position() + " is assigned more than once");
            }
        }
    }

    /**
     * @param tail segments ordered by position, highest first
     */
    private void shiftUpByOne(List<VideoSegment> tail) {
        if (tail.isEmpty()) {
            return;
        }
        // Highest first, so this rejects an overflowing shift before anything moves
        nextPosition(tail.get(0).getPosition());
        List<PositionMove> moves = tail.stream()
                .map(segment -> new PositionMove(segment.getId(), segment.getPosition(), segment.getPosition() + 1))
                .toList();

        for (PositionMove move : moves) {
            segmentRepository.updatePosition(move.segmentId(), -(move.from() + SHIFT_SCRATCH_OFFSET));
        }
        for (PositionMove move : moves) {
            segmentRepository.updatePosition(move.segmentId(), move.to());
        }
        log.debug("Shifted {} segments up by one from position {}", moves.size(), moves.get(moves.size() - 1).from());
    }

    /**
     * @throws ReindexConflictException if the position after {@code position} would exceed
     *                                  {@link VideoSegment#MAX_POSITION}
     */
    static int nextPosition(int position) {
        if (position >= VideoSegment.MAX_POSITION) {
            throw new ReindexConflictException("No position left after " + position
                    + "; the maximum is " + VideoSegment.MAX_POSITION);
        }
        return position + 1;
    }

    private record PositionMove(UUID segmentId, int from, int to) {
    }
}
