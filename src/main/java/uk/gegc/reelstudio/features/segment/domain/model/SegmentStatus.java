package uk.gegc.reelstudio.features.segment.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a generated segment. Moves only forward: pending, submitted, generating, then done or failed.
 */
public enum SegmentStatus {
    PENDING("Pending"),
    SUBMITTED("Submitted"),
    GENERATING("Generating"),
    DONE("Done"),
    FAILED("Failed");

    /**
     * States in which the segment's cost is held as a reservation.
     */
    public static final Set<SegmentStatus> IN_FLIGHT = EnumSet.of(SUBMITTED, GENERATING);

    private final String displayName;

    SegmentStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }

    /**
     * Statuses a segment may be in for a move to this status to be accepted.
     */
    public Set<SegmentStatus> allowedPredecessors() {
        return switch (this) {
            case PENDING -> EnumSet.noneOf(SegmentStatus.class);
            case SUBMITTED -> EnumSet.of(PENDING);
            case GENERATING -> EnumSet.of(SUBMITTED);
            case DONE, FAILED -> EnumSet.copyOf(IN_FLIGHT);
        };
    }
}
