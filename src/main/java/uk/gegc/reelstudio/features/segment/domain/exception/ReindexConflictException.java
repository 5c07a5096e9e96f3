package uk.gegc.reelstudio.features.segment.domain.exception;

/**
 * A reorder or insert request that cannot produce a unique, in-scope set of positions.
 * Raised before any position is written.
 */
public class ReindexConflictException extends RuntimeException {

    public ReindexConflictException(String message) {
        super(message);
    }
}
