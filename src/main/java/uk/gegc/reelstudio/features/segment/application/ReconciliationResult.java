package uk.gegc.reelstudio.features.segment.application;

/**
 * Outcome counts of one reconciliation pass.
 *
 * @param polled      segments the provider was asked about
 * @param transitioned status changes this pass performed (and settled)
 * @param superseded  changes another caller had already applied
 * @param failed      segments whose poll or transition threw; they stay candidates
 */
public record ReconciliationResult(int polled, int transitioned, int superseded, int failed) {

    public static final ReconciliationResult EMPTY = new ReconciliationResult(0, 0, 0, 0);
}
