package uk.gegc.reelstudio.features.billing.application;

import java.util.UUID;

/**
 * Micrometer counters for ledger movements.
 */
public interface BillingMetricsService {

    void incrementTokensReserved(UUID userId, long amount);
    void incrementTokensConsumed(UUID userId, long amount, String source);
    void incrementTokensReleased(UUID userId, long amount);
    void incrementTokensCredited(UUID userId, long amount, String source);

    void incrementReservationRejected(UUID userId, long amount);
    void incrementRefundSkipped(UUID userId);
}
