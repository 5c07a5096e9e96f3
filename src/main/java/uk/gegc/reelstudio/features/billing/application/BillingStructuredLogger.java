package uk.gegc.reelstudio.features.billing.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging for ledger writes. Fields go into the MDC under {@code ledger.*} for the duration
 * of one log call.
 */
public final class BillingStructuredLogger {

    private BillingStructuredLogger() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static void logLedgerWrite(Logger logger, String level, String message,
                                      UUID userId, String operation, long amount,
                                      long balanceAfter, long reservedAfter,
                                      String refId, Object... additionalArgs) {

        MDC.put("ledger.userId", userId != null ? userId.toString() : null);
        MDC.put("ledger.operation", operation);
        MDC.put("ledger.amount", String.valueOf(amount));
        MDC.put("ledger.balanceAfter", String.valueOf(balanceAfter));
        MDC.put("ledger.reservedAfter", String.valueOf(reservedAfter));
        MDC.put("ledger.refId", refId);

        try {
            switch (level.toLowerCase()) {
                case "warn" -> logger.warn(message, additionalArgs);
                case "error" -> logger.error(message, additionalArgs);
                case "debug" -> logger.debug(message, additionalArgs);
                default -> logger.info(message, additionalArgs);
            }
        } finally {
            clearLedgerMDC();
        }
    }

    public static void clearLedgerMDC() {
        MDC.remove("ledger.userId");
        MDC.remove("ledger.operation");
        MDC.remove("ledger.amount");
        MDC.remove("ledger.balanceAfter");
        MDC.remove("ledger.reservedAfter");
        MDC.remove("ledger.refId");
    }
}
