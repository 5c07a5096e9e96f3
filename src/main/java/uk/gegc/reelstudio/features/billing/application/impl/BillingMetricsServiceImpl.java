package uk.gegc.reelstudio.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.reelstudio.features.billing.application.BillingMetricsService;

import java.util.UUID;

@Slf4j
@Service
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter tokensReservedCounter;
    private final Counter tokensReleasedCounter;
    private final Counter reservationRejectedCounter;
    private final Counter refundSkippedCounter;

    public BillingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.tokensReservedCounter = Counter.builder("ledger.tokens.reserved")
                .description("Tokens earmarked for in-flight segments")
                .register(meterRegistry);
        this.tokensReleasedCounter = Counter.builder("ledger.tokens.released")
                .description("Tokens returned from reservations of failed or cancelled segments")
                .register(meterRegistry);
        this.reservationRejectedCounter = Counter.builder("ledger.reservations.rejected")
                .description("Reservations refused for insufficient funds")
                .register(meterRegistry);
        this.refundSkippedCounter = Counter.builder("ledger.refunds.skipped")
                .description("Refunds that found nothing reserved to release")
                .register(meterRegistry);
    }

    @Override
    public void incrementTokensReserved(UUID userId, long amount) {
        log.debug("METRIC: ledger.tokens.reserved userId={} amount={}", userId, amount);
        tokensReservedCounter.increment(amount);
    }

    @Override
    public void incrementTokensConsumed(UUID userId, long amount, String source) {
        log.debug("METRIC: ledger.tokens.consumed userId={} amount={} source={}", userId, amount, source);
        meterRegistry.counter("ledger.tokens.consumed", "source", source).increment(amount);
    }

    @Override
    public void incrementTokensReleased(UUID userId, long amount) {
        log.debug("METRIC: ledger.tokens.released userId={} amount={}", userId, amount);
        tokensReleasedCounter.increment(amount);
    }

    @Override
    public void incrementTokensCredited(UUID userId, long amount, String source) {
        log.debug("METRIC: ledger.tokens.credited userId={} amount={} source={}", userId, amount, source);
        meterRegistry.counter("ledger.tokens.credited", "source", source).increment(amount);
    }

    @Override
    public void incrementReservationRejected(UUID userId, long amount) {
        log.info("METRIC: ledger.reservations.rejected userId={} amount={}", userId, amount);
        reservationRejectedCounter.increment();
    }

    @Override
    public void incrementRefundSkipped(UUID userId) {
        log.warn("METRIC: ledger.refunds.skipped userId={}", userId);
        refundSkippedCounter.increment();
    }
}
