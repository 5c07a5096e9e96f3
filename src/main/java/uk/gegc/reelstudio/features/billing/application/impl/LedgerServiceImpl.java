package uk.gegc.reelstudio.features.billing.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.reelstudio.features.billing.api.dto.BalanceDto;
import uk.gegc.reelstudio.features.billing.api.dto.TransactionDto;
import uk.gegc.reelstudio.features.billing.application.BillingMetricsService;
import uk.gegc.reelstudio.features.billing.application.BillingStructuredLogger;
import uk.gegc.reelstudio.features.billing.application.LedgerService;
import uk.gegc.reelstudio.features.billing.domain.exception.InsufficientTokensException;
import uk.gegc.reelstudio.features.billing.domain.model.Balance;
import uk.gegc.reelstudio.features.billing.domain.model.TokenTransaction;
import uk.gegc.reelstudio.features.billing.domain.model.TokenTransactionType;
import uk.gegc.reelstudio.features.billing.infra.mapping.BalanceMapper;
import uk.gegc.reelstudio.features.billing.infra.mapping.TokenTransactionMapper;
import uk.gegc.reelstudio.features.billing.infra.repository.BalanceRepository;
import uk.gegc.reelstudio.features.billing.infra.repository.TokenTransactionRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Slf4j
@Service
public class LedgerServiceImpl implements LedgerService {

    private final BalanceRepository balanceRepository;
    private final TokenTransactionRepository transactionRepository;
    private final BalanceMapper balanceMapper;
    private final TokenTransactionMapper transactionMapper;
    private final BillingMetricsService metricsService;
    private final Clock clock;
    private final TransactionTemplate newTransaction;

    public LedgerServiceImpl(BalanceRepository balanceRepository,
                             TokenTransactionRepository transactionRepository,
                             BalanceMapper balanceMapper,
                             TokenTransactionMapper transactionMapper,
                             BillingMetricsService metricsService,
                             Clock clock,
                             PlatformTransactionManager transactionManager) {
        this.balanceRepository = balanceRepository;
        this.transactionRepository = transactionRepository;
        this.balanceMapper = balanceMapper;
        this.transactionMapper = transactionMapper;
        this.metricsService = metricsService;
        this.clock = clock;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    @Transactional
    public void reserve(UUID userId, long amount, String refId) {
        requirePositive(amount);

        int updated = balanceRepository.reserve(userId, amount, now());
        if (updated == 0) {
            long available = balanceRepository.findById(userId).map(Balance::getAvailable).orElse(0L);
            metricsService.incrementReservationRejected(userId, amount);
            throw new InsufficientTokensException(amount, available);
        }

        Balance after = reload(userId);
        recordTransaction(after, TokenTransactionType.RESERVE, amount, refId, "Reserved for segment generation");
        BillingStructuredLogger.logLedgerWrite(log, "info",
                "Reserved {} tokens for user {} (ref {})",
                userId, "RESERVE", amount, after.getBalance(), after.getReserved(), refId,
                amount, userId, refId);
        metricsService.incrementTokensReserved(userId, amount);
    }

    @Override
    @Transactional
    public void confirmDeduction(UUID userId, long amount, String refId) {
        requirePositive(amount);

        int updated = balanceRepository.confirm(userId, amount, now());
        if (updated == 0) {
            throw new IllegalStateException("No balance to settle for user " + userId);
        }

        Balance after = reload(userId);
        recordTransaction(after, TokenTransactionType.CONSUME, -amount, refId, "Segment generation completed");
        BillingStructuredLogger.logLedgerWrite(log, "info",
                "Consumed {} reserved tokens for user {} (ref {})",
                userId, "CONSUME", amount, after.getBalance(), after.getReserved(), refId,
                amount, userId, refId);
        metricsService.incrementTokensConsumed(userId, amount, "SEGMENT");
    }

    @Override
    @Transactional
    public long refundReservation(UUID userId, long amount, String refId, String reason) {
        requirePositive(amount);

        // Row lock so the clamp below sees the reserved value the UPDATE will act on
        Balance locked = balanceRepository.findByUserIdForUpdate(userId).orElse(null);
        long release = locked == null ? 0 : Math.min(locked.getReserved(), amount);
        if (release <= 0) {
            BillingStructuredLogger.logLedgerWrite(log, "warn",
                    "Refund of {} tokens for user {} skipped: nothing reserved (ref {})",
                    userId, "RELEASE", 0, locked == null ? 0 : locked.getBalance(), 0, refId,
                    amount, userId, refId);
            metricsService.incrementRefundSkipped(userId);
            return 0;
        }
        if (release < amount) {
            log.warn("Refund for user {} clamped from {} to {} tokens (ref {})", userId, amount, release, refId);
        }

        balanceRepository.release(userId, release, now());

        Balance after = reload(userId);
        recordTransaction(after, TokenTransactionType.RELEASE, release, refId,
                reason != null ? reason : "Reservation released");
        BillingStructuredLogger.logLedgerWrite(log, "info",
                "Released {} tokens for user {} (ref {}): {}",
                userId, "RELEASE", release, after.getBalance(), after.getReserved(), refId,
                release, userId, refId, reason);
        metricsService.incrementTokensReleased(userId, release);
        return release;
    }

    @Override
    @Transactional
    public void directDeduction(UUID userId, long amount, String refId, String description) {
        requirePositive(amount);

        int updated = balanceRepository.deduct(userId, amount, now());
        if (updated == 0) {
            long available = balanceRepository.findById(userId).map(Balance::getAvailable).orElse(0L);
            metricsService.incrementReservationRejected(userId, amount);
            throw new InsufficientTokensException(amount, available);
        }

        Balance after = reload(userId);
        recordTransaction(after, TokenTransactionType.CONSUME, -amount, refId,
                description != null ? description : "Direct charge");
        BillingStructuredLogger.logLedgerWrite(log, "info",
                "Charged {} tokens directly for user {} (ref {})",
                userId, "CONSUME", amount, after.getBalance(), after.getReserved(), refId,
                amount, userId, refId);
        metricsService.incrementTokensConsumed(userId, amount, "DIRECT");
    }

    @Override
    @Transactional
    public BalanceDto credit(UUID userId, long amount, TokenTransactionType type, String refId) {
        requirePositive(amount);
        if (type == null || !type.isFunding()) {
            throw new IllegalArgumentException("Credit type must be PURCHASE or BONUS, got " + type);
        }

        // Open the row before touching it here: a missed UPDATE would hold a gap lock the insert waits on
        if (!balanceRepository.existsById(userId)) {
            openBalance(userId);
        }
        int updated = balanceRepository.credit(userId, amount, now());
        if (updated == 0) {
            throw new IllegalStateException("Balance row missing after creation for user " + userId);
        }

        Balance after = reload(userId);
        recordTransaction(after, type, amount, refId,
                type == TokenTransactionType.PURCHASE ? "Token purchase" : "Bonus tokens");
        BillingStructuredLogger.logLedgerWrite(log, "info",
                "Credited {} tokens ({}) to user {} (ref {})",
                userId, type.name(), amount, after.getBalance(), after.getReserved(), refId,
                amount, type, userId, refId);
        metricsService.incrementTokensCredited(userId, amount, type.name());
        return balanceMapper.toDto(after);
    }

    @Override
    @Transactional(readOnly = true)
    public BalanceDto getBalance(UUID userId) {
        return balanceRepository.findById(userId)
                .map(balanceMapper::toDto)
                .orElseGet(() -> BalanceDto.empty(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<TransactionDto> listTransactions(UUID userId, TokenTransactionType type, Pageable pageable) {
        return transactionRepository.findByFilters(userId, type, pageable)
                .map(transactionMapper::toDto);
    }

    /**
     * Inserts the empty balance row in its own transaction so a lost insert race cannot poison the caller's.
     */
    private void openBalance(UUID userId) {
        try {
            newTransaction.executeWithoutResult(status -> {
                if (!balanceRepository.existsById(userId)) {
                    balanceRepository.saveAndFlush(Balance.open(userId, now()));
                    log.info("Opened token balance for user {}", userId);
                }
            });
        } catch (DataIntegrityViolationException e) {
            log.debug("Balance for user {} was opened concurrently", userId);
        }
    }

    private void recordTransaction(Balance after, TokenTransactionType type, long amount, String refId, String description) {
        TokenTransaction tx = new TokenTransaction();
        tx.setUserId(after.getUserId());
        tx.setType(type);
        tx.setAmount(amount);
        tx.setBalanceAfter(after.getBalance());
        tx.setReservedAfter(after.getReserved());
        tx.setRefId(refId);
        tx.setDescription(description);
        tx.setCreatedAt(now());
        transactionRepository.save(tx);
    }

    private Balance reload(UUID userId) {
        return balanceRepository.findById(userId)
                .orElseThrow(() -> new IllegalStateException("Balance not found for user " + userId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Token amount must be positive, got " + amount);
        }
    }
}
