package uk.gegc.reelstudio.features.billing.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.reelstudio.features.billing.api.dto.BalanceDto;
import uk.gegc.reelstudio.features.billing.api.dto.TransactionDto;
import uk.gegc.reelstudio.features.billing.domain.model.TokenTransactionType;

import java.util.UUID;

/**
 * Token ledger over the per-user {@code Balance} row.
 *
 * <p>Reservations are not stored separately: a reservation is the {@code reserved} delta on the balance,
 * settled later with exactly one {@link #confirmDeduction} or {@link #refundReservation}. The ledger does
 * not deduplicate settlements; callers must make sure each reservation is settled once.
 *
 * <p>All mutators join the caller's transaction, so a settlement commits or rolls back together with the
 * state change that triggered it.
 */
public interface LedgerService {

    /**
     * Earmarks {@code amount} tokens. Fails closed with
     * {@link uk.gegc.reelstudio.features.billing.domain.exception.InsufficientTokensException}
     * when {@code balance - reserved < amount}; nothing is written in that case.
     */
    void reserve(UUID userId, long amount, String refId);

    /**
     * Spends a reservation: {@code balance -= amount}, {@code reserved -= amount} (clamped at zero),
     * {@code totalConsumed += amount}.
     */
    void confirmDeduction(UUID userId, long amount, String refId);

    /**
     * Returns reserved tokens to the available pool. {@code balance} is untouched.
     * The release is clamped to what is currently reserved.
     *
     * @return tokens actually released; 0 when nothing was reserved
     */
    long refundReservation(UUID userId, long amount, String refId, String reason);

    /**
     * Charges available tokens without a prior reservation.
     */
    void directDeduction(UUID userId, long amount, String refId, String description);

    /**
     * Funds a balance, creating its row on first use.
     *
     * @param type {@link TokenTransactionType#PURCHASE} or {@link TokenTransactionType#BONUS}
     */
    BalanceDto credit(UUID userId, long amount, TokenTransactionType type, String refId);

    BalanceDto getBalance(UUID userId);

    Page<TransactionDto> listTransactions(UUID userId, TokenTransactionType type, Pageable pageable);
}
