package uk.gegc.reelstudio.features.billing.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import uk.gegc.reelstudio.BaseIntegrationTest;
import uk.gegc.reelstudio.features.billing.api.dto.BalanceDto;
import uk.gegc.reelstudio.features.billing.api.dto.TransactionDto;
import uk.gegc.reelstudio.features.billing.application.LedgerService;
import uk.gegc.reelstudio.features.billing.domain.exception.InsufficientTokensException;
import uk.gegc.reelstudio.features.billing.domain.model.TokenTransactionType;
import uk.gegc.reelstudio.features.billing.infra.repository.TokenTransactionRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Ledger against the database")
class LedgerIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private TokenTransactionRepository transactionRepository;

    private UUID userId;

    @BeforeEach
    void setUp() {
        clearTables();
        userId = UUID.randomUUID();
    }

    @AfterEach
    void tearDown() {
        clearTables();
    }

    @Test
    @DisplayName("credit opens the balance row on first funding")
    void credit_opensRow() {
        assertThat(ledgerService.getBalance(userId).balance()).isZero();

        BalanceDto funded = ledgerService.credit(userId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        BalanceDto topped = ledgerService.credit(userId, 20L, TokenTransactionType.BONUS, "promo-1");

        assertThat(funded.balance()).isEqualTo(100L);
        assertThat(topped.balance()).isEqualTo(120L);
        assertThat(topped.totalPurchased()).isEqualTo(120L);
        assertThat(topped.reserved()).isZero();
    }

    @Test
    @DisplayName("reserve 30 then confirm 30 from {100, 0} ends at {70, 0} with 30 consumed")
    void reserveThenConfirm() {
        // Given
        ledgerService.credit(userId, 100L, TokenTransactionType.PURCHASE, "pay-1");

        // When
        ledgerService.reserve(userId, 30L, "seg-1");
        BalanceDto reserved = ledgerService.getBalance(userId);
        ledgerService.confirmDeduction(userId, 30L, "seg-1");
        BalanceDto settled = ledgerService.getBalance(userId);

        // Then
        assertThat(reserved.balance()).isEqualTo(100L);
        assertThat(reserved.reserved()).isEqualTo(30L);
        assertThat(reserved.available()).isEqualTo(70L);

        assertThat(settled.balance()).isEqualTo(70L);
        assertThat(settled.reserved()).isZero();
        assertThat(settled.totalConsumed()).isEqualTo(30L);
    }

    @Test
    @DisplayName("reserve 30 then refund 30 from {100, 0} returns to {100, 0}")
    void reserveThenRefund() {
        ledgerService.credit(userId, 100L, TokenTransactionType.PURCHASE, "pay-1");

        ledgerService.reserve(userId, 30L, "seg-1");
        long released = ledgerService.refundReservation(userId, 30L, "seg-1", "Segment failed: timeout");
        BalanceDto after = ledgerService.getBalance(userId);

        assertThat(released).isEqualTo(30L);
        assertThat(after.balance()).isEqualTo(100L);
        assertThat(after.reserved()).isZero();
        assertThat(after.totalConsumed()).isZero();
    }

    @Test
    @DisplayName("reserving more than available leaves the balance untouched")
    void reserve_insufficientLeavesNoTrace() {
        ledgerService.credit(userId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        ledgerService.reserve(userId, 60L, "seg-1");

        assertThatThrownBy(() -> ledgerService.reserve(userId, 50L, "seg-2"))
                .isInstanceOf(InsufficientTokensException.class);

        BalanceDto after = ledgerService.getBalance(userId);
        assertThat(after.reserved()).isEqualTo(60L);
        assertThat(transactionRepository.countByRefIdAndType("seg-2", TokenTransactionType.RESERVE)).isZero();
    }

    @Test
    @DisplayName("concurrent reservations never over-commit the balance")
    void concurrentReservations() throws Exception {
        // Given
        ledgerService.credit(userId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        int attempts = 10;
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < attempts; i++) {
                String ref = "seg-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        ledgerService.reserve(userId, 20L, ref);
                        return true;
                    } catch (InsufficientTokensException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int won = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    won++;
                }
            }

            // Then
            assertThat(won).isEqualTo(5);
            BalanceDto after = ledgerService.getBalance(userId);
            assertThat(after.reserved()).isEqualTo(100L);
            assertThat(after.available()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("every mutation leaves an audit row, newest first")
    void auditTrail() {
        ledgerService.credit(userId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        ledgerService.reserve(userId, 30L, "seg-1");
        ledgerService.confirmDeduction(userId, 30L, "seg-1");
        ledgerService.directDeduction(userId, 5L, "export-1", "Script export");

        List<TransactionDto> all = ledgerService.listTransactions(userId, null, PageRequest.of(0, 10)).getContent();
        List<TransactionDto> consumes = ledgerService
                .listTransactions(userId, TokenTransactionType.CONSUME, PageRequest.of(0, 10)).getContent();

        assertThat(all).hasSize(4);
        assertThat(consumes).extracting(TransactionDto::amount).containsExactlyInAnyOrder(-30L, -5L);
        assertThat(ledgerService.getBalance(userId).balance()).isEqualTo(65L);
    }
}
