package uk.gegc.reelstudio.features.segment.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import uk.gegc.reelstudio.BaseIntegrationTest;
import uk.gegc.reelstudio.features.billing.api.dto.BalanceDto;
import uk.gegc.reelstudio.features.billing.application.LedgerService;
import uk.gegc.reelstudio.features.billing.domain.exception.InsufficientTokensException;
import uk.gegc.reelstudio.features.billing.domain.model.TokenTransactionType;
import uk.gegc.reelstudio.features.provider.application.ProviderTaskStatus;
import uk.gegc.reelstudio.features.provider.application.VideoGenerationProvider;
import uk.gegc.reelstudio.features.provider.domain.exception.ProviderException;
import uk.gegc.reelstudio.features.provider.domain.model.ProviderTaskState;
import uk.gegc.reelstudio.features.segment.api.dto.CreateSegmentRequest;
import uk.gegc.reelstudio.features.segment.api.dto.PlannedSegment;
import uk.gegc.reelstudio.features.segment.api.dto.ReplacePlanRequest;
import uk.gegc.reelstudio.features.segment.api.dto.ReplacePlanResult;
import uk.gegc.reelstudio.features.segment.api.dto.ResetScopeResult;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentBatchRequest;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentBatchResult;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentDto;
import uk.gegc.reelstudio.features.segment.application.SegmentService;
import uk.gegc.reelstudio.features.segment.domain.model.SegmentStatus;
import uk.gegc.reelstudio.features.segment.domain.repository.VideoSegmentRepository;
import uk.gegc.reelstudio.features.work.domain.model.Work;
import uk.gegc.reelstudio.features.work.domain.repository.WorkRepository;

import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Segment lifecycle through the service, with the provider replaced and everything else real.
 * seedance_2_0 at 1080p for 5s costs 8 tokens with the default pricing.
 */
@DisplayName("Segment flow")
class SegmentFlowIntegrationTest extends BaseIntegrationTest {

    private static final long COST = 8L;

    @MockitoBean
    private VideoGenerationProvider provider;

    @Autowired
    private SegmentService segmentService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private WorkRepository workRepository;

    @Autowired
    private VideoSegmentRepository segmentRepository;

    private UUID ownerId;
    private UUID workId;

    @BeforeEach
    void setUp() {
        clearTables();
        ownerId = UUID.randomUUID();
        workId = workRepository.save(new Work(ownerId, "Pilot")).getId();
    }

    @AfterEach
    void tearDown() {
        clearTables();
    }

    private CreateSegmentRequest request(boolean submit) {
        return new CreateSegmentRequest(null, "Harbour at dawn", "wide", "dolly-in", 1,
                "seedance_2_0", "1080p", 5, submit);
    }

    @Test
    @DisplayName("submit reserves, a polled completion confirms")
    void submitThenComplete() {
        // Given
        ledgerService.credit(ownerId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        when(provider.submit(any())).thenReturn("task-1");

        // When
        SegmentDto submitted = segmentService.createJob(workId, 1, request(true));

        // Then
        assertThat(submitted.status()).isEqualTo(SegmentStatus.SUBMITTED);
        assertThat(submitted.providerTaskId()).isEqualTo("task-1");
        assertThat(submitted.tokenCost()).isEqualTo(COST);
        assertThat(ledgerService.getBalance(ownerId).reserved()).isEqualTo(COST);

        // When the provider reports success
        when(provider.queryStatus(eq("seedance_2_0"), eq("task-1")))
                .thenReturn(new ProviderTaskStatus("task-1", ProviderTaskState.SUCCEEDED, "https://cdn.test/1.mp4", null));
        SegmentDto done = segmentService.getJob(submitted.id());
        SegmentDto polledAgain = segmentService.listJobs(workId, 1).get(0);

        // Then it is settled once
        assertThat(done.status()).isEqualTo(SegmentStatus.DONE);
        assertThat(done.resultUrl()).isEqualTo("https://cdn.test/1.mp4");
        assertThat(polledAgain.status()).isEqualTo(SegmentStatus.DONE);
        BalanceDto balance = ledgerService.getBalance(ownerId);
        assertThat(balance.balance()).isEqualTo(100L - COST);
        assertThat(balance.reserved()).isZero();
    }

    @Test
    @DisplayName("a provider rejection at submit fails the segment and refunds")
    void submitRejected() {
        ledgerService.credit(ownerId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        when(provider.submit(any())).thenThrow(new ProviderException("Provider submit returned 400 BAD_REQUEST"));

        SegmentDto failed = segmentService.createJob(workId, 1, request(true));

        assertThat(failed.status()).isEqualTo(SegmentStatus.FAILED);
        assertThat(failed.errorMessage()).startsWith("Submission failed");
        BalanceDto balance = ledgerService.getBalance(ownerId);
        assertThat(balance.balance()).isEqualTo(100L);
        assertThat(balance.reserved()).isZero();
    }

    @Test
    @DisplayName("a transient poll error leaves the segment in flight")
    void transientPollError() {
        ledgerService.credit(ownerId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        when(provider.submit(any())).thenReturn("task-1");
        SegmentDto submitted = segmentService.createJob(workId, 1, request(true));
        when(provider.queryStatus(any(), any())).thenThrow(new ProviderException("read timed out"));

        SegmentDto polled = segmentService.getJob(submitted.id());

        assertThat(polled.status()).isEqualTo(SegmentStatus.SUBMITTED);
        assertThat(ledgerService.getBalance(ownerId).reserved()).isEqualTo(COST);
    }

    @Test
    @DisplayName("without funds the segment stays pending and nothing is reserved")
    void submitWithoutFunds() {
        SegmentDto pending = segmentService.createJob(workId, 1, request(false));

        assertThatThrownBy(() -> segmentService.submit(pending.id()))
                .isInstanceOf(InsufficientTokensException.class);

        assertThat(segmentRepository.findById(pending.id()).orElseThrow().getStatus()).isEqualTo(SegmentStatus.PENDING);
        assertThat(segmentRepository.findById(pending.id()).orElseThrow().getTokenCost()).isNull();
    }

    @Test
    @DisplayName("deleting an in-flight segment cancels it with a refund")
    void deleteInFlight() {
        ledgerService.credit(ownerId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        when(provider.submit(any())).thenReturn("task-1");
        SegmentDto submitted = segmentService.createJob(workId, 1, request(true));

        segmentService.deleteJob(submitted.id());

        assertThat(segmentRepository.findById(submitted.id())).isEmpty();
        BalanceDto balance = ledgerService.getBalance(ownerId);
        assertThat(balance.balance()).isEqualTo(100L);
        assertThat(balance.reserved()).isZero();
    }

    @Test
    @DisplayName("resetting an episode refunds in-flight segments and removes everything")
    void resetEpisode() {
        ledgerService.credit(ownerId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        when(provider.submit(any())).thenReturn("task-1", "task-2");
        segmentService.createJob(workId, 1, request(true));
        segmentService.createJob(workId, 1, request(true));
        segmentService.createJob(workId, 1, request(false));

        ResetScopeResult result = segmentService.resetScope(workId, 1);

        assertThat(result).isEqualTo(new ResetScopeResult(3, 2, 2 * COST, 0));
        assertThat(segmentService.listJobs(workId, 1)).isEmpty();
        assertThat(ledgerService.getBalance(ownerId).reserved()).isZero();
    }

    private List<PlannedSegment> plannedShots(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new PlannedSegment("Shot " + i, "medium", "static", 1, 5))
                .toList();
    }

    @Test
    @DisplayName("create with submit and too few tokens leaves no segment and shifts nothing")
    void createAndSubmitWithoutFunds() {
        // Given
        ledgerService.credit(ownerId, 5L, TokenTransactionType.PURCHASE, "pay-1");
        SegmentDto first = segmentService.createJob(workId, 1, request(false));
        SegmentDto second = segmentService.createJob(workId, 1, request(false));
        CreateSegmentRequest atHead = new CreateSegmentRequest(-1, "Opening", "wide", null, 1,
                "seedance_2_0", "1080p", 5, true);

        // When / Then
        assertThatThrownBy(() -> segmentService.createJob(workId, 1, atHead))
                .isInstanceOfSatisfying(InsufficientTokensException.class,
                        e -> assertThat(e.getShortfall()).isEqualTo(3L));

        assertThat(segmentService.listJobs(workId, 1))
                .extracting(SegmentDto::id, SegmentDto::position)
                .containsExactly(
                        tuple(first.id(), 0),
                        tuple(second.id(), 1));
        assertThat(ledgerService.getBalance(ownerId).reserved()).isZero();
        verify(provider, never()).submit(any());
    }

    @Test
    @DisplayName("a batch reserves every segment and submits each")
    void batchSubmit() {
        // Given
        ledgerService.credit(ownerId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        when(provider.submit(any())).thenReturn("task-1", "task-2", "task-3");

        // When
        SegmentBatchResult result = segmentService.submitBatch(workId, 1,
                new SegmentBatchRequest(null, "seedance_2_0", "1080p", plannedShots(3)));

        // Then
        assertThat(result.totalCost()).isEqualTo(3 * COST);
        assertThat(result.segments()).extracting(SegmentDto::position).containsExactly(0, 1, 2);
        assertThat(result.segments()).extracting(SegmentDto::providerTaskId).containsExactly("task-1", "task-2", "task-3");
        assertThat(result.segments()).extracting(SegmentDto::status).containsOnly(SegmentStatus.SUBMITTED);
        assertThat(ledgerService.getBalance(ownerId).reserved()).isEqualTo(3 * COST);
    }

    @Test
    @DisplayName("a batch the balance cannot fully cover creates nothing")
    void batchWithoutFunds() {
        ledgerService.credit(ownerId, 20L, TokenTransactionType.PURCHASE, "pay-1");
        segmentService.createJob(workId, 1, request(false));

        assertThatThrownBy(() -> segmentService.submitBatch(workId, 1,
                new SegmentBatchRequest(-1, "seedance_2_0", "1080p", plannedShots(3))))
                .isInstanceOfSatisfying(InsufficientTokensException.class, e -> {
                    assertThat(e.getRequestedTokens()).isEqualTo(3 * COST);
                    assertThat(e.getAvailableTokens()).isEqualTo(20L);
                });

        assertThat(segmentService.listJobs(workId, 1)).extracting(SegmentDto::position).containsExactly(0);
        assertThat(ledgerService.getBalance(ownerId).reserved()).isZero();
        verify(provider, never()).submit(any());
    }

    @Test
    @DisplayName("replacing a plan refunds in-flight segments and writes the new plan as pending")
    void replacePlan() {
        // Given
        ledgerService.credit(ownerId, 100L, TokenTransactionType.PURCHASE, "pay-1");
        when(provider.submit(any())).thenReturn("task-1");
        segmentService.createJob(workId, 1, request(true));
        segmentService.createJob(workId, 1, request(false));

        // When
        ReplacePlanResult result = segmentService.replacePlan(workId, 1,
                new ReplacePlanRequest("seedance_2_0", "720p", plannedShots(3)));

        // Then
        assertThat(result.cleared()).isEqualTo(new ResetScopeResult(2, 1, COST, 0));
        List<SegmentDto> episode = segmentService.listJobs(workId, 1);
        assertThat(episode).extracting(SegmentDto::position).containsExactly(0, 1, 2);
        assertThat(episode).extracting(SegmentDto::status).containsOnly(SegmentStatus.PENDING);
        assertThat(episode).extracting(SegmentDto::resolution).containsOnly("720p");
        BalanceDto balance = ledgerService.getBalance(ownerId);
        assertThat(balance.balance()).isEqualTo(100L);
        assertThat(balance.reserved()).isZero();
    }
}
