package uk.gegc.reelstudio.features.segment.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.reelstudio.features.billing.application.LedgerService;
import uk.gegc.reelstudio.features.billing.domain.exception.InsufficientTokensException;
import uk.gegc.reelstudio.features.segment.domain.model.SegmentStatus;
import uk.gegc.reelstudio.features.segment.domain.repository.VideoSegmentRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SegmentLifecycleService")
class SegmentLifecycleServiceTest {

    @Mock
    private VideoSegmentRepository segmentRepository;

    @Mock
    private LedgerService ledgerService;

    private SegmentLifecycleService lifecycleService;

    private UUID segmentId;
    private UUID ownerId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        lifecycleService = new SegmentLifecycleService(segmentRepository, ledgerService, clock);
        segmentId = UUID.randomUUID();
        ownerId = UUID.randomUUID();
    }

    private void transitionReturns(int rows) {
        when(segmentRepository.transitionStatus(eq(segmentId), any(), any(), any(), any(), any(), any()))
                .thenReturn(rows);
    }

    @Nested
    @DisplayName("transition")
    class Transition {

        @Test
        @DisplayName("winner of a DONE move confirms the cost")
        void done_confirms() {
            // Given
            transitionReturns(1);
            when(segmentRepository.findTokenCostById(segmentId)).thenReturn(Optional.of(8L));

            // When
            boolean won = lifecycleService.transition(segmentId, ownerId, SegmentStatus.DONE, "https://cdn/x.mp4", null);

            // Then
            assertThat(won).isTrue();
            verify(ledgerService).confirmDeduction(ownerId, 8L, segmentId.toString());
            verify(ledgerService, never()).refundReservation(any(), anyLong(), anyString(), anyString());
        }

        @Test
        @DisplayName("winner of a FAILED move refunds with the failure reason")
        void failed_refunds() {
            transitionReturns(1);
            when(segmentRepository.findTokenCostById(segmentId)).thenReturn(Optional.of(8L));

            lifecycleService.transition(segmentId, ownerId, SegmentStatus.FAILED, null, "moderation");

            verify(ledgerService).refundReservation(ownerId, 8L, segmentId.toString(), "Segment failed: moderation");
            verify(ledgerService, never()).confirmDeduction(any(), anyLong(), anyString());
        }

        @Test
        @DisplayName("a lost compare-and-set settles nothing")
        void lost_noSettlement() {
            transitionReturns(0);

            boolean won = lifecycleService.transition(segmentId, ownerId, SegmentStatus.DONE, "https://cdn/x.mp4", null);

            assertThat(won).isFalse();
            verifyNoInteractions(ledgerService);
            verify(segmentRepository, never()).findTokenCostById(any());
        }

        @Test
        @DisplayName("a segment never charged is not settled")
        void nullCost_skipped() {
            transitionReturns(1);
            when(segmentRepository.findTokenCostById(segmentId)).thenReturn(Optional.empty());

            assertThat(lifecycleService.transition(segmentId, ownerId, SegmentStatus.DONE, "u", null)).isTrue();
            verifyNoInteractions(ledgerService);
        }

        @Test
        @DisplayName("an explicitly free segment is not settled")
        void zeroCost_skipped() {
            transitionReturns(1);
            when(segmentRepository.findTokenCostById(segmentId)).thenReturn(Optional.of(0L));

            lifecycleService.transition(segmentId, ownerId, SegmentStatus.FAILED, null, "boom");

            verifyNoInteractions(ledgerService);
        }

        @Test
        @DisplayName("an unresolved owner keeps the transition but skips settlement")
        void unknownOwner_skipped() {
            transitionReturns(1);
            when(segmentRepository.findTokenCostById(segmentId)).thenReturn(Optional.of(8L));

            assertThat(lifecycleService.transition(segmentId, null, SegmentStatus.DONE, "u", null)).isTrue();
            verifyNoInteractions(ledgerService);
        }

        @Test
        @DisplayName("non-terminal moves never settle and leave completedAt empty")
        void generating_noSettlement() {
            transitionReturns(1);

            lifecycleService.transition(segmentId, ownerId, SegmentStatus.GENERATING, null, null);

            verify(segmentRepository).transitionStatus(eq(segmentId), eq(SegmentStatus.GENERATING.allowedPredecessors()),
                    eq(SegmentStatus.GENERATING), isNull(), isNull(), isNull(), any());
            verifyNoInteractions(ledgerService);
        }

        @Test
        @DisplayName("long provider errors are truncated to the column size")
        void longError_truncated() {
            transitionReturns(1);
            when(segmentRepository.findTokenCostById(segmentId)).thenReturn(Optional.empty());

            lifecycleService.transition(segmentId, ownerId, SegmentStatus.FAILED, null, "x".repeat(5000));

            ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
            verify(segmentRepository).transitionStatus(eq(segmentId), any(), any(), any(), message.capture(), any(), any());
            assertThat(message.getValue()).hasSize(1000).endsWith("...");
        }
    }

    @Nested
    @DisplayName("claimForSubmission")
    class Claim {

        @Test
        @DisplayName("claims then reserves the cost")
        void claim_reserves() {
            when(segmentRepository.claimPending(eq(segmentId), eq(8L), eq(SegmentStatus.PENDING),
                    eq(SegmentStatus.SUBMITTED), any())).thenReturn(1);

            lifecycleService.claimForSubmission(segmentId, ownerId, 8L);

            verify(ledgerService).reserve(ownerId, 8L, segmentId.toString());
        }

        @Test
        @DisplayName("a segment that is no longer pending is refused without reserving")
        void claim_notPending() {
            when(segmentRepository.claimPending(any(), anyLong(), any(), any(), any())).thenReturn(0);

            assertThatThrownBy(() -> lifecycleService.claimForSubmission(segmentId, ownerId, 8L))
                    .isInstanceOf(IllegalStateException.class);
            verifyNoInteractions(ledgerService);
        }

        @Test
        @DisplayName("free segments are claimed without a reservation")
        void claim_free() {
            when(segmentRepository.claimPending(any(), anyLong(), any(), any(), any())).thenReturn(1);

            lifecycleService.claimForSubmission(segmentId, ownerId, 0L);

            verifyNoInteractions(ledgerService);
        }

        @Test
        @DisplayName("insufficient funds propagate so the claim rolls back")
        void claim_insufficient() {
            when(segmentRepository.claimPending(any(), anyLong(), any(), any(), any())).thenReturn(1);
            doThrow(new InsufficientTokensException(8L, 3L)).when(ledgerService).reserve(ownerId, 8L, segmentId.toString());

            assertThatThrownBy(() -> lifecycleService.claimForSubmission(segmentId, ownerId, 8L))
                    .isInstanceOf(InsufficientTokensException.class);
        }
    }

    @Test
    @DisplayName("failInFlight is a FAILED transition with the reason as error")
    void failInFlight_refunds() {
        transitionReturns(1);
        when(segmentRepository.findTokenCostById(segmentId)).thenReturn(Optional.of(8L));

        assertThat(lifecycleService.failInFlight(segmentId, ownerId, "Cancelled")).isTrue();

        verify(ledgerService).refundReservation(ownerId, 8L, segmentId.toString(), "Segment failed: Cancelled");
    }
}
