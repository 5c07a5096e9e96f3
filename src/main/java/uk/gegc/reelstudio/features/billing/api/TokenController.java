package uk.gegc.reelstudio.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.reelstudio.features.billing.api.dto.BalanceDto;
import uk.gegc.reelstudio.features.billing.api.dto.EstimationDto;
import uk.gegc.reelstudio.features.billing.api.dto.TransactionDto;
import uk.gegc.reelstudio.features.billing.application.EstimationService;
import uk.gegc.reelstudio.features.billing.application.LedgerService;
import uk.gegc.reelstudio.features.billing.domain.model.TokenTransactionType;
import uk.gegc.reelstudio.shared.security.CurrentUser;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/tokens")
@RequiredArgsConstructor
@Validated
@Tag(name = "Tokens", description = "Token balance, ledger history and cost estimates")
public class TokenController {

    private final LedgerService ledgerService;
    private final EstimationService estimationService;

    @Operation(summary = "Get token balance", description = "Returns the acting user's balance. Users never funded get a zero balance.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance retrieved",
                    content = @Content(schema = @Schema(implementation = BalanceDto.class))),
            @ApiResponse(responseCode = "401", description = "No forwarded user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/balance")
    public ResponseEntity<BalanceDto> getBalance(Authentication authentication) {
        UUID userId = CurrentUser.id(authentication);
        return ResponseEntity.ok()
                .header("Cache-Control", "private, no-cache")
                .body(ledgerService.getBalance(userId));
    }

    @Operation(summary = "Get ledger history", description = "Paginated token movements, newest first")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Transactions retrieved"),
            @ApiResponse(responseCode = "401", description = "No forwarded user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/transactions")
    public ResponseEntity<Page<TransactionDto>> getTransactions(
            @Parameter(description = "Optional movement type filter")
            @RequestParam(required = false) TokenTransactionType type,
            @PageableDefault(size = 20) Pageable pageable,
            Authentication authentication) {
        UUID userId = CurrentUser.id(authentication);
        return ResponseEntity.ok(ledgerService.listTransactions(userId, type, pageable));
    }

    @Operation(summary = "Estimate segment cost", description = "Tokens reserved when a segment with these parameters is submitted")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Estimate computed",
                    content = @Content(schema = @Schema(implementation = EstimationDto.class))),
            @ApiResponse(responseCode = "400", description = "Unknown model or resolution",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/estimate")
    public ResponseEntity<EstimationDto> estimate(
            @RequestParam @NotBlank String model,
            @RequestParam @NotBlank String resolution,
            @RequestParam @Positive @Max(60) int durationSec) {
        return ResponseEntity.ok(estimationService.estimate(model, resolution, durationSec));
    }
}
