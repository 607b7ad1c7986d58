package uk.gegc.creditledger.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.creditledger.features.billing.api.dto.*;
import uk.gegc.creditledger.features.billing.application.BillingService;
import uk.gegc.creditledger.features.billing.application.EstimationService;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/billing")
@RequiredArgsConstructor
@Validated
@Tag(name = "Billing", description = "Credit estimates and the reservation lifecycle")
public class BillingController {

    private final BillingService billingService;
    private final EstimationService estimationService;

    @Operation(
            summary = "Estimate credits",
            description = "Prices a generation request from the model pricing table. Deterministic and never below 1 credit."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Estimate computed",
                    content = @Content(schema = @Schema(implementation = EstimationDto.class))),
            @ApiResponse(responseCode = "400", description = "Missing or invalid request parameters",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Model unknown or lacks the requested capability",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/estimates")
    public ResponseEntity<EstimationDto> estimate(@Valid @RequestBody EstimateRequest request) {
        return ResponseEntity.ok(estimationService.estimate(request));
    }

    @Operation(
            summary = "Reserve credits",
            description = "Places a hold of the estimated credits before the provider call. Retrying with the same requestId returns the original reservation."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Reservation held",
                    content = @Content(schema = @Schema(implementation = ReservationDto.class))),
            @ApiResponse(responseCode = "404", description = "Workspace not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Insufficient credits or requestId reused with different parameters",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Workspace row under contention, retry later",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/reservations")
    public ResponseEntity<ReservationDto> reserve(@Valid @RequestBody ReserveRequest request) {
        ReservationDto reservation = billingService.reserve(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(reservation);
    }

    @Operation(summary = "Get reservation")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Reservation found",
                    content = @Content(schema = @Schema(implementation = ReservationDto.class))),
            @ApiResponse(responseCode = "404", description = "Reservation not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/reservations/{reservationId}")
    public ResponseEntity<ReservationDto> getReservation(
            @Parameter(description = "Reservation id", required = true) @PathVariable UUID reservationId) {
        return ResponseEntity.ok(billingService.getReservation(reservationId));
    }

    @Operation(
            summary = "Settle reservation",
            description = "Charges the actual usage and refunds the unused estimate. Settling a terminal or unknown reservation returns its recorded outcome."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Settlement outcome",
                    content = @Content(schema = @Schema(implementation = SettlementResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid actual amount",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/reservations/{reservationId}/settle")
    public ResponseEntity<SettlementResultDto> settle(
            @Parameter(description = "Reservation id", required = true) @PathVariable UUID reservationId,
            @Valid @RequestBody SettleRequest request) {
        return ResponseEntity.ok(billingService.settle(reservationId, request.actualCredits()));
    }

    @Operation(
            summary = "Release reservation",
            description = "Returns the full estimate to the balance after a failed or cancelled provider call."
    )
    @ApiResponse(responseCode = "200", description = "Release outcome",
            content = @Content(schema = @Schema(implementation = ReleaseResultDto.class)))
    @PostMapping("/reservations/{reservationId}/release")
    public ResponseEntity<ReleaseResultDto> release(
            @Parameter(description = "Reservation id", required = true) @PathVariable UUID reservationId,
            @Valid @RequestBody(required = false) ReleaseRequest request) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(billingService.release(reservationId, reason));
    }
}
