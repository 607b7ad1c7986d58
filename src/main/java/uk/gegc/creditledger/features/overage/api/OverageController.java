package uk.gegc.creditledger.features.overage.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.creditledger.features.overage.api.dto.OverageResultDto;
import uk.gegc.creditledger.features.overage.application.OverageService;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/workspaces/{workspaceId}/overage")
@RequiredArgsConstructor
@Tag(name = "Overage", description = "Usage beyond the plan credit limit")
public class OverageController {

    private final OverageService overageService;

    @Operation(summary = "Preview overage", description = "Current-period figures without recording or invoicing anything.")
    @GetMapping
    public ResponseEntity<OverageResultDto> preview(@PathVariable UUID workspaceId) {
        return ResponseEntity.ok(overageService.preview(workspaceId));
    }

    @Operation(summary = "List recorded overage charges")
    @GetMapping("/charges")
    public ResponseEntity<List<OverageResultDto>> listCharges(@PathVariable UUID workspaceId) {
        return ResponseEntity.ok(overageService.listCharges(workspaceId));
    }

    @Operation(summary = "Evaluate overage",
            description = "Records and invoices the overage for a period. Defaults to the current period. Safe to repeat.")
    @PostMapping("/evaluate")
    public ResponseEntity<OverageResultDto> evaluate(
            @PathVariable UUID workspaceId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime periodStart,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime periodEnd) {
        if ((periodStart == null) != (periodEnd == null)) {
            throw new IllegalArgumentException("periodStart and periodEnd must be given together");
        }
        OverageResultDto result = periodStart != null
                ? overageService.evaluate(workspaceId, periodStart, periodEnd)
                : overageService.evaluateCurrentPeriod(workspaceId);
        return ResponseEntity.ok(result);
    }
}
