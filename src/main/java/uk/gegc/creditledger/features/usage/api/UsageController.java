package uk.gegc.creditledger.features.usage.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.creditledger.features.usage.api.dto.UsageReportDto;
import uk.gegc.creditledger.features.usage.application.UsageAggregationService;

import java.time.LocalDateTime;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/workspaces/{workspaceId}/usage")
@RequiredArgsConstructor
@Tag(name = "Usage", description = "Settled usage per billing period")
public class UsageController {

    private final UsageAggregationService usageAggregationService;

    @Operation(summary = "Get period usage", description = "Defaults to the current billing period.")
    @GetMapping
    public ResponseEntity<UsageReportDto> getUsage(
            @PathVariable UUID workspaceId,
            @Parameter(description = "Billing period start; current period when omitted")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime periodStart) {
        UsageReportDto report = periodStart != null
                ? usageAggregationService.getPeriodUsage(workspaceId, periodStart)
                : usageAggregationService.getCurrentPeriodUsage(workspaceId);
        return ResponseEntity.ok(report);
    }
}
