package uk.gegc.creditledger.features.workspace.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.creditledger.features.workspace.api.dto.CreatePlanRequest;
import uk.gegc.creditledger.features.workspace.api.dto.PlanDto;
import uk.gegc.creditledger.features.workspace.application.WorkspaceService;

import java.util.List;

@RestController
@RequestMapping("/api/v1/plans")
@RequiredArgsConstructor
@Tag(name = "Plans", description = "Subscription plans with credit limits and overage rates")
public class PlanController {

    private final WorkspaceService workspaceService;

    @Operation(summary = "Create plan")
    @PostMapping
    public ResponseEntity<PlanDto> createPlan(@Valid @RequestBody CreatePlanRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workspaceService.createPlan(request));
    }

    @Operation(summary = "List plans")
    @GetMapping
    public ResponseEntity<List<PlanDto>> listPlans() {
        return ResponseEntity.ok(workspaceService.listPlans());
    }

    @Operation(summary = "Get plan by code")
    @GetMapping("/{code}")
    public ResponseEntity<PlanDto> getPlan(@PathVariable String code) {
        return ResponseEntity.ok(workspaceService.getPlan(code));
    }
}
