package uk.gegc.creditledger.features.overage.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.creditledger.features.overage.api.dto.OverageResultDto;
import uk.gegc.creditledger.features.overage.application.OverageService;
import uk.gegc.creditledger.features.overage.domain.model.OverageStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OverageController.class)
class OverageControllerTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 3, 1, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2025, 4, 1, 0, 0);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OverageService overageService;

    private static OverageResultDto invoiced(UUID workspaceId) {
        return new OverageResultDto(workspaceId, START, END, OverageStatus.INVOICED, 1500L, 1000L, 500L,
                new BigDecimal("0.01"), new BigDecimal("5.00"), "usd",
                "overage:" + workspaceId + ":" + START + ":" + END, "ii_1", UUID.randomUUID());
    }

    @Test
    @DisplayName("GET /overage: returns the current-period preview")
    void preview() throws Exception {
        UUID workspaceId = UUID.randomUUID();
        when(overageService.preview(workspaceId)).thenReturn(new OverageResultDto(workspaceId, START, END,
                OverageStatus.PREVIEW, 1500L, 1000L, 500L, new BigDecimal("0.01"), new BigDecimal("5.00"), "usd",
                null, null, null));

        mockMvc.perform(get("/api/v1/workspaces/{id}/overage", workspaceId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PREVIEW"))
                .andExpect(jsonPath("$.overageUnits").value(500))
                .andExpect(jsonPath("$.charge").value(5.00));
    }

    @Test
    @DisplayName("POST /overage/evaluate: without a period evaluates the current one")
    void evaluateCurrentPeriod() throws Exception {
        UUID workspaceId = UUID.randomUUID();
        when(overageService.evaluateCurrentPeriod(workspaceId)).thenReturn(invoiced(workspaceId));

        mockMvc.perform(post("/api/v1/workspaces/{id}/overage/evaluate", workspaceId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("INVOICED"))
                .andExpect(jsonPath("$.invoiceItemId").value("ii_1"));
    }

    @Test
    @DisplayName("POST /overage/evaluate: an explicit period is passed through")
    void evaluateExplicitPeriod() throws Exception {
        UUID workspaceId = UUID.randomUUID();
        when(overageService.evaluate(workspaceId, START, END)).thenReturn(invoiced(workspaceId));

        mockMvc.perform(post("/api/v1/workspaces/{id}/overage/evaluate", workspaceId)
                        .param("periodStart", "2025-03-01T00:00:00")
                        .param("periodEnd", "2025-04-01T00:00:00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overageUnits").value(500));
    }

    @Test
    @DisplayName("POST /overage/evaluate: half a period returns 400")
    void evaluateHalfPeriod_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/workspaces/{id}/overage/evaluate", UUID.randomUUID())
                        .param("periodStart", "2025-03-01T00:00:00"))
                .andExpect(status().isBadRequest());

        verify(overageService, never()).evaluate(any(), any(), any());
        verify(overageService, never()).evaluateCurrentPeriod(any());
    }
}
