package org.caureq.selfrepair.api;

import org.caureq.selfrepair.domain.ComponentHealth;
import org.caureq.selfrepair.service.StatusService;
import org.caureq.selfrepair.service.repair.RepairEscalator;
import org.caureq.selfrepair.service.store.UnknownComponentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.anyString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {StatusController.class, AdminAlertsController.class},
        properties = "supervisor.api-key=test-key")
@DisplayName("REST API")
class ApiControllersTest {
    @Autowired
    MockMvc mvc;

    @MockBean
    StatusService statusService;

    @MockBean
    RepairEscalator escalator;

    @Test
    @DisplayName("Status lists every component with its freshness")
    void statusList() throws Exception {
        var h = ComponentHealth.fresh("web", Instant.parse("2026-03-01T10:00:00Z"));
        when(statusService.all()).thenReturn(List.of(new StatusService.ComponentStatus(h, StatusService.Freshness.UNCHECKED)));

        mvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].component").value("web"))
                .andExpect(jsonPath("$[0].status").value("healthy"))
                .andExpect(jsonPath("$[0].freshness").value("UNCHECKED"));
    }

    @Test
    @DisplayName("An unknown component is a 404")
    void unknownComponent() throws Exception {
        when(statusService.one("ghost")).thenThrow(new UnknownComponentException("ghost"));

        mvc.perform(get("/api/status/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("COMPONENT_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/status/ghost"));
    }

    @Test
    @DisplayName("Admin routes require the API key")
    void adminNeedsKey() throws Exception {
        mvc.perform(post("/api/admin/alerts/a-1/ack"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_REQUIRED"));
        mvc.perform(post("/api/admin/alerts/a-1/ack").header("X-API-KEY", "wrong"))
                .andExpect(status().isUnauthorized());

        verify(escalator, never()).acknowledgeAlert(anyString());
    }

    @Test
    @DisplayName("Acknowledging an alert with the key succeeds")
    void ackWithKey() throws Exception {
        when(escalator.acknowledgeAlert("a-1")).thenReturn(true);

        mvc.perform(post("/api/admin/alerts/a-1/ack").header("X-API-KEY", "test-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acknowledged").value("a-1"));
    }

    @Test
    @DisplayName("Acknowledging an unknown alert is a bad request")
    void ackUnknown() throws Exception {
        when(escalator.acknowledgeAlert("nope")).thenReturn(false);

        mvc.perform(post("/api/admin/alerts/nope/ack").header("X-API-KEY", "test-key"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }
}
