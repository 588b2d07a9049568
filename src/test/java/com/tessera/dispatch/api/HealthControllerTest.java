package com.tessera.dispatch.api;

import com.tessera.core.health.HealthCheckService;
import com.tessera.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("all components up is 200 UP")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                HealthStatus.up(HealthStatus.BACKEND, "openai gpt-4o-mini", Map.of()),
                HealthStatus.up("sandbox", "local", Map.of("provider", "local"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.sandbox.metadata.provider").value("local"))
                .andExpect(jsonPath("$.components.backend.metadata").doesNotExist());
    }

    @Test
    @DisplayName("an optional component down is 200 DEGRADED")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                HealthStatus.up(HealthStatus.BACKEND, "ok", Map.of()),
                HealthStatus.down("sandbox", "Docker error", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.sandbox.status").value("DOWN"));
    }

    @Test
    @DisplayName("no backend is 503 DOWN")
    void backendDown() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                HealthStatus.down(HealthStatus.BACKEND, "No reasoning backend configured", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }

    @Test
    @DisplayName("a single component can be queried, unknown names are 404")
    void component() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                HealthStatus.degraded("git", "not a repository", Map.of("dir", "/work"))));

        mockMvc.perform(get("/api/v1/health/git"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.metadata.dir").value("/work"));
        mockMvc.perform(get("/api/v1/health/database"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }
}
