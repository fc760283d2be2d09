package likelion._th.safepath.controller;

import likelion._th.safepath.domain.Incident;
import likelion._th.safepath.domain.IncidentCategory;
import likelion._th.safepath.domain.LatLng;
import likelion._th.safepath.domain.SafetyMetrics;
import likelion._th.safepath.domain.Severity;
import likelion._th.safepath.service.IncidentRepository;
import likelion._th.safepath.service.SafePathService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("SafetyDataController")
class SafetyDataControllerTest {

    private static final Instant NOW = Instant.parse("2025-10-31T19:00:00Z");

    private SafePathService safePathService;
    private IncidentRepository incidentRepository;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        safePathService = mock(SafePathService.class);
        incidentRepository = mock(IncidentRepository.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new SafetyDataController(safePathService, incidentRepository,
                        Clock.fixed(NOW, ZoneOffset.UTC)))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("최근 사건 (기본값 48시간, 100건)")
    void recentIncidentsDefaults() throws Exception {
        given(safePathService.recentIncidents(48, 100)).willReturn(List.of(Incident.builder()
                .id("C1")
                .sourceId("dispatch-feed")
                .category(IncidentCategory.CRIME)
                .severity(Severity.HIGH)
                .location(new LatLng(37.78, -122.41))
                .occurredAt(NOW)
                .description("Robbery")
                .status("Active")
                .build()));

        mockMvc.perform(get("/api/v1/incidents/recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("C1"))
                .andExpect(jsonPath("$[0].category").value("crime"))
                .andExpect(jsonPath("$[0].location.lat").value(37.78));
    }

    @Test
    @DisplayName("최근 사건 조회 파라미터 전달")
    void recentIncidentsParameters() throws Exception {
        given(safePathService.recentIncidents(6, 5)).willReturn(List.of());

        mockMvc.perform(get("/api/v1/incidents/recent").param("maxAgeHours", "6").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("지점 안전 점수")
    void locationSafety() throws Exception {
        given(safePathService.scoreLocation(new LatLng(37.78, -122.41))).willReturn(SafetyMetrics.builder()
                .safetyScore(62)
                .crimeScore(80)
                .socialScore(88)
                .pedestrianScore(85)
                .build());

        mockMvc.perform(get("/api/v1/safety/location").param("lat", "37.78").param("lng", "-122.41"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.safetyScore").value(62))
                .andExpect(jsonPath("$.crimeScore").value(80));
    }

    @Test
    @DisplayName("좌표 누락 → 400")
    void locationSafetyRequiresCoordinates() throws Exception {
        mockMvc.perform(get("/api/v1/safety/location").param("lat", "37.78"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("모든 소스가 신선하면 healthy")
    void healthy() throws Exception {
        given(incidentRepository.sourceStatus()).willReturn(List.of(
                new IncidentRepository.SourceStatus("311-feed", 12, NOW, false),
                new IncidentRepository.SourceStatus("dispatch-feed", 3, NOW, false)));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.sources.length()").value(2))
                .andExpect(jsonPath("$.sources[0].incidentCount").value(12));
    }

    @Test
    @DisplayName("오래된 소스가 있으면 degraded")
    void degraded() throws Exception {
        given(incidentRepository.sourceStatus()).willReturn(List.of(
                new IncidentRepository.SourceStatus("311-feed", 12, NOW, false),
                new IncidentRepository.SourceStatus("dispatch-feed", 0, null, true)));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"));
    }
}
