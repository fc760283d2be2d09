package likelion._th.safepath.controller;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import likelion._th.safepath.domain.Incident;
import likelion._th.safepath.domain.LatLng;
import likelion._th.safepath.domain.SafetyMetrics;
import likelion._th.safepath.dto.response.HealthResponse;
import likelion._th.safepath.service.IncidentRepository;
import likelion._th.safepath.service.SafePathService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
// 사건 데이터 조회 / 캐시 상태
public class SafetyDataController {

    private final SafePathService safePathService;
    private final IncidentRepository incidentRepository;
    private final Clock clock;

    @GetMapping("/incidents/recent")
    public ResponseEntity<List<Incident>> recentIncidents(
            @RequestParam(defaultValue = "48") @Min(1) @Max(24 * 30) int maxAgeHours,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit
    ) {
        return ResponseEntity.ok(safePathService.recentIncidents(maxAgeHours, limit));
    }

    // 한 지점 주변 안전 점수
    @GetMapping("/safety/location")
    public ResponseEntity<SafetyMetrics> locationSafety(
            @RequestParam @DecimalMin("-90") @DecimalMax("90") double lat,
            @RequestParam @DecimalMin("-180") @DecimalMax("180") double lng
    ) {
        return ResponseEntity.ok(safePathService.scoreLocation(new LatLng(lat, lng)));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        List<IncidentRepository.SourceStatus> sources = incidentRepository.sourceStatus();
        boolean allFresh = sources.stream().noneMatch(IncidentRepository.SourceStatus::isStale);
        return ResponseEntity.ok(HealthResponse.builder()
                .status(allFresh ? "healthy" : "degraded")
                .sources(sources)
                .timestamp(clock.instant())
                .build());
    }
}
