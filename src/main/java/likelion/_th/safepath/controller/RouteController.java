package likelion._th.safepath.controller;

import jakarta.validation.Valid;
import likelion._th.safepath.domain.SafetyMetrics;
import likelion._th.safepath.dto.request.CompareRoutesRequest;
import likelion._th.safepath.dto.request.RouteSearchRequest;
import likelion._th.safepath.dto.request.ScoreRouteRequest;
import likelion._th.safepath.dto.response.RouteSearchResponse;
import likelion._th.safepath.service.RouteFeatureScorer;
import likelion._th.safepath.service.SafePathService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/routes")
@RequiredArgsConstructor
public class RouteController {

    public static final String SESSION_HEADER = "X-Session-Id";

    private final SafePathService safePathService;
    private final RouteFeatureScorer routeFeatureScorer;

    @PostMapping
    public ResponseEntity<RouteSearchResponse> searchRoutes(
            @Valid @RequestBody RouteSearchRequest request,
            @RequestHeader(value = SESSION_HEADER, required = false) String sessionId
    ) {
        return ResponseEntity.ok(safePathService.optimizeRoute(request, sessionId));
    }

    @PostMapping("/score")
    public ResponseEntity<SafetyMetrics> scoreRoute(
            @Valid @RequestBody ScoreRouteRequest request
    ) {
        return ResponseEntity.ok(safePathService.scoreRoute(request.getPath()));
    }

    @PostMapping("/compare")
    public ResponseEntity<RouteFeatureScorer.RouteComparison> compareRoutes(
            @Valid @RequestBody CompareRoutesRequest request
    ) {
        return ResponseEntity.ok(routeFeatureScorer.compare(request.getRouteA(), request.getRouteB()));
    }

    // 현재 가중치 기준 특성 중요도
    @GetMapping("/model/importance")
    public ResponseEntity<List<RouteFeatureScorer.FeatureImportance>> featureImportance() {
        return ResponseEntity.ok(routeFeatureScorer.featureImportance());
    }
}
