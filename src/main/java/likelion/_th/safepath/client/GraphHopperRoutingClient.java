package likelion._th.safepath.client;

import com.fasterxml.jackson.databind.JsonNode;
import likelion._th.safepath.config.SafePathProperties;
import likelion._th.safepath.domain.LatLng;
import likelion._th.safepath.domain.RouteGeometry;
import likelion._th.safepath.domain.RouteGeometryResult;
import likelion._th.safepath.util.GeoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;

@Component
@Slf4j
public class GraphHopperRoutingClient implements RouteGeometryProvider {

    static final int MAX_ALTERNATIVE_PATHS = 5;

    // 이 거리(m) 안쪽으로 차이 나는 우회 경로는 중복으로 봄
    static final double DUPLICATE_DISTANCE_METERS = 50;

    private final WebClient webClient;
    private final String apiKey;
    private final SafePathProperties properties;

    public GraphHopperRoutingClient(
            @Qualifier("graphhopperClient") WebClient webClient,
            @Value("${external-api.graphhopper.api-key:}") String apiKey,
            SafePathProperties properties
    ) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.properties = properties;
    }

    /**
     * GraphHopper 도보 경로 조회 (여러 경로 생성)
     * 1. alternative_route 로 최대 5개
     * 2. 북/남쪽 경유지 우회 경로
     *    - 500m 이하 ? 중간지점 경유 : 1/3 2/3 지점 경유
     * 실제 경로만 반환, 부족한 후보는 RouteSelectionOptimizer 가 채움
     */
    @Override
    public RouteGeometryResult fetchRoutes(LatLng origin, LatLng destination) {
        int maxCandidates = properties.getRouting().getMaxCandidates();
        long start = System.currentTimeMillis();

        // 1. 기본 + 대안 경로
        List<RouteGeometry> routes;
        try {
            routes = new ArrayList<>(requestRoutes(List.of(origin, destination), true));
        } catch (RuntimeException e) {
            log.warn("GraphHopper 경로 조회 실패: {}", e.getMessage());
            return RouteGeometryResult.failure("경로 제공자 오류: " + e.getMessage());
        }

        if (routes.isEmpty()) {
            return RouteGeometryResult.failure("경로 제공자가 경로를 반환하지 않음");
        }
        log.info("GraphHopper 대안 경로 {} 개 수신", routes.size());

        // 2. 북/남쪽 우회 경로
        if (routes.size() < maxCandidates) {
            List<Double> fractions = routes.get(0).getDistanceMeters() <= 500
                    ? List.of(0.5)
                    : List.of(1.0 / 3.0, 2.0 / 3.0);
            double offset = properties.getRouting().getDetourOffsetDegrees();

            for (double direction : new double[]{offset, -offset}) {
                if (routes.size() >= maxCandidates) {
                    break;
                }
                List<LatLng> points = new ArrayList<>();
                points.add(origin);
                for (double fraction : fractions) {
                    points.add(GeoUtils.detourWaypoint(origin, destination, fraction, direction));
                }
                points.add(destination);

                try {
                    for (RouteGeometry detour : requestRoutes(points, false)) {
                        if (!isDuplicate(routes, detour)) {
                            routes.add(detour);
                            log.info("   ✓ {} 우회: {}m, {}분", direction > 0 ? "북쪽" : "남쪽",
                                    Math.round(detour.getDistanceMeters()), Math.round(detour.getDurationMinutes()));
                        }
                    }
                } catch (RuntimeException e) {
                    // 우회 경로는 없어도 됨
                    log.warn("우회 경로 조회 실패: {}", e.getMessage());
                }
            }
        }

        List<RouteGeometry> result = routes.size() > maxCandidates ? routes.subList(0, maxCandidates) : routes;
        log.info("경로 후보 {} 개 생성 (소요: {}ms)", result.size(), System.currentTimeMillis() - start);
        return RouteGeometryResult.success(result);
    }

    /**
     * GraphHopper API 단일 호출
     */
    private List<RouteGeometry> requestRoutes(List<LatLng> points, boolean alternatives) {
        Object[] pointParams = points.stream()
                .map(p -> p.getLat() + "," + p.getLng())
                .toArray();

        JsonNode response = webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/route")
                            .queryParam("point", pointParams)
                            .queryParam("profile", "foot")
                            .queryParam("locale", "en")
                            .queryParam("points_encoded", false)
                            .queryParam("key", "{key}");
                    if (alternatives) {
                        uriBuilder.queryParam("algorithm", "alternative_route")
                                .queryParam("alternative_route.max_paths", MAX_ALTERNATIVE_PATHS);
                    }
                    return uriBuilder.build(apiKey);
                })
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getFetch().getTimeout())
                .block();

        return parsePaths(response);
    }

    /**
     * GraphHopper 응답 파싱 (좌표는 [lng, lat])
     */
    static List<RouteGeometry> parsePaths(JsonNode response) {
        List<RouteGeometry> routes = new ArrayList<>();
        if (response == null || !response.has("paths")) {
            return routes;
        }

        for (JsonNode path : response.get("paths")) {
            JsonNode coords = path.path("points").path("coordinates");
            List<LatLng> line = new ArrayList<>();
            for (JsonNode coord : coords) {
                if (coord.isArray() && coord.size() >= 2) {
                    line.add(new LatLng(coord.get(1).asDouble(), coord.get(0).asDouble()));
                }
            }
            if (line.size() < 2) {
                continue;
            }
            routes.add(RouteGeometry.builder()
                    .path(line)
                    .distanceMeters(path.path("distance").asDouble())
                    // ms -> 분
                    .durationMinutes(path.path("time").asDouble() / 60_000.0)
                    .build());
        }
        return routes;
    }

    private static boolean isDuplicate(List<RouteGeometry> routes, RouteGeometry candidate) {
        return routes.stream().anyMatch(r ->
                Math.abs(r.getDistanceMeters() - candidate.getDistanceMeters()) < DUPLICATE_DISTANCE_METERS);
    }
}
