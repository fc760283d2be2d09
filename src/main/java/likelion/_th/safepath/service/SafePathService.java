package likelion._th.safepath.service;

import likelion._th.safepath.client.GeocodingProvider;
import likelion._th.safepath.client.RouteGeometryProvider;
import likelion._th.safepath.config.SafePathProperties;
import likelion._th.safepath.domain.Incident;
import likelion._th.safepath.domain.IncidentCategory;
import likelion._th.safepath.domain.LatLng;
import likelion._th.safepath.domain.RouteCandidate;
import likelion._th.safepath.domain.RouteGeometry;
import likelion._th.safepath.domain.RouteGeometryResult;
import likelion._th.safepath.domain.SafetyMetrics;
import likelion._th.safepath.dto.request.RouteSearchRequest;
import likelion._th.safepath.dto.response.RouteInfo;
import likelion._th.safepath.dto.response.RouteSearchResponse;
import likelion._th.safepath.exception.NoGeocodingResultException;
import likelion._th.safepath.exception.NoRoutesAvailableException;
import likelion._th.safepath.exception.RouteRequestSupersededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
// 경로 추천
public class SafePathService {

    static final int BUSY_ROUTE_INCIDENTS = 5;
    static final int WELL_TRAVELED_SCORE = 80;

    private final GeocodingProvider geocodingProvider;
    private final RouteGeometryProvider routeGeometryProvider;
    private final ProximityRiskScorer proximityRiskScorer;
    private final TimeOfDayRiskAssessor timeOfDayRiskAssessor;
    private final RouteSelectionOptimizer routeSelectionOptimizer;
    private final IncidentRepository incidentRepository;
    private final SafePathProperties properties;

    // AsyncConfig 의 routeExecutor (경로별 점수 계산)
    @Qualifier("routeExecutor")
    private final Executor routeExecutor;

    // 세션별 진행 중인 요청
    private final ConcurrentMap<String, RequestTicket> activeRequests = new ConcurrentHashMap<>();

    public RouteSearchResponse optimizeRoute(RouteSearchRequest request) {
        return optimizeRoute(request, null);
    }

    /**
     * 안전 경로 3개 추천
     *
     * @param sessionId 같은 세션의 새 요청이 들어오면 이전 요청은 중단된다 (null 이면 중단 없음)
     * @throws NoGeocodingResultException     주소를 좌표로 바꿀 수 없음
     * @throws NoRoutesAvailableException     경로 API 가 경로를 주지 않음
     * @throws RouteRequestSupersededException 같은 세션의 더 새로운 요청으로 대체됨
     */
    public RouteSearchResponse optimizeRoute(RouteSearchRequest request, String sessionId) {
        RequestTicket ticket = register(sessionId);
        try {
            return runPipeline(request, ticket);
        } finally {
            if (ticket.sessionId != null) {
                activeRequests.remove(ticket.sessionId, ticket);
            }
        }
    }

    public SafetyMetrics scoreRoute(List<LatLng> path) {
        return proximityRiskScorer.scoreRoute(path);
    }

    public SafetyMetrics scoreLocation(LatLng point) {
        return proximityRiskScorer.scoreLocation(point);
    }

    public List<Incident> recentIncidents(int maxAgeHours, int limit) {
        return incidentRepository.recentIncidents(maxAgeHours, limit);
    }

    private RouteSearchResponse runPipeline(RouteSearchRequest request, RequestTicket ticket) {
        long totalStart = System.currentTimeMillis();

        // ---------------------------------------------------------------------
        // 1. 출발지/도착지 좌표 확정
        // ---------------------------------------------------------------------
        LatLng origin = request.hasStartCoordinates()
                ? new LatLng(request.getStartLat(), request.getStartLng())
                : geocode(request.getOrigin());
        ticket.checkActive();
        LatLng destination = request.hasEndCoordinates()
                ? new LatLng(request.getEndLat(), request.getEndLng())
                : geocode(request.getDestination());
        ticket.checkActive();

        log.info("경로 추천 시작: ({},{}) → ({},{}), 추가 시간 {}분",
                origin.getLat(), origin.getLng(), destination.getLat(), destination.getLng(),
                request.maxExtraTimeOrDefault());

        // ---------------------------------------------------------------------
        // 2. 경로 API 로 후보 형상 조회
        // ---------------------------------------------------------------------
        long routingStart = System.currentTimeMillis();
        RouteGeometryResult geometries = routeGeometryProvider.fetchRoutes(origin, destination);
        if (geometries.isFailed() || geometries.isEmpty()) {
            throw new NoRoutesAvailableException(geometries.isFailed()
                    ? "경로 조회 실패: " + geometries.getFailureReason()
                    : "출발지와 도착지 사이 도보 경로 없음");
        }
        List<RouteGeometry> routes = geometries.getRoutes();
        long routingEnd = System.currentTimeMillis();
        ticket.checkActive();

        // ---------------------------------------------------------------------
        // 3. 각 경로 안전 점수를 CompletableFuture 로 병렬 계산
        // ---------------------------------------------------------------------
        long scoringStart = System.currentTimeMillis();
        long routeTimeoutMillis = properties.getFetch().getTimeout().multipliedBy(3).toMillis();

        List<CompletableFuture<SafetyMetrics>> futures = new ArrayList<>();
        for (int i = 0; i < routes.size(); i++) {
            RouteGeometry route = routes.get(i);
            String routeId = routeId(i);
            CompletableFuture<SafetyMetrics> future = CompletableFuture
                    .supplyAsync(() -> proximityRiskScorer.scoreRoute(route.getPath()), routeExecutor)
                    .orTimeout(routeTimeoutMillis, TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        // 점수 계산 실패 시 기본값으로 폴백
                        log.warn("경로 점수 계산 실패: routeId={}, {}", routeId, e.getMessage());
                        return SafetyMetrics.neutralApproximate();
                    });
            ticket.track(future);
            futures.add(future);
        }

        List<SafetyMetrics> metrics = new ArrayList<>();
        try {
            for (CompletableFuture<SafetyMetrics> future : futures) {
                metrics.add(future.join());
            }
        } catch (CancellationException | CompletionException e) {
            ticket.checkActive();
            throw e;
        }
        long scoringEnd = System.currentTimeMillis();
        ticket.checkActive();

        // ---------------------------------------------------------------------
        // 4. 후보 생성 (시간대 보정) 후 3개 선택
        // ---------------------------------------------------------------------
        TimeOfDayRiskAssessor.TimeOfDayRisk timeRisk = timeOfDayRiskAssessor.assessNow();
        double fastest = routes.stream().mapToDouble(RouteGeometry::getDurationMinutes).min().orElse(0);

        List<RouteCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < routes.size(); i++) {
            candidates.add(toCandidate(i, routes.get(i), metrics.get(i), timeRisk, fastest));
        }

        RouteSelectionOptimizer.OptimizationResult result =
                routeSelectionOptimizer.optimize(candidates, request.maxExtraTimeOrDefault());

        boolean approximate = metrics.stream().anyMatch(SafetyMetrics::isApproximate);
        long totalEnd = System.currentTimeMillis();

        log.info("경로 추천 완료: 후보 {} 개 → 추천 {} (안전 {}점) | 전체 소요시간: {}ms (경로: {}ms, 점수: {}ms){}",
                candidates.size(),
                result.getRoutes().getPrimary().getId(),
                result.getRoutes().getPrimary().getSafetyScore(),
                (totalEnd - totalStart),
                (routingEnd - routingStart),
                (scoringEnd - scoringStart),
                approximate ? " [approximate]" : "");

        return RouteSearchResponse.builder()
                .message(result.isBelowSafetyThreshold() ? "안전 기준을 만족하는 경로가 없습니다" : "경로 추천 성공")
                .primary(toRouteInfo(result.getRoutes().getPrimary(), true))
                .alternative1(toRouteInfo(result.getRoutes().getAlternative1(), false))
                .alternative2(toRouteInfo(result.getRoutes().getAlternative2(), false))
                .allQualifyingRoutes(result.getAllQualifyingRoutes().stream()
                        .map(c -> toRouteInfo(c, c.getId().equals(result.getRoutes().getPrimary().getId())))
                        .collect(Collectors.toList()))
                .tradeoffs(result.getTradeoffs())
                .budgetEscalated(result.isBudgetEscalated())
                .maxAcceptableMinutes(result.getMaxAcceptableMinutes())
                .approximate(approximate)
                .nightTime(timeRisk.isNight())
                .originCoords(origin)
                .destCoords(destination)
                .build();
    }

    private LatLng geocode(String address) {
        return geocodingProvider.geocode(address)
                .orElseThrow(() -> new NoGeocodingResultException(address));
    }

    // 경로 형상 + 안전 점수 + 시간대 → 후보
    private RouteCandidate toCandidate(int index,
                                       RouteGeometry route,
                                       SafetyMetrics metrics,
                                       TimeOfDayRiskAssessor.TimeOfDayRisk timeRisk,
                                       double fastestMinutes) {
        int safetyScore = Math.max(0, Math.min(100, metrics.getSafetyScore() - timeRisk.getPenalty()));
        List<Incident> incidents = metrics.getIncidents();

        List<String> riskFactors = new ArrayList<>();
        if (incidents.size() > BUSY_ROUTE_INCIDENTS) {
            riskFactors.add(incidents.size() + " recent incidents nearby");
        }
        Map<IncidentCategory, Long> byCategory = incidents.stream()
                .collect(Collectors.groupingBy(Incident::getCategory, () -> new EnumMap<>(IncidentCategory.class),
                        Collectors.counting()));
        byCategory.forEach((category, count) -> riskFactors.add(count + " " + category.getCode() + " reports"));
        riskFactors.addAll(timeRisk.getRiskFactors());
        if (metrics.isApproximate()) {
            riskFactors.add("Safety data partially unavailable");
        }

        List<String> safetyGains = new ArrayList<>();
        if (safetyScore >= WELL_TRAVELED_SCORE) {
            safetyGains.add("Well-traveled route");
        }
        if (incidents.isEmpty()) {
            safetyGains.add("Avoids all reported incidents");
        }
        safetyGains.addAll(timeRisk.getSafetyGains());

        return RouteCandidate.builder()
                .id(routeId(index))
                .name("Route " + (index + 1))
                .path(route.getPath())
                .distanceMeters(route.getDistanceMeters())
                .durationMinutes(route.getDurationMinutes())
                .safetyScore(safetyScore)
                .timeAddedMinutes(route.getDurationMinutes() - fastestMinutes)
                .riskFactors(riskFactors)
                .safetyGains(safetyGains)
                .build();
    }

    private RouteInfo toRouteInfo(RouteCandidate candidate, boolean isRecommended) {
        return RouteInfo.builder()
                .id(candidate.getId())
                .name(candidate.getName())
                .time(Math.round(candidate.getDurationMinutes() * 10.0) / 10.0)
                .distance((int) Math.round(candidate.getDistanceMeters()))
                .polyline(candidate.getPath())
                .safetyScore(candidate.getSafetyScore())
                .timeAdded(Math.round(candidate.getTimeAddedMinutes() * 10.0) / 10.0)
                .summaryGrade(toSummaryGrade(candidate.getSafetyScore()))
                .riskFactors(candidate.getRiskFactors())
                .safetyGains(candidate.getSafetyGains())
                .recommended(isRecommended)
                .synthetic(candidate.isSynthetic())
                .belowSafetyThreshold(candidate.isBelowSafetyThreshold())
                .build();
    }

    private static String routeId(int index) {
        return "route-" + (index + 1);
    }

    /**
     * 점수 → 등급 문자열 변환
     * 예) 96 → "A (96점)"
     */
    static String toSummaryGrade(double score) {
        String grade;
        if (score >= 90) {
            grade = "A";
        } else if (score >= 75) {
            grade = "B";
        } else if (score >= 60) {
            grade = "C";
        } else if (score >= 40) {
            grade = "D";
        } else {
            grade = "E";
        }
        int roundedScore = (int) Math.round(score);
        return String.format("%s (%d점)", grade, roundedScore);
    }

    // ================== 세션별 요청 대체 ==================

    private RequestTicket register(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return new RequestTicket(null);
        }
        RequestTicket ticket = new RequestTicket(sessionId);
        RequestTicket previous = activeRequests.put(sessionId, ticket);
        if (previous != null) {
            log.info("세션 {} 의 이전 경로 요청 중단", sessionId);
            previous.supersede();
        }
        return ticket;
    }

    /**
     * In-flight request of one session. Superseding it cancels its pending
     * scoring futures; the pipeline notices at its next checkpoint. Only the
     * request is abandoned, the incident cache is keyed by source and untouched.
     */
    private static final class RequestTicket {
        private final String sessionId;
        private final List<CompletableFuture<?>> pending = new CopyOnWriteArrayList<>();
        private volatile boolean superseded;

        private RequestTicket(String sessionId) {
            this.sessionId = sessionId;
        }

        void track(CompletableFuture<?> future) {
            pending.add(future);
            if (superseded) {
                future.cancel(true);
            }
        }

        void supersede() {
            superseded = true;
            pending.forEach(f -> f.cancel(true));
        }

        void checkActive() {
            if (superseded) {
                throw new RouteRequestSupersededException(sessionId);
            }
        }
    }
}
