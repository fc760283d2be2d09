package likelion._th.safepath.service;

import likelion._th.safepath.config.SafePathProperties;
import likelion._th.safepath.domain.Incident;
import likelion._th.safepath.domain.IncidentCategory;
import likelion._th.safepath.domain.LatLng;
import likelion._th.safepath.domain.SafetyMetrics;
import likelion._th.safepath.domain.Severity;
import likelion._th.safepath.util.GeoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Turns incidents near a point into bounded scores, and a route into the
 * average of its sampled points.
 */
@Service
@Slf4j
public class ProximityRiskScorer {

    // 사건 1건당 감점
    static final int HIGH_PENALTY = 15;
    static final int MEDIUM_PENALTY = 8;
    static final int LOW_PENALTY = 3;
    static final int CRIME_PENALTY = 10;
    static final int SOCIAL_PENALTY = 12;
    static final int PEDESTRIAN_PENALTY = 5;

    private final IncidentRepository incidentRepository;
    private final SafePathProperties properties;
    private final Executor scoringExecutor;

    public ProximityRiskScorer(IncidentRepository incidentRepository,
                               SafePathProperties properties,
                               @Qualifier("scoringExecutor") Executor scoringExecutor) {
        this.incidentRepository = incidentRepository;
        this.properties = properties;
        this.scoringExecutor = scoringExecutor;
    }

    // 기본 반경 (scoring.location-radius-meters)
    public SafetyMetrics scoreLocation(LatLng point) {
        return scoreLocation(point, properties.getScoring().getLocationRadiusMeters());
    }

    public SafetyMetrics scoreLocation(LatLng point, double radiusMeters) {
        IncidentRepository.IncidentSnapshot snapshot = incidentRepository.allIncidents();

        List<Incident> nearby = snapshot.getIncidents().stream()
                .filter(i -> GeoUtils.withinRadius(i.getLocation(), point, radiusMeters))
                .collect(Collectors.toList());

        long high = nearby.stream().filter(i -> i.getSeverity() == Severity.HIGH).count();
        long medium = nearby.stream().filter(i -> i.getSeverity() == Severity.MEDIUM).count();
        long low = nearby.stream().filter(i -> i.getSeverity() == Severity.LOW).count();
        long crime = nearby.stream().filter(i -> i.getCategory() == IncidentCategory.CRIME).count();
        long social = nearby.stream().filter(i -> i.getCategory().isSocial()).count();

        return SafetyMetrics.builder()
                .safetyScore(clamp(100 - HIGH_PENALTY * high - MEDIUM_PENALTY * medium - LOW_PENALTY * low))
                .crimeScore(clamp(100 - CRIME_PENALTY * crime))
                .socialScore(clamp(100 - SOCIAL_PENALTY * social))
                .pedestrianScore(clamp(100 - PEDESTRIAN_PENALTY * (long) nearby.size()))
                .incidents(List.copyOf(nearby))
                .approximate(snapshot.isDegraded())
                .build();
    }

    /**
     * Scores every {@code sample-stride}-th point of the path (the first
     * point always included) within the route radius and averages the four
     * scores. Samples are scored concurrently; a sample that fails or times
     * out is left out of the average. An empty path yields the neutral 85s.
     */
    public SafetyMetrics scoreRoute(List<LatLng> path) {
        if (path == null || path.isEmpty()) {
            return SafetyMetrics.neutral();
        }

        List<LatLng> samples = samplePoints(path, properties.getScoring().getSampleStride());
        double radius = properties.getScoring().getRouteRadiusMeters();
        long timeoutMillis = properties.getFetch().getTimeout().plusSeconds(2).toMillis();

        List<CompletableFuture<SafetyMetrics>> futures = new ArrayList<>();
        for (LatLng sample : samples) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> scoreLocation(sample, radius), scoringExecutor)
                    .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.warn("샘플 지점 점수 계산 실패 ({}): {}", sample, e.getMessage());
                        return null;
                    }));
        }

        List<SafetyMetrics> scored = futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        if (scored.isEmpty()) {
            // 모든 샘플 실패
            return SafetyMetrics.neutralApproximate();
        }

        Map<String, Incident> union = new LinkedHashMap<>();
        for (SafetyMetrics metrics : scored) {
            for (Incident incident : metrics.getIncidents()) {
                union.putIfAbsent(incident.getId(), incident);
            }
        }

        boolean approximate = scored.size() < samples.size()
                || scored.stream().anyMatch(SafetyMetrics::isApproximate);

        return SafetyMetrics.builder()
                .safetyScore(average(scored, SafetyMetrics::getSafetyScore))
                .crimeScore(average(scored, SafetyMetrics::getCrimeScore))
                .socialScore(average(scored, SafetyMetrics::getSocialScore))
                .pedestrianScore(average(scored, SafetyMetrics::getPedestrianScore))
                .incidents(List.copyOf(union.values()))
                .approximate(approximate)
                .build();
    }

    // index % stride == 0 인 지점 (첫 지점 포함)
    static List<LatLng> samplePoints(List<LatLng> path, int stride) {
        int step = Math.max(1, stride);
        List<LatLng> samples = new ArrayList<>();
        for (int i = 0; i < path.size(); i += step) {
            samples.add(path.get(i));
        }
        if (samples.isEmpty() && !path.isEmpty()) {
            samples.add(path.get(0));
        }
        return samples;
    }

    // 정수 반올림 (half-up)
    private static int average(List<SafetyMetrics> metrics, ToIntFunction<SafetyMetrics> score) {
        double mean = metrics.stream().mapToInt(score).average().orElse(SafetyMetrics.NEUTRAL_SCORE);
        return (int) Math.floor(mean + 0.5);
    }

    private static int clamp(long score) {
        return (int) Math.max(0, Math.min(100, score));
    }
}
