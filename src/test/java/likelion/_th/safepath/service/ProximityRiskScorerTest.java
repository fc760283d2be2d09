package likelion._th.safepath.service;

import likelion._th.safepath.config.SafePathProperties;
import likelion._th.safepath.domain.Incident;
import likelion._th.safepath.domain.IncidentCategory;
import likelion._th.safepath.domain.LatLng;
import likelion._th.safepath.domain.SafetyMetrics;
import likelion._th.safepath.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

@DisplayName("ProximityRiskScorer")
class ProximityRiskScorerTest {

    private static final LatLng UNION_SQUARE = new LatLng(37.7880, -122.4075);
    // 위도 0.01도 ≈ 1.1km, 반경 밖
    private static final LatLng MARINA = new LatLng(37.8080, -122.4075);
    private static final LatLng MISSION = new LatLng(37.7680, -122.4075);

    private IncidentRepository repository;
    private ProximityRiskScorer scorer;

    @BeforeEach
    void setUp() {
        repository = mock(IncidentRepository.class);
        scorer = new ProximityRiskScorer(repository, new SafePathProperties(), Runnable::run);
    }

    private static Incident incident(String id, IncidentCategory category, Severity severity, LatLng at) {
        return Incident.builder()
                .id(id)
                .sourceId("dispatch-feed")
                .category(category)
                .severity(severity)
                .location(at)
                .occurredAt(Instant.parse("2025-10-31T18:00:00Z"))
                .description(id)
                .status("Open")
                .build();
    }

    private void incidents(boolean degraded, Incident... incidents) {
        given(repository.allIncidents())
                .willReturn(new IncidentRepository.IncidentSnapshot(List.of(incidents), degraded));
    }

    @Test
    @DisplayName("HIGH 2건 + MEDIUM 1건 → 안전 62")
    void scoresLocationFromNearbyIncidents() {
        incidents(false,
                incident("h1", IncidentCategory.CRIME, Severity.HIGH, UNION_SQUARE),
                incident("h2", IncidentCategory.CRIME, Severity.HIGH, UNION_SQUARE),
                incident("m1", IncidentCategory.ENCAMPMENT, Severity.MEDIUM, UNION_SQUARE),
                incident("far", IncidentCategory.CRIME, Severity.HIGH, MARINA));

        SafetyMetrics metrics = scorer.scoreLocation(UNION_SQUARE, 500);

        assertThat(metrics.getSafetyScore()).isEqualTo(62);
        assertThat(metrics.getCrimeScore()).isEqualTo(80);
        assertThat(metrics.getSocialScore()).isEqualTo(88);
        assertThat(metrics.getPedestrianScore()).isEqualTo(85);
        assertThat(metrics.getIncidents()).extracting(Incident::getId).containsExactly("h1", "h2", "m1");
        assertThat(metrics.isApproximate()).isFalse();
    }

    @Test
    @DisplayName("기본 반경은 500m")
    void defaultLocationRadius() {
        // 위도 0.004도 ≈ 445m
        incidents(false,
                incident("inside", IncidentCategory.CRIME, Severity.LOW, new LatLng(37.7920, -122.4075)),
                incident("outside", IncidentCategory.CRIME, Severity.LOW, new LatLng(37.7930, -122.4075)));

        SafetyMetrics metrics = scorer.scoreLocation(UNION_SQUARE);

        assertThat(metrics.getIncidents()).extracting(Incident::getId).containsExactly("inside");
        assertThat(metrics.getSafetyScore()).isEqualTo(97);
    }

    @Test
    @DisplayName("사건이 아무리 많아도 점수는 0 이상")
    void scoresAreClamped() {
        Incident[] many = IntStream.range(0, 1000)
                .mapToObj(i -> incident("h" + i, IncidentCategory.AGGRESSIVE_BEHAVIOR, Severity.HIGH, UNION_SQUARE))
                .toArray(Incident[]::new);
        incidents(false, many);

        SafetyMetrics metrics = scorer.scoreLocation(UNION_SQUARE, 500);

        assertThat(metrics.getSafetyScore()).isZero();
        assertThat(metrics.getCrimeScore()).isEqualTo(100);
        assertThat(metrics.getSocialScore()).isZero();
        assertThat(metrics.getPedestrianScore()).isZero();
    }

    @Test
    @DisplayName("소스 일부가 실패하면 approximate")
    void degradedSnapshotIsApproximate() {
        incidents(true);

        SafetyMetrics metrics = scorer.scoreLocation(UNION_SQUARE, 500);

        assertThat(metrics.getSafetyScore()).isEqualTo(100);
        assertThat(metrics.isApproximate()).isTrue();
    }

    @Test
    @DisplayName("빈 경로 → 85점 기본값")
    void emptyPathIsNeutral() {
        SafetyMetrics metrics = scorer.scoreRoute(List.of());

        assertThat(metrics).isEqualTo(SafetyMetrics.neutral());
        assertThat(metrics.getIncidents()).isEmpty();
    }

    @Test
    @DisplayName("5개 간격으로 샘플링해 평균")
    void averagesSampledPoints() {
        incidents(false,
                incident("h1", IncidentCategory.CRIME, Severity.HIGH, UNION_SQUARE),
                incident("h2", IncidentCategory.CRIME, Severity.HIGH, UNION_SQUARE),
                incident("m1", IncidentCategory.ENCAMPMENT, Severity.MEDIUM, UNION_SQUARE),
                incident("skipped", IncidentCategory.CRIME, Severity.HIGH, MISSION));

        // 0 번째(유니언 스퀘어)와 5 번째(마리나)만 샘플, 1~4 번째(미션)는 건너뜀
        List<LatLng> path = new ArrayList<>();
        path.add(UNION_SQUARE);
        for (int i = 0; i < 4; i++) {
            path.add(MISSION);
        }
        path.add(MARINA);

        SafetyMetrics metrics = scorer.scoreRoute(path);

        assertThat(metrics.getSafetyScore()).isEqualTo(81);
        assertThat(metrics.getCrimeScore()).isEqualTo(90);
        assertThat(metrics.getSocialScore()).isEqualTo(94);
        // (85 + 100) / 2 = 92.5 → 93
        assertThat(metrics.getPedestrianScore()).isEqualTo(93);
        assertThat(metrics.getIncidents()).extracting(Incident::getId).containsExactly("h1", "h2", "m1");
    }

    @Test
    @DisplayName("여러 샘플에 걸친 사건은 한 번만")
    void incidentsAreUnionedAcrossSamples() {
        incidents(false, incident("h1", IncidentCategory.CRIME, Severity.HIGH, UNION_SQUARE));

        SafetyMetrics metrics = scorer.scoreRoute(List.of(UNION_SQUARE, UNION_SQUARE, UNION_SQUARE,
                UNION_SQUARE, UNION_SQUARE, UNION_SQUARE));

        assertThat(metrics.getSafetyScore()).isEqualTo(85);
        assertThat(metrics.getIncidents()).extracting(Incident::getId).containsExactly("h1");
    }

    @Test
    @DisplayName("샘플 실패는 평균에서 제외하고 approximate")
    void failedSamplesAreLeftOut() {
        given(repository.allIncidents())
                .willReturn(new IncidentRepository.IncidentSnapshot(
                        List.of(incident("h1", IncidentCategory.CRIME, Severity.HIGH, UNION_SQUARE)), false))
                .willThrow(new IllegalStateException("boom"));

        SafetyMetrics metrics = scorer.scoreRoute(List.of(UNION_SQUARE, MISSION, MISSION, MISSION, MISSION, MARINA));

        assertThat(metrics.getSafetyScore()).isEqualTo(85);
        assertThat(metrics.isApproximate()).isTrue();
    }

    @Test
    @DisplayName("모든 샘플 실패 → 85점 approximate")
    void allSamplesFailing() {
        given(repository.allIncidents()).willThrow(new IllegalStateException("boom"));

        SafetyMetrics metrics = scorer.scoreRoute(List.of(UNION_SQUARE, MARINA));

        assertThat(metrics).isEqualTo(SafetyMetrics.neutralApproximate());
    }

    @Test
    @DisplayName("샘플링 간격")
    void samplePoints() {
        List<LatLng> path = IntStream.range(0, 12)
                .mapToObj(i -> new LatLng(37.78 + i * 0.0001, -122.41))
                .collect(Collectors.toList());

        assertThat(ProximityRiskScorer.samplePoints(path, 5))
                .containsExactly(path.get(0), path.get(5), path.get(10));
        assertThat(ProximityRiskScorer.samplePoints(path.subList(0, 3), 5)).containsExactly(path.get(0));
        assertThat(ProximityRiskScorer.samplePoints(path.subList(0, 2), 0)).containsExactly(path.get(0), path.get(1));
    }
}
