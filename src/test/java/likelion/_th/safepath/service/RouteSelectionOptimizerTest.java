package likelion._th.safepath.service;

import likelion._th.safepath.domain.RouteCandidate;
import likelion._th.safepath.exception.NoRoutesAvailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RouteSelectionOptimizer")
class RouteSelectionOptimizerTest {

    private final RouteSelectionOptimizer optimizer = new RouteSelectionOptimizer();

    private static RouteCandidate candidate(String id, double minutes, int score) {
        return RouteCandidate.builder()
                .id(id)
                .name(id)
                .durationMinutes(minutes)
                .distanceMeters(minutes * 80)
                .safetyScore(score)
                .riskFactors(List.of("existing risk"))
                .safetyGains(List.of("existing gain"))
                .build();
    }

    @Test
    @DisplayName("조건 충족 2개 → 예산 확장 후 변형 경로로 3개 채움")
    void escalatesAndPads() {
        RouteSelectionOptimizer.OptimizationResult result = optimizer.optimize(List.of(
                candidate("r1", 10, 50),
                candidate("r2", 12, 75),
                candidate("r3", 15, 90)), 3);

        RouteCandidate primary = result.getRoutes().getPrimary();
        RouteCandidate alt1 = result.getRoutes().getAlternative1();
        RouteCandidate alt2 = result.getRoutes().getAlternative2();

        assertThat(primary.getId()).isEqualTo("r3");
        assertThat(primary.getDurationMinutes()).isEqualTo(15);
        assertThat(primary.getSafetyScore()).isEqualTo(90);
        assertThat(primary.getTimeAddedMinutes()).isEqualTo(5);

        assertThat(alt1.getId()).isEqualTo("r2");
        assertThat(alt1.getSafetyScore()).isEqualTo(75);

        assertThat(alt2.getId()).isEqualTo("r3_alt2");
        assertThat(alt2.getName()).isEqualTo("r3 (Alternative 2)");
        assertThat(alt2.getDurationMinutes()).isEqualTo(17);
        assertThat(alt2.getTimeAddedMinutes()).isEqualTo(7);
        assertThat(alt2.getSafetyScore()).isEqualTo(86);
        assertThat(alt2.isSynthetic()).isTrue();

        assertThat(result.isBudgetEscalated()).isTrue();
        assertThat(result.getMaxAcceptableMinutes()).isEqualTo(15);
        assertThat(result.isBelowSafetyThreshold()).isFalse();
        assertThat(result.getAllQualifyingRoutes()).extracting(RouteCandidate::getId).containsExactly("r3", "r2");
    }

    @Test
    @DisplayName("후보 1개 → 같은 경로의 변형 2개")
    void singleCandidate() {
        RouteSelectionOptimizer.OptimizationResult result = optimizer.optimize(List.of(candidate("only", 10, 80)), 5);

        assertThat(result.getRoutes().asList())
                .extracting(RouteCandidate::getId)
                .containsExactly("only", "only_alt1", "only_alt2");
        assertThat(result.getRoutes().asList())
                .extracting(RouteCandidate::getSafetyScore)
                .containsExactly(80, 78, 76);
        assertThat(result.getRoutes().getAlternative1().getDurationMinutes()).isEqualTo(11);
        assertThat(result.isBudgetEscalated()).isTrue();
    }

    @Test
    @DisplayName("후보가 없으면 예외")
    void emptyCandidates() {
        assertThatThrownBy(() -> optimizer.optimize(List.of(), 5)).isInstanceOf(NoRoutesAvailableException.class);
        assertThatThrownBy(() -> optimizer.optimize(null, 5)).isInstanceOf(NoRoutesAvailableException.class);
    }

    @Test
    @DisplayName("안전 기준 미달뿐이면 가장 안전한 경로를 경고와 함께")
    void warningRouteWhenNothingQualifies() {
        RouteSelectionOptimizer.OptimizationResult result = optimizer.optimize(List.of(
                candidate("r1", 10, 40),
                candidate("r2", 20, 55),
                candidate("r3", 12, 55)), 5);

        RouteCandidate primary = result.getRoutes().getPrimary();
        assertThat(primary.getId()).isEqualTo("r2");
        assertThat(primary.getName()).isEqualTo("r2 (Below Safety Threshold)");
        assertThat(primary.getRiskFactors())
                .containsExactly("existing risk", RouteSelectionOptimizer.WARNING_RISK);
        assertThat(primary.getSafetyGains())
                .containsExactly("existing gain", RouteSelectionOptimizer.WARNING_GAIN);
        assertThat(primary.isBelowSafetyThreshold()).isTrue();

        assertThat(result.getRoutes().getAlternative1().getId()).isEqualTo("r2_alt1");
        assertThat(result.getRoutes().getAlternative1().isSynthetic()).isTrue();
        assertThat(result.getRoutes().getAlternative2().getSafetyScore()).isEqualTo(51);
        assertThat(result.isBelowSafetyThreshold()).isTrue();
        assertThat(result.getAllQualifyingRoutes()).isEmpty();
        assertThat(result.getTradeoffs().getRejectedUnsafeRoutes()).isEqualTo(3);
        assertThat(result.getTradeoffs().getAverageSafetyGain()).isZero();
    }

    @Test
    @DisplayName("안전 점수가 같으면 빠른 경로 우선")
    void tieBreakOnDuration() {
        RouteSelectionOptimizer.OptimizationResult result = optimizer.optimize(List.of(
                candidate("a", 12, 80),
                candidate("b", 10, 80),
                candidate("c", 11, 90),
                candidate("d", 14, 80)), 5);

        assertThat(result.getRoutes().asList())
                .extracting(RouteCandidate::getId)
                .containsExactly("c", "b", "a");
        assertThat(result.isBudgetEscalated()).isFalse();
        assertThat(result.getMaxAcceptableMinutes()).isEqualTo(15);
        assertThat(result.getAllQualifyingRoutes()).extracting(RouteCandidate::getId)
                .containsExactly("c", "b", "a", "d");
    }

    @Test
    @DisplayName("예산 경계는 포함")
    void budgetIsInclusive() {
        RouteSelectionOptimizer.OptimizationResult result = optimizer.optimize(List.of(
                candidate("fast", 10, 70),
                candidate("edge", 15, 80),
                candidate("edge2", 15, 65),
                candidate("over", 16, 85)), 5);

        assertThat(result.isBudgetEscalated()).isFalse();
        assertThat(result.getRoutes().asList())
                .extracting(RouteCandidate::getId)
                .containsExactly("edge", "fast", "edge2");
    }

    @Test
    @DisplayName("트레이드오프 분석")
    void tradeoffAnalysis() {
        RouteSelectionOptimizer.OptimizationResult result = optimizer.optimize(List.of(
                candidate("r3", 15, 90),
                candidate("r1", 10, 50),
                candidate("r2", 12, 75)), 3);

        RouteSelectionOptimizer.TradeoffAnalysis tradeoffs = result.getTradeoffs();
        assertThat(tradeoffs.getPoints())
                .extracting(RouteSelectionOptimizer.TradeoffPoint::getRouteId)
                .containsExactly("r1", "r2", "r3");
        // ((90 - 50) + (75 - 50)) / 2 = 32.5
        assertThat(tradeoffs.getAverageSafetyGain()).isEqualTo(33);
        assertThat(tradeoffs.getRejectedUnsafeRoutes()).isEqualTo(1);
    }

    @Test
    @DisplayName("변형 경로 점수는 0 미만으로 내려가지 않음")
    void variantScoreFloor() {
        RouteCandidate variant = RouteSelectionOptimizer.variant(candidate("low", 10, 3), 2);

        assertThat(variant.getSafetyScore()).isZero();
        assertThat(variant.getDurationMinutes()).isEqualTo(12);
    }
}
