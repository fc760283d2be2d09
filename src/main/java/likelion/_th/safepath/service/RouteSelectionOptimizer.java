package likelion._th.safepath.service;

import likelion._th.safepath.domain.RankedRouteSet;
import likelion._th.safepath.domain.RouteCandidate;
import likelion._th.safepath.exception.NoRoutesAvailableException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks three routes out of the scored candidates under a time budget.
 *
 * <ol>
 *   <li>Fastest = first candidate with the minimal duration.</li>
 *   <li>Qualify: safety score at least {@value #CAUTION_THRESHOLD} and duration within
 *       fastest + max extra minutes.</li>
 *   <li>Fewer than three qualify: widen the budget by {@value #BUDGET_ESCALATION_MINUTES}
 *       minutes, once.</li>
 *   <li>Rank by safety descending, then duration ascending.</li>
 *   <li>Fill missing slots with variants of the best route (+N minutes, -2N safety).</li>
 * </ol>
 *
 * Nothing qualifying even after escalation yields a warning route built
 * from the safest candidate regardless of time.
 */
@Service
@Slf4j
public class RouteSelectionOptimizer {

    public static final int CAUTION_THRESHOLD = 60;
    public static final int BUDGET_ESCALATION_MINUTES = 2;
    static final int SLOTS = 3;

    static final String WARNING_SUFFIX = " (Below Safety Threshold)";
    static final String WARNING_RISK = "No safe routes found - consider alternative transport";
    static final String WARNING_GAIN = "This is the least dangerous option available";

    private static final Comparator<RouteCandidate> RANKING =
            Comparator.comparingInt(RouteCandidate::getSafetyScore).reversed()
                    .thenComparingDouble(RouteCandidate::getDurationMinutes);

    public OptimizationResult optimize(List<RouteCandidate> candidates, double maxExtraTimeMinutes) {
        if (candidates == null || candidates.isEmpty()) {
            throw new NoRoutesAvailableException("최적화할 후보 경로 없음");
        }

        // 1. 가장 빠른 경로 (동률이면 먼저 들어온 것)
        RouteCandidate fastest = candidates.get(0);
        for (RouteCandidate candidate : candidates) {
            if (candidate.getDurationMinutes() < fastest.getDurationMinutes()) {
                fastest = candidate;
            }
        }
        double fastestDuration = fastest.getDurationMinutes();

        List<RouteCandidate> normalized = candidates.stream()
                .map(c -> c.toBuilder().timeAddedMinutes(c.getDurationMinutes() - fastestDuration).build())
                .collect(Collectors.toList());

        // 2. 시간 예산 안의 안전한 경로
        double budget = fastestDuration + maxExtraTimeMinutes;
        List<RouteCandidate> qualifying = qualify(normalized, budget);

        // 3. 3개 미만이면 예산을 한 번만 늘림
        boolean escalated = false;
        if (qualifying.size() < SLOTS) {
            budget += BUDGET_ESCALATION_MINUTES;
            qualifying = qualify(normalized, budget);
            escalated = true;
        }

        // 4. 안전 점수 내림차순, 시간 오름차순 (안정 정렬)
        List<RouteCandidate> ranked = new ArrayList<>(qualifying);
        ranked.sort(RANKING);

        RankedRouteSet routes;
        boolean belowThreshold = false;
        if (ranked.isEmpty()) {
            RouteCandidate warning = warningRoute(normalized);
            routes = new RankedRouteSet(warning, variant(warning, 1), variant(warning, 2));
            belowThreshold = true;
            log.warn("안전 기준({}) 이상 경로 없음 → 경고 경로 반환: {}", CAUTION_THRESHOLD, warning.getId());
        } else {
            RouteCandidate primary = ranked.get(0);
            routes = new RankedRouteSet(
                    primary,
                    ranked.size() > 1 ? ranked.get(1) : variant(primary, 1),
                    ranked.size() > 2 ? ranked.get(2) : variant(primary, 2));
        }

        log.info("경로 선택 완료: 후보 {} 개, 조건 충족 {} 개, 예산 {}분{}, 추천={}",
                candidates.size(), ranked.size(), budget, escalated ? " (확장)" : "", routes.getPrimary().getId());

        return OptimizationResult.builder()
                .routes(routes)
                .allQualifyingRoutes(List.copyOf(ranked))
                .budgetEscalated(escalated)
                .maxAcceptableMinutes(budget)
                .belowSafetyThreshold(belowThreshold)
                .tradeoffs(analyzeTradeoffs(normalized, ranked, fastest))
                .build();
    }

    private static List<RouteCandidate> qualify(List<RouteCandidate> candidates, double maxAcceptableMinutes) {
        return candidates.stream()
                .filter(c -> c.getSafetyScore() >= CAUTION_THRESHOLD)
                .filter(c -> c.getDurationMinutes() <= maxAcceptableMinutes)
                .collect(Collectors.toList());
    }

    /**
     * Padding variant of a real route: N minutes slower and 2N safety points
     * lower, named so the three slots stay distinguishable.
     */
    static RouteCandidate variant(RouteCandidate base, int n) {
        return base.toBuilder()
                .id(base.getId() + "_alt" + n)
                .name(base.getName() + " (Alternative " + n + ")")
                .durationMinutes(base.getDurationMinutes() + n)
                .timeAddedMinutes(base.getTimeAddedMinutes() + n)
                .safetyScore(Math.max(0, base.getSafetyScore() - 2 * n))
                .synthetic(true)
                .build();
    }

    // 시간 예산을 무시한 가장 안전한 경로 (동률이면 먼저 들어온 것)
    private static RouteCandidate warningRoute(List<RouteCandidate> candidates) {
        RouteCandidate safest = candidates.get(0);
        for (RouteCandidate candidate : candidates) {
            if (candidate.getSafetyScore() > safest.getSafetyScore()) {
                safest = candidate;
            }
        }

        List<String> riskFactors = new ArrayList<>(safest.getRiskFactors());
        riskFactors.add(WARNING_RISK);
        List<String> safetyGains = new ArrayList<>(safest.getSafetyGains());
        safetyGains.add(WARNING_GAIN);

        return safest.toBuilder()
                .name(safest.getName() + WARNING_SUFFIX)
                .riskFactors(riskFactors)
                .safetyGains(safetyGains)
                .belowSafetyThreshold(true)
                .build();
    }

    private static TradeoffAnalysis analyzeTradeoffs(List<RouteCandidate> candidates,
                                                     List<RouteCandidate> qualifying,
                                                     RouteCandidate fastest) {
        List<TradeoffPoint> points = candidates.stream()
                .sorted(Comparator.comparingDouble(RouteCandidate::getDurationMinutes))
                .map(c -> new TradeoffPoint(c.getId(), c.getDurationMinutes(), c.getSafetyScore()))
                .collect(Collectors.toList());

        // 선택 가능한 경로가 가장 빠른 경로보다 평균적으로 얼마나 안전한지
        double averageGain = qualifying.stream()
                .mapToInt(c -> c.getSafetyScore() - fastest.getSafetyScore())
                .average()
                .orElse(0);

        int rejected = (int) candidates.stream()
                .filter(c -> c.getSafetyScore() < CAUTION_THRESHOLD)
                .count();

        return TradeoffAnalysis.builder()
                .points(points)
                .averageSafetyGain(Math.round(averageGain))
                .rejectedUnsafeRoutes(rejected)
                .build();
    }

    @Value
    @Builder
    public static class OptimizationResult {
        RankedRouteSet routes;
        // 순위순
        List<RouteCandidate> allQualifyingRoutes;
        boolean budgetEscalated;
        double maxAcceptableMinutes;
        boolean belowSafetyThreshold;
        TradeoffAnalysis tradeoffs;
    }

    @Value
    @Builder
    public static class TradeoffAnalysis {
        // 시간 오름차순
        List<TradeoffPoint> points;
        long averageSafetyGain;
        int rejectedUnsafeRoutes;
    }

    @Value
    public static class TradeoffPoint {
        String routeId;
        double durationMinutes;
        int safetyScore;
    }
}
