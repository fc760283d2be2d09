package likelion._th.safepath.service;

import likelion._th.safepath.domain.ModelWeights;
import likelion._th.safepath.domain.RouteFeature;
import likelion._th.safepath.domain.RouteFeatures;
import likelion._th.safepath.domain.SafetyBand;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Fixed-weight logistic scoring of a route from its static features.
 *
 * Every scoring call reads one immutable {@link ModelWeights} snapshot, so
 * results are a pure function of the input and the current version.
 * {@link #applyFeedback} is the only way the weights change and it swaps in
 * a new version instead of editing the current one.
 */
@Service
@Slf4j
public class RouteFeatureScorer {

    // 차이가 이보다 크면 "X% safer"
    static final double SIGNIFICANT_DIFFERENCE = 0.1;

    private final AtomicReference<ModelWeights> weights;

    public RouteFeatureScorer() {
        this(ModelWeights.initial());
    }

    public RouteFeatureScorer(ModelWeights initialWeights) {
        this.weights = new AtomicReference<>(initialWeights);
    }

    public ModelWeights currentWeights() {
        return weights.get();
    }

    public double score(RouteFeatures features) {
        return probability(weights.get(), normalize(features));
    }

    public FeatureAssessment assess(RouteFeatures features) {
        ModelWeights snapshot = weights.get();
        Map<RouteFeature, Double> x = normalize(features);
        double p = probability(snapshot, x);

        Map<String, Double> details = new LinkedHashMap<>();
        details.put("Crime Level", 1 - x.get(RouteFeature.RECENT_CRIMES));
        details.put("Lighting", x.get(RouteFeature.LIGHTING));
        details.put("Foot Traffic", x.get(RouteFeature.FOOT_TRAFFIC));
        details.put("Businesses", x.get(RouteFeature.BUSINESS_DENSITY));
        details.put("Visibility", x.get(RouteFeature.VISIBILITY));

        return FeatureAssessment.builder()
                .probability(p)
                .band(SafetyBand.fromProbability(p))
                .weightsVersion(snapshot.getVersion())
                .details(details)
                .build();
    }

    /**
     * Scores both routes with the same weight snapshot. A wins ties. The
     * reasons describe the feature differences and never affect the winner.
     */
    public RouteComparison compare(RouteFeatures routeA, RouteFeatures routeB) {
        ModelWeights snapshot = weights.get();
        double scoreA = probability(snapshot, normalize(routeA));
        double scoreB = probability(snapshot, normalize(routeB));

        String winner = scoreA >= scoreB ? "A" : "B";
        double difference = Math.abs(scoreA - scoreB);

        return RouteComparison.builder()
                .winner(winner)
                .scoreA(scoreA)
                .scoreB(scoreB)
                .safetyDifference(difference)
                .weightsVersion(snapshot.getVersion())
                .reasons(reasons(routeA, routeB, winner, difference))
                .build();
    }

    // 가중치 절댓값 내림차순
    public List<FeatureImportance> featureImportance() {
        ModelWeights snapshot = weights.get();
        return snapshot.getWeights().entrySet().stream()
                .map(e -> new FeatureImportance(e.getKey().getLabel(), e.getValue(), Math.abs(e.getValue())))
                .sorted(Comparator.comparingDouble(FeatureImportance::getImportance).reversed())
                .collect(Collectors.toList());
    }

    /**
     * One gradient step on a labelled example. Administrative only: produces
     * the next weight version and swaps it in atomically; in-flight scoring
     * keeps the snapshot it already read.
     *
     * @param safe whether the route turned out to be safe (label 1) or not (label 0)
     */
    public ModelWeights applyFeedback(RouteFeatures features, boolean safe, double learningRate) {
        Map<RouteFeature, Double> x = normalize(features);
        double label = safe ? 1.0 : 0.0;

        ModelWeights updated = weights.updateAndGet(current ->
                current.nextVersion(x, label - probability(current, x), learningRate));

        log.info("경로 모델 가중치 갱신: v{} (label={}, lr={})", updated.getVersion(), label, learningRate);
        return updated;
    }

    static Map<RouteFeature, Double> normalize(RouteFeatures features) {
        Map<RouteFeature, Double> x = new EnumMap<>(RouteFeature.class);
        for (RouteFeature feature : RouteFeature.values()) {
            x.put(feature, feature.normalize(features));
        }
        return x;
    }

    private static double probability(ModelWeights w, Map<RouteFeature, Double> x) {
        double z = w.getBias();
        for (RouteFeature feature : RouteFeature.values()) {
            z += w.weight(feature) * x.get(feature);
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    private static List<String> reasons(RouteFeatures a, RouteFeatures b, String winner, double difference) {
        RouteFeatures safer = "A".equals(winner) ? a : b;
        RouteFeatures other = "A".equals(winner) ? b : a;
        List<String> reasons = new ArrayList<>();

        if (safer.getCrimeIncidents24h() < other.getCrimeIncidents24h()) {
            reasons.add(String.format("Route %s has %d fewer crimes in last 24 hours",
                    winner, other.getCrimeIncidents24h() - safer.getCrimeIncidents24h()));
        }
        if (safer.getLightingScore() > other.getLightingScore()) {
            reasons.add(String.format(Locale.ROOT, "Route %s is %.0f%% better lit",
                    winner, (safer.getLightingScore() - other.getLightingScore()) * 100));
        }
        if (safer.getFootTraffic() > other.getFootTraffic()) {
            reasons.add(String.format("Route %s has more foot traffic", winner));
        }
        if (safer.getBusinessDensity() > other.getBusinessDensity()) {
            reasons.add(String.format("Route %s passes %d more open businesses",
                    winner, safer.getBusinessDensity() - other.getBusinessDensity()));
        }
        if (safer.getConstructionZones() < other.getConstructionZones()) {
            reasons.add(String.format("Route %s avoids %d construction zones",
                    winner, other.getConstructionZones() - safer.getConstructionZones()));
        }

        double timeDiff = Math.abs(a.getEstimatedTimeMinutes() - b.getEstimatedTimeMinutes());
        if (timeDiff > 0) {
            String faster = a.getEstimatedTimeMinutes() < b.getEstimatedTimeMinutes() ? "A" : "B";
            reasons.add(String.format(Locale.ROOT, "Route %s is %s minutes faster", faster, formatMinutes(timeDiff)));
        }

        if (difference > SIGNIFICANT_DIFFERENCE) {
            reasons.add(String.format(Locale.ROOT, "Route %s is %.1f%% safer overall", winner, difference * 100));
        } else {
            reasons.add("Both routes have similar safety levels");
        }
        return reasons;
    }

    private static String formatMinutes(double minutes) {
        return minutes == Math.rint(minutes)
                ? String.valueOf((long) minutes)
                : String.format(Locale.ROOT, "%.1f", minutes);
    }

    @Value
    @Builder
    public static class FeatureAssessment {
        double probability;
        SafetyBand band;
        int weightsVersion;
        Map<String, Double> details;
    }

    @Value
    @Builder
    public static class RouteComparison {
        // "A" or "B"
        String winner;
        double scoreA;
        double scoreB;
        double safetyDifference;
        int weightsVersion;
        List<String> reasons;
    }

    @Value
    public static class FeatureImportance {
        String feature;
        double weight;
        double importance;
    }
}
