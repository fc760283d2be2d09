package likelion._th.safepath.domain;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable, versioned weight table of the route scoring model.
 *
 * A feedback step never edits a table in place; it yields the next version.
 */
@Getter
public final class ModelWeights {

    private final int version;
    private final double bias;
    private final Map<RouteFeature, Double> weights;

    public ModelWeights(int version, double bias, Map<RouteFeature, Double> weights) {
        if (weights.size() != RouteFeature.values().length) {
            throw new IllegalArgumentException(
                    "가중치는 " + RouteFeature.values().length + " 개 특성을 모두 포함해야 함 (입력: " + weights.size() + ")");
        }
        this.version = version;
        this.bias = bias;
        this.weights = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    // v1: SF 데이터 기준 고정 가중치
    public static ModelWeights initial() {
        Map<RouteFeature, Double> w = new EnumMap<>(RouteFeature.class);
        w.put(RouteFeature.RECENT_CRIMES, -0.45);
        w.put(RouteFeature.HISTORICAL_CRIME_RATE, -0.38);
        w.put(RouteFeature.LIGHTING, 0.42);
        w.put(RouteFeature.FOOT_TRAFFIC, 0.35);
        w.put(RouteFeature.BUSINESS_DENSITY, 0.28);
        w.put(RouteFeature.VISIBILITY, 0.22);
        w.put(RouteFeature.SIDEWALK_WIDTH, 0.18);
        w.put(RouteFeature.INTERSECTIONS, -0.25);
        w.put(RouteFeature.CONSTRUCTION_ZONES, -0.20);
        w.put(RouteFeature.DISTANCE_TO_POLICE, -0.15);
        w.put(RouteFeature.EMERGENCY_CALL_BOXES, 0.12);
        w.put(RouteFeature.SURVEILLANCE_CAMERAS, 0.10);
        w.put(RouteFeature.DISTANCE, -0.05);
        w.put(RouteFeature.ESTIMATED_TIME, -0.03);
        return new ModelWeights(1, 0.15, w);
    }

    public double weight(RouteFeature feature) {
        return weights.get(feature);
    }

    /**
     * One gradient-descent step on a single labelled example.
     *
     * @param normalized normalised feature values, keyed by feature
     * @param error      label minus predicted probability
     */
    public ModelWeights nextVersion(Map<RouteFeature, Double> normalized, double error, double learningRate) {
        Map<RouteFeature, Double> updated = new EnumMap<>(RouteFeature.class);
        for (RouteFeature feature : RouteFeature.values()) {
            double x = normalized.getOrDefault(feature, 0.0);
            updated.put(feature, weight(feature) + learningRate * error * x);
        }
        return new ModelWeights(version + 1, bias + learningRate * error, updated);
    }
}
