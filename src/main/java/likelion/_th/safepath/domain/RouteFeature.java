package likelion._th.safepath.domain;

import java.util.function.ToDoubleFunction;

/**
 * Features of the route scoring model with their normalisation caps. The caps
 * are part of the model contract: a feature is normalised as
 * {@code clamp(raw / cap, 0, 1)}.
 */
public enum RouteFeature {
    RECENT_CRIMES("Crime Incidents (24h)", 10, RouteFeatures::getCrimeIncidents24h),
    HISTORICAL_CRIME_RATE("Historical Crime Rate", 10, RouteFeatures::getHistoricalCrimeRate),
    LIGHTING("Lighting Quality", 1, RouteFeatures::getLightingScore),
    FOOT_TRAFFIC("Foot Traffic", 1, RouteFeatures::getFootTraffic),
    BUSINESS_DENSITY("Business Density", 20, RouteFeatures::getBusinessDensity),
    VISIBILITY("Visibility Score", 1, RouteFeatures::getVisibilityScore),
    SIDEWALK_WIDTH("Sidewalk Width", 5, RouteFeatures::getSidewalkWidthMeters),
    INTERSECTIONS("Number of Intersections", 15, RouteFeatures::getNumIntersections),
    CONSTRUCTION_ZONES("Construction Zones", 5, RouteFeatures::getConstructionZones),
    DISTANCE_TO_POLICE("Distance to Police", 3, RouteFeatures::getDistanceToPoliceStationKm),
    EMERGENCY_CALL_BOXES("Emergency Call Boxes", 10, RouteFeatures::getEmergencyCallBoxes),
    SURVEILLANCE_CAMERAS("Surveillance Cameras", 20, RouteFeatures::getSurveillanceCameras),
    DISTANCE("Route Distance", 5, RouteFeatures::getDistanceKm),
    ESTIMATED_TIME("Estimated Time", 30, RouteFeatures::getEstimatedTimeMinutes);

    private final String label;
    private final double cap;
    private final ToDoubleFunction<RouteFeatures> extractor;

    RouteFeature(String label, double cap, ToDoubleFunction<RouteFeatures> extractor) {
        this.label = label;
        this.cap = cap;
        this.extractor = extractor;
    }

    public String getLabel() {
        return label;
    }

    public double getCap() {
        return cap;
    }

    public double normalize(RouteFeatures features) {
        double scaled = extractor.applyAsDouble(features) / cap;
        return Math.max(0.0, Math.min(1.0, scaled));
    }
}
