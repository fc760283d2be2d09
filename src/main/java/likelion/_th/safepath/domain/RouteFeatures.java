package likelion._th.safepath.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Static and environmental description of a route, scored without the live
 * incident feeds. Raw units; normalisation caps live on {@link RouteFeature}.
 */
@Value
@Builder
@Jacksonized
public class RouteFeatures {

    // 안전 지표
    int crimeIncidents24h;
    double historicalCrimeRate;     // 0 ~ 10
    double lightingScore;           // 0 ~ 1

    // 환경
    double footTraffic;             // 0 ~ 1
    int businessDensity;
    double visibilityScore;         // 0 ~ 1
    double sidewalkWidthMeters;

    // 경로 특성
    double distanceKm;
    double estimatedTimeMinutes;
    int numIntersections;
    int constructionZones;

    // 긴급 대응
    double distanceToPoliceStationKm;
    int emergencyCallBoxes;
    int surveillanceCameras;
}
