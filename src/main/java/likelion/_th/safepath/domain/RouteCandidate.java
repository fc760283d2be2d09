package likelion._th.safepath.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * A scored route under consideration. Created per route-selection request and
 * never persisted.
 */
@Value
@Builder(toBuilder = true)
public class RouteCandidate {

    String id;
    String name;

    // 출발지 ~ 도착지 좌표 (최소 2개)
    @Builder.Default
    List<LatLng> path = Collections.emptyList();

    double distanceMeters;
    double durationMinutes;

    // 0 ~ 100
    int safetyScore;

    // durationMinutes - 가장 빠른 후보의 durationMinutes
    double timeAddedMinutes;

    // 안내용 문구 (비교에는 사용하지 않음)
    @Builder.Default
    List<String> riskFactors = Collections.emptyList();
    @Builder.Default
    List<String> safetyGains = Collections.emptyList();

    /** Padding variant derived from a real candidate */
    boolean synthetic;

    /** Returned only because no candidate met the caution threshold */
    boolean belowSafetyThreshold;
}
