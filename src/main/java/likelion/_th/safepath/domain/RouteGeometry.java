package likelion._th.safepath.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

// 외부 경로 API가 돌려준 형상 (점수 없음)
@Value
@Builder(toBuilder = true)
public class RouteGeometry {
    List<LatLng> path;
    double distanceMeters;
    double durationMinutes;
}
