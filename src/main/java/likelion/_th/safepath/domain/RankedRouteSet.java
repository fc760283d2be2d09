package likelion._th.safepath.domain;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

// 항상 3개 슬롯이 채워진 결과
@Value
public class RankedRouteSet {
    @NonNull RouteCandidate primary;
    @NonNull RouteCandidate alternative1;
    @NonNull RouteCandidate alternative2;

    public List<RouteCandidate> asList() {
        return List.of(primary, alternative1, alternative2);
    }
}
