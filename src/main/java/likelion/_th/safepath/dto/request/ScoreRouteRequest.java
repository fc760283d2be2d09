package likelion._th.safepath.dto.request;

import jakarta.validation.constraints.NotNull;
import likelion._th.safepath.domain.LatLng;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
// 경로 좌표만으로 안전 점수 계산 (빈 경로는 기본값 85)
public class ScoreRouteRequest {
    @NotNull
    private List<LatLng> path;
}
