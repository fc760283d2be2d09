package likelion._th.safepath.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import likelion._th.safepath.domain.RouteFeatures;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
// 두 경로의 환경 특성 비교
public class CompareRoutesRequest {
    @NotNull
    @JsonProperty("route_a")
    private RouteFeatures routeA;

    @NotNull
    @JsonProperty("route_b")
    private RouteFeatures routeB;
}
