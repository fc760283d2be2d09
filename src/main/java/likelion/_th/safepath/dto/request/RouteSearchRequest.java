package likelion._th.safepath.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
// 경로 추천 요청 (좌표가 없으면 주소를 지오코딩)
public class RouteSearchRequest {

    // 출발지 주소
    private String origin;

    // 도착지 주소
    private String destination;

    @JsonProperty("start_lat")
    private Double startLat;

    @JsonProperty("start_lng")
    private Double startLng;

    @JsonProperty("end_lat")
    private Double endLat;

    @JsonProperty("end_lng")
    private Double endLng;

    // 가장 빠른 경로 대비 감수할 추가 시간 (분), 기본 5분
    @DecimalMin("0")
    @DecimalMax("60")
    @JsonProperty("max_extra_time_minutes")
    private Double maxExtraTimeMinutes;

    public boolean hasStartCoordinates() {
        return startLat != null && startLng != null;
    }

    public boolean hasEndCoordinates() {
        return endLat != null && endLng != null;
    }

    public double maxExtraTimeOrDefault() {
        return maxExtraTimeMinutes != null ? maxExtraTimeMinutes : 5.0;
    }

    @JsonIgnore
    @AssertTrue(message = "origin address or start_lat/start_lng is required")
    public boolean isOriginGiven() {
        return hasStartCoordinates() || (origin != null && !origin.isBlank());
    }

    @JsonIgnore
    @AssertTrue(message = "destination address or end_lat/end_lng is required")
    public boolean isDestinationGiven() {
        return hasEndCoordinates() || (destination != null && !destination.isBlank());
    }
}
