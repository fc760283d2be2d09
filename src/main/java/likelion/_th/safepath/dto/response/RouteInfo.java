package likelion._th.safepath.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import likelion._th.safepath.domain.LatLng;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
// 경로 추천 - 경로 한 개에 대한 정보
public class RouteInfo {
    // route-1, route-1_alt1 ...
    private String id;
    private String name;
    // 걸리는 시간 (분)
    private Double time;
    // 거리 (m)
    private Integer distance;
    private List<LatLng> polyline;
    @JsonProperty("safety_score")
    private Integer safetyScore;
    // 가장 빠른 경로 대비 추가 시간 (분)
    @JsonProperty("time_added")
    private Double timeAdded;
    // 종합 등급: A (90점)
    @JsonProperty("summary_grade")
    private String summaryGrade;
    @JsonProperty("risk_factors")
    private List<String> riskFactors;
    @JsonProperty("safety_gains")
    private List<String> safetyGains;
    @JsonProperty("is_recommended")
    private boolean recommended;
    @JsonProperty("is_synthetic")
    private boolean synthetic;
    @JsonProperty("below_safety_threshold")
    private boolean belowSafetyThreshold;
}
