package likelion._th.safepath.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import likelion._th.safepath.domain.LatLng;
import likelion._th.safepath.service.RouteSelectionOptimizer;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
// 경로 추천 응답
public class RouteSearchResponse {
    private String message;
    private RouteInfo primary;
    private RouteInfo alternative1;
    private RouteInfo alternative2;
    @JsonProperty("all_qualifying_routes")
    private List<RouteInfo> allQualifyingRoutes;
    private RouteSelectionOptimizer.TradeoffAnalysis tradeoffs;
    @JsonProperty("budget_escalated")
    private boolean budgetEscalated;
    @JsonProperty("max_acceptable_minutes")
    private double maxAcceptableMinutes;
    // 일부 사건 데이터가 오래되었거나 조회 실패
    private boolean approximate;
    @JsonProperty("night_time")
    private boolean nightTime;
    @JsonProperty("origin_coords")
    private LatLng originCoords;
    @JsonProperty("dest_coords")
    private LatLng destCoords;
}
