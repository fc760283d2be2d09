package likelion._th.safepath.client;

import likelion._th.safepath.domain.LatLng;
import likelion._th.safepath.domain.RouteGeometryResult;

// 외부 경로 API (도보)
public interface RouteGeometryProvider {

    /**
     * Walking route geometries between two points. Never throws for provider
     * errors; a failure is reported through {@link RouteGeometryResult#isFailed()}.
     */
    RouteGeometryResult fetchRoutes(LatLng origin, LatLng destination);
}
