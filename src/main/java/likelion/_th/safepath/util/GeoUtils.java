package likelion._th.safepath.util;

import likelion._th.safepath.domain.LatLng;

// 위경도 거리 계산
public final class GeoUtils {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private GeoUtils() {
    }

    /**
     * Great-circle (haversine) distance in meters. Symmetric in its arguments
     * and zero for identical points.
     */
    public static double distanceMeters(LatLng a, LatLng b) {
        double phi1 = Math.toRadians(a.getLat());
        double phi2 = Math.toRadians(b.getLat());
        double dPhi = Math.toRadians(b.getLat() - a.getLat());
        double dLambda = Math.toRadians(b.getLng() - a.getLng());

        double h = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));

        return EARTH_RADIUS_METERS * c;
    }

    public static boolean withinRadius(LatLng point, LatLng center, double radiusMeters) {
        return distanceMeters(point, center) <= radiusMeters;
    }

    // 출발지 -> 도착지 직선 위 fraction 지점에서 위도 방향으로 offset 만큼 이동한 경유지
    public static LatLng detourWaypoint(LatLng start, LatLng end, double fraction, double latOffsetDegrees) {
        double midLat = start.getLat() + (end.getLat() - start.getLat()) * fraction;
        double midLng = start.getLng() + (end.getLng() - start.getLng()) * fraction;
        return new LatLng(midLat + latOffsetDegrees, midLng);
    }
}
