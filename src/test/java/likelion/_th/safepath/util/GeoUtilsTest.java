package likelion._th.safepath.util;

import likelion._th.safepath.domain.LatLng;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("GeoUtils")
class GeoUtilsTest {

    private static final LatLng CITY_HALL = new LatLng(37.7793, -122.4193);
    private static final LatLng FERRY_BUILDING = new LatLng(37.7955, -122.3937);

    @Test
    @DisplayName("같은 지점 사이 거리는 0")
    void distanceToSelfIsZero() {
        assertThat(GeoUtils.distanceMeters(CITY_HALL, CITY_HALL)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("거리는 대칭")
    void distanceIsSymmetric() {
        assertThat(GeoUtils.distanceMeters(CITY_HALL, FERRY_BUILDING))
                .isEqualTo(GeoUtils.distanceMeters(FERRY_BUILDING, CITY_HALL));
    }

    @Test
    @DisplayName("시청 ~ 페리 빌딩 약 2.9km")
    void haversineMatchesKnownDistance() {
        assertThat(GeoUtils.distanceMeters(CITY_HALL, FERRY_BUILDING)).isCloseTo(2882.0, within(1.0));
    }

    @Test
    @DisplayName("반경 경계 포함")
    void withinRadiusIsInclusive() {
        LatLng north = new LatLng(37.7749 + 0.002, -122.4194);
        LatLng center = new LatLng(37.7749, -122.4194);
        double exact = GeoUtils.distanceMeters(north, center);

        assertThat(GeoUtils.withinRadius(north, center, exact)).isTrue();
        assertThat(GeoUtils.withinRadius(north, center, 250)).isTrue();
        assertThat(GeoUtils.withinRadius(north, center, 200)).isFalse();
    }

    @Test
    @DisplayName("우회 경유지는 직선 위 지점에서 위도만 이동")
    void detourWaypointOffsetsLatitude() {
        LatLng start = new LatLng(37.0, -122.0);
        LatLng end = new LatLng(38.0, -121.0);

        LatLng north = GeoUtils.detourWaypoint(start, end, 0.5, 0.001);
        LatLng south = GeoUtils.detourWaypoint(start, end, 0.5, -0.001);

        assertThat(north.getLat()).isCloseTo(37.501, within(1e-9));
        assertThat(north.getLng()).isCloseTo(-121.5, within(1e-9));
        assertThat(south.getLat()).isCloseTo(37.499, within(1e-9));
    }
}
