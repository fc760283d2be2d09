package likelion._th.safepath.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a geometry request. Failures are reported through
 * {@link #isFailed()} rather than thrown.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RouteGeometryResult {

    private final List<RouteGeometry> routes;
    private final boolean failed;
    private final String failureReason;

    public static RouteGeometryResult success(List<RouteGeometry> routes) {
        return new RouteGeometryResult(List.copyOf(routes), false, null);
    }

    public static RouteGeometryResult failure(String reason) {
        return new RouteGeometryResult(Collections.emptyList(), true, reason);
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }
}
