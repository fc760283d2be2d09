package likelion._th.safepath.exception;

import lombok.Getter;

// 같은 세션에서 더 새로운 요청이 들어와 중단된 요청
@Getter
public class RouteRequestSupersededException extends RuntimeException {

    private final String sessionId;

    public RouteRequestSupersededException(String sessionId) {
        super("같은 세션의 새 요청으로 중단된 경로 요청: " + sessionId);
        this.sessionId = sessionId;
    }
}
