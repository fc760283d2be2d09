package likelion._th.safepath.exception;

import lombok.Getter;

// 외부 사건 피드 조회 실패 (전송 오류, 타임아웃, 응답 형식 오류)
@Getter
public class IncidentFetchException extends RuntimeException {

    private final String sourceId;

    public IncidentFetchException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public IncidentFetchException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }
}
