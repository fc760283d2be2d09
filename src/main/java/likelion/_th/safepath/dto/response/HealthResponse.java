package likelion._th.safepath.dto.response;

import likelion._th.safepath.service.IncidentRepository;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
// 사건 소스별 캐시 상태
public class HealthResponse {
    private String status;
    private List<IncidentRepository.SourceStatus> sources;
    private Instant timestamp;
}
