package likelion._th.safepath.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Scores for one point or one route. Each score is clamped to [0,100]
 * independently; {@code safetyScore} is not a blend of the other three.
 */
@Value
@Builder(toBuilder = true)
public class SafetyMetrics {

    public static final int NEUTRAL_SCORE = 85;

    int safetyScore;
    int crimeScore;
    int socialScore;
    int pedestrianScore;

    /** Contributing incidents, unique by id */
    @Builder.Default
    List<Incident> incidents = Collections.emptyList();

    /** True when some incident source was stale or unavailable while scoring */
    boolean approximate;

    // 경로 형상이 없을 때의 기본값
    public static SafetyMetrics neutral() {
        return SafetyMetrics.builder()
                .safetyScore(NEUTRAL_SCORE)
                .crimeScore(NEUTRAL_SCORE)
                .socialScore(NEUTRAL_SCORE)
                .pedestrianScore(NEUTRAL_SCORE)
                .incidents(Collections.emptyList())
                .approximate(false)
                .build();
    }

    public static SafetyMetrics neutralApproximate() {
        return neutral().toBuilder().approximate(true).build();
    }
}
