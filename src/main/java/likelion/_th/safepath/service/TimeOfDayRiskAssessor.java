package likelion._th.safepath.service;

import likelion._th.safepath.config.SafePathProperties;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

// 시간대별 위험도 (현지 시각 기준)
@Component
@RequiredArgsConstructor
public class TimeOfDayRiskAssessor {

    static final int LATE_NIGHT_PENALTY = 15;
    static final int BAR_CLOSING_PENALTY = 10;

    // 샌프란시스코 대략적인 일출/일몰
    static final LocalTime SUNRISE = LocalTime.of(6, 30);
    static final LocalTime SUNSET = LocalTime.of(19, 30);

    private final SafePathProperties properties;
    private final Clock clock;

    public TimeOfDayRisk assessNow() {
        return assess(clock.instant());
    }

    public TimeOfDayRisk assess(Instant at) {
        LocalTime local = at.atZone(properties.getZone()).toLocalTime();
        int hour = local.getHour();

        int penalty = 0;
        List<String> riskFactors = new ArrayList<>();
        List<String> safetyGains = new ArrayList<>();

        if (hour >= 23 || hour <= 5) {
            penalty += LATE_NIGHT_PENALTY;
            riskFactors.add("Late night");
        }
        if (hour >= 1 && hour <= 3) {
            penalty += BAR_CLOSING_PENALTY;
            riskFactors.add("Bar closing hours");
        }
        if ((hour >= 7 && hour <= 9) || (hour >= 17 && hour <= 19)) {
            safetyGains.add("Rush hour foot traffic");
        }

        return TimeOfDayRisk.builder()
                .hour(hour)
                .night(local.isBefore(SUNRISE) || local.isAfter(SUNSET))
                .penalty(penalty)
                .riskFactors(riskFactors)
                .safetyGains(safetyGains)
                .build();
    }

    @Value
    @Builder
    public static class TimeOfDayRisk {
        int hour;
        boolean night;
        // 안전 점수에서 뺄 값
        int penalty;
        List<String> riskFactors;
        List<String> safetyGains;
    }
}
