package likelion._th.safepath.service;

import likelion._th.safepath.config.SafePathProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimeOfDayRiskAssessor")
class TimeOfDayRiskAssessorTest {

    // 2025-10-31 은 PDT (UTC-7)
    private final TimeOfDayRiskAssessor assessor = new TimeOfDayRiskAssessor(
            new SafePathProperties(), Clock.fixed(Instant.parse("2025-10-31T19:00:00Z"), ZoneOffset.UTC));

    @ParameterizedTest(name = "{0} → {1}시, 감점 {2}, 야간 {3}")
    @CsvSource({
            "2025-10-31T19:00:00Z, 12, 0, false",
            "2025-10-31T09:00:00Z, 2, 25, true",
            "2025-10-31T12:59:00Z, 5, 15, true",
            "2025-10-31T13:00:00Z, 6, 0, true",
            "2025-10-31T13:45:00Z, 6, 0, false",
            "2025-11-01T02:45:00Z, 19, 0, true",
            "2025-11-01T06:00:00Z, 23, 15, true"
    })
    void assessesLocalHour(String instant, int hour, int penalty, boolean night) {
        TimeOfDayRiskAssessor.TimeOfDayRisk risk = assessor.assess(Instant.parse(instant));

        assertThat(risk.getHour()).isEqualTo(hour);
        assertThat(risk.getPenalty()).isEqualTo(penalty);
        assertThat(risk.isNight()).isEqualTo(night);
    }

    @Test
    @DisplayName("새벽 2시: 심야 + 술집 마감 시간")
    void barClosingHours() {
        TimeOfDayRiskAssessor.TimeOfDayRisk risk = assessor.assess(Instant.parse("2025-10-31T09:00:00Z"));

        assertThat(risk.getRiskFactors()).containsExactly("Late night", "Bar closing hours");
        assertThat(risk.getSafetyGains()).isEmpty();
    }

    @Test
    @DisplayName("출퇴근 시간에는 유동 인구 가점")
    void rushHour() {
        TimeOfDayRiskAssessor.TimeOfDayRisk morning = assessor.assess(Instant.parse("2025-10-31T15:00:00Z"));

        assertThat(morning.getHour()).isEqualTo(8);
        assertThat(morning.getRiskFactors()).isEmpty();
        assertThat(morning.getSafetyGains()).containsExactly("Rush hour foot traffic");
    }

    @Test
    @DisplayName("현재 시각은 주입된 시계 기준")
    void assessNowUsesClock() {
        TimeOfDayRiskAssessor.TimeOfDayRisk risk = assessor.assessNow();

        assertThat(risk.getHour()).isEqualTo(12);
        assertThat(risk.isNight()).isFalse();
    }
}
