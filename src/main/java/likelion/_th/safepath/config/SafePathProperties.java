package likelion._th.safepath.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "safepath")
@Data
public class SafePathProperties {

    private Cache cache = new Cache();
    private Fetch fetch = new Fetch();
    private Scoring scoring = new Scoring();
    private Routing routing = new Routing();

    // 시간대 판단 기준 (샌프란시스코)
    private ZoneId zone = ZoneId.of("America/Los_Angeles");

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofMinutes(15);
        private Duration refreshInterval = Duration.ofMinutes(10);
        private boolean warmOnStartup = false;
    }

    @Data
    public static class Fetch {
        // 외부 호출 1건당 제한 시간
        private Duration timeout = Duration.ofSeconds(5);
        private int lookbackDays = 30;
        private int serviceRequestLimit = 1000;
        private int dispatchLimit = 500;
    }

    @Data
    public static class Scoring {
        private int sampleStride = 5;
        private double routeRadiusMeters = 250;
        private double locationRadiusMeters = 500;
    }

    @Data
    public static class Routing {
        private int maxCandidates = 10;
        private double detourOffsetDegrees = 0.001;
    }
}
