package likelion._th.safepath.util;

import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

// 한 번에 통째로 교체되는 캐시 값
@Value
public class CacheEntry<T> {
    T payload;
    Instant fetchedAt;

    public boolean isFreshAt(Clock clock, Duration ttl) {
        return Duration.between(fetchedAt, clock.instant()).compareTo(ttl) < 0;
    }
}
