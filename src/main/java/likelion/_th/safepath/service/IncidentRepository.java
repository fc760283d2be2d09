package likelion._th.safepath.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import likelion._th.safepath.client.IncidentFeed;
import likelion._th.safepath.config.SafePathProperties;
import likelion._th.safepath.domain.Incident;
import likelion._th.safepath.exception.IncidentFetchException;
import likelion._th.safepath.util.CacheEntry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Incident records from every configured feed, cached per source id.
 *
 * The caches are the only shared mutable state of the engine. Entries are
 * replaced whole, keyed by source id, and concurrent misses for one source
 * share a single fetch. A read that finds an expired entry blocks until the
 * refresh completes; if that refresh fails the last good entry is served
 * flagged stale.
 */
@Component
@Slf4j
public class IncidentRepository {

    private final Map<String, IncidentFeed> feeds;
    // TTL 안의 값만 보관 (만료되면 다음 읽기에서 다시 조회)
    private final Cache<String, CacheEntry<List<Incident>>> fresh;
    // 마지막으로 성공한 값 (갱신 실패 시 stale 로 제공)
    private final Cache<String, CacheEntry<List<Incident>>> lastGood;
    private final SafePathProperties properties;
    private final Clock clock;
    private final Executor fetchExecutor;

    public IncidentRepository(List<IncidentFeed> feeds,
                              SafePathProperties properties,
                              Clock clock,
                              @Qualifier("fetchExecutor") Executor fetchExecutor) {
        this.feeds = new LinkedHashMap<>();
        for (IncidentFeed feed : feeds) {
            this.feeds.put(feed.sourceId(), feed);
        }
        this.fresh = Caffeine.newBuilder()
                .maximumSize(this.feeds.size())
                .expireAfterWrite(properties.getCache().getTtl())
                // 만료 판단도 주입된 Clock 기준
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
        this.lastGood = Caffeine.newBuilder()
                .maximumSize(this.feeds.size())
                .build();
        this.properties = properties;
        this.clock = clock;
        this.fetchExecutor = fetchExecutor;
    }

    /**
     * Uncached fetch of one source. Failures come back as
     * {@code failed=true} with no incidents, never as an exception.
     */
    public FetchOutcome fetchSource(String sourceId) {
        IncidentFeed feed = feed(sourceId);
        long start = System.currentTimeMillis();
        try {
            List<Incident> incidents = List.copyOf(feed.fetch());
            log.info("{} 조회 성공: {} 건 (소요: {}ms)", sourceId, incidents.size(), System.currentTimeMillis() - start);
            return FetchOutcome.success(sourceId, incidents);
        } catch (IncidentFetchException e) {
            log.warn("{} 조회 실패: {}", sourceId, e.getMessage());
            return FetchOutcome.failure(sourceId, e.getMessage());
        }
    }

    /**
     * Cached incidents of one source, refreshed through {@link #fetchSource}
     * when older than the TTL.
     */
    public SourceSnapshot getCached(String sourceId) {
        feed(sourceId);
        try {
            // 같은 소스의 동시 미스는 하나의 조회를 기다림
            return SourceSnapshot.of(sourceId, fresh.get(sourceId, this::load));
        } catch (RuntimeException e) {
            return fallback(sourceId, e);
        }
    }

    // 스케줄러용: TTL 과 관계없이 모든 소스 갱신
    public List<SourceSnapshot> refreshAll() {
        List<SourceSnapshot> snapshots = new ArrayList<>();
        for (String sourceId : feeds.keySet()) {
            try {
                snapshots.add(SourceSnapshot.of(sourceId, fresh.asMap().compute(sourceId, (id, old) -> load(id))));
            } catch (RuntimeException e) {
                snapshots.add(fallback(sourceId, e));
            }
        }
        return snapshots;
    }

    /**
     * Union of every source, unique by incident id. Sources are read
     * concurrently; a source that fails or exceeds the fetch timeout
     * contributes nothing and marks the result degraded, without holding up
     * the others.
     */
    public IncidentSnapshot allIncidents() {
        List<SourceSnapshot> snapshots = new ArrayList<>();
        Map<String, CompletableFuture<SourceSnapshot>> pending = new LinkedHashMap<>();

        for (String sourceId : feeds.keySet()) {
            CacheEntry<List<Incident>> entry = fresh.getIfPresent(sourceId);
            if (entry != null) {
                // 캐시 적중은 바로 사용
                snapshots.add(SourceSnapshot.of(sourceId, entry));
                continue;
            }
            Duration timeout = properties.getFetch().getTimeout().plusSeconds(1);
            pending.put(sourceId, CompletableFuture
                    .supplyAsync(() -> getCached(sourceId), fetchExecutor)
                    .completeOnTimeout(SourceSnapshot.unavailable(sourceId), timeout.toMillis(),
                            TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.warn("{} 조회 중 오류: {}", sourceId, e.getMessage());
                        return SourceSnapshot.unavailable(sourceId);
                    }));
        }

        pending.values().forEach(f -> snapshots.add(f.join()));

        Map<String, Incident> byId = new LinkedHashMap<>();
        boolean degraded = false;
        for (SourceSnapshot snapshot : snapshots) {
            degraded |= snapshot.isStale() || snapshot.isFailed();
            for (Incident incident : snapshot.getIncidents()) {
                byId.putIfAbsent(incident.getId(), incident);
            }
        }
        return new IncidentSnapshot(List.copyOf(byId.values()), degraded);
    }

    /**
     * Incidents from all sources that occurred within the last
     * {@code maxAgeHours}, newest first, at most {@code limit}.
     */
    public List<Incident> recentIncidents(int maxAgeHours, int limit) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(maxAgeHours));
        return allIncidents().getIncidents().stream()
                .filter(i -> !i.getOccurredAt().isBefore(cutoff))
                .sorted(Comparator.comparing(Incident::getOccurredAt).reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    // 조회 없이 현재 캐시 상태만 보고
    public List<SourceStatus> sourceStatus() {
        List<SourceStatus> statuses = new ArrayList<>();
        for (String sourceId : feeds.keySet()) {
            CacheEntry<List<Incident>> entry = lastGood.getIfPresent(sourceId);
            if (entry == null) {
                statuses.add(new SourceStatus(sourceId, 0, null, true));
            } else {
                statuses.add(new SourceStatus(sourceId, entry.getPayload().size(), entry.getFetchedAt(),
                        !isFresh(entry)));
            }
        }
        return statuses;
    }

    private CacheEntry<List<Incident>> load(String sourceId) {
        FetchOutcome outcome = fetchSource(sourceId);
        if (outcome.isFailed()) {
            // 캐시에 기존 값을 남기기 위해 실패는 예외로 전달
            throw new IncidentFetchException(sourceId, outcome.getFailureReason());
        }
        CacheEntry<List<Incident>> entry = new CacheEntry<>(outcome.getIncidents(), clock.instant());
        lastGood.put(sourceId, entry);
        return entry;
    }

    // 갱신 실패: 마지막 성공 값이 있으면 그것을, 없으면 빈 결과
    private SourceSnapshot fallback(String sourceId, RuntimeException cause) {
        CacheEntry<List<Incident>> previous = lastGood.getIfPresent(sourceId);
        if (previous == null) {
            log.warn("{} 캐시 갱신 실패, 이전 데이터 없음: {}", sourceId, cause.getMessage());
            return SourceSnapshot.unavailable(sourceId);
        }
        log.warn("{} 캐시 갱신 실패, {} 에 가져온 이전 데이터 사용: {}",
                sourceId, previous.getFetchedAt(), cause.getMessage());
        return new SourceSnapshot(sourceId, previous.getPayload(), previous.getFetchedAt(), !isFresh(previous), true);
    }

    private boolean isFresh(CacheEntry<List<Incident>> entry) {
        return entry.isFreshAt(clock, properties.getCache().getTtl());
    }

    private IncidentFeed feed(String sourceId) {
        IncidentFeed feed = feeds.get(sourceId);
        if (feed == null) {
            throw new IllegalArgumentException("알 수 없는 사건 소스: " + sourceId);
        }
        return feed;
    }

    @Value
    public static class FetchOutcome {
        String sourceId;
        List<Incident> incidents;
        boolean failed;
        String failureReason;

        static FetchOutcome success(String sourceId, List<Incident> incidents) {
            return new FetchOutcome(sourceId, incidents, false, null);
        }

        static FetchOutcome failure(String sourceId, String reason) {
            return new FetchOutcome(sourceId, Collections.emptyList(), true, reason);
        }
    }

    @Value
    public static class SourceSnapshot {
        String sourceId;
        List<Incident> incidents;
        // 한 번도 성공하지 못했으면 null
        Instant fetchedAt;
        // TTL 이 지났는데 갱신이 실패해서 이전 값을 제공
        boolean stale;
        // 이번 읽기에서 시도한 갱신이 실패
        boolean failed;

        static SourceSnapshot of(String sourceId, CacheEntry<List<Incident>> entry) {
            return new SourceSnapshot(sourceId, entry.getPayload(), entry.getFetchedAt(), false, false);
        }

        static SourceSnapshot unavailable(String sourceId) {
            return new SourceSnapshot(sourceId, Collections.emptyList(), null, false, true);
        }
    }

    @Value
    public static class IncidentSnapshot {
        List<Incident> incidents;
        boolean degraded;
    }

    @Value
    public static class SourceStatus {
        String sourceId;
        int incidentCount;
        Instant fetchedAt;
        boolean stale;
    }
}
