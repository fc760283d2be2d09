package likelion._th.safepath.service;

import likelion._th.safepath.config.SafePathProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Keeps the incident cache warm so route requests rarely wait on a feed.
 *
 * Refreshes go through the same single-flight path as reads.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IncidentRefreshScheduler {

    private final IncidentRepository incidentRepository;
    private final SafePathProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.getCache().isWarmOnStartup()) {
            log.info("WARM_ON_STARTUP=true: 사건 캐시 초기 적재");
            refresh();
        } else {
            log.info("사건 캐시는 첫 요청 시 적재 (갱신 주기: {})", properties.getCache().getRefreshInterval());
        }
    }

    @Scheduled(fixedDelayString = "${safepath.cache.refresh-interval:PT10M}",
            initialDelayString = "${safepath.cache.refresh-interval:PT10M}")
    public void scheduledRefresh() {
        log.info("사건 캐시 정기 갱신 시작");
        refresh();
    }

    private void refresh() {
        long start = System.currentTimeMillis();
        List<IncidentRepository.SourceSnapshot> snapshots = incidentRepository.refreshAll();
        for (IncidentRepository.SourceSnapshot snapshot : snapshots) {
            if (snapshot.isFailed()) {
                log.warn("{} 갱신 실패 (기존 {} 건 유지, stale={})",
                        snapshot.getSourceId(), snapshot.getIncidents().size(), snapshot.isStale());
            } else {
                log.info("{} 갱신 완료: {} 건", snapshot.getSourceId(), snapshot.getIncidents().size());
            }
        }
        log.info("사건 캐시 갱신 종료 (소요: {}ms)", System.currentTimeMillis() - start);
    }
}
