package likelion._th.safepath.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for the fan-out stages. Each stage gets its own pool so a task
 * never waits on a task queued behind it in the same pool:
 * routeExecutor (route) -> scoringExecutor (sample point) -> fetchExecutor (source).
 */
@Configuration
public class AsyncConfig {

    // 경로별 점수 계산
    @Bean(name = "routeExecutor")
    public Executor routeExecutor() {
        return pool("route-", 4, 10, 50);
    }

    // 샘플 지점별 점수 계산
    @Bean(name = "scoringExecutor")
    public Executor scoringExecutor() {
        return pool("scoring-", 8, 16, 200);
    }

    // 사건 피드 조회 (소스당 1개)
    @Bean(name = "fetchExecutor")
    public Executor fetchExecutor() {
        return pool("fetch-", 2, 4, 20);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private ThreadPoolTaskExecutor pool(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        // 포화 시 호출 스레드에서 실행
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
