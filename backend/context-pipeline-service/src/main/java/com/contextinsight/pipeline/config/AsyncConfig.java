package com.contextinsight.pipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 크롤 실행자 및 실행 마감 스케줄러 설정
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.crawl.core-pool-size:4}")
    private int crawlCorePoolSize;

    @Value("${async.crawl.max-pool-size:8}")
    private int crawlMaxPoolSize;

    @Value("${async.crawl.queue-capacity:50}")
    private int crawlQueueCapacity;

    @Value("${async.crawl.await-termination-seconds:300}")
    private int awaitTerminationSeconds;

    /**
     * 토픽별 크롤 실행 전용 실행자.
     * 큐가 가득 차면 호출 스레드에서 실행해 토픽이 누락되지 않게 한다.
     */
    @Bean(name = "crawlExecutor")
    public Executor crawlExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(crawlCorePoolSize);
        executor.setMaxPoolSize(crawlMaxPoolSize);
        executor.setQueueCapacity(crawlQueueCapacity);
        executor.setThreadNamePrefix("crawl-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.setRejectedExecutionHandler((task, pool) -> {
            if (pool.isShutdown()) {
                throw new RejectedExecutionException("crawlExecutor is shut down");
            }
            log.warn("crawlExecutor saturated, running crawl task on caller thread");
            task.run();
        });
        executor.initialize();
        return executor;
    }

    /**
     * run-deadline-seconds 마감 작업용. 실행이 끝나면 예약 작업은 취소된다.
     */
    @Bean(name = "crawlDeadlineScheduler")
    public TaskScheduler crawlDeadlineScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("crawl-deadline-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
