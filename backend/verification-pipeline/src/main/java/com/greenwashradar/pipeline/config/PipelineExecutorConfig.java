package com.greenwashradar.pipeline.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the pipeline.
 */
@Configuration
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class PipelineExecutorConfig {

    private final PipelineProperties properties;

    /**
     * 작업(job) 단위 실행자. 한 스레드가 한 작업을 끝까지 진행한다.
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        PipelineProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getJobPoolSize());
        executor.setMaxPoolSize(settings.getJobPoolSize());
        executor.setQueueCapacity(settings.getJobQueueCapacity());
        executor.setThreadNamePrefix("pipeline-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        // rejection surfaces to the submitter as TaskRejectedException
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * 뉴스 검색 전용 실행자. 모든 작업이 공유하며, 큐가 가득 차면 제출한 스레드가 직접 실행한다.
     */
    @Bean(name = "fetchExecutor")
    public ThreadPoolTaskExecutor fetchExecutor() {
        PipelineProperties.Fetch settings = properties.getFetch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getPoolSize());
        executor.setMaxPoolSize(settings.getPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("news-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("fetchExecutor saturated, running task on submitting thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.initialize();
        return executor;
    }

    /**
     * 단계 내부의 병렬 분기(클레임 추출과 워드클라우드 생성) 실행자.
     */
    @Bean(name = "stageExecutor")
    public ThreadPoolTaskExecutor stageExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getStagePoolSize());
        executor.setMaxPoolSize(properties.getExecutor().getStagePoolSize() * 2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("stage-branch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
