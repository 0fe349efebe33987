package com.markettracker.config;

import com.markettracker.ingestion.config.PipelineProperties;
import com.markettracker.schedule.config.SchedulerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. Timer threads only hand off to job-handler; blocking pipeline work runs on pipeline
 * (one coordinator per run) and ingestion-worker (producer and consumer tasks).
 */
@Configuration
public class AsyncConfig {

    public static final String JOB_HANDLER_EXECUTOR = "job-handler-executor";
    public static final String PIPELINE_EXECUTOR = "pipeline-executor";
    public static final String INGESTION_WORKER_EXECUTOR = "ingestion-worker-executor";

    /** Trigger bodies: mark state, arm triggers, submit pipelines. Bounded like a 20-worker job store. */
    @Bean(name = JOB_HANDLER_EXECUTOR)
    public Executor jobHandlerExecutor(SchedulerProperties schedulerProperties) {
        int poolSize = schedulerProperties.getHandlerPoolSize();
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, poolSize));
        e.setMaxPoolSize(Math.max(1, poolSize));
        e.setThreadNamePrefix("job-handler-");
        e.initialize();
        return e;
    }

    @Bean(name = PIPELINE_EXECUTOR)
    public Executor pipelineExecutor(PipelineProperties pipelineProperties) {
        int concurrentRuns = pipelineProperties.getConcurrentRuns();
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, concurrentRuns));
        e.setMaxPoolSize(Math.max(1, concurrentRuns));
        e.setThreadNamePrefix("pipeline-");
        e.initialize();
        return e;
    }

    /** Producer and consumer tasks; direct handoff so a run never waits behind another run's consumer. */
    @Bean(name = INGESTION_WORKER_EXECUTOR)
    public Executor ingestionWorkerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(32);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("ingestion-worker-");
        e.initialize();
        return e;
    }
}
