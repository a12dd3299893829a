package com.phillippitts.sessionscribe.config;

import com.phillippitts.sessionscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools shared by every recording session.
 *
 * <p>The {@code taskScheduler} drives all per-session timers (burst watchdogs, silence timers,
 * stream rotation checks, resampler idle kills) as well as {@code @Scheduled} jobs. The
 * {@code eventExecutor} offloads application event listeners from the publishing thread.
 *
 * <p>Both pools copy the Log4j2 ThreadContext from the submitting thread, so timer callbacks
 * keep the {@code sessionId} of the session that armed them.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Scheduler for session timers. Cancelled timers are removed from the queue immediately;
     * a long session arms and cancels thousands of silence timers.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties schedulerProps = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerProps.getPoolSize());
        scheduler.setThreadNamePrefix(schedulerProps.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setTaskDecorator(mdcPropagatingDecorator());
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Bounded pool for event listeners. When full, the publishing thread runs the listener
     * itself ({@link ThreadPoolExecutor.CallerRunsPolicy}) instead of dropping the event.
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        ThreadPoolProperties.EventPoolProperties eventProps = threadPoolProperties.getEvent();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(eventProps.getCorePoolSize());
        executor.setMaxPoolSize(eventProps.getMaxPoolSize());
        executor.setQueueCapacity(eventProps.getQueueCapacity());
        executor.setThreadNamePrefix(eventProps.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
