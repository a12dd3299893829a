package com.phillippitts.sessionscribe.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizes of the shared timer scheduler and the application event pool.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    private SchedulerPoolProperties scheduler = new SchedulerPoolProperties();
    private EventPoolProperties event = new EventPoolProperties();

    public SchedulerPoolProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerPoolProperties scheduler) {
        this.scheduler = scheduler;
    }

    public EventPoolProperties getEvent() {
        return event;
    }

    public void setEvent(EventPoolProperties event) {
        this.event = event;
    }

    public static class SchedulerPoolProperties {
        @Positive
        private int poolSize = 4;
        private String threadNamePrefix = "session-timer-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    public static class EventPoolProperties {
        @Positive
        private int corePoolSize = 2;
        @Positive
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
        private String threadNamePrefix = "event-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
