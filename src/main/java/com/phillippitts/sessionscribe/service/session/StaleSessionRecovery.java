package com.phillippitts.sessionscribe.service.session;

import com.phillippitts.sessionscribe.persistence.RecordingStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Marks sessions left {@code ACTIVE} by an unclean shutdown as {@code ERROR} before recording resumes.
 */
@Component
class StaleSessionRecovery {

    private static final Logger LOG = LogManager.getLogger(StaleSessionRecovery.class);

    private final RecordingStore store;
    private final TaskScheduler scheduler;

    StaleSessionRecovery(RecordingStore store, TaskScheduler scheduler) {
        this.store = store;
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    void recover() {
        int recovered = store.recoverStaleSessions(scheduler.getClock().instant());
        if (recovered > 0) {
            LOG.warn("Recovered {} session(s) left active by a previous run; marked as error", recovered);
        } else {
            LOG.debug("No stale sessions found");
        }
    }
}
