package com.starscape.photocatalog.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lets an ingestion run finish its current file when the application is closed (e.g. Ctrl-C).
 * The context-closed event arrives before any bean is destroyed, so the database is
 * still available while the in-flight file commits or rolls back.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class IngestShutdownGuard implements ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(IngestShutdownGuard.class);
    private static final Duration DEFAULT_GRACE = Duration.ofSeconds(60);

    private final AtomicReference<Run> active = new AtomicReference<>();
    private final Duration grace;

    public IngestShutdownGuard() {
        this(DEFAULT_GRACE);
    }

    IngestShutdownGuard(Duration grace) {
        this.grace = grace;
    }

    /**
     * Register the listener of a run that is about to start.
     */
    public void begin(ConsoleProgressListener listener) {
        active.set(new Run(listener, new CountDownLatch(1)));
    }

    /**
     * Mark the current run as finished, releasing a pending shutdown.
     */
    public void end() {
        Run run = active.getAndSet(null);
        if (run != null) {
            run.finished().countDown();
        }
    }

    @Override
    public void onApplicationEvent(@NonNull ContextClosedEvent event) {
        Run run = active.get();
        if (run == null) {
            return;
        }
        log.info("Shutdown requested: finishing the current file, then stopping");
        run.listener().cancel();
        try {
            if (!run.finished().await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Ingestion did not stop within {}s; closing anyway", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Run(ConsoleProgressListener listener, CountDownLatch finished) {
    }
}
