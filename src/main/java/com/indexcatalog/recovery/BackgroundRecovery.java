package com.indexcatalog.recovery;

import com.indexcatalog.exception.CatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs recovery passes periodically on a single background thread.
 * <p>
 * A failed pass is logged and retried at the next tick; the checkpoint makes the
 * retry resume at the entry that failed.
 */
public class BackgroundRecovery implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BackgroundRecovery.class);

    private final RecoveryEngine engine;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong completedPasses = new AtomicLong();
    private final AtomicReference<CatalogException> lastFailure = new AtomicReference<>();
    private volatile boolean running = false;

    public BackgroundRecovery(RecoveryEngine engine) {
        this.engine = engine;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "catalog-recovery");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start(Duration interval) {
        if (running) {
            return;
        }
        running = true;
        scheduler.scheduleWithFixedDelay(this::runPass, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Background recovery started, interval={}", interval);
    }

    public boolean isRunning() {
        return running;
    }

    /** Passes that finished without error. */
    public long getCompletedPasses() {
        return completedPasses.get();
    }

    public Optional<CatalogException> getLastFailure() {
        return Optional.ofNullable(lastFailure.get());
    }

    private void runPass() {
        if (!running) return;
        try {
            engine.recover();
            lastFailure.set(null);
            completedPasses.incrementAndGet();
        } catch (CatalogException e) {
            lastFailure.set(e);
            LOG.warn("Background recovery pass failed: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            // keep the schedule alive; an escaped exception would cancel it
            LOG.error("Background recovery pass crashed", e);
        }
    }

    @Override
    public synchronized void close() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
