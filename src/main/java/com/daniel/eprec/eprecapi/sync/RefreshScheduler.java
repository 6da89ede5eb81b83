package com.daniel.eprec.eprecapi.sync;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle; // Lets Spring start/stop the background loop with the context.
import org.springframework.stereotype.Component;

import com.daniel.eprec.eprecapi.access.AccessTicket;
import com.daniel.eprec.eprecapi.access.DatasetAccessCoordinator;
import com.daniel.eprec.eprecapi.config.EprecProperties;

/**
 * Background loop that keeps the local dataset snapshot current.
 *
 * <p>
 * One cycle per {@code eprec.refresh-interval} (fixed delay, first cycle after
 * {@code eprec.initial-delay}), on a single daemon thread, so cycles never
 * overlap. Per cycle:
 * <ol>
 * <li>{@link DatasetSynchronizer#prepare()} without the access ticket (network),</li>
 * <li>{@link PendingUpdate#apply()} while holding the ticket (snapshot replace).</li>
 * </ol>
 * Any failure ends the cycle as {@link RefreshOutcome.Status#FAILED}; there is
 * no backoff, the next scheduled cycle starts from scratch.
 */
@Component
public class RefreshScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final DatasetSynchronizer synchronizer;
    private final DatasetAccessCoordinator coordinator;
    private final List<RefreshOutcomeListener> listeners;
    private final boolean enabled;
    private final Duration initialDelay;
    private final Duration interval;

    private ScheduledExecutorService executor;

    private volatile RefreshOutcome lastOutcome;
    private volatile boolean running;

    public RefreshScheduler(
            DatasetSynchronizer synchronizer,
            DatasetAccessCoordinator coordinator,
            List<RefreshOutcomeListener> listeners,
            EprecProperties properties) {
        this.synchronizer = synchronizer;
        this.coordinator = coordinator;
        this.listeners = List.copyOf(listeners);
        this.enabled = properties.isSyncEnabled();
        this.initialDelay = properties.effectiveInitialDelay();
        this.interval = properties.effectiveRefreshInterval();
    }

    // A fresh executor per start, so the loop can be stopped and started again.
    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!enabled) {
            log.info("Dataset refresh disabled (eprec.sync-enabled=false)");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dataset-refresh");
            t.setDaemon(true);
            return t;
        });
        running = true;
        executor.scheduleWithFixedDelay(
                this::runCycle,
                initialDelay.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Dataset refresh scheduled every {} (first run in {})", interval, initialDelay);
    }

    @Override
    public synchronized void stop() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one cycle on the calling thread and reports its outcome.
     * Never throws, not even for an {@link Error}: anything escaping here
     * would silently cancel the schedule.
     */
    public synchronized RefreshOutcome runCycle() {
        RefreshOutcome outcome;
        try {
            Optional<PendingUpdate> pending = synchronizer.prepare();
            if (pending.isEmpty()) {
                outcome = RefreshOutcome.skipped("already up to date");
            } else {
                log.debug("Applying {}", pending.get().description());
                try (AccessTicket ticket = coordinator.acquire()) {
                    outcome = pending.get().apply();
                }
            }
        } catch (DatasetSyncException ex) {
            outcome = RefreshOutcome.failed(ex.getMessage());
        } catch (RuntimeException ex) {
            log.debug("Unexpected refresh failure", ex);
            outcome = RefreshOutcome.failed(ex.toString());
        } catch (Error err) {
            log.error("Refresh cycle hit {}, loop keeps running", err.toString(), err);
            outcome = RefreshOutcome.failed(err.toString());
        }
        lastOutcome = outcome;
        publish(outcome);
        return outcome;
    }

    public Optional<RefreshOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    private void publish(RefreshOutcome outcome) {
        for (RefreshOutcomeListener listener : listeners) {
            try {
                listener.onRefreshOutcome(outcome);
            } catch (RuntimeException ex) {
                log.warn("Refresh outcome listener {} failed: {}", listener.getClass().getSimpleName(), ex.getMessage());
            }
        }
    }
}
