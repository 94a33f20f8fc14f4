package com.dcruver.promptloom.reporting;

import com.dcruver.promptloom.domain.IndexProgress;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Emits an "elapsed" progress update on a fixed interval while a long phase runs.
 * Purely cosmetic: it never touches the work it reports on. Close it when the phase ends.
 */
@Slf4j
public final class ProgressHeartbeat implements AutoCloseable {

    private final ScheduledExecutorService scheduler;

    private ProgressHeartbeat(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public static ProgressHeartbeat start(Consumer<IndexProgress> sink, String stage, Duration interval, Clock clock) {
        if (sink == null || interval == null || interval.isZero() || interval.isNegative()) {
            return new ProgressHeartbeat(null);
        }

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tag-index-heartbeat");
            thread.setDaemon(true);
            return thread;
        });

        long startedAt = clock.millis();
        long periodMillis = interval.toMillis();
        scheduler.scheduleAtFixedRate(() -> {
            try {
                sink.accept(new IndexProgress(stage + " (elapsed " + formatElapsed(clock.millis() - startedAt) + ")", 0, 0));
            } catch (RuntimeException e) {
                log.debug("Heartbeat sink failed: {}", e.getMessage());
            }
        }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);

        return new ProgressHeartbeat(scheduler);
    }

    static String formatElapsed(long millis) {
        long seconds = Math.max(0, millis) / 1000;
        return String.format("%02d:%02d", seconds / 60, seconds % 60);
    }

    @Override
    public void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }
}
