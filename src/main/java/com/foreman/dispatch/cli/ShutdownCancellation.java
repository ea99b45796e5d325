package com.foreman.dispatch.cli;

import com.foreman.core.scheduler.RunCancellation;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancels a CLI run when the JVM is asked to stop (Ctrl-C, SIGTERM).
 * <p>
 * The hook holds shutdown open for up to {@code grace} so the scheduler can finish the
 * current pass and the command can print the CANCELLED report. Closing marks the run
 * finished and removes the hook.
 */
class ShutdownCancellation implements AutoCloseable {

    static final Duration DEFAULT_GRACE = Duration.ofSeconds(30);

    private final RunCancellation cancellation;
    private final Duration grace;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicBoolean shuttingDown = new AtomicBoolean();
    private final Thread hook;

    ShutdownCancellation(RunCancellation cancellation, Duration grace) {
        this.cancellation = cancellation;
        this.grace = grace;
        this.hook = new Thread(this::cancelAndWait, "foreman-shutdown");
    }

    static ShutdownCancellation register(RunCancellation cancellation) {
        var shutdown = new ShutdownCancellation(cancellation, DEFAULT_GRACE);
        Runtime.getRuntime().addShutdownHook(shutdown.hook);
        return shutdown;
    }

    RunCancellation cancellation() {
        return cancellation;
    }

    void cancelAndWait() {
        shuttingDown.set(true);
        cancellation.cancel("interrupted");
        try {
            finished.await(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        finished.countDown();
        // Removing a hook while the JVM is already running hooks throws.
        if (!shuttingDown.get()) {
            Runtime.getRuntime().removeShutdownHook(hook);
        }
    }
}
