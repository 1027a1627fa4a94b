package com.rackplay.common.lifecycle;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The shared "work" executor, shut down with the application. */
public final class ExecutorWithLifecycle implements Executor, LifecycleListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorWithLifecycle.class);

    private final ExecutorService executor = Executors.newFixedThreadPool(
            Math.max(2, Runtime.getRuntime().availableProcessors()),
            new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("rackplay-worker-%d")
                    .build());

    @Override
    public void execute(final Runnable command) {
        this.executor.execute(command);
    }

    @Override
    public void onRackplayExit() {
        this.executor.shutdown();
        try {
            if (!this.executor.awaitTermination(10, TimeUnit.SECONDS)) {
                this.executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            LOGGER.error("Interrupted while shutting down the work executor", e);
            this.executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
