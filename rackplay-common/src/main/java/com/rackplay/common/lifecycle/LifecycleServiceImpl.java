package com.rackplay.common.lifecycle;

import com.rackplay.common.factory.ObjectFactory;
import jakarta.inject.Inject;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class LifecycleServiceImpl implements LifecycleService {

    private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleServiceImpl.class);

    private final Deque<LifecycleListener> toLoad = new ArrayDeque<>();
    private final Deque<LifecycleListener> loaded = new ArrayDeque<>();
    private final AtomicBoolean exited = new AtomicBoolean(false);

    private final ExitService exit;
    private final ObjectFactory factory;

    @Inject
    public LifecycleServiceImpl(final ExitService exit, final ObjectFactory factory) {
        this.exit = exit;
        this.factory = factory;
    }

    @Override
    public void addListener(final LifecycleListener listener) {
        this.toLoad.add(listener);
    }

    @Override
    public void addListener(final Class<? extends LifecycleListener> listener) {
        this.toLoad.add(this.factory.get(listener));
    }

    @Override
    public void load() {
        final var collected = this.factory.collect(LifecycleListener.class);
        for (int i = collected.size() - 1; i >= 0; i--) {
            this.toLoad.addFirst(collected.get(i));
        }
        try {
            while (!this.toLoad.isEmpty()) {
                final var listener = this.toLoad.removeFirst();
                if (this.loaded.contains(listener)) {
                    continue;
                }
                listener.onRackplayInit();
                this.loaded.addFirst(listener);
            }
            LOGGER.debug("Loaded {} lifecycle listeners", this.loaded.size());
        } catch (final RuntimeException exception) {
            this.exit(ExitService.Code.FAILURE);
            throw exception;
        }
    }

    @Override
    public void exit(ExitService.Code code) {
        if (this.exited.getAndSet(true)) {
            return;
        }

        for (final var listener : this.loaded) {
            try {
                listener.onRackplayExit();
            } catch (final Exception e) {
                LOGGER.error("Failed to exit listener {}", listener.getClass().getSimpleName(), e);
                if (code == ExitService.Code.SUCCESS) {
                    code = ExitService.Code.FAILURE;
                }
            }
        }

        this.exit.exit(code);
    }

    @Override
    public List<LifecycleListener> listeners() {
        return List.copyOf(this.loaded);
    }
}
