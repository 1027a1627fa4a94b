package com.rackplay.common.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackplay.common.factory.ObjectFactory;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class LifecycleServiceImplTest {

    private Journal journal;
    private List<ExitService.Code> codes;

    @BeforeEach
    void setup() {
        this.journal = new Journal();
        this.codes = new ArrayList<>();
    }

    @Test
    void exit_runs_in_reverse_load_order() {
        final var lifecycle = create(false);
        lifecycle.addListener(new NamedListener("manual", this.journal));
        lifecycle.load();

        final var inits = List.copyOf(this.journal.events);
        assertThat(inits).containsExactlyInAnyOrder("init:first", "init:second", "init:manual");
        assertThat(inits).last().isEqualTo("init:manual");

        this.journal.events.clear();
        lifecycle.exit(ExitService.Code.SUCCESS);

        final var exits = inits.stream().map(e -> e.replace("init:", "exit:")).toList();
        assertThat(this.journal.events).containsExactlyElementsOf(reversed(exits));
        assertThat(this.codes).containsExactly(ExitService.Code.SUCCESS);
    }

    @Test
    void exit_is_idempotent() {
        final var lifecycle = create(false);
        lifecycle.load();
        lifecycle.exit(ExitService.Code.SUCCESS);
        lifecycle.exit(ExitService.Code.FAILURE);
        assertThat(this.codes).containsExactly(ExitService.Code.SUCCESS);
    }

    @Test
    void failing_listener_downgrades_exit_code() {
        final var lifecycle = create(false);
        lifecycle.addListener(new LifecycleListener() {
            @Override
            public void onRackplayExit() {
                throw new IllegalStateException("boom");
            }
        });
        lifecycle.load();
        lifecycle.exit(ExitService.Code.SUCCESS);

        assertThat(this.codes).containsExactly(ExitService.Code.FAILURE);
        assertThat(this.journal.events).contains("exit:first", "exit:second");
    }

    @Test
    void failing_init_exits_with_failure() {
        final var lifecycle = create(true);
        assertThatThrownBy(lifecycle::load).isInstanceOf(IllegalStateException.class);
        assertThat(this.codes).containsExactly(ExitService.Code.FAILURE);
    }

    @Test
    void listeners_are_loaded_once() {
        final var lifecycle = create(false);
        final var manual = new NamedListener("manual", this.journal);
        lifecycle.addListener(manual);
        lifecycle.addListener(manual);
        lifecycle.load();
        assertThat(lifecycle.listeners()).hasSize(3);
        assertThat(this.journal.events).containsOnlyOnce("init:manual");
    }

    private LifecycleService create(final boolean failing) {
        final var factory = ObjectFactory.create(new LifecycleModule(), binder -> {
            binder.bind(Journal.class).toInst(this.journal);
            binder.bind(ExitService.class).toInst(this.codes::add);
            binder.bind(LifecycleListener.class).named("first").toImpl(FirstListener.class);
            binder.bind(LifecycleListener.class)
                    .named("second")
                    .toImpl(failing ? FailingListener.class : SecondListener.class);
        });
        return factory.get(LifecycleService.class);
    }

    private static <T> List<T> reversed(final List<T> list) {
        final var copy = new ArrayList<>(list);
        Collections.reverse(copy);
        return copy;
    }

    static final class Journal {
        final List<String> events = new CopyOnWriteArrayList<>();
    }

    static class NamedListener implements LifecycleListener {

        private final String name;
        private final Journal journal;

        NamedListener(final String name, final Journal journal) {
            this.name = name;
            this.journal = journal;
        }

        @Override
        public void onRackplayInit() {
            this.journal.events.add("init:" + this.name);
        }

        @Override
        public void onRackplayExit() {
            this.journal.events.add("exit:" + this.name);
        }
    }

    static final class FirstListener extends NamedListener {

        @Inject
        FirstListener(final Journal journal) {
            super("first", journal);
        }
    }

    static final class SecondListener extends NamedListener {

        @Inject
        SecondListener(final Journal journal) {
            super("second", journal);
        }
    }

    static final class FailingListener implements LifecycleListener {

        @Inject
        FailingListener() {}

        @Override
        public void onRackplayInit() {
            throw new IllegalStateException("cannot start");
        }
    }
}
