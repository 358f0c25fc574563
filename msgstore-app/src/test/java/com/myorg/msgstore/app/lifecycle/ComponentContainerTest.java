package com.myorg.msgstore.app.lifecycle;

import com.myorg.msgstore.contracts.core.cancel.CancellationSignal;
import com.myorg.msgstore.contracts.core.exception.MessageStoreException;
import com.myorg.msgstore.contracts.core.exception.ShutdownException;
import com.myorg.msgstore.contracts.core.lifecycle.Component;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentContainerTest {

    private final List<String> events = new ArrayList<>();
    private final CancellationSignal signal = new CancellationSignal();

    private Component component(String name, RuntimeException onStart, RuntimeException onStop) {
        return new Component() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void start(CancellationSignal s) {
                events.add("start " + name);
                if (onStart != null) throw onStart;
            }

            @Override
            public void stop(Duration timeout) {
                events.add("stop " + name);
                if (onStop != null) throw onStop;
            }
        };
    }

    @Test
    void startsInOrderAndStopsInReverse() {
        ComponentContainer container = new ComponentContainer(List.of(
                component("mongodb", null, null), component("kafka", null, null)), Duration.ofSeconds(5));

        container.startAll(signal);
        container.stopAll();

        assertThat(events).containsExactly("start mongodb", "start kafka", "stop kafka", "stop mongodb");
        assertThat(container.startedComponents()).isEmpty();
    }

    @Test
    void startFailureStopsWhatAlreadyStarted() {
        ComponentContainer container = new ComponentContainer(List.of(
                component("mongodb", null, null),
                component("kafka", new IllegalStateException("broker down"), null),
                component("never", null, null)), Duration.ofSeconds(5));

        assertThatThrownBy(() -> container.startAll(signal))
                .isInstanceOf(MessageStoreException.class)
                .hasMessageContaining("kafka")
                .hasRootCauseMessage("broker down");
        assertThat(events).containsExactly("start mongodb", "start kafka", "stop mongodb");
    }

    @Test
    void everyComponentIsStoppedAndFailuresAreAggregated() {
        ComponentContainer container = new ComponentContainer(List.of(
                component("a", null, new IllegalStateException("a failed")),
                component("b", null, null),
                component("c", null, new IllegalStateException("c failed"))), Duration.ofSeconds(5));
        container.startAll(signal);

        assertThatThrownBy(container::stopAll)
                .isInstanceOfSatisfying(ShutdownException.class, e -> assertThat(e.getSuppressed())
                        .extracting(Throwable::getMessage)
                        .containsExactly("c failed", "a failed"));
        assertThat(events).endsWith("stop c", "stop b", "stop a");
    }

    @Test
    void exhaustedDeadlineFailsWithoutCallingStop() {
        ComponentContainer container = new ComponentContainer(List.of(component("kafka", null, null)), Duration.ZERO);
        container.startAll(signal);

        assertThatThrownBy(container::stopAll).isInstanceOf(ShutdownException.class);
        assertThat(events).containsExactly("start kafka");
    }
}
