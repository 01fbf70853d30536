package com.ambient.core.operator;

import com.ambient.core.cluster.WatchEvent;
import com.ambient.core.cluster.WatchStream;
import com.ambient.core.metrics.AmbientMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class ResubscribingWatchLoopTest {

    private SimpleMeterRegistry meters;
    private AmbientMetrics metrics;
    private List<WatchEvent<String>> handled;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        metrics = new AmbientMetrics(meters);
        handled = new ArrayList<>();
    }

    private ResubscribingWatchLoop<String> loop(Supplier<WatchStream<String>> subscribe,
                                                Consumer<WatchEvent<String>> handler) {
        return new ResubscribingWatchLoop<>("Test", subscribe, handler, 1, 1, metrics);
    }

    /** A stream that replays {@code events} once and records whether it was closed. */
    private static final class ListStream implements WatchStream<String> {
        private final Iterator<WatchEvent<String>> events;
        boolean closed;

        ListStream(List<WatchEvent<String>> events) {
            this.events = events.iterator();
        }

        @Override
        public boolean hasNext() {
            return events.hasNext();
        }

        @Override
        public WatchEvent<String> next() {
            return events.next();
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    @DisplayName("error and bookmark events never reach the handler")
    void skipsNonObjectEvents() {
        var loop = loop(() -> null, handled::add);

        loop.dispatch(new WatchEvent<>(WatchEvent.Type.ERROR, null));
        loop.dispatch(new WatchEvent<>(WatchEvent.Type.BOOKMARK, null));
        loop.dispatch(new WatchEvent<>(WatchEvent.Type.ADDED, "a"));

        assertEquals(1, handled.size());
        assertEquals("a", handled.get(0).object());
    }

    @Test
    @DisplayName("a failing handler does not stop dispatch")
    void handlerFailureTolerated() {
        var loop = loop(() -> null, event -> {
            throw new IllegalStateException("bad event");
        });

        assertDoesNotThrow(() -> loop.dispatch(new WatchEvent<>(WatchEvent.Type.MODIFIED, "a")));
    }

    @Test
    @DisplayName("resubscribes after a failed subscribe and after the stream ends")
    void resubscribes() {
        AtomicInteger subscriptions = new AtomicInteger();
        List<ListStream> opened = new ArrayList<>();
        AtomicReference<ResubscribingWatchLoop<String>> self = new AtomicReference<>();
        self.set(loop(() -> {
            int n = subscriptions.incrementAndGet();
            if (n == 1) {
                throw new IllegalStateException("api server unavailable");
            }
            if (n == 3) {
                self.get().stop();
            }
            ListStream stream = new ListStream(List.of(new WatchEvent<>(WatchEvent.Type.ADDED, "e" + n)));
            opened.add(stream);
            return stream;
        }, handled::add));

        self.get().run();

        assertEquals(3, subscriptions.get());
        assertEquals("e2", handled.get(0).object());
        assertTrue(opened.stream().allMatch(s -> s.closed));
        assertFalse(self.get().isRunning());
        assertEquals(2.0, meters.get("ambient.watch.restarts").tag("kind", "Test").counter().count());
    }
}
