package com.ambient.core.operator;

import com.ambient.core.cluster.WatchEvent;
import com.ambient.core.cluster.WatchStream;
import com.ambient.core.metrics.AmbientMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Keeps one watch subscription alive for the life of the controller. A failed subscribe is
 * retried after the retry delay; a stream that ends is reopened after the restart delay.
 * Handler failures are logged per event and never end the loop.
 */
public class ResubscribingWatchLoop<T> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ResubscribingWatchLoop.class);

    private final String kind;
    private final Supplier<WatchStream<T>> subscribe;
    private final Consumer<WatchEvent<T>> handler;
    private final long retryDelayMs;
    private final long restartDelayMs;
    private final AmbientMetrics metrics;

    private volatile boolean running = true;
    private volatile WatchStream<T> current;

    public ResubscribingWatchLoop(String kind, Supplier<WatchStream<T>> subscribe, Consumer<WatchEvent<T>> handler,
                                  long retryDelayMs, long restartDelayMs, AmbientMetrics metrics) {
        this.kind = kind;
        this.subscribe = subscribe;
        this.handler = handler;
        this.retryDelayMs = retryDelayMs;
        this.restartDelayMs = restartDelayMs;
        this.metrics = metrics;
    }

    @Override
    public void run() {
        while (running) {
            WatchStream<T> stream;
            try {
                stream = subscribe.get();
            } catch (RuntimeException e) {
                log.warn("Failed to create {} watcher: {}", kind, e.getMessage());
                metrics.recordWatchRestart(kind);
                if (!pause(retryDelayMs)) {
                    return;
                }
                continue;
            }
            current = stream;
            log.info("Watching {} events", kind);
            try {
                while (running && stream.hasNext()) {
                    dispatch(stream.next());
                }
            } catch (RuntimeException e) {
                if (running) {
                    log.warn("{} watch stream failed: {}", kind, e.getMessage());
                }
            } finally {
                stream.close();
                current = null;
            }
            if (!running) {
                return;
            }
            log.info("{} watch channel closed, restarting", kind);
            metrics.recordWatchRestart(kind);
            if (!pause(restartDelayMs)) {
                return;
            }
        }
    }

    void dispatch(WatchEvent<T> event) {
        if (event.type() == WatchEvent.Type.ERROR || event.type() == WatchEvent.Type.BOOKMARK) {
            return;
        }
        try {
            handler.accept(event);
        } catch (RuntimeException e) {
            log.error("Error handling {} {} event: {}", kind, event.type(), e.getMessage(), e);
        }
    }

    /** Ends the loop and closes the open stream so a blocked read returns. */
    public void stop() {
        running = false;
        WatchStream<T> stream = current;
        if (stream != null) {
            stream.close();
        }
    }

    public boolean isRunning() {
        return running;
    }

    private boolean pause(long ms) {
        try {
            Thread.sleep(ms);
            return running;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            return false;
        }
    }
}
