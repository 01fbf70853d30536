package com.ambient.core.operator;

import com.ambient.core.config.AmbientProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the periodic supervision tasks, one per running session, keyed by
 * {@code namespace/name}. Tasks are cancelled explicitly when their session is deleted and
 * all at once on shutdown.
 */
@Component
public class SupervisionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SupervisionRegistry.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public SupervisionRegistry(AmbientProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(
                Math.max(1, properties.getOperator().getSupervisionThreads()), r -> {
                    Thread t = new Thread(r, "job-supervisor-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    static String key(String namespace, String name) {
        return namespace + "/" + name;
    }

    /**
     * Schedules {@code tick} every {@code intervalSeconds}, replacing any task already registered
     * for the session. The task ends when {@code tick} returns {@code true}.
     *
     * @return {@code false} if the registry has been shut down
     */
    public boolean schedule(String namespace, String name, long intervalSeconds, SupervisionTick tick) {
        String key = key(namespace, name);
        if (scheduler.isShutdown()) {
            log.debug("Registry stopped, not supervising {}", key);
            return false;
        }
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
        Runnable body = () -> {
            boolean finished;
            try {
                finished = tick.run();
            } catch (RuntimeException e) {
                log.warn("Supervision of {} failed this round: {}", key, e.getMessage());
                finished = false;
            }
            if (finished) {
                ScheduledFuture<?> own = self.get();
                tasks.remove(key, own);
                own.cancel(false);
            }
        };
        self.set(scheduler.scheduleWithFixedDelay(body, intervalSeconds, intervalSeconds, TimeUnit.SECONDS));
        ScheduledFuture<?> previous = tasks.put(key, self.get());
        if (previous != null) {
            previous.cancel(false);
            log.debug("Replaced existing supervision of {}", key);
        }
        return true;
    }

    /** Cancels the session's task, if any. */
    public boolean cancel(String namespace, String name) {
        ScheduledFuture<?> task = tasks.remove(key(namespace, name));
        if (task == null) {
            return false;
        }
        task.cancel(true);
        log.info("Cancelled supervision of {}/{}", namespace, name);
        return true;
    }

    public boolean isSupervising(String namespace, String name) {
        return tasks.containsKey(key(namespace, name));
    }

    public int activeCount() {
        return tasks.size();
    }

    @PreDestroy
    public void cancelAll() {
        int count = tasks.size();
        tasks.values().forEach(task -> task.cancel(true));
        tasks.clear();
        scheduler.shutdownNow();
        if (count > 0) {
            log.info("Cancelled {} supervision task(s) on shutdown", count);
        }
    }

    /**
     * One supervision round.
     */
    @FunctionalInterface
    public interface SupervisionTick {

        /** @return {@code true} when supervision is finished */
        boolean run();
    }
}
