package com.ambient.core.cluster.kube;

import com.ambient.core.cluster.WatchEvent;
import com.ambient.core.cluster.WatchStream;
import io.kubernetes.client.util.Watch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Function;

/**
 * Adapts a client-java {@link Watch} to {@link WatchStream}, converting each payload.
 */
final class KubeWatchStream<S, T> implements WatchStream<T> {

    private static final Logger log = LoggerFactory.getLogger(KubeWatchStream.class);

    private final Watch<S> watch;
    private final Function<S, T> converter;

    KubeWatchStream(Watch<S> watch, Function<S, T> converter) {
        this.watch = watch;
        this.converter = converter;
    }

    @Override
    public boolean hasNext() {
        return watch.hasNext();
    }

    @Override
    public WatchEvent<T> next() {
        Watch.Response<S> response = watch.next();
        WatchEvent.Type type = WatchEvent.Type.fromWire(response.type);
        if (type == WatchEvent.Type.ERROR || response.object == null) {
            if (response.status != null) {
                log.warn("Watch error event: {} ({})", response.status.getMessage(), response.status.getCode());
            }
            return new WatchEvent<>(WatchEvent.Type.ERROR, null);
        }
        return new WatchEvent<>(type, converter.apply(response.object));
    }

    @Override
    public void close() {
        try {
            watch.close();
        } catch (IOException e) {
            log.debug("Error closing watch: {}", e.getMessage());
        }
    }
}
