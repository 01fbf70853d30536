package com.ambient.core.cluster;

import java.io.Closeable;
import java.util.Iterator;

/**
 * A live subscription to object changes. Iteration blocks until the next event and ends
 * when the server closes the stream.
 */
public interface WatchStream<T> extends Iterator<WatchEvent<T>>, Closeable {

    @Override
    void close();
}
