package org.neuralchilli.dagrun.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory producing {@code <prefix>-thread-<n>} daemon threads.
 */
public class NamedThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger(0);
    private final String prefix;

    public NamedThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r);
        t.setName(prefix + "-thread-" + counter.incrementAndGet());
        // Pools are per run, a stuck task must not keep the JVM alive
        t.setDaemon(true);
        return t;
    }
}
