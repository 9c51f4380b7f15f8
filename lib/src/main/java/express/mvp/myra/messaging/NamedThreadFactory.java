package express.mvp.myra.messaging;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread factory that creates named platform threads.
 *
 * <p>Threads are named "{prefix}-{counter}". The event loop uses one for its single I/O thread;
 * worker pools use one for their handler threads.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * NamedThreadFactory factory = new NamedThreadFactory("myra-worker");
 * ExecutorService executor = Executors.newFixedThreadPool(4, factory);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Multiple threads can call {@link #newThread(Runnable)}
 * concurrently.
 */
public final class NamedThreadFactory implements ThreadFactory {

    /** Counter for generating unique thread names. */
    private final AtomicLong threadCount = new AtomicLong(0);

    /** Base name prefix for created threads. */
    private final String namePrefix;

    /** Whether created threads should be daemon threads. */
    private final boolean daemon;

    /**
     * Creates a factory for daemon threads with the given name prefix.
     *
     * @param namePrefix the prefix for thread names
     */
    public NamedThreadFactory(String namePrefix) {
        this(namePrefix, true);
    }

    /**
     * Creates a factory with configurable daemon status.
     *
     * @param namePrefix the prefix for thread names
     * @param daemon whether created threads should be daemon threads
     */
    public NamedThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    /**
     * Creates a new, unstarted thread that will execute the given runnable.
     *
     * @param runnable the task to execute
     * @return a new thread (not started)
     */
    @Override
    public Thread newThread(Runnable runnable) {
        long count = threadCount.incrementAndGet();
        Thread thread = new Thread(runnable, namePrefix + "-" + count);
        thread.setDaemon(daemon);
        return thread;
    }

    /**
     * Returns the number of threads created by this factory.
     *
     * @return the total count of threads created
     */
    public long getThreadCount() {
        return threadCount.get();
    }

    @Override
    public String toString() {
        return "NamedThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
