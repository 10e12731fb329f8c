package eventsource.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates named daemon threads ({@code <prefix>1}, {@code <prefix>2}, ...) so background
 * loops such as the event stream listener never keep the JVM alive.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger(1);
    private final Thread.UncaughtExceptionHandler uncaughtHandler;

    public DaemonThreadFactory(String prefix) {
        this(prefix, null);
    }

    /**
     * @param prefix          thread name prefix
     * @param uncaughtHandler handler for failures escaping the thread, or {@code null} for the JVM default
     */
    public DaemonThreadFactory(String prefix, Thread.UncaughtExceptionHandler uncaughtHandler) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.uncaughtHandler = uncaughtHandler;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + sequence.getAndIncrement());
        thread.setDaemon(true);
        if (uncaughtHandler != null) {
            thread.setUncaughtExceptionHandler(uncaughtHandler);
        }
        return thread;
    }
}
