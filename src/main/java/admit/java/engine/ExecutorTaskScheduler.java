package admit.java.engine;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskScheduler} backed by a {@link ScheduledExecutorService} with daemon threads.
 */
public final class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ScheduledExecutorService executor;

    public ExecutorTaskScheduler(String threadNamePrefix, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        this.executor = Executors.newScheduledThreadPool(threads, daemonThreads(threadNamePrefix));
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMillis) {
        ScheduledFuture<?> future = executor.schedule(task, Math.max(0L, delayMillis), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
