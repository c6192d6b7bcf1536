package rsb.scheduler;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared default schedulers, one cached daemon thread pool per {@link TaskPriority}.
 */
public final class Schedulers {

    static final Logger LOGGER = LoggerFactory.getLogger(Schedulers.class);

    static final Map<TaskPriority, Scheduler> SHARED = new ConcurrentHashMap<>();

    private Schedulers() {
        throw new IllegalStateException("No instances!");
    }

    /**
     * @return the shared scheduler of {@link TaskPriority#MEDIUM}
     */
    public static Scheduler background() {
        return forPriority(TaskPriority.MEDIUM);
    }

    /**
     * Returns the shared scheduler whose threads run with the given priority.
     * @param priority the priority hint
     * @return the shared scheduler, created on first use
     */
    public static Scheduler forPriority(TaskPriority priority) {
        Objects.requireNonNull(priority, "priority");
        return SHARED.computeIfAbsent(priority, Schedulers::newPriorityScheduler);
    }

    /**
     * Wraps an ExecutorService; shutting the returned scheduler down shuts the executor down.
     * @param executor the executor to wrap
     * @return the scheduler
     */
    public static Scheduler fromExecutorService(ExecutorService executor) {
        return new ExecutorServiceScheduler(executor);
    }

    /**
     * Shuts down the shared schedulers; the next use creates fresh ones.
     */
    public static void shutdownNow() {
        for (TaskPriority p : TaskPriority.values()) {
            Scheduler s = SHARED.remove(p);
            if (s != null) {
                s.shutdown();
            }
        }
    }

    static Scheduler newPriorityScheduler(TaskPriority priority) {
        LOGGER.debug("Creating the shared {} scheduler", priority);
        return new ExecutorServiceScheduler(Executors.newCachedThreadPool(new PriorityThreadFactory(priority)));
    }

    static final class PriorityThreadFactory implements ThreadFactory {

        final TaskPriority priority;

        final String prefix;

        final AtomicLong counter = new AtomicLong();

        PriorityThreadFactory(TaskPriority priority) {
            this.priority = priority;
            this.prefix = "rsb-" + priority.name().toLowerCase(Locale.ROOT) + "-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            t.setPriority(priority.threadPriority());
            return t;
        }
    }
}
