package rsb.scheduler;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import rsb.flow.Disposable;
import rsb.util.ExceptionHelper;
import rsb.util.UnsignalledExceptions;

/**
 * A scheduler which uses a backing ExecutorService to run the driving tasks of the bridges.
 * <p>
 * Disposing a running task interrupts its thread unless the task disposes itself.
 */
public final class ExecutorServiceScheduler implements Scheduler {

    static final Runnable EMPTY = new Runnable() {
        @Override
        public void run() {

        }
    };

    static final Future<?> CANCELLED_FUTURE = new FutureTask<>(EMPTY, null);

    static final Future<?> FINISHED = new FutureTask<>(EMPTY, null);

    final ExecutorService executor;

    public ExecutorServiceScheduler(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public Disposable schedule(Runnable task) {
        ScheduledRunnable sr = new ScheduledRunnable(task);
        Future<?> f;
        try {
            f = executor.submit(sr);
        } catch (RejectedExecutionException ex) {
            return REJECTED;
        }
        sr.setFuture(f);
        return sr;
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }

    @Override
    public String toString() {
        return "ExecutorServiceScheduler[" + executor + "]";
    }

    static final class ScheduledRunnable
    extends AtomicReference<Future<?>>
    implements Runnable, Disposable {
        /** */
        private static final long serialVersionUID = 2284024836904862408L;

        final Runnable task;

        volatile Thread current;

        ScheduledRunnable(Runnable task) {
            this.task = Objects.requireNonNull(task, "task");
        }

        @Override
        public void run() {
            current = Thread.currentThread();
            try {
                try {
                    task.run();
                } catch (Throwable e) {
                    ExceptionHelper.throwIfFatal(e);
                    UnsignalledExceptions.onErrorDropped(e);
                }
            } finally {
                for (;;) {
                    Future<?> a = get();
                    if (a == CANCELLED_FUTURE) {
                        break;
                    }
                    if (compareAndSet(a, FINISHED)) {
                        break;
                    }
                }
                current = null;
            }
        }

        void doCancel(Future<?> a) {
            a.cancel(Thread.currentThread() != current);
        }

        @Override
        public void dispose() {
            for (;;) {
                Future<?> a = get();
                if (a == FINISHED || a == CANCELLED_FUTURE) {
                    return;
                }
                if (compareAndSet(a, CANCELLED_FUTURE)) {
                    if (a != null) {
                        doCancel(a);
                    }
                    return;
                }
            }
        }

        void setFuture(Future<?> f) {
            for (;;) {
                Future<?> a = get();
                if (a == FINISHED) {
                    return;
                }
                if (a == CANCELLED_FUTURE) {
                    doCancel(f);
                    return;
                }
                if (compareAndSet(null, f)) {
                    return;
                }
            }
        }

        @Override
        public String toString() {
            return "ScheduledRunnable[cancelled=" + (get() == CANCELLED_FUTURE) + ", task=" + task + "]";
        }
    }
}
