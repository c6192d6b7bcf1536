package rsb.scheduler;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

import rsb.flow.Disposable;
import rsb.util.ExceptionHelper;

/**
 * A one-shot computation launched on a {@link Scheduler}, with an awaitable result
 * and a cancel operation.
 *
 * @param <T> the result type
 */
public final class Task<T> implements Disposable {

    final Callable<? extends T> body;

    final CompletableFuture<T> result;

    final Disposable handle;

    Task(Scheduler scheduler, Callable<? extends T> body) {
        this.body = Objects.requireNonNull(body, "body");
        this.result = new CompletableFuture<>();
        Disposable d = scheduler.schedule(this::execute);
        if (d == Scheduler.REJECTED) {
            result.completeExceptionally(new RejectedExecutionException("Scheduler rejected the task: " + scheduler));
        }
        this.handle = d;
    }

    /**
     * Launches the body on the shared {@link TaskPriority#MEDIUM} scheduler.
     * @param <T> the result type
     * @param body the computation
     * @return the running task
     */
    public static <T> Task<T> run(Callable<? extends T> body) {
        return run(TaskPriority.MEDIUM, body);
    }

    /**
     * Launches the body on the shared scheduler of the given priority.
     * @param <T> the result type
     * @param priority the priority hint
     * @param body the computation
     * @return the running task
     */
    public static <T> Task<T> run(TaskPriority priority, Callable<? extends T> body) {
        return run(Schedulers.forPriority(priority), body);
    }

    public static <T> Task<T> run(Scheduler scheduler, Callable<? extends T> body) {
        return new Task<>(Objects.requireNonNull(scheduler, "scheduler"), body);
    }

    void execute() {
        if (result.isDone()) {
            return;
        }
        try {
            result.complete(body.call());
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            result.completeExceptionally(e);
        }
    }

    /**
     * @return the future completed with the outcome of the body
     */
    public CompletableFuture<T> future() {
        return result;
    }

    /**
     * Blocks until the body finished and returns its value.
     * @return the value of the body
     * @throws CancellationException if the task was cancelled or the waiting thread interrupted
     */
    public T join() {
        try {
            return result.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            CancellationException c = new CancellationException("Interrupted while waiting for the task");
            c.initCause(ex);
            throw c;
        } catch (ExecutionException ex) {
            throw ExceptionHelper.propagate(ex.getCause());
        }
    }

    /**
     * Cancels the task: its result completes with a {@link CancellationException} and a running
     * body gets interrupted.
     */
    public void cancel() {
        if (result.cancel(false)) {
            handle.dispose();
        }
    }

    @Override
    public void dispose() {
        cancel();
    }

    public boolean isCancelled() {
        return result.isCancelled();
    }

    public boolean isDone() {
        return result.isDone();
    }

    @Override
    public String toString() {
        return "Task[done=" + result.isDone() + ", cancelled=" + result.isCancelled() + "]";
    }
}
