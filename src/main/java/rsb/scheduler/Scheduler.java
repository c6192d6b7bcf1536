package rsb.scheduler;

import rsb.flow.Disposable;

/**
 * Provides an abstract asychronous boundary to the bridges.
 */
public interface Scheduler {
    /**
     * Schedules the given task on this scheduler non-delayed execution.
     *
     * <p>
     * This method is safe to be called from multiple threads but there are no
     * ordering guarantees between tasks.
     *
     * @param task the task to execute
     *
     * @return the Disposable instance that let's one cancel this particular task.
     * If the Scheduler has been shut down, the {@link #REJECTED} Disposable instance is returned.
     */
    Disposable schedule(Runnable task);

    /**
     * Instructs this Scheduler to release all resources and reject
     * any new tasks to be executed.
     */
    default void shutdown() {

    }

    /**
     * Returned by the schedule() methods if the Scheduler has been shut down.
     */
    Disposable REJECTED = new Disposable() {
        @Override
        public void dispose() {
            // deliberately no-op
        }

        @Override
        public String toString() {
            return "Rejected task";
        }
    };
}
