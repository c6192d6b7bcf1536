package rsb.scheduler;

/**
 * Priority hint for launched tasks, mapped onto {@link Thread} priorities.
 */
public enum TaskPriority {
    BACKGROUND(Thread.MIN_PRIORITY),
    LOW(3),
    MEDIUM(Thread.NORM_PRIORITY),
    HIGH(7);

    final int threadPriority;

    TaskPriority(int threadPriority) {
        this.threadPriority = threadPriority;
    }

    /**
     * @return the priority the worker threads of this hint run with
     */
    public int threadPriority() {
        return threadPriority;
    }
}
