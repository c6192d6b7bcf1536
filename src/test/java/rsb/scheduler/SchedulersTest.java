package rsb.scheduler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.Assert;
import org.junit.Test;

public class SchedulersTest {

    @Test
    public void sharedPerPriority() {
        Assert.assertSame(Schedulers.forPriority(TaskPriority.LOW), Schedulers.forPriority(TaskPriority.LOW));
        Assert.assertSame(Schedulers.forPriority(TaskPriority.MEDIUM), Schedulers.background());
        Assert.assertNotSame(Schedulers.forPriority(TaskPriority.LOW), Schedulers.forPriority(TaskPriority.HIGH));
    }

    @Test(timeout = 5000)
    public void threadsAreNamedDaemons() throws Exception {
        CompletableFuture<Thread> thread = new CompletableFuture<>();

        Schedulers.forPriority(TaskPriority.BACKGROUND).schedule(() -> thread.complete(Thread.currentThread()));

        Thread t = thread.get(4, TimeUnit.SECONDS);
        Assert.assertTrue(t.getName(), t.getName().startsWith("rsb-background-"));
        Assert.assertTrue(t.isDaemon());
        Assert.assertEquals(Thread.MIN_PRIORITY, t.getPriority());
    }

    @Test(expected = NullPointerException.class)
    public void priorityNull() {
        Schedulers.forPriority(null);
    }
}
