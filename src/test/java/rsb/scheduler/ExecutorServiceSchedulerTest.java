package rsb.scheduler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import rsb.flow.Disposable;
import rsb.util.UnsignalledExceptions;

public class ExecutorServiceSchedulerTest {

    ExecutorService exec;

    Scheduler scheduler;

    @Before
    public void before() {
        exec = Executors.newSingleThreadExecutor();
        scheduler = new ExecutorServiceScheduler(exec);
    }

    @After
    public void after() {
        scheduler.shutdown();
        UnsignalledExceptions.setErrorConsumer(null);
    }

    @Test(expected = NullPointerException.class)
    public void executorNull() {
        new ExecutorServiceScheduler(null);
    }

    @Test(timeout = 5000)
    public void runsTask() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.schedule(ran::countDown);

        Assert.assertTrue(ran.await(4, TimeUnit.SECONDS));
    }

    @Test(timeout = 5000)
    public void disposeInterruptsRunningTask() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        Disposable d = scheduler.schedule(() -> {
            running.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ex) {
                interrupted.countDown();
            }
        });

        Assert.assertTrue(running.await(4, TimeUnit.SECONDS));

        d.dispose();

        Assert.assertTrue(interrupted.await(4, TimeUnit.SECONDS));
    }

    @Test(timeout = 5000)
    public void selfDisposeDoesNotInterrupt() throws Exception {
        CompletableFuture<Disposable> self = new CompletableFuture<>();
        CompletableFuture<Boolean> interruptedAfterDispose = new CompletableFuture<>();

        self.complete(scheduler.schedule(() -> {
            Disposable d = self.join();
            d.dispose();
            interruptedAfterDispose.complete(Thread.currentThread().isInterrupted());
        }));

        Assert.assertFalse(interruptedAfterDispose.get(4, TimeUnit.SECONDS));
    }

    @Test(timeout = 5000)
    public void taskFailureGoesToTheHook() throws Exception {
        CompletableFuture<Throwable> dropped = new CompletableFuture<>();
        UnsignalledExceptions.setErrorConsumer(dropped::complete);

        scheduler.schedule(() -> {
            throw new IllegalStateException("task failed");
        });

        Assert.assertEquals("task failed", dropped.get(4, TimeUnit.SECONDS).getMessage());
    }

    @Test
    public void rejectedAfterShutdown() {
        scheduler.shutdown();

        Assert.assertSame(Scheduler.REJECTED, scheduler.schedule(() -> { }));
    }
}
