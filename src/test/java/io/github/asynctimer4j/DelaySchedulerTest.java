package io.github.asynctimer4j;

import org.testng.annotations.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.testng.Assert.*;

public class DelaySchedulerTest {

	@Test
	public void testDefaultInstanceRunsOnDaemonThread() throws Exception {
		CountDownLatch latch = new CountDownLatch(1);
		AtomicReference<Thread> thread = new AtomicReference<>();
		DelayScheduler.defaultInstance().delay(() -> {
			thread.set(Thread.currentThread());
			latch.countDown();
		}, 5, TimeUnit.MILLISECONDS);

		assertTrue(latch.await(2, TimeUnit.SECONDS));
		assertTrue(thread.get().isDaemon());
		assertTrue(thread.get().getName().startsWith("asynctimer4j-scheduler-"));
	}

	@Test
	public void testCancelledDelayNeverRuns() throws Exception {
		ScheduledExecutorService sched = Executors.newSingleThreadScheduledExecutor();
		try {
			AtomicBoolean ran = new AtomicBoolean();
			DelayScheduler.fromExecutor(sched).delay(() -> ran.set(true), 50, TimeUnit.MILLISECONDS).cancel();
			Thread.sleep(150);
			assertFalse(ran.get());
		} finally {
			sched.shutdownNow();
		}
	}
}
