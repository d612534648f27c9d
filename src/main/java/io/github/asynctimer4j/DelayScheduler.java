package io.github.asynctimer4j;


import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Source of one-shot delays for {@link Timer} waits.
 */
@FunctionalInterface
public interface DelayScheduler {

	/**
	 * Runs r once after the timeout. Must not run r in the caller thread.
	 */
	Cancellable delay(Runnable r, long timeout, TimeUnit unit);

	@FunctionalInterface
	interface Cancellable {
		/**
		 * Best effort, the delayed runnable may still run if it is already started.
		 */
		void cancel();
	}

	/**
	 * Adapts caller-owned executor, its lifecycle remains the caller's responsibility.
	 */
	static DelayScheduler fromExecutor(ScheduledExecutorService sched) {
		requireNonNull(sched);
		return (r, t, u) -> {
			ScheduledFuture<?> f = sched.schedule(r, t, u);
			return () -> f.cancel(false);
		};
	}

	/**
	 * Shared pool of daemon threads, its size is taken from "asynctimer4j.scheduler.threads" system property.
	 */
	static DelayScheduler defaultInstance() {
		return DefaultImpl.scheduler;
	}


	final class DefaultImpl {
		private static final int poolSize = Integer.getInteger("asynctimer4j.scheduler.threads", 2);
		private static final DelayScheduler scheduler = fromExecutor(newExecutor());

		private DefaultImpl() {
		}

		private static ScheduledExecutorService newExecutor() {
			if (poolSize < 1) {
				throw new IllegalStateException("asynctimer4j.scheduler.threads must be at least 1");
			}
			ScheduledThreadPoolExecutor sched = new ScheduledThreadPoolExecutor(poolSize, new ThreadFactoryBuilder()
					.setNameFormat("asynctimer4j-scheduler-%d")
					.setDaemon(true)
					.build());
			sched.setRemoveOnCancelPolicy(true);
			return sched;
		}
	}
}
