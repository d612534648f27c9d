package io.github.asynctimer4j;

import io.github.asynctimer4j.internal.TimerUtil;

import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * The unit of work a {@link Timer} executes on each tick.
 * <p>
 * The tick is considered complete when the resultant CompletionStage is complete
 * (unlike normal Runnable, which completes when its run() method returns).
 * <p>
 * The tick fails if this method throws, or if the resultant stage completes exceptionally.
 * Throw (or complete with) {@link CallbackFailedException} to signal failure explicitly; other exceptions are wrapped into it.
 * A failed tick is still counted and never stops the timer.
 */
@FunctionalInterface
public interface TimerCallback {
	/**
	 * Must be non-blocking (usually, but it depends on the callback executor chosen in {@link Timer.Conf}).
	 * It may return null, which is interpreted the same as {@link java.util.concurrent.CompletableFuture#completedFuture(Object)} (immediate completion)
	 */
	CompletionStage<?> executeAsync();

	static TimerCallback fromRunnable(Runnable r) {
		requireNonNull(r);
		return () -> {
			r.run();
			return TimerUtil.doneFuture;
		};
	}
}
