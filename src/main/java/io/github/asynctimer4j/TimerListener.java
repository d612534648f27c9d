package io.github.asynctimer4j;

/**
 * For logging/monitoring usage only.
 * <p>
 * Methods are called outside of the timer's lock, possibly concurrently from the caller thread and from the loop.
 * Listener must never throw, exceptions are logged (debug level) and ignored.
 * The Timer is passed here only for printing or monitoring (toString()/associatedId() methods).
 */
public interface TimerListener {

	default void onStart(Timer timer, boolean recurring) {
	}

	default void onPause(Timer timer) {
	}

	default void onResume(Timer timer) {
	}

	/**
	 * Explicit stop (or restart), with the statistics of the cancelled run.
	 */
	default void onStop(Timer timer, TimerStatistics stats) {
	}

	default void onTick(Timer timer, TimerStatistics stats) {
	}

	default void onCallbackFailed(Timer timer, CallbackFailedException failure) {
	}

	/**
	 * The run ended by itself: one-time tick done or expiration count reached.
	 */
	default void onExpire(Timer timer, TimerStatistics stats) {
	}
}
