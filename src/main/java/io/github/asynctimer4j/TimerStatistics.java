package io.github.asynctimer4j;

import com.google.common.base.MoreObjects;

import java.time.Duration;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Immutable snapshot of a timer run.
 * Stats usage only, never use it for the logic of your App: it may reflect any point between two ticks.
 */
public final class TimerStatistics {
	static final TimerStatistics EMPTY = new TimerStatistics(0, Duration.ZERO);

	private final long executionCount;
	private final Duration elapsedTime;

	TimerStatistics(long executionCount, Duration elapsedTime) {
		if (executionCount < 0) {
			throw new IllegalArgumentException("executionCount must be >= 0");
		}
		this.executionCount = executionCount;
		this.elapsedTime = requireNonNull(elapsedTime);
	}

	/**
	 * Number of callback invocations in the current (or last) run, failed invocations included.
	 */
	public long executionCount() {
		return executionCount;
	}

	/**
	 * Time since the run started, refreshed after each tick.
	 */
	public Duration elapsedTime() {
		return elapsedTime;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TimerStatistics)) return false;
		TimerStatistics that = (TimerStatistics) o;
		return executionCount == that.executionCount && elapsedTime.equals(that.elapsedTime);
	}

	@Override
	public int hashCode() {
		return Objects.hash(executionCount, elapsedTime);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("executionCount", executionCount)
				.add("elapsedTime", elapsedTime)
				.toString();
	}
}
