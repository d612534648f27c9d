package io.github.asynctimer4j;

/**
 * Operation requires an active timer.
 */
public class TimerStoppedException extends TimerException {

	public TimerStoppedException(Object timer, TimerState state) {
		super("Operation attempted on a stopped timer. " + timer + " is " + state);
	}
}
