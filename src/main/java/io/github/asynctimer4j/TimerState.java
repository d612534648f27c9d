package io.github.asynctimer4j;

/**
 * Exactly one value holds at any instant for a given {@link Timer}. New timers are {@link #STOPPED}.
 */
public enum TimerState {
	RUNNING,
	PAUSED,
	STOPPED
}
