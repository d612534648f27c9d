package io.github.asynctimer4j;

/**
 * Base class of all errors reported by {@link Timer} operations.
 */
public class TimerException extends RuntimeException {

	public TimerException(String message) {
		super(message);
	}

	public TimerException(String message, Throwable cause) {
		super(message, cause);
	}
}
