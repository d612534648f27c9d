package io.github.asynctimer4j;

/**
 * A supplied duration or count is out of range, or the operation is not permitted in the current state
 * (e.g. resume of a timer which is not paused).
 */
public class InvalidParameterException extends TimerException {

	public InvalidParameterException(String detail) {
		super("Invalid parameter: " + detail);
	}
}
