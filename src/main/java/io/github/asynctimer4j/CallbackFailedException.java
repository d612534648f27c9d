package io.github.asynctimer4j;

/**
 * {@link TimerCallback} signalled failure.
 * It is never thrown to the timer's user, only reported to {@link TimerListener#onCallbackFailed} and logged.
 */
public class CallbackFailedException extends TimerException {

	public CallbackFailedException(String detail) {
		super("Callback execution failed: " + detail);
	}

	public CallbackFailedException(Throwable cause) {
		super("Callback execution failed: " + cause, cause);
	}
}
