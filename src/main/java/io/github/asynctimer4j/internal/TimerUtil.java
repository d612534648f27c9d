package io.github.asynctimer4j.internal;


import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

public final class TimerUtil {
	public static final CompletableFuture<Void> doneFuture = CompletableFuture.completedFuture(null);

	private TimerUtil() {
	}

	public static <T> T with(T t, Consumer<? super T> scope) {
		scope.accept(t);
		return t;
	}

	public static <T> CompletableFuture<T> failedFuture(Throwable ex) {
		CompletableFuture<T> f = new CompletableFuture<>();
		f.completeExceptionally(ex);
		return f;
	}

	/**
	 * @return true if duration is non-null and strictly positive.
	 */
	public static boolean isPositive(Duration d) {
		return d != null && !d.isZero() && !d.isNegative();
	}

	/**
	 * CompletionStage failures usually arrive wrapped into CompletionException, this method digs out the real cause.
	 */
	public static Throwable unwrap(Throwable ex) {
		Throwable cause = ex;
		while (cause instanceof CompletionException && cause.getCause() != null) {
			cause = cause.getCause();
		}
		return cause;
	}
}
