package io.github.asynctimer4j;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import io.github.asynctimer4j.internal.TimerUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Objects.requireNonNull;

/**
 * Timer executes {@link TimerCallback} after a delay, once or repeatedly, and can be paused, resumed, stopped
 * and re-tuned (see {@link #adjustInterval(Duration)}) while it runs.<p>
 * <p>
 * Each run is driven by a single non-blocking loop: "wait for interval, then execute callback".
 * The loop never holds a thread while waiting or while paused: waits are delays of {@link DelayScheduler},
 * and every loop step is executed by the callback executor, see {@link Conf}. <p>
 * <p>
 * {@link TimerState} is the single source of truth for the loop and for all public methods.
 * All state transitions are done under the timer's lock, which is never held while the callback runs. <p>
 * <p>
 * Timer guarantees that
 * <ul><li> At most one loop exists per timer, start methods stop the previous run first
 * <li> No callback is executed after {@link #stop()} returns. An execution which was already in flight is allowed to finish,
 * but its outcome is discarded (not counted in statistics)
 * <li> Callback failures never stop the timer, they are counted as ticks and reported to {@link TimerListener}
 * </ul>
 * <p>
 * Timers are never collected while running, use {@link #stop()} or {@link #close()} when you're done.
 */
@SuppressWarnings("WeakerAccess")
public final class Timer implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(Timer.class);

	/**
	 * Configuration object
	 */
	public static class Conf {
		private static final TimerListener emptyListener = new TimerListener() {
		};

		private DelayScheduler scheduler = DelayScheduler.defaultInstance();
		private Executor callbackExecutor = ForkJoinPool.commonPool();
		private Object id;
		private TimerListener listener = emptyListener;
		private Ticker ticker = Ticker.systemTicker();

		public void setScheduler(DelayScheduler scheduler) {
			this.scheduler = requireNonNull(scheduler);
		}

		/**
		 * Default pool is FJP. Callbacks and all loop steps are executed there.
		 */
		public void setCallbackExecutor(Executor callbackExecutor) {
			this.callbackExecutor = requireNonNull(callbackExecutor);
		}

		/**
		 * Optional user associated id, it is used for logging, and in toString()
		 *
		 * @param id must have good readable toString() representation
		 */
		public void setAssociatedId(Object id) {
			this.id = requireNonNull(id);
		}

		public void setListener(TimerListener listener) {
			this.listener = requireNonNull(listener);
		}

		/**
		 * Time source of {@link TimerStatistics#elapsedTime()}.
		 */
		public void setTicker(Ticker ticker) {
			this.ticker = requireNonNull(ticker);
		}
	}

	private final DelayScheduler scheduler;
	private final Executor callbackExecutor;
	private final Object id;
	private final TimerListener listener;
	private final Ticker ticker;

	private final Object lock = new Object();

	//<editor-fold desc="Guarded by lock:">
	private TimerState state = TimerState.STOPPED;
	private Duration interval;
	private TimerStatistics statistics = TimerStatistics.EMPTY;
	/**
	 * Non-null iff state != STOPPED.
	 */
	private Run run;
	/**
	 * The current run or the one which ended most recently, null if the timer was never started.
	 */
	private Run lastRun;
	//</editor-fold>

	public static Conf newConf() {
		return new Conf();
	}

	public Timer(Conf config) {
		this.scheduler = config.scheduler;
		this.callbackExecutor = config.callbackExecutor;
		this.id = config.id;
		this.listener = config.listener;
		this.ticker = config.ticker;
	}

	public Timer() {
		this(newConf());
	}

	/**
	 * This form of constructor can save you a few lines of code: you don't need to create configuration object yourself.
	 */
	public Timer(Consumer<Conf> configInit) {
		this(TimerUtil.with(newConf(), configInit));
	}

	/**
	 * Executes callback once after the delay, then the timer stops by itself.
	 */
	public void startOnce(Duration delay, TimerCallback callback) throws InvalidParameterException {
		start(delay, callback, false, 0);
	}

	/**
	 * Executes callback every interval until stopped.
	 */
	public void startRecurring(Duration interval, TimerCallback callback) throws InvalidParameterException {
		start(interval, callback, true, 0);
	}

	/**
	 * Executes callback every interval, the timer stops by itself after expirationCount executions.
	 */
	public void startRecurring(Duration interval, TimerCallback callback, long expirationCount)
			throws InvalidParameterException {
		if (expirationCount < 1) {
			throw new InvalidParameterException("expiration count must be at least 1, got " + expirationCount);
		}
		start(interval, callback, true, expirationCount);
	}

	/**
	 * Only running timer can be paused, pausing a paused timer is an error as well.
	 */
	public void pause() throws TimerStoppedException {
		synchronized (lock) {
			if (state != TimerState.RUNNING) {
				throw new TimerStoppedException(this, state);
			}
			state = TimerState.PAUSED;
		}
		log.debug("{} paused", this);
		notifyListener(l -> l.onPause(this));
	}

	public void resume() throws InvalidParameterException {
		CompletableFuture<Void> pauseSignal;
		synchronized (lock) {
			if (state != TimerState.PAUSED) {
				throw new InvalidParameterException("timer is not paused, " + this + " is " + state);
			}
			state = TimerState.RUNNING;
			pauseSignal = run.takePauseSignal();
		}
		if (pauseSignal != null) {
			pauseSignal.complete(null);
		}
		log.debug("{} resumed", this);
		notifyListener(l -> l.onResume(this));
	}

	/**
	 * Stopping a stopped timer is an error. <p>
	 * If the loop has already committed to a callback invocation, this method waits until {@link TimerCallback#executeAsync()}
	 * returns (it must be non-blocking anyway), but never for the resultant CompletionStage.
	 * It doesn't wait when called from the callback itself.
	 */
	public void stop() throws TimerStoppedException {
		Runnable teardown;
		TimerStatistics finalStats;
		synchronized (lock) {
			if (state == TimerState.STOPPED) {
				throw new TimerStoppedException(this, state);
			}
			state = TimerState.STOPPED;
			finalStats = statistics;
			Run taken = run;
			teardown = takeRunLocked(finalStats);
			if (taken != null) {
				taken.awaitInvocationLocked();
			}
		}
		if (teardown != null) {
			teardown.run();
		}
		log.debug("{} stopped, {}", this, finalStats);
		notifyListener(l -> l.onStop(this, finalStats));
	}

	/**
	 * The wait which is already scheduled keeps its duration, the new interval is used starting from the next wait.
	 */
	public void adjustInterval(Duration newInterval) throws InvalidParameterException {
		if (!TimerUtil.isPositive(newInterval)) {
			throw new InvalidParameterException("interval must be greater than zero, got " + newInterval);
		}
		synchronized (lock) {
			this.interval = newInterval;
		}
		log.debug("{} interval adjusted to {}", this, newInterval);
	}

	public TimerState getState() {
		synchronized (lock) {
			return state;
		}
	}

	public TimerStatistics getStatistics() {
		synchronized (lock) {
			return statistics;
		}
	}

	/**
	 * Completes with the final statistics when the current run ends: by stop(), by restart, or by itself. <p>
	 * If there's no current run, it is the stage of the last one (exceptional if the loop failed). <p>
	 * Use async-methods of resultant CompletionStage (with custom executor) if you need lengthy/blocking processing!
	 */
	public CompletionStage<TimerStatistics> whenStopped() {
		synchronized (lock) {
			return lastRun != null ? lastRun.stopped : CompletableFuture.completedFuture(statistics);
		}
	}

	/**
	 * Same as {@link #stop()}, but tolerates already stopped timer.
	 */
	@Override
	public void close() {
		try {
			stop();
		} catch (TimerStoppedException e) {
			log.trace("{} is already stopped", this);
		}
	}

	/**
	 * User associated id, can be anything having good toString() method.
	 *
	 * @see Conf#setAssociatedId(Object)
	 */
	public Object associatedId() {
		return id;
	}

	@Override
	public String toString() {
		if (id != null) {
			return getClass().getSimpleName() + "@" + id;
		}
		return super.toString();
	}

	private void start(Duration interval, TimerCallback callback, boolean recurring, long expirationCount) {
		checkNotNull(callback, "callback");
		if (!TimerUtil.isPositive(interval)) {
			throw new InvalidParameterException("interval must be greater than zero, got " + interval);
		}
		Run next = new Run(callback, recurring, expirationCount);
		Runnable teardown;
		TimerStatistics prevStats;
		synchronized (lock) {
			prevStats = statistics;
			Run prev = run;
			teardown = takeRunLocked(prevStats);
			this.interval = interval;
			this.state = TimerState.RUNNING;
			this.statistics = TimerStatistics.EMPTY;
			this.run = next;
			this.lastRun = next;
			if (prev != null) {
				prev.awaitInvocationLocked();
			}
		}
		if (teardown != null) {
			teardown.run();
			log.debug("{} previous run stopped, {}", this, prevStats);
			notifyListener(l -> l.onStop(this, prevStats));
		}
		if (log.isDebugEnabled()) {
			log.debug("{} started, interval={} recurring={} expirationCount={}", this, interval, recurring,
					expirationCount > 0 ? expirationCount : "none");
		}
		notifyListener(l -> l.onStart(this, recurring));
		next.loop();
	}

	private Runnable takeRunLocked(TimerStatistics finalStats) {
		Run r = this.run;
		this.run = null;
		return r != null ? r.cancelLocked(finalStats) : null;
	}

	private void notifyListener(Consumer<TimerListener> event) {
		try {
			event.accept(listener);
		} catch (Exception ex) {
			log.debug("TimerListener should never throw exceptions", ex);
		}
	}

	/**
	 * A single run: from start till the loop exit.
	 * Once cancelled, the run never becomes current again, all its pending continuations just exit.
	 */
	private final class Run {
		private final TimerCallback callback;
		private final boolean recurring;
		/**
		 * 0 means unbounded.
		 */
		private final long expirationCount;
		private final Stopwatch stopwatch = Stopwatch.createStarted(ticker);
		private final CompletableFuture<TimerStatistics> stopped = new CompletableFuture<>();

		//<editor-fold desc="Guarded by lock:">
		private boolean cancelled;
		private CompletableFuture<Void> pendingWait;
		private DelayScheduler.Cancellable pendingDelay;
		private CompletableFuture<Void> pauseSignal;
		/**
		 * Thread which is inside {@link TimerCallback#executeAsync()} right now, if any.
		 */
		private Thread invoker;
		//</editor-fold>

		Run(TimerCallback callback, boolean recurring, long expirationCount) {
			this.callback = callback;
			this.recurring = recurring;
			this.expirationCount = expirationCount;
		}

		/**
		 * Either parks on the pause signal, or schedules the next wait.
		 */
		void loop() {
			try {
				doLoop();
			} catch (Throwable ex) {
				// e.g. DelayScheduler rejected the wait
				fail(ex);
			}
		}

		private void doLoop() {
			CompletableFuture<Void> parkedOn;
			boolean paused;
			synchronized (lock) {
				if (cancelled) {
					return;
				}
				assert run == this && state != TimerState.STOPPED;
				paused = state == TimerState.PAUSED;
				if (paused) {
					parkedOn = pauseSignal = new CompletableFuture<>();
				} else {
					CompletableFuture<Void> elapsed = new CompletableFuture<>();
					pendingDelay = scheduler.delay(() -> elapsed.complete(null), TimeUnit.NANOSECONDS.convert(interval), TimeUnit.NANOSECONDS);
					parkedOn = pendingWait = elapsed;
				}
			}
			if (paused) {
				log.trace("{} parked", Timer.this);
				continueAfter(parkedOn, this::loop);
			} else {
				continueAfter(parkedOn, this::afterWait);
			}
		}

		/**
		 * Waits (releasing the lock) till the committed callback invocation returns, so that no invocation
		 * of a cancelled run can begin after the caller leaves the lock.
		 */
		void awaitInvocationLocked() {
			boolean interrupted = false;
			while (invoker != null && invoker != Thread.currentThread()) {
				try {
					lock.wait();
				} catch (InterruptedException e) {
					interrupted = true;
				}
			}
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		}

		CompletableFuture<Void> takePauseSignal() {
			CompletableFuture<Void> signal = pauseSignal;
			pauseSignal = null;
			return signal;
		}

		/**
		 * @return teardown action to be executed outside of the lock
		 */
		Runnable cancelLocked(TimerStatistics finalStats) {
			cancelled = true;
			CompletableFuture<Void> wait = pendingWait;
			DelayScheduler.Cancellable delay = pendingDelay;
			CompletableFuture<Void> signal = takePauseSignal();
			pendingWait = null;
			pendingDelay = null;
			return () -> {
				if (delay != null) {
					delay.cancel();
				}
				if (wait != null) {
					wait.complete(null);
				}
				if (signal != null) {
					signal.complete(null);
				}
				stopped.complete(finalStats);
			};
		}

		private void continueAfter(CompletableFuture<Void> wakeUp, Runnable step) {
			try {
				wakeUp.thenRunAsync(step, callbackExecutor).whenComplete((ignored, ex) -> {
					if (ex != null) {
						fail(ex);
					}
				});
			} catch (Throwable ex) {
				// executor rejected an already completed wakeUp
				fail(ex);
			}
		}

		private void afterWait() {
			boolean paused;
			synchronized (lock) {
				pendingWait = null;
				pendingDelay = null;
				if (cancelled) {
					return;
				}
				paused = state == TimerState.PAUSED;
				if (!paused) {
					invoker = Thread.currentThread();
				}
			}
			if (paused) {
				loop();
				return;
			}
			CompletionStage<?> result;
			try {
				result = invokeCallback();
			} finally {
				synchronized (lock) {
					invoker = null;
					lock.notifyAll();
				}
			}
			result
					.handle((ignored, ex) -> {
						afterTick(ex);
						return null;
					})
					.whenComplete((ignored, ex) -> {
						if (ex != null) {
							fail(ex);
						}
					});
		}

		private CompletionStage<?> invokeCallback() {
			try {
				CompletionStage<?> result = callback.executeAsync();
				return result != null ? result : TimerUtil.doneFuture;
			} catch (Throwable ex) {
				return TimerUtil.failedFuture(ex);
			}
		}

		private void afterTick(Throwable callbackError) {
			final TimerStatistics stats;
			final boolean expired;
			synchronized (lock) {
				if (cancelled) {
					stats = null;
					expired = false;
				} else {
					stats = new TimerStatistics(statistics.executionCount() + 1, stopwatch.elapsed());
					statistics = stats;
					expired = !recurring || (expirationCount > 0 && stats.executionCount() >= expirationCount);
					if (expired) {
						cancelled = true;
						run = null;
						state = TimerState.STOPPED;
					}
				}
			}
			if (stats == null) {
				log.debug("{} callback finished after stop, its outcome is discarded", Timer.this);
				return;
			}
			if (callbackError != null) {
				CallbackFailedException failure = asCallbackFailure(callbackError);
				log.warn(Timer.this + " callback failed", failure);
				notifyListener(l -> l.onCallbackFailed(Timer.this, failure));
			}
			log.debug("{} tick, {}", Timer.this, stats);
			notifyListener(l -> l.onTick(Timer.this, stats));
			if (expired) {
				log.debug("{} expired", Timer.this);
				notifyListener(l -> l.onExpire(Timer.this, stats));
				stopped.complete(stats);
			} else {
				loop();
			}
		}

		private void fail(Throwable ex) {
			Throwable cause = TimerUtil.unwrap(ex);
			log.error(Timer.this + ": BUG: uncaught error in timer loop", cause);
			synchronized (lock) {
				cancelled = true;
				if (run == this) {
					run = null;
					state = TimerState.STOPPED;
				}
			}
			stopped.completeExceptionally(cause);
		}
	}

	private static CallbackFailedException asCallbackFailure(Throwable ex) {
		Throwable cause = TimerUtil.unwrap(ex);
		return cause instanceof CallbackFailedException ? (CallbackFailedException) cause : new CallbackFailedException(cause);
	}
}
