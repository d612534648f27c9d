package io.github.asynctimer4j;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Registry of timers keyed by generated ids. <p>
 * Ids are allocated sequentially starting from 0 and never reused by the same manager.
 * The manager doesn't take part in timer execution, it only stores timers and fans out {@link #stopAll()}.
 */
@SuppressWarnings("WeakerAccess")
public final class TimerManager implements AutoCloseable {
	private static final Logger log = LoggerFactory.getLogger(TimerManager.class);

	private final ConcurrentMap<Long, Timer> timers = new ConcurrentHashMap<>();
	private final AtomicLong nextId = new AtomicLong();

	public long addTimer(Timer timer) {
		checkNotNull(timer);
		long id = nextId.getAndIncrement();
		timers.put(id, timer);
		return id;
	}

	/**
	 * @return the registered instance itself, all Timer methods can be called on it
	 */
	public Optional<Timer> getTimer(long id) {
		return Optional.ofNullable(timers.get(id));
	}

	/**
	 * Ids of timers which are not stopped, in no particular order.
	 */
	public List<Long> listTimers() {
		return timers.entrySet().stream()
				.filter(e -> e.getValue().getState() != TimerState.STOPPED)
				.map(Map.Entry::getKey)
				.collect(Collectors.toList());
	}

	/**
	 * Stops every registered timer, already stopped ones are skipped silently.
	 */
	public void stopAll() {
		timers.forEach((id, timer) -> {
			try {
				timer.stop();
			} catch (TimerStoppedException e) {
				log.debug("timer {} is already stopped", id);
			}
		});
	}

	@Override
	public void close() {
		stopAll();
	}
}
