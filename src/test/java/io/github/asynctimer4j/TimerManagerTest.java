package io.github.asynctimer4j;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.testng.Assert.*;


public class TimerManagerTest {

	private static final TimerCallback noop = () -> null;

	@Test
	public void testIdsAreSequential() {
		TimerManager manager = new TimerManager();
		assertEquals(manager.addTimer(new Timer()), 0L);
		assertEquals(manager.addTimer(new Timer()), 1L);
		assertEquals(manager.addTimer(new Timer()), 2L);
	}

	@Test
	public void testListOnlyActiveTimersThenStopAll() {
		TimerManager manager = new TimerManager();
		Timer running1 = new Timer();
		running1.startRecurring(Duration.ofSeconds(1), noop);
		Timer running2 = new Timer();
		running2.startRecurring(Duration.ofSeconds(1), noop);

		long id1 = manager.addTimer(running1);
		long id2 = manager.addTimer(running2);
		manager.addTimer(new Timer());

		assertEquals(running1.getState(), TimerState.RUNNING);
		assertEquals(running2.getState(), TimerState.RUNNING);
		assertEquals(sorted(manager.listTimers()), Arrays.asList(id1, id2));

		manager.stopAll();

		assertEquals(manager.listTimers(), Collections.emptyList());
		assertEquals(running1.getState(), TimerState.STOPPED);
		assertEquals(running2.getState(), TimerState.STOPPED);
	}

	@Test
	public void testPausedTimerIsListedAndStopped() {
		TimerManager manager = new TimerManager();
		Timer paused = new Timer();
		paused.startRecurring(Duration.ofSeconds(1), noop);
		paused.pause();
		long id = manager.addTimer(paused);

		assertEquals(manager.listTimers(), Collections.singletonList(id));
		manager.stopAll();
		assertEquals(paused.getState(), TimerState.STOPPED);
		assertEquals(manager.listTimers(), Collections.emptyList());
	}

	@Test
	public void testStopAllSkipsStoppedTimers() {
		TimerManager manager = new TimerManager();
		Timer stopped = new Timer();
		Timer running = new Timer();
		running.startRecurring(Duration.ofSeconds(1), noop);
		manager.addTimer(stopped);
		manager.addTimer(running);

		manager.stopAll();
		manager.stopAll();

		assertEquals(running.getState(), TimerState.STOPPED);
	}

	@Test
	public void testGetTimerReturnsSharedInstance() {
		TimerManager manager = new TimerManager();
		Timer timer = new Timer();
		long id = manager.addTimer(timer);

		assertSame(manager.getTimer(id).orElseThrow(AssertionError::new), timer);
		assertFalse(manager.getTimer(id + 1).isPresent());

		manager.getTimer(id).ifPresent(t -> t.startRecurring(Duration.ofSeconds(1), noop));
		assertEquals(timer.getState(), TimerState.RUNNING);
		assertEquals(manager.listTimers(), Collections.singletonList(id));
		manager.close();
		assertEquals(timer.getState(), TimerState.STOPPED);
	}

	private static List<Long> sorted(List<Long> ids) {
		return ids.stream().sorted().collect(Collectors.toList());
	}
}
