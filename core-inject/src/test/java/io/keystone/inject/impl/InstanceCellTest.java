package io.keystone.inject.impl;

import io.keystone.inject.Key;
import io.keystone.inject.binding.DIException;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.Assert.*;

public final class InstanceCellTest {
	private static final Key<String> KEY = Key.of(String.class);

	private static InstanceCell<String> cell(boolean threadsafe, Supplier<String> factory, String preset) {
		return threadsafe ?
				new AbstractInstanceCell<>(KEY, new Object(), preset) {
					@Override
					protected String doCreateInstance() {
						return factory.get();
					}
				} :
				new AbstractUnsyncInstanceCell<>(KEY, preset) {
					@Override
					protected String doCreateInstance() {
						return factory.get();
					}
				};
	}

	@Test
	public void createsOnce() {
		for (boolean threadsafe : new boolean[]{true, false}) {
			AtomicInteger calls = new AtomicInteger();
			InstanceCell<String> cell = cell(threadsafe, () -> "value " + calls.incrementAndGet(), null);

			assertNull(cell.peekInstance());
			assertEquals("value 1", cell.getInstance());
			assertEquals("value 1", cell.getInstance());
			assertEquals("value 1", cell.peekInstance());
			assertEquals(1, calls.get());
			assertEquals(KEY, cell.getKey());
		}
	}

	@Test
	public void presetIsNeverCreated() {
		for (boolean threadsafe : new boolean[]{true, false}) {
			InstanceCell<String> cell = cell(threadsafe, () -> {
				throw new AssertionError();
			}, "preset");

			assertEquals("preset", cell.peekInstance());
			assertEquals("preset", cell.getInstance());
		}
	}

	@Test
	public void failureLeavesCellEmpty() {
		for (boolean threadsafe : new boolean[]{true, false}) {
			AtomicInteger calls = new AtomicInteger();
			InstanceCell<String> cell = cell(threadsafe, () -> {
				if (calls.incrementAndGet() == 1) throw new IllegalArgumentException("first");
				return "second";
			}, null);

			assertThrows(IllegalArgumentException.class, cell::getInstance);
			assertNull(cell.peekInstance());
			assertEquals("second", cell.getInstance());
		}
	}

	@Test
	public void nullIsRejected() {
		for (boolean threadsafe : new boolean[]{true, false}) {
			InstanceCell<String> cell = cell(threadsafe, () -> null, null);

			assertThrows(DIException.class, cell::getInstance);
			assertNull(cell.peekInstance());
		}
	}

	@Test
	public void reentrancyFailsFast() {
		for (boolean threadsafe : new boolean[]{true, false}) {
			InstanceCell<?>[] self = new InstanceCell<?>[1];
			InstanceCell<String> cell = cell(threadsafe, () -> (String) self[0].getInstance(), null);
			self[0] = cell;

			DIException e = assertThrows(DIException.class, cell::getInstance);
			assertTrue(e.getMessage().contains("was requested again"));
			assertNull(cell.peekInstance());
		}
	}
}
