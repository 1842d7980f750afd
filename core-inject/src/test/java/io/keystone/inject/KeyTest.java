package io.keystone.inject;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public final class KeyTest {

	@Test
	public void equality() {
		assertEquals(Key.of(String.class), Key.of(String.class));
		assertEquals(Key.of(String.class, "name"), Key.of(String.class).qualified("name"));
		assertNotEquals(Key.of(String.class), Key.of(String.class, "name"));
		assertNotEquals(Key.of(String.class, "first"), Key.of(String.class, "second"));
		assertEquals(Key.of(String.class, "name").hashCode(), Key.of(String.class).qualified("name").hashCode());
	}

	@Test
	public void typeTokens() {
		Key<List<String>> key = new Key<List<String>>() {};

		assertEquals(List.class, key.getRawType());
		assertEquals("List<String>", key.getDisplayString());
		assertEquals(new Key<List<String>>() {}, key);
		assertNotEquals(new Key<List<Integer>>() {}, key);
		assertEquals("named List<String>", new Key<List<String>>("named") {}.getDisplayString());
	}

	@Test
	public void rawTypeOfClass() {
		assertEquals(Integer.class, Key.of(Integer.class).getRawType());
		assertNull(Key.of(Integer.class).getQualifier());
	}

	@Test
	public void displayString() {
		assertEquals("KeyTest", Key.of(KeyTest.class).getDisplayString());
		assertEquals("Key<java.lang.String>(name)", Key.of(String.class, "name").toString());
	}
}
