package io.keystone.inject;

import org.junit.Test;

import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.Assert.*;

public final class ParametersTest {
	enum Mode {
		FAST, SAFE
	}

	@Test
	public void with() {
		Parameter<Integer> size = Parameter.of("size", int.class, 10);

		Parameters empty = Parameters.create();
		Parameters parameters = empty.with(size, 20).with("name", "cache");

		assertTrue(empty.isEmpty());
		assertEquals(Set.of("size", "name"), parameters.getNames());
		assertEquals(20, parameters.get("size"));
		assertTrue(parameters.has("name"));
		assertNull(parameters.get("missing"));
		assertEquals(Parameters.of(Map.of("size", 20, "name", "cache")), parameters);
	}

	@Test
	public void nullValuesAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> Parameters.create().with("name", null));
		assertThrows(IllegalArgumentException.class, () -> Parameters.create().with("", "value"));
	}

	@Test
	public void ofProperties() {
		Properties properties = new Properties();
		properties.setProperty("cache.size", "20");
		properties.setProperty("cache.mode", "SAFE");
		properties.setProperty("cache", "ignored");
		properties.setProperty("cachesize", "ignored");
		properties.setProperty("db.url", "ignored");

		Parameters parameters = Parameters.ofProperties(properties, "cache");

		assertEquals(Map.of("size", "20", "mode", "SAFE"), parameters.asMap());
		assertEquals(5, Parameters.ofProperties(properties, "").getNames().size());
	}

	@Test
	public void defaultConverters() {
		assertEquals(Integer.valueOf(42), Parameter.of("int", int.class, 0).convert(" 42 "));
		assertEquals(Long.valueOf(42), Parameter.of("long", Long.class, 0L).convert("42"));
		assertEquals(Double.valueOf(1.5), Parameter.of("double", double.class, 0.0).convert("1.5"));
		assertEquals(Boolean.TRUE, Parameter.of("flag", boolean.class, false).convert("TRUE"));
		assertEquals(Mode.SAFE, Parameter.of("mode", Mode.class, Mode.FAST).convert("SAFE"));
		assertEquals("text", Parameter.required("text", String.class).convert("text"));

		assertThrows(IllegalArgumentException.class, () -> Parameter.of("flag", boolean.class, false).convert("yes"));
		assertThrows(NumberFormatException.class, () -> Parameter.of("int", int.class, 0).convert("many"));
	}

	@Test
	public void customConverter() {
		Parameter<StringBuilder> buffer = Parameter.required("buffer", StringBuilder.class);
		assertFalse(buffer.hasConverter());
		assertThrows(IllegalStateException.class, () -> buffer.convert("text"));

		Parameter<StringBuilder> converted = buffer.withConverter(StringBuilder::new);
		assertTrue(converted.hasConverter());
		assertEquals("text", converted.convert("text").toString());
		assertEquals(buffer, converted);
	}

	@Test
	public void defaults() {
		Parameter<Integer> size = Parameter.of("size", int.class, 10);
		Parameter<Integer> required = Parameter.required("size", Integer.class);

		assertTrue(size.hasDefault());
		assertEquals(Integer.valueOf(10), size.getDefaultValue());
		assertEquals(Integer.class, size.getType());
		assertFalse(required.hasDefault());
		assertThrows(IllegalStateException.class, required::getDefaultValue);
		assertEquals(size, required);
		assertEquals("size: Integer = 10", size.toString());
	}
}
