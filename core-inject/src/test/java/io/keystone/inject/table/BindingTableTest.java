package io.keystone.inject.table;

import io.keystone.inject.Key;
import io.keystone.inject.Module;
import io.keystone.inject.Parameter;
import io.keystone.inject.binding.Binding;
import io.keystone.inject.binding.BindingType;
import io.keystone.inject.binding.ComponentBinding;
import io.keystone.inject.binding.DIException;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public final class BindingTableTest {

	interface Database {
	}

	interface Cache {
	}

	interface Request {
	}

	static final class MemoryDatabase implements Database, Cache {
	}

	static final class LruCache implements Cache {
		LruCache(Database database) {
		}
	}

	static final class HttpRequest implements Request {
	}

	@Test
	public void validTable() {
		BindingTable table = BindingTable.builder()
				.bind(Database.class).toComponent(MemoryDatabase.class, $ -> new MemoryDatabase())
				.bind(Cache.class).toComponent(LruCache.class, context -> new LruCache(context.resolve(Database.class)))
				.withDependencies(Database.class)
				.bind(Request.class).toProvider(HttpRequest.class, $ -> new HttpRequest())
				.withDependencies(Cache.class)
				.build();

		assertEquals(3, table.size());
		assertTrue(table.contains(Key.of(Cache.class)));
		assertEquals(BindingType.COMPONENT, table.getType(Key.of(Database.class)));
		assertEquals(BindingType.PROVIDER, table.getType(Key.of(Request.class)));
		assertNull(table.getType(Key.of(String.class)));

		Binding<Cache> cache = table.get(Key.of(Cache.class));
		assertNotNull(cache);
		assertEquals(LruCache.class, cache.getImplementation());
		assertEquals(List.of(Key.of(Database.class)), cache.getDependencies());
		assertNotNull(cache.getLocation());
		assertThat(cache.getLocation().toString(), containsString("BindingTableTest.validTable"));

		ComponentBinding<?> byImplementation = table.getComponentByImplementation(MemoryDatabase.class);
		assertNotNull(byImplementation);
		assertEquals(Key.of(Database.class), byImplementation.getKey());
		assertNull(table.getComponentByImplementation(HttpRequest.class));
	}

	@Test
	public void qualifiedKeys() {
		BindingTable table = BindingTable.builder()
				.bind(Database.class, "primary").toComponent(MemoryDatabase.class, $ -> new MemoryDatabase())
				.bind(Database.class, "replica").toProvider(MemoryDatabase.class, $ -> new MemoryDatabase())
				.build();

		assertEquals(BindingType.COMPONENT, table.getType(Key.of(Database.class, "primary")));
		assertEquals(BindingType.PROVIDER, table.getType(Key.of(Database.class, "replica")));
		assertFalse(table.contains(Key.of(Database.class)));
	}

	@Test
	public void instanceBinding() {
		MemoryDatabase database = new MemoryDatabase();
		BindingTable table = BindingTable.builder()
				.bind(Database.class).toInstance(database)
				.build();

		assertEquals(MemoryDatabase.class, table.get(Key.of(Database.class)).getImplementation());
	}

	@Test
	public void qualifiedInstancesOfOneClass() {
		BindingTable table = BindingTable.builder()
				.bind(String.class, "today").toInstance("June 19")
				.bind(String.class, "city").toInstance("Berlin")
				.build();

		assertEquals(2, table.size());
		assertNull(table.getComponentByImplementation(String.class));

		Module module = Module.of(table);
		assertEquals("June 19", module.resolve(Key.of(String.class, "today")));
		assertEquals("Berlin", module.resolve(Key.of(String.class, "city")));
	}

	@Test
	public void instanceBindingHasNoParameters() {
		BindingTableBuilder1<String> builder = BindingTable.builder()
				.bind(String.class).toInstance("text");

		assertThrows(IllegalStateException.class, () -> builder.withParameters(Parameter.of("size", int.class, 10)));
	}

	@Test
	public void duplicateKey() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Database.class).toComponent(MemoryDatabase.class, $ -> new MemoryDatabase())
				.bind(Database.class).toProvider(MemoryDatabase.class, $ -> new MemoryDatabase());

		DIException e = assertThrows(DIException.class, builder::build);
		assertThat(e.getMessage(), startsWith("Duplicate bindings detected:"));
		assertThat(e.getMessage(), containsString("key BindingTableTest.Database is bound more than once"));
	}

	@Test
	public void duplicateImplementation() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Database.class).toComponent(MemoryDatabase.class, $ -> new MemoryDatabase())
				.bind(Cache.class).toComponent(MemoryDatabase.class, $ -> new MemoryDatabase());

		DIException e = assertThrows(DIException.class, builder::build);
		assertThat(e.getMessage(), containsString("implements more than one interface"));
	}

	@Test
	public void unsatisfiedDependency() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Cache.class).toComponent(LruCache.class, context -> new LruCache(context.resolve(Database.class)))
				.withDependencies(Database.class);

		DIException e = assertThrows(DIException.class, builder::build);
		assertThat(e.getMessage(), startsWith("Unsatisfied dependencies detected:"));
		assertThat(e.getMessage(), containsString("key BindingTableTest.Database required to make:"));
	}

	@Test
	public void componentCannotDependOnProvider() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Database.class).toProvider(MemoryDatabase.class, $ -> new MemoryDatabase())
				.bind(Cache.class).toComponent(LruCache.class, context -> new LruCache(context.resolve(Database.class)))
				.withDependencies(Database.class);

		DIException e = assertThrows(DIException.class, builder::build);
		assertThat(e.getMessage(), startsWith("Invalid dependencies detected"));
		assertThat(e.getMessage(), containsString("which is a provider"));
	}

	@Test
	public void componentCannotDependOnAsyncProvider() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Database.class).toAsyncProvider(MemoryDatabase.class, $ -> CompletableFuture.completedFuture(new MemoryDatabase()))
				.bind(Cache.class).toComponent(LruCache.class, context -> new LruCache(context.resolve(Database.class)))
				.withDependencies(Database.class);

		DIException e = assertThrows(DIException.class, builder::build);
		assertThat(e.getMessage(), containsString("which is an async provider"));
	}

	@Test
	public void providerCannotDependOnAsyncProvider() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Database.class).toAsyncProvider(MemoryDatabase.class, $ -> CompletableFuture.completedFuture(new MemoryDatabase()))
				.bind(Request.class).toProvider(HttpRequest.class, $ -> new HttpRequest())
				.withDependencies(Database.class);

		DIException e = assertThrows(DIException.class, builder::build);
		assertThat(e.getMessage(), containsString("which is an async provider"));
	}

	@Test
	public void asyncProviderMayDependOnAnything() {
		BindingTable table = BindingTable.builder()
				.bind(Database.class).toAsyncProvider(MemoryDatabase.class, $ -> CompletableFuture.completedFuture(new MemoryDatabase()))
				.bind(Cache.class).toProvider(MemoryDatabase.class, $ -> new MemoryDatabase())
				.bind(Request.class).toAsyncProvider(HttpRequest.class, $ -> CompletableFuture.completedFuture(new HttpRequest()))
				.withDependencies(Database.class, Cache.class)
				.build();

		assertEquals(BindingType.ASYNC_PROVIDER, table.getType(Key.of(Request.class)));
	}

	@Test
	public void cycle() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Database.class).toComponent(MemoryDatabase.class, $ -> new MemoryDatabase())
				.withDependencies(Cache.class)
				.bind(Cache.class).toComponent(LruCache.class, context -> new LruCache(context.resolve(Database.class)))
				.withDependencies(Database.class);

		DIException e = assertThrows(DIException.class, builder::build);
		assertThat(e.getMessage(), startsWith("Cyclic dependencies detected:"));
		assertThat(e.getMessage(), containsString("BindingTableTest.Database -> BindingTableTest.Cache"));
	}

	@Test
	public void providerCycle() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Request.class).toProvider(HttpRequest.class, $ -> new HttpRequest())
				.withDependencies(Request.class);

		DIException e = assertThrows(DIException.class, builder::build);
		assertThat(e.getMessage(), startsWith("Cyclic dependencies detected:"));
	}

	@Test
	public void providerParameters() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Request.class).toProvider(HttpRequest.class, $ -> new HttpRequest())
				.withParameters(Parameter.of("timeout", int.class, 10));

		DIException e = assertThrows(DIException.class, builder::build);
		assertThat(e.getMessage(), containsString("only components may have them"));
	}

	@Test
	public void duplicateParameterNames() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Database.class).toComponent(MemoryDatabase.class, $ -> new MemoryDatabase())
				.withParameters(Parameter.of("size", int.class, 10), Parameter.of("size", String.class, "10"));

		DIException e = assertThrows(DIException.class, builder::build);
		assertThat(e.getMessage(), containsString("declares parameter 'size' more than once"));
	}

	@Test
	public void install() {
		BindingTable storage = BindingTable.builder()
				.bind(Database.class).toComponent(MemoryDatabase.class, $ -> new MemoryDatabase())
				.build();

		BindingTable table = BindingTable.builder()
				.install(storage)
				.bind(Cache.class).toComponent(LruCache.class, context -> new LruCache(context.resolve(Database.class)))
				.withDependencies(Database.class)
				.build();

		assertEquals(2, table.size());
		assertSame(storage.get(Key.of(Database.class)), table.get(Key.of(Database.class)));
	}

	@Test
	public void installDuplicate() {
		BindingTable storage = BindingTable.builder()
				.bind(Database.class).toComponent(MemoryDatabase.class, $ -> new MemoryDatabase())
				.build();

		BindingTableBuilder builder = BindingTable.builder()
				.install(storage)
				.bind(Database.class).toProvider(MemoryDatabase.class, $ -> new MemoryDatabase());

		assertThrows(DIException.class, builder::build);
	}

	@Test
	public void unfinishedBinding() {
		BindingTableBuilder builder = BindingTable.builder();
		builder.bind(Database.class);

		IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
		assertThat(e.getMessage(), containsString("was not finished"));
	}

	@Test
	public void builderIsSingleUse() {
		BindingTableBuilder builder = BindingTable.builder()
				.bind(Database.class).toComponent(MemoryDatabase.class, $ -> new MemoryDatabase());
		builder.build();

		assertThrows(IllegalStateException.class, builder::build);
		assertThrows(IllegalStateException.class, () -> builder.bind(Cache.class));
	}

	@Test
	public void bindingsKeepDeclarationOrder() {
		BindingTable table = BindingTable.builder()
				.bind(Request.class).toProvider(HttpRequest.class, $ -> new HttpRequest())
				.bind(Database.class).toComponent(MemoryDatabase.class, $ -> new MemoryDatabase())
				.bind(Cache.class).toComponent(LruCache.class, context -> new LruCache(context.resolve(Database.class)))
				.withDependencies(Database.class)
				.build();

		assertEquals(List.of(Key.of(Request.class), Key.of(Database.class), Key.of(Cache.class)),
				List.copyOf(table.getBindings().keySet()));
	}
}
