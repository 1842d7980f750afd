import io.keystone.inject.Module;
import io.keystone.inject.table.BindingTable;
import io.keystone.inject.util.Utils;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Providers make a new instance on every request, which is owned by the caller.
 * They may depend on components and on other providers, and async providers may depend on anything.
 */
public final class ProviderExample {

	interface ConnectionPool {
		int next();
	}

	interface Connection {
		String query(String sql);
	}

	interface Report {
		String render();
	}

	static final class SimplePool implements ConnectionPool {
		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public int next() {
			return counter.incrementAndGet();
		}
	}

	record PooledConnection(int id) implements Connection {
		@Override
		public String query(String sql) {
			return "connection #" + id + ": " + sql;
		}
	}

	record SalesReport(String data) implements Report {
		@Override
		public String render() {
			return "Report of " + data;
		}
	}

	public static void main(String[] args) throws Exception {
		BindingTable table = BindingTable.builder()
				.bind(ConnectionPool.class).toComponent(SimplePool.class, $ -> new SimplePool())
				.bind(Connection.class).toProvider(PooledConnection.class, locator -> new PooledConnection(locator.resolve(ConnectionPool.class).next()))
				.withDependencies(ConnectionPool.class)
				.bind(Report.class).toAsyncProvider(SalesReport.class, locator -> CompletableFuture.supplyAsync(() -> {
					try {
						return new SalesReport(locator.provide(Connection.class).query("SELECT * FROM sales"));
					} catch (Exception e) {
						throw new CompletionException(e);
					}
				}))
				.withDependencies(Connection.class)
				.build();

		Utils.printGraphVizGraph(table);

		Module module = Module.of(table);
		System.out.println(module.provide(Connection.class).query("SELECT 1"));
		System.out.println(module.provide(Connection.class).query("SELECT 2"));
		System.out.println(module.asyncProvide(Report.class).toCompletableFuture().get().render());
	}
}
