package io.keystone.inject;

import io.keystone.inject.table.BindingTable;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public final class ModuleConcurrencyTest {
	private static final int THREADS = 16;

	interface Service {
	}

	interface Client {
		Service service();
	}

	static final class SlowService implements Service {
		SlowService(AtomicInteger counter) {
			counter.incrementAndGet();
			try {
				Thread.sleep(50);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
	}

	record ServiceClient(Service service) implements Client {
	}

	@Test
	public void componentIsConstructedOnceUnderContention() throws Exception {
		AtomicInteger services = new AtomicInteger();
		AtomicInteger clients = new AtomicInteger();
		BindingTable table = BindingTable.builder()
				.bind(Service.class).toComponent(SlowService.class, $ -> new SlowService(services))
				.bind(Client.class).toComponent(ServiceClient.class, context -> {
					clients.incrementAndGet();
					return new ServiceClient(context.resolve(Service.class));
				})
				.withDependencies(Service.class)
				.build();
		Module module = Module.of(table);

		ExecutorService executor = Executors.newFixedThreadPool(THREADS);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<Object[]>> futures = new ArrayList<>();
		try {
			for (int i = 0; i < THREADS; i++) {
				boolean clientFirst = i % 2 == 0;
				futures.add(executor.submit(() -> {
					start.await();
					if (clientFirst) {
						Client client = module.resolve(Client.class);
						return new Object[]{client, module.resolve(Service.class)};
					}
					Service service = module.resolve(Service.class);
					return new Object[]{module.resolve(Client.class), service};
				}));
			}
			start.countDown();

			Client client = module.resolve(Client.class);
			for (Future<Object[]> future : futures) {
				Object[] result = future.get(10, TimeUnit.SECONDS);
				assertSame(client, result[0]);
				assertSame(client.service(), result[1]);
			}
		} finally {
			executor.shutdownNow();
		}

		assertEquals(1, services.get());
		assertEquals(1, clients.get());
	}
}
