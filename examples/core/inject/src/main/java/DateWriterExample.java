import io.keystone.inject.Module;
import io.keystone.inject.Parameter;
import io.keystone.inject.Parameters;
import io.keystone.inject.table.BindingTable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Components are created at most once per module, and their parameters are given
 * when the module is built, so that one binding table can make differently configured modules.
 */
public final class DateWriterExample {

	//[START COMPONENTS]
	interface Logger {
		void log(String message);
	}

	interface DateWriter {
		void write();
	}

	static final class ConsoleLogger implements Logger {
		@Override
		public void log(String message) {
			System.out.println(message);
		}
	}

	static final class TodayWriter implements DateWriter {
		static final Parameter<String> TODAY = Parameter.of("today", String.class, "today");
		static final Parameter<Integer> YEAR = Parameter.of("year", int.class, 1970);

		private final Logger logger;
		private final String today;
		private final int year;

		TodayWriter(Logger logger, String today, int year) {
			this.logger = logger;
			this.today = today;
			this.year = year;
		}

		@Override
		public void write() {
			logger.log("Today is " + today + ", " + year);
		}
	}
	//[END COMPONENTS]

	public static void main(String[] args) throws IOException {
		//[START TABLE]
		BindingTable table = BindingTable.builder()
				.bind(Logger.class).toComponent(ConsoleLogger.class, $ -> new ConsoleLogger())
				.bind(DateWriter.class).toComponent(TodayWriter.class, context -> new TodayWriter(
						context.resolve(Logger.class),
						context.getParameter(TodayWriter.TODAY),
						context.getParameter(TodayWriter.YEAR)))
				.withDependencies(Logger.class)
				.withParameters(TodayWriter.TODAY, TodayWriter.YEAR)
				.build();
		//[END TABLE]

		//[START MODULES]
		Module module = Module.builder(table)
				.withComponentParameters(TodayWriter.class, Parameters.create()
						.with(TodayWriter.TODAY, "June 19")
						.with(TodayWriter.YEAR, 2020))
				.build();
		module.resolve(DateWriter.class).write();

		Properties properties = new Properties();
		try (InputStream stream = DateWriterExample.class.getResourceAsStream("/writer.properties")) {
			if (stream != null) {
				properties.load(stream);
			}
		}
		Module configured = Module.builder(table)
				.withComponentParameters(TodayWriter.class, Parameters.ofProperties(properties, "writer"))
				.build();
		configured.resolve(DateWriter.class).write();

		Module muted = Module.builder(table)
				.withComponentOverride(Logger.class, message -> {})
				.build();
		muted.resolve(DateWriter.class).write();
		//[END MODULES]
	}
}
