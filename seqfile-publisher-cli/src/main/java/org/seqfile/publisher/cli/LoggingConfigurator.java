package org.seqfile.publisher.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import org.jspecify.annotations.Nullable;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Applies the logging command-line options to Logback at startup.
 *
 * <p>
 * The console shows INFO and above unless verbose output is requested. A log file, when
 * given, always receives DEBUG and above with timestamps, so the root level is lowered
 * and the console gets a threshold filter instead.
 */
public final class LoggingConfigurator {

	private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

	static final String CONSOLE_APPENDER = "CONSOLE";

	static final String FILE_APPENDER = "FILE";

	static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss} - %logger - %level - %msg%n";

	private LoggingConfigurator() {
	}

	/**
	 * Configure logging for a run.
	 * @param verbose show DEBUG output on the console
	 * @param logFile path of a detailed log file, or null for console only
	 */
	public static void configure(boolean verbose, @Nullable String logFile) {
		ILoggerFactory factory = LoggerFactory.getILoggerFactory();
		if (!(factory instanceof LoggerContext context)) {
			log.warn("Logging options ignored: backend {} does not support dynamic configuration",
					factory.getClass().getName());
			return;
		}

		Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		if (verbose || logFile != null) {
			root.setLevel(Level.DEBUG);
		}

		if (logFile != null) {
			if (!verbose) {
				Appender<ILoggingEvent> console = root.getAppender(CONSOLE_APPENDER);
				if (console != null) {
					ThresholdFilter threshold = new ThresholdFilter();
					threshold.setLevel(Level.INFO.levelStr);
					threshold.start();
					console.addFilter(threshold);
				}
			}
			root.addAppender(fileAppender(context, logFile));
			log.debug("Writing detailed log to {}", logFile);
		}
	}

	private static FileAppender<ILoggingEvent> fileAppender(LoggerContext context, String logFile) {
		PatternLayoutEncoder encoder = new PatternLayoutEncoder();
		encoder.setContext(context);
		encoder.setPattern(FILE_PATTERN);
		encoder.start();

		FileAppender<ILoggingEvent> appender = new FileAppender<>();
		appender.setContext(context);
		appender.setName(FILE_APPENDER);
		appender.setFile(logFile);
		appender.setAppend(true);
		appender.setEncoder(encoder);
		appender.start();
		return appender;
	}

}
