package works.arbor.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ParseErrorHandler} that reports each failure to an SLF4J logger.
 */
public final class LoggingErrorHandler implements ParseErrorHandler {
	private final Logger logger;
	private final Level level;

	public LoggingErrorHandler(Logger logger, Level level) {
		this.logger = requireNonNull(logger);
		this.level = requireNonNull(level);
	}

	/**
	 * Logs to this class's own logger.
	 */
	public static LoggingErrorHandler atLevel(Level level) {
		return new LoggingErrorHandler(LOGGER, level);
	}

	public Level level() {
		return level;
	}

	@Override
	public void onError(ParserContext context) {
		logger.atLevel(level).log("{} at offset {}: {} |{}|",
			context.error(), context.position(), context.message(), context.surroundings());
	}

	@Override
	public String toString() {
		return "LoggingErrorHandler(" + logger.getName() + ", " + level + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingErrorHandler.class);
}
