package works.arbor.codec;

import org.slf4j.event.Level;

import static java.util.Objects.requireNonNull;

/**
 * @param errorContextRadius how many chars either side of the failure
 *                           to include in {@link ParserContext#surroundings()}
 * @param handler called when a parse fails
 */
public record ParserSettings(
	int errorContextRadius,
	ParseErrorHandler handler
) {
	public static final ParserSettings DEFAULT = new ParserSettings(20, LoggingErrorHandler.atLevel(Level.WARN));

	public ParserSettings {
		if (errorContextRadius < 0) {
			throw new IllegalArgumentException("errorContextRadius must be non-negative, got " + errorContextRadius);
		}
		requireNonNull(handler);
	}

	public ParserSettings withErrorContextRadius(int errorContextRadius) {
		return new ParserSettings(errorContextRadius, handler);
	}

	public ParserSettings withHandler(ParseErrorHandler handler) {
		return new ParserSettings(errorContextRadius, handler);
	}
}
