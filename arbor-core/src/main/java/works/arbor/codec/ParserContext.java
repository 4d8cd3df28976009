package works.arbor.codec;

import static java.lang.Math.max;
import static java.lang.Math.min;
import static java.util.Objects.requireNonNull;

/**
 * Describes where and how a {@link Parser} failed.
 * Passed to a {@link ParseErrorHandler}.
 */
public final class ParserContext {
	private final ParserError error;
	private final int position;
	private final String input;
	private final int defaultRadius;

	ParserContext(ParserError error, int position, String input, int defaultRadius) {
		this.error = requireNonNull(error);
		this.position = position;
		this.input = requireNonNull(input);
		this.defaultRadius = defaultRadius;
	}

	public ParserError error() {
		return error;
	}

	/**
	 * @return the offset, in chars, of the cursor when the error was detected
	 */
	public int position() {
		return position;
	}

	public String input() {
		return input;
	}

	public String message() {
		return error.description();
	}

	/**
	 * @return the input text around {@link #position()}, using the
	 * {@link ParserSettings#errorContextRadius() configured radius}
	 */
	public String surroundings() {
		return surroundings(defaultRadius);
	}

	/**
	 * @return up to {@code radius} chars either side of {@link #position()},
	 * clamped to the bounds of the input
	 */
	public String surroundings(int radius) {
		if (radius < 0) {
			throw new IllegalArgumentException("Radius must be non-negative, got " + radius);
		}
		int start = max(0, position - radius);
		int end = min(input.length(), position + radius);
		if (start >= end) {
			return "";
		}
		return input.substring(start, end);
	}

	@Override
	public String toString() {
		return error + " at offset " + position + ": |" + surroundings() + "|";
	}
}
