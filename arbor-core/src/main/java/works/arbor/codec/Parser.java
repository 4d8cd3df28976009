package works.arbor.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.dom.Kind;
import works.arbor.dom.Value;

import static java.lang.Math.min;
import static java.util.Objects.requireNonNull;
import static works.arbor.codec.ParserError.EXPECTED_COLON;
import static works.arbor.codec.ParserError.EXPECTED_COMMA_BEFORE_NEXT_ARRAY_ITEM;
import static works.arbor.codec.ParserError.EXPECTED_COMMA_BEFORE_NEXT_ATTRIBUTE;
import static works.arbor.codec.ParserError.EXPECTED_STRING_ATTRIBUTE_KEY;
import static works.arbor.codec.ParserError.EXPECTED_VALUE_BUT_GOT_COMMA;
import static works.arbor.codec.ParserError.INVALID_NUMBER;
import static works.arbor.codec.ParserError.OK;
import static works.arbor.codec.ParserError.UNEXPECTED_TOKEN;
import static works.arbor.codec.ParserError.UNTERMINATED_STRING;

/**
 * Recursive-descent reader that turns relaxed JSON text into a {@link Value} tree.
 * <p>
 * The grammar is more permissive than RFC 8259 in some ways and less capable in others:
 * <ul>
 *     <li>
 *         String contents are kept verbatim, escape sequences included.
 *         A quote ends the string unless the char just before it is a backslash,
 *         so a string ending in an escaped backslash ({@code "a\\"}) is not terminated there.
 *     </li>
 *     <li>
 *         Numbers are an optional {@code -}, then digits with at most one {@code .}.
 *         There are no exponents. Integers too large for a {@code long} saturate
 *         to {@link Long#MAX_VALUE} or {@link Long#MIN_VALUE}.
 *     </li>
 *     <li>
 *         Objects and arrays tolerate a trailing comma and a missing closing bracket at end of input.
 *     </li>
 *     <li>
 *         Anything after the first complete value is ignored.
 *     </li>
 * </ul>
 * Errors don't throw. The first one stops the walk, is kept in a sticky register,
 * and the partial tree built so far is returned.
 * <p>
 * Recursion depth equals nesting depth, so deeply nested input is bounded only by the stack.
 * <p>
 * A parser is single-use and not thread-safe.
 */
public final class Parser {
	private final String input;
	private final ParserSettings settings;
	private int pos;
	private ParserError error = OK;

	public Parser(String input, ParserSettings settings) {
		this(input, 0, settings);
	}

	public Parser(String input, int startPosition, ParserSettings settings) {
		if (startPosition < 0 || startPosition > input.length()) {
			throw new IllegalArgumentException("Start position " + startPosition + " outside input of length " + input.length());
		}
		this.input = input;
		this.settings = requireNonNull(settings);
		this.pos = startPosition;
	}

	public boolean hasError() {
		return error != OK;
	}

	public ParserError error() {
		return error;
	}

	/**
	 * @return the offset of the cursor, in chars
	 */
	public int position() {
		return pos;
	}

	public ParserContext context() {
		return new ParserContext(error, pos, input, settings.errorContextRadius());
	}

	/**
	 * Skips whitespace, then parses whichever kind of value starts at the cursor.
	 *
	 * @return the parsed value; never null. If the next char can't start a value,
	 * records {@link ParserError#UNEXPECTED_TOKEN UNEXPECTED_TOKEN} and returns an empty object.
	 */
	public Value parseValue() {
		skipWhitespace();
		logEntry("parseValue");
		return switch (peekRawChar()) {
			case '{' -> parseObject();
			case '[' -> parseArray();
			case '"' -> parseString();
			case 't', 'f' -> parseBoolean();
			case 'n' -> parseNull();
			case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '-' -> parseNumber();
			default -> {
				fail(UNEXPECTED_TOKEN);
				yield new Value();
			}
		};
	}

	private Value parseObject() {
		logEntry("parseObject");
		pos++; // Opening brace
		Value object = Value.object();
		String key = null;
		boolean expectComma = false;
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (isWhitespace(c)) {
				pos++;
			} else if (c == '}') {
				pos++;
				break;
			} else if (c == ',') {
				if (!expectComma) {
					fail(EXPECTED_VALUE_BUT_GOT_COMMA);
					break;
				}
				expectComma = false;
				pos++;
			} else if (key == null) {
				if (expectComma) {
					fail(EXPECTED_COMMA_BEFORE_NEXT_ATTRIBUTE);
					break;
				}
				key = parseKey();
				if (hasError()) {
					break;
				}
			} else {
				if (c != ':') {
					fail(EXPECTED_COLON);
					break;
				}
				pos++;
				object.insert(key, parseValue());
				key = null;
				expectComma = true;
				if (hasError()) {
					break;
				}
			}
		}
		return object;
	}

	/**
	 * @return the key, which is only meaningful if no error was recorded
	 */
	private String parseKey() {
		Value parsed = parseValue();
		String key = (parsed.type() == Kind.STRING) ? parsed.extractString().orElse("") : "";
		if (key.isEmpty()) {
			// Overrides whatever went wrong while parsing the non-string
			fail(EXPECTED_STRING_ATTRIBUTE_KEY);
		}
		return key;
	}

	private Value parseArray() {
		logEntry("parseArray");
		pos++; // Opening bracket
		Value array = Value.array();
		boolean expectComma = false;
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (isWhitespace(c)) {
				pos++;
			} else if (c == ']') {
				pos++;
				break;
			} else if (c == ',') {
				if (!expectComma) {
					fail(EXPECTED_VALUE_BUT_GOT_COMMA);
					break;
				}
				expectComma = false;
				pos++;
			} else {
				if (expectComma) {
					fail(EXPECTED_COMMA_BEFORE_NEXT_ARRAY_ITEM);
					break;
				}
				array.add(parseValue());
				expectComma = true;
				if (hasError()) {
					break;
				}
			}
		}
		return array;
	}

	private Value parseString() {
		logEntry("parseString");
		int start = ++pos; // First char after the opening quote
		for (; pos < input.length(); pos++) {
			// A one-char look-behind. The char before the first content char is the opening quote.
			if (input.charAt(pos) == '"' && input.charAt(pos - 1) != '\\') {
				String text = input.substring(start, pos);
				pos++; // Closing quote
				return Value.of(text);
			}
		}
		fail(UNTERMINATED_STRING);
		return Value.of(input.substring(start));
	}

	private Value parseNumber() {
		logEntry("parseNumber");
		int start = pos;
		boolean isFloat = false;
		boolean sawDigit = false;
		if (peekRawChar() == '-') {
			pos++;
		}
		for (; pos < input.length(); pos++) {
			char c = input.charAt(pos);
			if (c >= '0' && c <= '9') {
				sawDigit = true;
			} else if (c == '.' && !isFloat) {
				isFloat = true;
			} else {
				break;
			}
		}
		String text = input.substring(start, pos);
		if (!sawDigit) {
			return invalidNumber(text, isFloat);
		}
		if (isFloat) {
			return Value.of(Double.parseDouble(text));
		}
		try {
			return Value.of(Long.parseLong(text));
		} catch (NumberFormatException e) {
			// The run is all digits, so this can only be overflow
			long saturated = text.startsWith("-") ? Long.MIN_VALUE : Long.MAX_VALUE;
			LOGGER.debug("Integer \"{}\" out of range; using {}", text, saturated);
			return Value.of(saturated);
		}
	}

	private Value invalidNumber(String text, boolean isFloat) {
		// Point the diagnostics at the number, not past it
		pos -= text.length();
		fail(INVALID_NUMBER);
		return isFloat ? Value.of(0.0) : Value.of(0L);
	}

	/**
	 * Anything starting with {@code t} or {@code f} that isn't {@code true} is taken to be {@code false}.
	 */
	private Value parseBoolean() {
		logEntry("parseBoolean");
		if (input.startsWith("true", pos)) {
			pos += "true".length();
			return Value.of(true);
		} else {
			pos = min(input.length(), pos + "false".length());
			return Value.of(false);
		}
	}

	private Value parseNull() {
		logEntry("parseNull");
		if (input.startsWith("null", pos)) {
			pos += "null".length();
		} else {
			fail(UNEXPECTED_TOKEN);
		}
		return Value.nullValue();
	}

	private void fail(ParserError newError) {
		error = newError;
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("{} @ {}: |{}|", newError, pos, previewString());
		}
	}

	/**
	 * @return NOT a code point! Also, -1 at end of input.
	 */
	private int peekRawChar() {
		if (pos >= input.length()) {
			return -1;
		} else {
			return input.charAt(pos);
		}
	}

	private void skipWhitespace() {
		while (pos < input.length() && isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	private void logEntry(String methodName) {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} @ {}: |{}|", methodName, pos, previewString());
		}
	}

	private String previewString() {
		return input.substring(pos, min(input.length(), pos + PREVIEW_LENGTH));
	}

	private static final int PREVIEW_LENGTH = 20;
	private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);
}
