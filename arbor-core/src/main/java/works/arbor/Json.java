package works.arbor;

import works.arbor.codec.ParseErrorHandler;
import works.arbor.codec.Parser;
import works.arbor.codec.ParserSettings;
import works.arbor.dom.Value;
import works.arbor.dom.ValueError;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Entry points for turning text into a {@link Value} tree.
 * <p>
 * These methods always return a usable tree. If the text was malformed,
 * the settings' {@link ParseErrorHandler} is called once with the details,
 * and the returned root carries {@link ValueError#PARSE_ERROR PARSE_ERROR}
 * along with whatever could be parsed before the failure.
 * To turn a tree back into text, use {@link Value#dump()}.
 */
public final class Json {
	private Json() { }

	/**
	 * Parses using {@link ParserSettings#DEFAULT}, which logs failures.
	 */
	public static Value parse(String text) {
		return parse(text, ParserSettings.DEFAULT);
	}

	public static Value parse(String text, ParseErrorHandler onError) {
		return parse(text, ParserSettings.DEFAULT.withHandler(onError));
	}

	/**
	 * Malformed UTF-8 sequences are not an error: each one decodes to
	 * U+FFFD, the replacement character, and parsing carries on.
	 *
	 * @param utf8 the complete document; parser positions reported to {@code onError}
	 *             are char offsets into the decoded text, not byte offsets
	 */
	public static Value parse(byte[] utf8, ParseErrorHandler onError) {
		return parse(new String(utf8, UTF_8), onError);
	}

	public static Value parse(String text, ParserSettings settings) {
		Parser parser = new Parser(text, settings);
		Value result = parser.parseValue();
		if (parser.hasError()) {
			settings.handler().onError(parser.context());
			result.setError(ValueError.PARSE_ERROR);
		}
		return result;
	}
}
