package works.arbor.jackson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between the verbatim string contents held by a {@link works.arbor.dom.Value}
 * and the decoded text held by Jackson.
 */
final class StringEscapes {
	private StringEscapes() { }

	/**
	 * Interprets JSON escape sequences.
	 * Malformed sequences are kept verbatim, since the parser that produced
	 * {@code raw} doesn't validate them.
	 */
	static String decode(String raw) {
		if (raw.indexOf('\\') < 0) {
			return raw;
		}
		StringBuilder sb = new StringBuilder(raw.length());
		int pos = 0;
		while (pos < raw.length()) {
			char c = raw.charAt(pos++);
			if (c != '\\' || pos >= raw.length()) {
				sb.append(c);
				continue;
			}
			char esc = raw.charAt(pos++);
			switch (esc) {
				case '"', '\\', '/' -> sb.append(esc);
				case 'b' -> sb.append('\b');
				case 'f' -> sb.append('\f');
				case 'n' -> sb.append('\n');
				case 'r' -> sb.append('\r');
				case 't' -> sb.append('\t');
				case 'u' -> {
					int value = (pos + 4 <= raw.length()) ? parseHex(raw, pos) : -1;
					if (value < 0) {
						pos = keepVerbatim(sb, raw, pos - 2);
					} else {
						sb.append((char) value);
						pos += 4;
					}
				}
				default -> pos = keepVerbatim(sb, raw, pos - 2);
			}
		}
		return sb.toString();
	}

	/**
	 * Produces contents that {@link #decode} turns back into {@code text},
	 * and that are safe to emit between quotes.
	 */
	static String encode(String text) {
		StringBuilder sb = new StringBuilder(text.length() + 8);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\b' -> sb.append("\\b");
				case '\f' -> sb.append("\\f");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.toString();
	}

	/**
	 * @return the value of the four hex digits at {@code start}, or -1 if they aren't all hex digits
	 */
	private static int parseHex(String raw, int start) {
		int value = 0;
		for (int i = start; i < start + 4; i++) {
			int digit = Character.digit(raw.charAt(i), 16);
			if (digit < 0) {
				return -1;
			}
			value = (value << 4) | digit;
		}
		return value;
	}

	/**
	 * Emits only the backslash. The char after it is handled by the next iteration.
	 *
	 * @return the position to continue decoding from
	 */
	private static int keepVerbatim(StringBuilder sb, String raw, int backslashPos) {
		LOGGER.debug("Keeping invalid escape verbatim at offset {} of |{}|", backslashPos, raw);
		sb.append('\\');
		return backslashPos + 1;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StringEscapes.class);
}
