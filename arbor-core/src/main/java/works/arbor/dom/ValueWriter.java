package works.arbor.dom;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Emits compact text for a {@link Value} tree.
 * <p>
 * Output contains no insignificant whitespace. String contents are emitted
 * exactly as stored, between quotes, with no escaping; since the parser keeps
 * escape sequences verbatim, parsed strings come back out unchanged.
 * Strings built in code must not contain quotes or control characters
 * if the output is meant to be parsed again.
 * <p>
 * Floats use fixed-point notation with six fractional digits, like C's {@code %f}.
 * Object members come out in whatever order the underlying map yields them.
 */
final class ValueWriter {
	private ValueWriter() { }

	static String dump(Value value) {
		StringBuilder out = new StringBuilder();
		write(out, value);
		return out.toString();
	}

	static void write(StringBuilder out, Value value) {
		Payload p = value.payload();
		switch (p.kind()) {
			case OBJECT -> writeObject(out, ((Payload.Members) p).members());
			case ARRAY -> writeArray(out, ((Payload.Elements) p).elements());
			case STRING -> out.append('"').append(((Payload.Text) p).text()).append('"');
			case INTEGER -> out.append(((Payload.Int) p).value());
			case FLOAT -> out.append(formatFloat(((Payload.Real) p).value()));
			case BOOLEAN -> out.append(((Payload.Bool) p).value());
			case NULL -> out.append("null");
		}
	}

	static String formatFloat(double value) {
		return String.format(Locale.ROOT, "%f", value);
	}

	private static void writeObject(StringBuilder out, Map<String, Value> members) {
		out.append('{');
		String separator = "";
		for (Map.Entry<String, Value> member : members.entrySet()) {
			out.append(separator).append('"').append(member.getKey()).append("\":");
			write(out, member.getValue());
			separator = ",";
		}
		out.append('}');
	}

	private static void writeArray(StringBuilder out, List<Value> elements) {
		out.append('[');
		String separator = "";
		for (Value element : elements) {
			out.append(separator);
			write(out, element);
			separator = ",";
		}
		out.append(']');
	}
}
