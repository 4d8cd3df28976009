package works.arbor.jackson;

import java.util.Map;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;
import works.arbor.dom.Value;

import static java.util.Objects.requireNonNull;

/**
 * Converts between {@link Value} trees and Jackson {@link JsonNode} trees.
 * <p>
 * Both directions preserve the {@link works.arbor.dom.Kind kind} of every node.
 * Strings are translated between the verbatim contents a {@link Value} holds,
 * escape sequences included, and the decoded text a {@link JsonNode} holds.
 * <p>
 * Caveat: a string whose decoded text ends in a backslash is stored as contents ending in {@code \\},
 * which {@link works.arbor.Json#parse(String) parse} can't read back, since it sees the
 * closing quote as escaped.
 */
public final class JsonNodeConverter {
	private final JsonNodeFactory factory;

	public JsonNodeConverter() {
		this(JsonNodeFactory.instance);
	}

	public JsonNodeConverter(JsonNodeFactory factory) {
		this.factory = requireNonNull(factory);
	}

	/**
	 * Ignores pending errors anywhere in {@code value}.
	 */
	public JsonNode toJsonNode(Value value) {
		return switch (value.type()) {
			case OBJECT -> {
				ObjectNode result = factory.objectNode();
				value.members().forEach((key, child) -> result.set(StringEscapes.decode(key), toJsonNode(child)));
				yield result;
			}
			case ARRAY -> {
				ArrayNode result = factory.arrayNode();
				value.elements().forEach(element -> result.add(toJsonNode(element)));
				yield result;
			}
			case STRING -> factory.stringNode(StringEscapes.decode(value.extractString().orElseThrow()));
			case INTEGER -> factory.numberNode(value.extractInt().orElseThrow());
			case FLOAT -> factory.numberNode(value.extractFloat().orElseThrow());
			case BOOLEAN -> factory.booleanNode(value.extractBool().orElseThrow());
			case NULL -> factory.nullNode();
		};
	}

	/**
	 * Integral numbers that fit in a {@code long} become {@link works.arbor.dom.Kind#INTEGER INTEGER};
	 * all other numbers become {@link works.arbor.dom.Kind#FLOAT FLOAT}.
	 * <p>
	 * A member with an empty name can't be represented, so it is left out,
	 * and the enclosing object records {@link works.arbor.dom.ValueError#EMPTY_KEY EMPTY_KEY}.
	 *
	 * @throws IllegalArgumentException for binary, POJO, and missing nodes
	 */
	public Value fromJsonNode(JsonNode node) {
		return switch (node.getNodeType()) {
			case OBJECT -> {
				Value result = Value.object();
				for (Map.Entry<String, JsonNode> property : node.properties()) {
					result.insert(StringEscapes.encode(property.getKey()), fromJsonNode(property.getValue()));
				}
				yield result;
			}
			case ARRAY -> {
				Value result = Value.array();
				for (int i = 0; i < node.size(); i++) {
					result.add(fromJsonNode(node.get(i)));
				}
				yield result;
			}
			case STRING -> Value.of(StringEscapes.encode(node.stringValue()));
			case NUMBER -> {
				if (node.isIntegralNumber() && node.canConvertToLong()) {
					yield Value.of(node.longValue());
				} else {
					yield Value.of(node.doubleValue());
				}
			}
			case BOOLEAN -> Value.of(node.booleanValue());
			case NULL -> Value.nullValue();
			default -> throw new IllegalArgumentException("No Value equivalent for " + node.getNodeType() + " node");
		};
	}
}
