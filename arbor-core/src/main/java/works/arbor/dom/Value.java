package works.arbor.dom;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.LongConsumer;
import works.arbor.exceptions.MovedValueException;
import works.arbor.exceptions.OwnershipException;

import static java.util.Objects.requireNonNull;
import static works.arbor.dom.ValueError.EMPTY_KEY;
import static works.arbor.dom.ValueError.NOT_FOUND;
import static works.arbor.dom.ValueError.NOT_SUPPORTED;
import static works.arbor.dom.ValueError.OK;
import static works.arbor.dom.ValueError.TYPE_MISMATCH;

/**
 * A node in a JSON document tree.
 * <p>
 * A value holds exactly one {@link Kind} of payload. Operations that don't make sense
 * for the current kind do not throw. Instead, they record a {@link ValueError} in this
 * value's <em>sticky error register</em> and return a well-defined default,
 * which is usually {@code this}. The register keeps the most recent error until
 * {@link #clearError() cleared} or consumed by {@link #error(Consumer)}.
 * <p>
 * This makes long chains of calls possible without checking each step:
 *
 * <pre>
 * root.get("a").get("b").set("c", 1);
 * root.error(e -&gt; LOGGER.warn("Update failed: {}", e));
 * </pre>
 *
 * Note that a chain never short-circuits. When a lookup fails, it returns the receiver,
 * and the rest of the chain runs against that. Check for errors once the chain is done.
 *
 * <h2>Ownership</h2>
 *
 * Every value has at most one owner: the container it has been {@link #insert inserted} into.
 * Inserting a value that already has an owner, or a value into its own subtree,
 * throws {@link OwnershipException}.
 * When an object member is replaced, the previous child and its whole subtree are discarded.
 * <p>
 * {@link #move()} transfers the contents of a root value to a new value,
 * leaving the original in the <em>moved-from</em> state.
 * Discarded values are also in that state.
 * Any operation on a moved-from value throws {@link MovedValueException}.
 *
 * <h2>Threading</h2>
 *
 * Values are not thread-safe. A tree belongs to whichever thread holds its root.
 */
public final class Value {
	private Payload payload;
	private ValueError lastError = OK;
	private Value owner;

	/**
	 * Creates an empty {@link Kind#OBJECT object}.
	 */
	public Value() {
		this(new Payload.Members(new HashMap<>()));
	}

	private Value(Payload payload) {
		this.payload = payload;
	}

	public static Value object() {
		return new Value();
	}

	public static Value array() {
		return new Value(new Payload.Elements(new ArrayList<>()));
	}

	/**
	 * Creates a {@link Kind#STRING string} value. This does not parse {@code text}.
	 */
	public static Value of(String text) {
		return new Value(new Payload.Text(requireNonNull(text)));
	}

	public static Value of(long value) {
		return new Value(new Payload.Int(value));
	}

	public static Value of(double value) {
		return new Value(new Payload.Real(value));
	}

	public static Value of(boolean value) {
		return new Value(value ? Payload.TRUE : Payload.FALSE);
	}

	public static Value nullValue() {
		return new Value(Payload.NULL);
	}

	//
	// Structure
	//

	public Kind type() {
		return live().kind();
	}

	/**
	 * @return the number of members or elements for containers; 1 for scalars
	 */
	public int size() {
		Payload p = live();
		return switch (p.kind()) {
			case OBJECT -> members(p).size();
			case ARRAY -> elements(p).size();
			case STRING, INTEGER, FLOAT, BOOLEAN, NULL -> 1;
		};
	}

	/**
	 * Adds {@code child} to this container, which becomes its owner.
	 * <ul>
	 *     <li>
	 *         For an {@link Kind#OBJECT object}, {@code key} must be non-empty,
	 *         or else {@link ValueError#EMPTY_KEY EMPTY_KEY} is recorded.
	 *         An existing member with the same key is replaced and discarded.
	 *     </li>
	 *     <li>
	 *         For an {@link Kind#ARRAY array}, {@code key} must be empty,
	 *         or else {@link ValueError#NOT_SUPPORTED NOT_SUPPORTED} is recorded.
	 *         The child is appended.
	 *     </li>
	 *     <li>
	 *         Any other kind records {@link ValueError#NOT_SUPPORTED NOT_SUPPORTED}.
	 *     </li>
	 * </ul>
	 * On failure, this value is unchanged and {@code child} remains unowned.
	 *
	 * @return this
	 * @throws OwnershipException if {@code child} already has an owner,
	 * or if this value is {@code child} or lies in its subtree
	 */
	public Value insert(String key, Value child) {
		requireNonNull(key);
		Payload p = live();
		requireNonNull(child).live();
		switch (p.kind()) {
			case OBJECT -> {
				if (key.isEmpty()) {
					lastError = EMPTY_KEY;
				} else {
					adopt(child);
					Value previous = members(p).put(key, child);
					if (previous != null) {
						previous.discard();
					}
				}
			}
			case ARRAY -> {
				if (key.isEmpty()) {
					adopt(child);
					elements(p).add(child);
				} else {
					lastError = NOT_SUPPORTED;
				}
			}
			case STRING, INTEGER, FLOAT, BOOLEAN, NULL -> lastError = NOT_SUPPORTED;
		}
		return this;
	}

	/**
	 * Looks up an object member.
	 *
	 * @return the member with the given key; or this value if the key is absent
	 * ({@link ValueError#NOT_FOUND NOT_FOUND}), if this is not an object
	 * ({@link ValueError#NOT_SUPPORTED NOT_SUPPORTED}),
	 * or if an error was already pending
	 */
	public Value get(String key) {
		Payload p = live();
		Value child = switch (p.kind()) {
			case OBJECT -> {
				Value found = members(p).get(key);
				if (found == null) {
					lastError = NOT_FOUND;
				}
				yield found;
			}
			case ARRAY, STRING, INTEGER, FLOAT, BOOLEAN, NULL -> {
				lastError = NOT_SUPPORTED;
				yield null;
			}
		};
		return (child == null || hasError()) ? this : child;
	}

	/**
	 * Looks up an array element.
	 * <p>
	 * The index is not checked: the caller must ensure {@code 0 <= index < size()}.
	 * Violating that is a bug in the caller, and the resulting
	 * {@link IndexOutOfBoundsException} is not part of the contract.
	 *
	 * @return the element at {@code index}; or this value if this is not an array
	 * ({@link ValueError#NOT_SUPPORTED NOT_SUPPORTED}) or if an error was already pending
	 */
	public Value get(int index) {
		Payload p = live();
		Value child = switch (p.kind()) {
			case ARRAY -> elements(p).get(index);
			case OBJECT, STRING, INTEGER, FLOAT, BOOLEAN, NULL -> {
				lastError = NOT_SUPPORTED;
				yield null;
			}
		};
		return (child == null || hasError()) ? this : child;
	}

	/**
	 * Read-only view of an object's members, in unspecified order.
	 * Unlike {@link #get(String)}, this ignores any pending error,
	 * which makes it suitable for walking a tree that came from malformed input.
	 *
	 * @return the members; or an empty map, recording {@link ValueError#NOT_SUPPORTED NOT_SUPPORTED},
	 * if this is not an object
	 */
	public Map<String, Value> members() {
		Payload p = live();
		if (p.kind() == Kind.OBJECT) {
			return Collections.unmodifiableMap(members(p));
		}
		lastError = NOT_SUPPORTED;
		return Map.of();
	}

	/**
	 * Read-only view of an array's elements. Ignores any pending error.
	 *
	 * @return the elements; or an empty list, recording {@link ValueError#NOT_SUPPORTED NOT_SUPPORTED},
	 * if this is not an array
	 */
	public List<Value> elements() {
		Payload p = live();
		if (p.kind() == Kind.ARRAY) {
			return Collections.unmodifiableList(elements(p));
		}
		lastError = NOT_SUPPORTED;
		return List.of();
	}

	/**
	 * Transfers the contents of this value, including its pending error,
	 * to a new unowned value.
	 * Afterward, this value is in the moved-from state.
	 *
	 * @throws OwnershipException if this value is owned by a container,
	 * which would otherwise be left holding a moved-from child
	 */
	public Value move() {
		Payload p = live();
		if (owner != null) {
			throw new OwnershipException("Cannot move a value out of the container that owns it");
		}
		Value result = new Value(p);
		result.lastError = lastError;
		for (Value child : children(p)) {
			child.owner = result;
		}
		payload = Payload.MOVED;
		lastError = OK;
		return result;
	}

	/**
	 * @return a deep copy of this value that has no owner and no pending error
	 */
	public Value copy() {
		Payload p = live();
		return switch (p.kind()) {
			case OBJECT -> {
				Value result = object();
				members(p).forEach((key, child) -> result.insert(key, child.copy()));
				yield result;
			}
			case ARRAY -> {
				Value result = array();
				elements(p).forEach(element -> result.insert("", element.copy()));
				yield result;
			}
			case STRING, INTEGER, FLOAT, BOOLEAN, NULL -> new Value(p);
		};
	}

	/**
	 * Unlike every other operation, this is permitted on a moved-from value.
	 */
	public boolean isMoved() {
		return payload instanceof Payload.Moved;
	}

	//
	// Serialization
	//

	/**
	 * @return compact JSON-like text for this value.
	 * The order of object members is unspecified.
	 * @see ValueWriter
	 */
	public String dump() {
		return ValueWriter.dump(this);
	}

	//
	// Extraction
	//

	/**
	 * @return the text of a {@link Kind#STRING string} value;
	 * otherwise empty, recording {@link ValueError#TYPE_MISMATCH TYPE_MISMATCH}
	 */
	public Optional<String> extractString() {
		Payload p = live();
		if (p instanceof Payload.Text t) {
			return Optional.of(t.text());
		}
		lastError = TYPE_MISMATCH;
		return Optional.empty();
	}

	public OptionalLong extractInt() {
		Payload p = live();
		if (p instanceof Payload.Int i) {
			return OptionalLong.of(i.value());
		}
		lastError = TYPE_MISMATCH;
		return OptionalLong.empty();
	}

	public Optional<Boolean> extractBool() {
		Payload p = live();
		if (p instanceof Payload.Bool b) {
			return Optional.of(b.value());
		}
		lastError = TYPE_MISMATCH;
		return Optional.empty();
	}

	public OptionalDouble extractFloat() {
		Payload p = live();
		if (p instanceof Payload.Real r) {
			return OptionalDouble.of(r.value());
		}
		lastError = TYPE_MISMATCH;
		return OptionalDouble.empty();
	}

	//
	// Conditional combinators
	//

	/**
	 * Calls {@code action} with this string's text,
	 * unless an error is pending or this is not a string.
	 *
	 * @return this
	 */
	public Value mapString(Consumer<String> action) {
		if (!hasError()) {
			extractString().ifPresent(action);
		}
		return this;
	}

	public Value mapInt(LongConsumer action) {
		if (!hasError()) {
			extractInt().ifPresent(action);
		}
		return this;
	}

	public Value mapBool(Consumer<Boolean> action) {
		if (!hasError()) {
			extractBool().ifPresent(action);
		}
		return this;
	}

	public Value mapFloat(DoubleConsumer action) {
		if (!hasError()) {
			extractFloat().ifPresent(action);
		}
		return this;
	}

	/**
	 * Calls {@code action} on each element in index order,
	 * stopping early if an error becomes pending on this value.
	 * Does nothing if an error is already pending.
	 * Records {@link ValueError#NOT_SUPPORTED NOT_SUPPORTED} if this is not an array.
	 *
	 * @return this
	 */
	public Value mapArray(Consumer<Value> action) {
		Payload p = live();
		if (hasError()) {
			return this;
		}
		if (p.kind() != Kind.ARRAY) {
			lastError = NOT_SUPPORTED;
			return this;
		}
		List<Value> elements = elements(p);
		for (int i = 0; i < elements.size() && !hasError(); i++) {
			action.accept(elements.get(i));
		}
		return this;
	}

	/**
	 * Calls {@code action} on each member.
	 * The iteration order is unspecified, and {@code action}
	 * must not add members to this object.
	 * Does nothing if an error is already pending.
	 * Records {@link ValueError#NOT_SUPPORTED NOT_SUPPORTED} if this is not an object.
	 *
	 * @return this
	 */
	public Value mapObject(BiConsumer<String, Value> action) {
		Payload p = live();
		if (hasError()) {
			return this;
		}
		if (p.kind() != Kind.OBJECT) {
			lastError = NOT_SUPPORTED;
			return this;
		}
		members(p).forEach(action);
		return this;
	}

	/**
	 * Runs {@code action} unless an error is pending.
	 *
	 * @return this
	 */
	public Value map(Runnable action) {
		if (!hasError()) {
			action.run();
		}
		return this;
	}

	//
	// Fluent setters
	//

	public Value set(String key, String text) {
		return insert(key, of(text));
	}

	public Value set(String key, long value) {
		return insert(key, of(value));
	}

	public Value set(String key, double value) {
		return insert(key, of(value));
	}

	public Value set(String key, boolean value) {
		return insert(key, of(value));
	}

	public Value set(String key, Value child) {
		return insert(key, child);
	}

	public Value setNull(String key) {
		return insert(key, nullValue());
	}

	public Value add(String text) {
		return insert("", of(text));
	}

	public Value add(long value) {
		return insert("", of(value));
	}

	public Value add(double value) {
		return insert("", of(value));
	}

	public Value add(boolean value) {
		return insert("", of(value));
	}

	public Value add(Value child) {
		return insert("", child);
	}

	public Value addNull() {
		return insert("", nullValue());
	}

	//
	// Sticky error register
	//

	public boolean hasError() {
		live();
		return lastError != OK;
	}

	/**
	 * @return the pending error, or {@link ValueError#OK OK}
	 */
	public ValueError lastError() {
		live();
		return lastError;
	}

	/**
	 * @return the pending error, if any. Does not clear it.
	 */
	public Optional<ValueError> error() {
		return hasError() ? Optional.of(lastError) : Optional.empty();
	}

	/**
	 * If an error is pending, clears it and passes it to {@code handler}.
	 */
	public void error(Consumer<ValueError> handler) {
		if (hasError()) {
			ValueError pending = lastError;
			lastError = OK;
			handler.accept(pending);
		}
	}

	public void clearError() {
		live();
		lastError = OK;
	}

	/**
	 * @return this
	 */
	public Value setError(ValueError error) {
		live();
		lastError = requireNonNull(error);
		return this;
	}

	//
	// Object methods
	//

	/**
	 * Structural equality: same kind and same contents.
	 * Object members are compared without regard to order.
	 * Pending errors are ignored.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		return obj instanceof Value other && payload.equals(other.payload);
	}

	@Override
	public int hashCode() {
		return payload.hashCode();
	}

	@Override
	public String toString() {
		if (isMoved()) {
			return "(moved)";
		} else {
			return dump();
		}
	}

	//
	// Internals
	//

	Payload payload() {
		return live();
	}

	private Payload live() {
		Payload p = payload;
		if (p instanceof Payload.Moved) {
			throw new MovedValueException("Value has been moved or discarded");
		}
		return p;
	}

	private void adopt(Value child) {
		if (child.owner != null) {
			throw new OwnershipException("Value already belongs to a container; insert a copy instead");
		}
		for (Value ancestor = this; ancestor != null; ancestor = ancestor.owner) {
			if (ancestor == child) {
				throw new OwnershipException("Value cannot be inserted into its own subtree");
			}
		}
		child.owner = this;
	}

	/**
	 * Puts this value and its whole subtree into the moved-from state.
	 */
	private void discard() {
		Collection<Value> children = children(payload);
		payload = Payload.MOVED;
		lastError = OK;
		owner = null;
		children.forEach(Value::discard);
	}

	private static Collection<Value> children(Payload p) {
		if (p instanceof Payload.Members m) {
			return m.members().values();
		} else if (p instanceof Payload.Elements e) {
			return e.elements();
		} else {
			return List.of();
		}
	}

	private static Map<String, Value> members(Payload p) {
		return ((Payload.Members) p).members();
	}

	private static List<Value> elements(Payload p) {
		return ((Payload.Elements) p).elements();
	}
}
