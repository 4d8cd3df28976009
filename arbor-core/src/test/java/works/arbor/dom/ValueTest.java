package works.arbor.dom;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import works.arbor.exceptions.MovedValueException;
import works.arbor.exceptions.OwnershipException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.arbor.dom.ValueError.EMPTY_KEY;
import static works.arbor.dom.ValueError.NOT_FOUND;
import static works.arbor.dom.ValueError.NOT_SUPPORTED;
import static works.arbor.dom.ValueError.OK;
import static works.arbor.dom.ValueError.TYPE_MISMATCH;

class ValueTest {

	@Test
	void defaultIsEmptyObject() {
		Value value = new Value();
		assertEquals(Kind.OBJECT, value.type());
		assertEquals(0, value.size());
		assertFalse(value.hasError());
	}

	@Test
	void scalarsHaveSizeOne() {
		for (Value scalar : List.of(Value.of("x"), Value.of(1L), Value.of(1.5), Value.of(true), Value.nullValue())) {
			assertEquals(1, scalar.size(), scalar.type().toString());
			assertFalse(scalar.type().isContainer());
		}
	}

	@Test
	void objectInsertReplacesAndDiscards() {
		Value object = Value.object();
		Value first = Value.of("first");
		object.insert("k", first);
		object.insert("k", Value.of("second"));

		assertFalse(object.hasError());
		assertEquals(1, object.size());
		assertEquals("second", object.get("k").extractString().orElseThrow());
		assertTrue(first.isMoved(), "Replaced child is discarded");
		assertThrows(MovedValueException.class, first::type);
	}

	@Test
	void discardIsRecursive() {
		Value object = Value.object();
		Value inner = Value.array().add(1L);
		object.insert("k", Value.object().set("inner", inner));
		object.setNull("k");
		assertTrue(inner.isMoved());
	}

	@Test
	void emptyKeyIsRejected() {
		Value object = Value.object();
		Value child = Value.of(1L);
		object.insert("", child);
		assertEquals(EMPTY_KEY, object.lastError());
		assertEquals(0, object.size());

		// The rejected child was never adopted
		object.clearError();
		object.insert("one", child);
		assertFalse(object.hasError());
		assertEquals(1, object.size());
	}

	@Test
	void arrayInsertAppends() {
		Value array = Value.array()
			.add("a")
			.add(2L)
			.add(3.5)
			.add(false)
			.addNull()
			.add(Value.object());
		assertFalse(array.hasError());
		assertEquals(6, array.size());
		assertEquals(Kind.STRING, array.get(0).type());
		assertEquals(Kind.INTEGER, array.get(1).type());
		assertEquals(Kind.FLOAT, array.get(2).type());
		assertEquals(Kind.BOOLEAN, array.get(3).type());
		assertEquals(Kind.NULL, array.get(4).type());
		assertEquals(Kind.OBJECT, array.get(5).type());
	}

	@Test
	void arrayInsertWithKeyFails() {
		Value array = Value.array();
		array.insert("key", Value.of(1L));
		assertEquals(NOT_SUPPORTED, array.lastError());
		assertEquals(0, array.size());
	}

	@Test
	void scalarInsertFails() {
		Value scalar = Value.of(5L);
		scalar.add(6L);
		assertEquals(NOT_SUPPORTED, scalar.lastError());
		assertEquals(1, scalar.size());
	}

	@Test
	void getMissingKey() {
		Value object = Value.object().set("present", 1L);
		Value result = object.get("absent");
		assertSame(object, result);
		assertEquals(NOT_FOUND, object.lastError());
	}

	@Test
	void getWithWrongKind() {
		Value array = Value.array().add(1L);
		assertSame(array, array.get("key"));
		assertEquals(NOT_SUPPORTED, array.lastError());

		Value object = Value.object().set("key", 1L);
		assertSame(object, object.get(0));
		assertEquals(NOT_SUPPORTED, object.lastError());
	}

	@Test
	void pendingErrorPinsChainToReceiver() {
		Value object = Value.object().set("a", Value.object().set("b", 1L));
		object.setError(TYPE_MISMATCH);
		assertSame(object, object.get("a"), "Lookups don't leave a value with a pending error");
	}

	@Test
	void chainDoesNotShortCircuit() {
		Value root = Value.object().set("a", Value.object());
		root.get("missing")
			.set("added", 1L);
		// The set ran against the receiver of the failed lookup
		assertEquals(NOT_FOUND, root.lastError());
		assertEquals(2, root.size());
		assertEquals(1L, root.members().get("added").extractInt().orElseThrow());
	}

	@Test
	void extractionMatchesKind() {
		assertEquals(Optional.of("s"), Value.of("s").extractString());
		assertEquals(7L, Value.of(7L).extractInt().orElseThrow());
		assertEquals(Optional.of(true), Value.of(true).extractBool());
		assertEquals(0.25, Value.of(0.25).extractFloat().orElseThrow());
	}

	@Test
	void extractionMismatch() {
		Value integer = Value.of(7L);
		assertTrue(integer.extractString().isEmpty());
		assertEquals(TYPE_MISMATCH, integer.lastError());

		Value text = Value.of("7");
		assertTrue(text.extractInt().isEmpty());
		assertEquals(TYPE_MISMATCH, text.lastError());

		Value integerAsFloat = Value.of(7L);
		assertTrue(integerAsFloat.extractFloat().isEmpty(), "No implicit widening");
		assertEquals(TYPE_MISMATCH, integerAsFloat.lastError());

		Value nothing = Value.nullValue();
		assertTrue(nothing.extractBool().isEmpty());
		assertEquals(TYPE_MISMATCH, nothing.lastError());
	}

	@Test
	void mapSkipsWhenErrorPending() {
		AtomicBoolean called = new AtomicBoolean();
		Value text = Value.of("x");
		text.setError(NOT_FOUND);
		text.mapString(s -> called.set(true))
			.map(() -> called.set(true));
		assertFalse(called.get());
		assertEquals(NOT_FOUND, text.lastError(), "Unchanged");
	}

	@Test
	void mapWithWrongKind() {
		AtomicBoolean called = new AtomicBoolean();
		Value flag = Value.of(true);
		flag.mapInt(i -> called.set(true));
		assertFalse(called.get());
		assertEquals(TYPE_MISMATCH, flag.lastError());
	}

	@Test
	void mapScalars() {
		AtomicReference<Object> seen = new AtomicReference<>();
		Value.of(true).mapBool(seen::set);
		assertEquals(true, seen.get());
		Value.of(1.5).mapFloat(seen::set);
		assertEquals(1.5, seen.get());
	}

	@Test
	void mapArrayInOrder() {
		Value array = Value.array().add(1L).add(2L).add(3L);
		List<Long> seen = new ArrayList<>();
		array.mapArray(element -> element.mapInt(seen::add));
		assertEquals(List.of(1L, 2L, 3L), seen);
		assertFalse(array.hasError());
	}

	@Test
	void mapArrayStopsWhenReceiverFails() {
		Value array = Value.array().add(1L).add(2L).add(3L);
		List<Value> seen = new ArrayList<>();
		array.mapArray(element -> {
			seen.add(element);
			array.get("not an object");
		});
		assertEquals(1, seen.size());
		assertEquals(NOT_SUPPORTED, array.lastError());
	}

	@Test
	void mapArrayOnObject() {
		Value object = Value.object().set("a", 1L);
		object.mapArray(element -> { throw new AssertionError("Should not be called"); });
		assertEquals(NOT_SUPPORTED, object.lastError());
	}

	@Test
	void mapObjectVisitsEveryMember() {
		Value object = Value.object().set("a", 1L).set("b", 2L);
		Map<String, Long> seen = new HashMap<>();
		object.mapObject((key, child) -> child.mapInt(i -> seen.put(key, i)));
		assertEquals(Map.of("a", 1L, "b", 2L), seen);

		Value array = Value.array();
		array.mapObject((key, child) -> { throw new AssertionError("Should not be called"); });
		assertEquals(NOT_SUPPORTED, array.lastError());
	}

	@Test
	void errorCallbackConsumesError() {
		Value object = Value.object();
		object.get("missing");
		assertEquals(Optional.of(NOT_FOUND), object.error());

		List<ValueError> seen = new ArrayList<>();
		object.error(seen::add);
		assertEquals(List.of(NOT_FOUND), seen);
		assertFalse(object.hasError());
		assertEquals(OK, object.lastError());

		object.error(seen::add);
		assertEquals(1, seen.size(), "Not called when nothing is pending");
	}

	@Test
	void moveLeavesSourceUnusable() {
		Value source = Value.object().set("a", Value.array().add(1L));
		source.setError(NOT_FOUND);
		Value moved = source.move();

		assertTrue(source.isMoved());
		assertFalse(moved.isMoved());
		assertEquals(1, moved.size());
		assertEquals(NOT_FOUND, moved.lastError(), "Error moves too");
		assertEquals("(moved)", source.toString());
		assertThrows(MovedValueException.class, source::size);
		assertThrows(MovedValueException.class, source::dump);
		assertThrows(MovedValueException.class, source::hasError);
		assertThrows(MovedValueException.class, () -> source.get("a"));
		assertThrows(MovedValueException.class, () -> Value.array().add(source));
	}

	@Test
	void movedRootKeepsChildrenUsable() {
		Value source = Value.object().set("a", Value.array());
		Value moved = source.move();
		Value child = moved.get("a");
		moved.insert("b", Value.of(1L));

		// The child's owner is now the moved value, so a cycle is still detected
		assertThrows(OwnershipException.class, () -> child.add(moved));
	}

	@Test
	void cannotMoveOwnedValue() {
		Value root = Value.object().set("a", Value.array());
		Value child = root.get("a");
		assertThrows(OwnershipException.class, child::move);
		assertFalse(child.isMoved());
	}

	@Test
	void cannotShareOwnership() {
		Value child = Value.of(1L);
		Value first = Value.array().add(child);
		Value second = Value.array();
		assertThrows(OwnershipException.class, () -> second.add(child));
		assertEquals(0, second.size());
		assertEquals(1, first.size());
	}

	@Test
	void cannotCreateCycles() {
		Value root = Value.object();
		assertThrows(OwnershipException.class, () -> root.insert("self", root));

		Value outer = Value.array();
		Value inner = Value.array();
		outer.add(inner);
		assertThrows(OwnershipException.class, () -> inner.add(outer));
	}

	@Test
	void copyIsDeepAndUnowned() {
		Value original = Value.object().set("a", Value.array().add("x"));
		Value copy = original.get("a").copy();
		Value other = Value.object().set("b", copy);
		assertFalse(other.hasError());

		copy.add("y");
		assertEquals(1, original.get("a").size());
		assertEquals(2, other.get("b").size());
	}

	@Test
	void copyDropsErrors() {
		Value original = Value.object().set("a", 1L);
		original.get("missing");
		Value copy = original.copy();
		assertFalse(copy.hasError());
		assertEquals(original, copy);
		assertNotSame(original, copy);
	}

	@Test
	void structuralEquality() {
		Value a = Value.object().set("x", 1L).set("y", Value.array().add(2.5).add("z"));
		Value b = Value.object().set("y", Value.array().add(2.5).add("z")).set("x", 1L);
		assertEquals(a, b, "Member order doesn't matter");
		assertEquals(a.hashCode(), b.hashCode());

		assertNotEquals(Value.of(1L), Value.of(1.0), "Kind matters");
		assertNotEquals(Value.array().add(1L).add(2L), Value.array().add(2L).add(1L), "Element order matters");
	}

	@Test
	void membersAndElementsIgnorePendingError() {
		Value object = Value.object().set("a", 1L);
		object.setError(ValueError.PARSE_ERROR);
		assertEquals(1, object.members().size());
		assertThrows(UnsupportedOperationException.class, () -> object.members().clear());

		Value scalar = Value.of(1L);
		assertEquals(List.of(), scalar.elements());
		assertEquals(NOT_SUPPORTED, scalar.lastError());
	}
}
