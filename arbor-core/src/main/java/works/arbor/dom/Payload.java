package works.arbor.dom;

import java.util.List;
import java.util.Map;
import works.arbor.exceptions.MovedValueException;

/**
 * The contents of a {@link Value}. Exactly one variant is active at a time.
 * <p>
 * Scalar variants are immutable and may be shared freely between values;
 * the container variants hold mutable collections and belong to exactly one value.
 */
sealed interface Payload {
	/**
	 * @throws MovedValueException for {@link Moved}, which has no kind
	 */
	Kind kind();

	Moved MOVED = new Moved();
	Null NULL = new Null();
	Bool TRUE = new Bool(true);
	Bool FALSE = new Bool(false);

	record Members(Map<String, Value> members) implements Payload {
		@Override
		public Kind kind() {
			return Kind.OBJECT;
		}
	}

	record Elements(List<Value> elements) implements Payload {
		@Override
		public Kind kind() {
			return Kind.ARRAY;
		}
	}

	record Text(String text) implements Payload {
		@Override
		public Kind kind() {
			return Kind.STRING;
		}
	}

	record Int(long value) implements Payload {
		@Override
		public Kind kind() {
			return Kind.INTEGER;
		}
	}

	record Real(double value) implements Payload {
		@Override
		public Kind kind() {
			return Kind.FLOAT;
		}
	}

	record Bool(boolean value) implements Payload {
		@Override
		public Kind kind() {
			return Kind.BOOLEAN;
		}
	}

	record Null() implements Payload {
		@Override
		public Kind kind() {
			return Kind.NULL;
		}
	}

	/**
	 * The state left behind by {@link Value#move()},
	 * and by a child that its owner discarded.
	 */
	record Moved() implements Payload {
		@Override
		public Kind kind() {
			throw new MovedValueException("Value has been moved or discarded");
		}
	}
}
