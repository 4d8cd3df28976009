package works.arbor.dom;

/**
 * The kinds of JSON value a {@link Value} can hold.
 */
public enum Kind {
	/**
	 * Unordered mapping from non-empty string keys to values.
	 */
	OBJECT,
	ARRAY,
	STRING,

	/**
	 * 64-bit signed integer.
	 */
	INTEGER,

	/**
	 * 64-bit IEEE 754 floating point.
	 */
	FLOAT,
	BOOLEAN,
	NULL;

	public boolean isContainer() {
		return switch (this) {
			case OBJECT, ARRAY -> true;
			case STRING, INTEGER, FLOAT, BOOLEAN, NULL -> false;
		};
	}
}
