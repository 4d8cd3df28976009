package works.arbor.dom;

/**
 * The contents of the sticky error register of a {@link Value}.
 */
public enum ValueError {
	OK("No error."),

	/**
	 * The operation does not apply to the value's {@link Kind}.
	 */
	NOT_SUPPORTED("The operation is not supported by this kind of value."),
	NOT_FOUND("The requested key does not exist."),
	EMPTY_KEY("Object attribute keys must not be empty."),

	/**
	 * Set on the root returned by {@link works.arbor.Json#parse(String) parse}
	 * when the input text was malformed. The tree is a best-effort partial result.
	 */
	PARSE_ERROR("The value was produced from malformed input and may be incomplete."),
	TYPE_MISMATCH("The value is not of the requested kind.");

	private final String description;

	ValueError(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}
}
