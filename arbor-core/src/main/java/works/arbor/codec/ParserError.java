package works.arbor.codec;

/**
 * The contents of the sticky error register of a {@link Parser}.
 */
public enum ParserError {
	OK("No error."),
	EXPECTED_COMMA_BEFORE_NEXT_ATTRIBUTE("Expected ',' before the next attribute in the object."),
	EXPECTED_COMMA_BEFORE_NEXT_ARRAY_ITEM("Expected ',' before the next item in the array."),

	/**
	 * A comma that doesn't follow a completed attribute or array item.
	 */
	EXPECTED_VALUE_BUT_GOT_COMMA("Expected the next attribute or array item but got ',' instead."),
	EXPECTED_STRING_ATTRIBUTE_KEY("Expected a string attribute key but found no string, or the string was empty."),
	UNTERMINATED_STRING("Expected a closing quote but reached the end of the input."),
	UNEXPECTED_TOKEN("Expected the beginning of a value (string, number, boolean, null, array or object) but got something else."),
	EXPECTED_COLON("Expected ':' after the attribute key."),
	INVALID_NUMBER("Expected an integer or floating-point number.");

	private final String description;

	ParserError(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}
}
