package works.arbor.codec;

/**
 * Receives the details of a failed parse.
 * Called at most once per parse, after the parse stops at the first error.
 *
 * @see LoggingErrorHandler
 */
@FunctionalInterface
public interface ParseErrorHandler {
	void onError(ParserContext context);

	/**
	 * @return a handler that does nothing; the caller must check
	 * {@link works.arbor.dom.Value#hasError() hasError} on the result instead
	 */
	static ParseErrorHandler ignore() {
		return context -> { };
	}
}
