package works.arbor.exceptions;

/**
 * Signals a bug in the calling code, as opposed to a problem with a document.
 * <p>
 * Problems with documents, like a missing key or malformed input text,
 * never throw: they are recorded in the sticky error registers of
 * {@link works.arbor.dom.Value Value} and {@link works.arbor.codec.Parser Parser}.
 */
public sealed abstract class ArborException extends RuntimeException permits MovedValueException, OwnershipException {
	protected ArborException(String message) {
		super(message);
	}
}
