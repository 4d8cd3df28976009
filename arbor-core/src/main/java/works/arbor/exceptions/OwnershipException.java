package works.arbor.exceptions;

/**
 * An operation would have given a {@link works.arbor.dom.Value Value} a second owner,
 * made it an ancestor of itself,
 * or left a hole in the container that owns it.
 */
public final class OwnershipException extends ArborException {
	public OwnershipException(String message) {
		super(message);
	}
}
