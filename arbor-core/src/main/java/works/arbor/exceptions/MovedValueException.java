package works.arbor.exceptions;

/**
 * An operation was attempted on a {@link works.arbor.dom.Value Value}
 * whose contents have been {@link works.arbor.dom.Value#move() moved} elsewhere,
 * or which was discarded when its owner replaced it.
 */
public final class MovedValueException extends ArborException {
	public MovedValueException(String message) {
		super(message);
	}
}
