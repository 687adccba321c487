package gramlab.grammar;

import gramlab.GramlabException;

/**
 * Thrown if the sides of a production, item or transition don't have the required shape.
 */
public class InvalidSymbolsException extends GramlabException {

	public InvalidSymbolsException(String message) {
		super(message);
	}
}
