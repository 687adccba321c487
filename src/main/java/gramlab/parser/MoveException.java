package gramlab.parser;

import gramlab.GramlabException;

/**
 * Thrown if a move of a pushdown automaton isn't possible in the current instantaneous description.
 */
public class MoveException extends GramlabException {

	public MoveException(String message) {
		super(message);
	}
}
