package gramlab.parser;

import gramlab.grammar.Production;

/**
 * The right hand side of the production isn't on top of the stack.
 */
public class ReduceMismatchException extends MoveException {

	public final Production production;

	public ReduceMismatchException(Production production, String message) {
		super(message);
		this.production = production;
	}
}
