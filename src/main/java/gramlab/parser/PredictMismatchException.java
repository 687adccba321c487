package gramlab.parser;

import gramlab.grammar.Production;

/**
 * The left hand side of the predicted production isn't the top of the stack.
 */
public class PredictMismatchException extends MoveException {

	public final Production production;

	public final String top;

	public PredictMismatchException(Production production, String top, String message) {
		super(message);
		this.production = production;
		this.top = top;
	}
}
