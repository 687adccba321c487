package gramlab.automaton;

import gramlab.GramlabException;
import gramlab.grammar.Production;

/**
 * Thrown if a grammar can't be turned into a finite automaton.
 */
public class NotRegularException extends GramlabException {

	/**
	 * The production that isn't of a regular form, <code>null</code> if the grammar as a whole is the problem
	 */
	public final Production production;

	public NotRegularException(Production production, String message) {
		super(message);
		this.production = production;
	}
}
