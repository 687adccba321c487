package gramlab.automaton;

import gramlab.GramlabException;

/**
 * Thrown if the parts of an automaton violate one of its invariants.
 */
public class InvalidAutomatonException extends GramlabException {

	public enum Reason {
		/**
		 * A state is also an input symbol
		 */
		NOT_DISJOINT,
		INITIAL_NOT_STATE,
		FINAL_NOT_STATES,
		/**
		 * A transition uses a state or label that isn't part of the automaton
		 */
		UNKNOWN_SYMBOLS
	}

	public final Reason reason;

	public InvalidAutomatonException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}
}
