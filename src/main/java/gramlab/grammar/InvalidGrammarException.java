package gramlab.grammar;

import gramlab.GramlabException;

/**
 * Thrown if the parts of a grammar violate one of its invariants.
 */
public class InvalidGrammarException extends GramlabException {

	/**
	 * The violated invariant
	 */
	public enum Reason {
		/**
		 * N ∩ T ≠ ∅
		 */
		NOT_DISJOINT,
		/**
		 * S ∉ N
		 */
		START_NOT_NONTERMINAL,
		/**
		 * A context free grammar has a production whose left hand side isn't a non terminal
		 */
		LHS_NOT_NONTERMINAL,
		/**
		 * A production uses a symbol that is neither a terminal nor a non terminal
		 */
		UNKNOWN_SYMBOLS,
		/**
		 * A line of a grammar description can't be parsed
		 */
		MALFORMED_LINE
	}

	public final Reason reason;

	public InvalidGrammarException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public InvalidGrammarException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
	}
}
