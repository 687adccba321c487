package gramlab.grammar;

/**
 * Thrown if a grammar description can't be turned into a grammar.
 */
public class MalformedGrammarException extends InvalidGrammarException {

	/**
	 * Offending line, <code>null</code> if the whole description is the problem
	 */
	public final String line;

	public MalformedGrammarException(String line, String message) {
		super(Reason.MALFORMED_LINE, message);
		this.line = line;
	}

	/**
	 * Wraps a violated grammar invariant
	 */
	public MalformedGrammarException(InvalidGrammarException cause) {
		super(cause.reason, cause.getMessage(), cause);
		this.line = null;
	}
}
