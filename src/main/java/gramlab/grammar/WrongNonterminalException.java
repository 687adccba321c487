package gramlab.grammar;

/**
 * The leftmost (or rightmost) non terminal isn't the left hand side of the production to apply.
 */
public class WrongNonterminalException extends DerivationException {

	/**
	 * The leftmost (or rightmost) non terminal of the sentential form
	 */
	public final String symbol;

	/**
	 * Its position in the sentential form
	 */
	public final int position;

	public WrongNonterminalException(String symbol, int position, String message) {
		super(message);
		this.symbol = symbol;
		this.position = position;
	}
}
