package gramlab.grammar;

/**
 * The sentential form consists only of terminals.
 */
public class NoNonterminalException extends DerivationException {

	public NoNonterminalException(String message) {
		super(message);
	}
}
