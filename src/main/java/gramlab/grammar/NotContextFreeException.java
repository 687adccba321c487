package gramlab.grammar;

/**
 * Leftmost and rightmost derivations need a context free grammar.
 */
public class NotContextFreeException extends DerivationException {

	public NotContextFreeException(String message) {
		super(message);
	}
}
