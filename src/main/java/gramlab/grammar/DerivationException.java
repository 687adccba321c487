package gramlab.grammar;

import gramlab.GramlabException;

/**
 * Thrown if a derivation step can't be performed.
 */
public class DerivationException extends GramlabException {

	public DerivationException(String message) {
		super(message);
	}
}
