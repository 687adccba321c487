package gramlab.grammar;

/**
 * The left hand side of the production doesn't occur at the requested position of the sentential form.
 */
public class StepMismatchException extends DerivationException {

	public final int production;

	public final int position;

	public StepMismatchException(int production, int position, String message) {
		super(message);
		this.production = production;
		this.position = position;
	}
}
