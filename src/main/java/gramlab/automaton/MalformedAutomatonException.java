package gramlab.automaton;

import gramlab.GramlabException;

/**
 * Thrown if a line of a transition description isn't of the form <code>frm, label, to</code>.
 */
public class MalformedAutomatonException extends GramlabException {

	/**
	 * Offending line, <code>null</code> if the whole description is the problem
	 */
	public final String line;

	public MalformedAutomatonException(String line, String message) {
		super(message);
		this.line = line;
	}
}
