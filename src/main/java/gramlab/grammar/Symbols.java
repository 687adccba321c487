package gramlab.grammar;

/**
 * Reserved symbols.
 *
 * Symbols are plain non empty strings, these are the ones with a special meaning.
 */
public final class Symbols {

	/**
	 * The empty word, a production with ε as its right hand side produces nothing
	 */
	public static final String EPSILON = "ε";

	/**
	 * The accepting state added when an automaton is created from a regular grammar
	 */
	public static final String DIAMOND = "◇";

	/**
	 * End of input marker of the top down parser (on the tape and at the bottom of the stack)
	 */
	public static final String HASH = "♯";

	/**
	 * Separator between the symbols of productions and sentential forms in their string forms
	 */
	public static final String HAIR_SPACE = "\u200a";

	private Symbols() {
	}
}
