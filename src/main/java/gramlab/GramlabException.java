package gramlab;

/**
 * Base class of all exceptions thrown by gramlab.
 */
public class GramlabException extends RuntimeException {

	public GramlabException(String message) {
		super(message);
	}

	public GramlabException(String message, Throwable cause) {
		super(message, cause);
	}
}
