package gramlab.parser;

public class MatchMismatchException extends MoveException {

	public final String top;

	public final String head;

	public MatchMismatchException(String top, String head, String message) {
		super(message);
		this.top = top;
		this.head = head;
	}
}
