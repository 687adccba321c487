package gramlab.parser;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import gramlab.grammar.Grammar;
import gramlab.grammar.Production;
import gramlab.util.PersistentStack;
import gramlab.util.Utils;

/**
 * Snapshot of a pushdown automaton: the tape with the head position, the stack and the
 * productions applied so far.
 *
 * Descriptions are immutable, every move returns a new description. Several descriptions can
 * be derived from the same one to explore alternatives, they share the unchanged part of the
 * stack. Two descriptions are equal if they only differ in their steps.
 *
 * @param <E> type of the stack elements
 */
public abstract class InstantaneousDescription<E> {

	protected final Grammar grammar;

	protected final ImmutableList<String> tape;

	protected final int headPosition;

	protected final PersistentStack<E> stack;

	protected final ImmutableList<Production> steps;

	protected InstantaneousDescription(Grammar grammar, List<String> tape, int headPosition, PersistentStack<E> stack,
	                                   List<Production> steps) {
		this.grammar = grammar;
		this.tape = ImmutableList.copyOf(tape);
		this.headPosition = headPosition;
		this.stack = stack;
		this.steps = ImmutableList.copyOf(steps);
	}

	/**
	 * Symbol of a stack element
	 */
	protected abstract String symbolOf(E element);

	/**
	 * Has the automaton accepted the input?
	 */
	public abstract boolean isDone();

	/**
	 * The symbol under the head
	 *
	 * @throws IllegalStateException if the head is past the end of the tape
	 */
	public String head(){
		if (headPosition >= tape.size()){
			throw new IllegalStateException("The head is past the end of the tape");
		}
		return tape.get(headPosition);
	}

	/**
	 * The symbol on top of the stack (the root symbol, if the stack holds trees)
	 *
	 * @throws IllegalStateException if the stack is empty
	 */
	public String top(){
		if (stack.isEmpty()){
			throw new IllegalStateException("The stack is empty");
		}
		return symbolOf(stack.peek());
	}

	public Grammar getGrammar(){
		return grammar;
	}

	public List<String> getTape(){
		return tape;
	}

	public int getHeadPosition(){
		return headPosition;
	}

	/**
	 * Stack elements, top first
	 */
	public List<E> getStack(){
		return stack.toList();
	}

	public List<Production> getSteps(){
		return steps;
	}

	/**
	 * The tape with the consumed part and the remaining part separated by the head position
	 */
	protected String tapeString(){
		return Utils.join(tape.subList(0, headPosition), "") + "|" + Utils.join(tape.subList(headPosition, tape.size()), "");
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || obj.getClass() != getClass()) return false;
		InstantaneousDescription<?> other = (InstantaneousDescription<?>)obj;
		return headPosition == other.headPosition && grammar.equals(other.grammar) && tape.equals(other.tape)
				&& stack.equals(other.stack);
	}

	@Override
	public int hashCode() {
		return Objects.hash(grammar, tape, headPosition, stack);
	}

	@Override
	public String toString() {
		return String.format("%s(tape=%s, stack=%s, steps=%s)", getClass().getSimpleName(), tapeString(), stack,
				Utils.tuple(steps));
	}
}
