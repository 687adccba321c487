package gramlab.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import gramlab.grammar.Grammar;
import gramlab.grammar.Production;
import gramlab.util.PersistentStack;
import gramlab.util.Utils;

import static gramlab.grammar.Symbols.EPSILON;

/**
 * Instantaneous description of a shift-reduce (bottom-up) pushdown automaton whose stack holds
 * the partial parse trees.
 *
 * The steps are the reduced productions in reverse order, so that they read as a rightmost
 * derivation.
 */
public class BottomUpInstantaneousDescription extends InstantaneousDescription<Tree> {

	private static final Logger LOG = Utils.logger("BottomUp");

	public BottomUpInstantaneousDescription(Grammar grammar, List<String> word) {
		super(grammar, word, 0, PersistentStack.empty(), ImmutableList.of());
	}

	/**
	 * @param word input, each character is a symbol
	 */
	public BottomUpInstantaneousDescription(Grammar grammar, String word) {
		this(grammar, Utils.characters(word));
	}

	private BottomUpInstantaneousDescription(Grammar grammar, List<String> tape, int headPosition,
	                                         PersistentStack<Tree> stack, List<Production> steps) {
		super(grammar, tape, headPosition, stack, steps);
	}

	@Override
	protected String symbolOf(Tree element) {
		return element.root;
	}

	/**
	 * Pushes a leaf with the symbol under the head and moves the head one symbol to the right
	 *
	 * @throws IllegalStateException if the whole tape has been read
	 */
	public BottomUpInstantaneousDescription shift(){
		String head = head();
		BottomUpInstantaneousDescription description = new BottomUpInstantaneousDescription(grammar, tape,
				headPosition + 1, stack.push(Tree.leaf(head)), steps);
		if (LOG.isLoggable(Level.FINER)){
			LOG.finer("Shifted " + head + ": " + description);
		}
		return description;
	}

	/**
	 * Replaces the trees on top of the stack whose roots form the right hand side of the
	 * production with a tree rooted at its left hand side. An ε production pops nothing and
	 * pushes a tree with a single ε leaf.
	 *
	 * @throws ReduceMismatchException if the roots on top of the stack (in the order they were
	 *                                 pushed) aren't the right hand side
	 */
	public BottomUpInstantaneousDescription reduce(Production production){
		if (!production.isContextFree()){
			throw new ReduceMismatchException(production,
					String.format("Cannot reduce %s, its lefthand side is not a single symbol.", production));
		}
		PersistentStack<Tree> next = stack;
		List<Tree> children = new ArrayList<>();
		if (production.isEpsilonProduction()){
			children.add(Tree.leaf(EPSILON));
		} else {
			int size = production.rhs.size();
			if (stack.size() < size){
				throw new ReduceMismatchException(production, String.format("Cannot reduce %s, the stack %s has less than %d elements.",
						production, stack, size));
			}
			for (int i = 0; i < size; i++){
				children.add(next.peek());
				next = next.pop();
			}
			Collections.reverse(children);
			List<String> roots = new ArrayList<>();
			for (Tree child : children){
				roots.add(child.root);
			}
			if (!roots.equals(production.rhs)){
				throw new ReduceMismatchException(production, String.format("Cannot reduce %s, the top of the stack %s is %s.",
						production, stack, Utils.join(roots, " ")));
			}
		}
		next = next.push(new Tree(production.lhsSymbol(), children));
		BottomUpInstantaneousDescription description = new BottomUpInstantaneousDescription(grammar, tape, headPosition,
				next, ImmutableList.<Production>builder().add(production).addAll(steps).build());
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine("Reduced " + production + ": " + description);
		}
		return description;
	}

	/**
	 * The only tree on the stack is rooted at the start symbol and the whole tape has been read
	 */
	@Override
	public boolean isDone() {
		return stack.size() == 1 && grammar.getStart().equals(top()) && headPosition == tape.size();
	}
}
