package gramlab.parser;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import gramlab.grammar.Grammar;
import gramlab.grammar.Production;
import gramlab.util.PersistentStack;
import gramlab.util.Utils;

import static gramlab.grammar.Symbols.EPSILON;
import static gramlab.grammar.Symbols.HASH;

/**
 * Instantaneous description of a predictive (top-down) pushdown automaton.
 *
 * The tape ends with ♯ and the stack initially holds ♯ below the start symbol. The
 * automaton either replaces the non terminal on top of the stack with the right hand side of
 * a production (predict) or consumes the terminal on top of the stack if it is under the head
 * (match).
 */
public class TopDownInstantaneousDescription extends InstantaneousDescription<String> {

	private static final Logger LOG = Utils.logger("TopDown");

	/**
	 * @param word input symbols, without the end marker
	 * @throws IllegalArgumentException if the grammar uses the end marker ♯
	 */
	public TopDownInstantaneousDescription(Grammar grammar, List<String> word) {
		super(grammar, ImmutableList.<String>builder().addAll(word).add(HASH).build(), 0,
				PersistentStack.of(HASH, grammar.getStart()), ImmutableList.of());
		if (grammar.getSymbols().contains(HASH)){
			throw new IllegalArgumentException("The grammar already uses the end marker " + HASH);
		}
	}

	/**
	 * @param word input, each character is a symbol
	 */
	public TopDownInstantaneousDescription(Grammar grammar, String word) {
		this(grammar, Utils.characters(word));
	}

	private TopDownInstantaneousDescription(Grammar grammar, List<String> tape, int headPosition,
	                                        PersistentStack<String> stack, List<Production> steps) {
		super(grammar, tape, headPosition, stack, steps);
	}

	@Override
	protected String symbolOf(String element) {
		return element;
	}

	/**
	 * Replaces the top of the stack with the right hand side of the production, its first
	 * symbol ending up on top. ε isn't pushed.
	 *
	 * @throws PredictMismatchException if the lhs of the production isn't the top of the stack
	 */
	public TopDownInstantaneousDescription predict(Production production){
		String top = top();
		if (!production.isContextFree() || !production.lhsSymbol().equals(top)){
			throw new PredictMismatchException(production, top,
					String.format("Cannot predict %s, the top of the stack is %s.", production, top));
		}
		PersistentStack<String> next = stack.pop();
		for (String symbol : production.rhs.reverse()){
			if (!EPSILON.equals(symbol)){
				next = next.push(symbol);
			}
		}
		TopDownInstantaneousDescription description = new TopDownInstantaneousDescription(grammar, tape, headPosition, next,
				ImmutableList.<Production>builder().addAll(steps).add(production).build());
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine("Predicted " + production + ": " + description);
		}
		return description;
	}

	/**
	 * Pops an ε from the stack, or a terminal that equals the symbol under the head and moves the
	 * head one symbol to the right.
	 *
	 * @throws MatchMismatchException if the top of the stack is neither ε nor the terminal under the head
	 */
	public TopDownInstantaneousDescription match(){
		String top = top();
		TopDownInstantaneousDescription description;
		if (EPSILON.equals(top)){
			description = new TopDownInstantaneousDescription(grammar, tape, headPosition, stack.pop(), steps);
		} else {
			String head = head();
			if (!grammar.isTerminal(top) || !top.equals(head)){
				throw new MatchMismatchException(top, head,
						String.format("Cannot match %s on top of the stack with %s under the head.", top, head));
			}
			description = new TopDownInstantaneousDescription(grammar, tape, headPosition + 1, stack.pop(), steps);
		}
		if (LOG.isLoggable(Level.FINER)){
			LOG.finer("Matched " + top + ": " + description);
		}
		return description;
	}

	/**
	 * The end markers of the stack and of the tape meet
	 */
	@Override
	public boolean isDone() {
		return !stack.isEmpty() && HASH.equals(top()) && headPosition < tape.size() && HASH.equals(head());
	}
}
