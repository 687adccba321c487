package gramlab.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import com.google.common.collect.ImmutableList;

import gramlab.util.Utils;

import static gramlab.grammar.Symbols.EPSILON;
import static gramlab.grammar.Symbols.HAIR_SPACE;

/**
 * A derivation: the history of production applications starting with a single non terminal.
 *
 * Derivations are immutable, every step returns a new derivation and leaves this one untouched,
 * which allows exploring several alternatives starting from the same derivation.
 */
public class Derivation {

	private static final Logger LOG = Utils.logger("Derivation");

	/**
	 * An applied step: the index of the production and the position in the sentential form
	 * where its left hand side has been replaced.
	 */
	public static final class Step {

		public final int production;

		public final int position;

		public Step(int production, int position) {
			this.production = production;
			this.position = position;
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Step)){
				return false;
			}
			Step step = (Step)obj;
			return step.production == production && step.position == position;
		}

		@Override
		public int hashCode() {
			return Objects.hash(production, position);
		}

		@Override
		public String toString() {
			return String.format("(%d, %d)", production, position);
		}
	}

	private final Grammar grammar;

	private final String start;

	private final ImmutableList<Step> steps;

	private final ImmutableList<String> sententialForm;

	private final String repr;

	/**
	 * Derivation starting with the start symbol of the passed grammar
	 */
	public Derivation(Grammar grammar) {
		this(grammar, grammar.getStart());
	}

	/**
	 * Derivation starting with the passed non terminal
	 */
	public Derivation(Grammar grammar, String start) {
		this(grammar, start, ImmutableList.of(), ImmutableList.of(start), start);
		if (!grammar.isNonTerminal(start)){
			throw new IllegalArgumentException(String.format("The start symbol %s is not a nonterminal of the grammar.", start));
		}
	}

	private Derivation(Grammar grammar, String start, ImmutableList<Step> steps, ImmutableList<String> sententialForm,
	                   String repr) {
		this.grammar = grammar;
		this.start = start;
		this.steps = steps;
		this.sententialForm = sententialForm;
		this.repr = repr;
	}

	/**
	 * Performs a derivation step, returning a new derivation.
	 *
	 * @param production index of the production to apply
	 * @param position position in the sentential form where its left hand side starts
	 * @throws StepMismatchException if the left hand side doesn't occur at the passed position
	 */
	public Derivation step(int production, int position){
		Production prod = grammar.getProduction(production).asUnrestricted();
		if (!matches(prod.lhs, position)){
			throw new StepMismatchException(production, position, String.format("Cannot apply %s at position %d of %s.",
					prod, position, String.join(HAIR_SPACE, sententialForm)));
		}
		List<String> form = new ArrayList<>(sententialForm.subList(0, position));
		form.addAll(prod.rhs);
		form.addAll(sententialForm.subList(position + prod.lhs.size(), sententialForm.size()));
		form.removeIf(EPSILON::equals);
		Derivation next = new Derivation(grammar, start,
				ImmutableList.<Step>builder().addAll(steps).add(new Step(production, position)).build(),
				ImmutableList.copyOf(form), repr + " -> " + String.join(HAIR_SPACE, form));
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Applied %s at %d: %s", prod, position, String.join(HAIR_SPACE, form)));
		}
		return next;
	}

	public Derivation step(Step step){
		return step(step.production, step.position);
	}

	/**
	 * Performs the passed steps one after another
	 */
	public Derivation step(Iterable<Step> steps){
		Derivation derivation = this;
		for (Step step : steps){
			derivation = derivation.step(step);
		}
		return derivation;
	}

	public Derivation step(Step... steps){
		return step(Arrays.asList(steps));
	}

	/**
	 * Applies the passed productions (given as indices) one after another, each one to the leftmost
	 * non terminal of the current sentential form.
	 *
	 * @throws NotContextFreeException if the grammar isn't context free
	 * @throws NoNonterminalException if the sentential form contains no non terminal
	 * @throws WrongNonterminalException if the leftmost non terminal isn't the lhs of the production
	 */
	public Derivation leftmost(int... productions){
		Derivation derivation = this;
		for (int production : productions){
			derivation = derivation.extreme(production, true);
		}
		return derivation;
	}

	public Derivation leftmost(Production... productions){
		return leftmost(indicesOf(productions));
	}

	/**
	 * Applies the passed productions (given as indices) one after another, each one to the rightmost
	 * non terminal of the current sentential form.
	 *
	 * @see #leftmost(int...)
	 */
	public Derivation rightmost(int... productions){
		Derivation derivation = this;
		for (int production : productions){
			derivation = derivation.extreme(production, false);
		}
		return derivation;
	}

	public Derivation rightmost(Production... productions){
		return rightmost(indicesOf(productions));
	}

	private int[] indicesOf(Production[] productions){
		int[] indices = new int[productions.length];
		for (int i = 0; i < productions.length; i++){
			indices[i] = grammar.indexOf(productions[i]);
		}
		return indices;
	}

	private Derivation extreme(int production, boolean leftmost){
		String kind = leftmost ? "leftmost" : "rightmost";
		if (!grammar.isContextFree()){
			throw new NotContextFreeException("Cannot perform a " + kind + " derivation on a non context-free grammar");
		}
		Production prod = grammar.getProduction(production);
		int size = sententialForm.size();
		for (int i = 0; i < size; i++){
			int position = leftmost ? i : size - 1 - i;
			String symbol = sententialForm.get(position);
			if (grammar.isNonTerminal(symbol)){
				if (prod.lhsSymbol().equals(symbol)){
					return step(production, position);
				}
				throw new WrongNonterminalException(symbol, position, String.format("Cannot apply %s: the %s nonterminal of %s is %s.",
						prod, kind, String.join(HAIR_SPACE, sententialForm), symbol));
			}
		}
		throw new NoNonterminalException(String.format("Cannot apply %s: there are no nonterminals in %s.",
				prod, String.join(HAIR_SPACE, sententialForm)));
	}

	private boolean matches(List<String> lhs, int position){
		return position >= 0 && position <= sententialForm.size() - lhs.size()
				&& sententialForm.subList(position, position + lhs.size()).equals(lhs);
	}

	/**
	 * All steps that can be applied to the current sentential form
	 */
	public Iterable<Step> possibleSteps(){
		return possibleSteps(null, null);
	}

	/**
	 * Steps that can be applied to the current sentential form, ordered by production index and
	 * then by position.
	 *
	 * @param production only consider this production, <code>null</code> for all
	 * @param position only consider this position, <code>null</code> for all
	 * @return lazily evaluated steps, can be iterated several times
	 */
	public Iterable<Step> possibleSteps(Integer production, Integer position){
		return () -> {
			IntStream productions = production == null ? IntStream.range(0, grammar.getProductions().size())
					: IntStream.of(production);
			Stream<Step> candidates = productions.boxed().flatMap(n -> {
				List<String> lhs = grammar.getProduction(n).asUnrestricted().lhs;
				IntStream positions = position == null ? IntStream.rangeClosed(0, sententialForm.size() - lhs.size())
						: IntStream.of(position);
				return positions.filter(p -> matches(lhs, p)).mapToObj(p -> new Step(n, p));
			});
			return candidates.iterator();
		};
	}

	public List<Step> steps(){
		return steps;
	}

	public List<String> sententialForm(){
		return sententialForm;
	}

	public Grammar getGrammar(){
		return grammar;
	}

	public String getStart(){
		return start;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof Derivation)) return false;
		Derivation other = (Derivation)obj;
		return grammar.equals(other.grammar) && start.equals(other.start) && steps.equals(other.steps);
	}

	@Override
	public int hashCode() {
		return Objects.hash(grammar, start, steps);
	}

	/**
	 * The sentential forms of all steps, separated by arrows
	 */
	@Override
	public String toString() {
		return repr;
	}
}
