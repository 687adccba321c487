package gramlab.automaton;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import gramlab.grammar.Grammar;
import gramlab.grammar.Production;
import gramlab.util.Closure;
import gramlab.util.Utils;

import static gramlab.grammar.Symbols.DIAMOND;
import static gramlab.grammar.Symbols.EPSILON;

/**
 * A (non deterministic) finite automaton <code>(N, T, transitions, q0, F)</code>.
 *
 * Instances are immutable and checked on construction.
 */
public class Automaton implements Serializable {

	private static final Logger LOG = Utils.logger("Automaton");

	/**
	 * States
	 */
	private final ImmutableSet<State> states;

	/**
	 * Input symbols (transition labels without ε)
	 */
	private final ImmutableSet<String> inputSymbols;

	private final ImmutableList<Transition> transitions;

	private final State initialState;

	private final ImmutableSet<State> finalStates;

	/**
	 * @throws InvalidAutomatonException if the parts don't form a valid automaton
	 */
	public Automaton(Collection<? extends State> states, Collection<String> inputSymbols, List<Transition> transitions,
	                 State initialState, Collection<? extends State> finalStates) {
		this.states = ImmutableSet.copyOf(states);
		this.inputSymbols = ImmutableSet.copyOf(inputSymbols);
		this.transitions = ImmutableList.copyOf(transitions);
		this.initialState = initialState;
		this.finalStates = ImmutableSet.copyOf(finalStates);
		Set<State> common = this.states.stream()
				.filter(s -> s instanceof State.Single && this.inputSymbols.contains(((State.Single)s).symbol))
				.collect(Collectors.toSet());
		if (!common.isEmpty()){
			throw new InvalidAutomatonException(InvalidAutomatonException.Reason.NOT_DISJOINT,
					String.format("The set of states and input symbols are not disjoint, but have %s in common.",
							Utils.toString(common)));
		}
		if (!this.states.contains(initialState)){
			throw new InvalidAutomatonException(InvalidAutomatonException.Reason.INITIAL_NOT_STATE,
					String.format("The specified q0 (%s) is not a state.", initialState));
		}
		if (!this.states.containsAll(this.finalStates)){
			Set<State> notStates = new HashSet<>(this.finalStates);
			notStates.removeAll(this.states);
			throw new InvalidAutomatonException(InvalidAutomatonException.Reason.FINAL_NOT_STATES,
					String.format("The accepting states %s in F are not states.", Utils.toString(notStates)));
		}
		List<Transition> badTransitions = this.transitions.stream()
				.filter(t -> !this.states.contains(t.frm) || !this.states.contains(t.to)
						|| !(this.inputSymbols.contains(t.label) || EPSILON.equals(t.label)))
				.collect(Collectors.toList());
		if (!badTransitions.isEmpty()){
			throw new InvalidAutomatonException(InvalidAutomatonException.Reason.UNKNOWN_SYMBOLS,
					String.format("The following transitions contain states or symbols that are neither states nor input symbols: %s.",
							Utils.tuple(badTransitions)));
		}
	}

	/**
	 * Parses an automaton without accepting states
	 *
	 * @see #fromText(String, Set, String)
	 */
	public static Automaton fromText(String text){
		return fromText(text, Collections.emptySet(), null);
	}

	public static Automaton fromText(String text, Set<String> finalStates){
		return fromText(text, finalStates, null);
	}

	/**
	 * Parses an automaton from lines of the form <code>frm, label, to</code>.
	 *
	 * The states and input symbols are the ones used by the transitions.
	 *
	 * @param finalStates accepting states
	 * @param initialState initial state, <code>null</code> for the source of the first transition
	 * @throws MalformedAutomatonException if a line isn't of the required form
	 * @throws InvalidAutomatonException if the resulting automaton isn't valid
	 */
	public static Automaton fromText(String text, Set<String> finalStates, String initialState){
		List<Transition> transitions = Transition.fromText(text);
		if (transitions.isEmpty()){
			throw new MalformedAutomatonException(null, "The automaton description contains no transitions.");
		}
		State q0 = initialState == null ? transitions.get(0).frm : State.of(initialState);
		Set<State> states = new LinkedHashSet<>();
		Set<String> inputSymbols = new LinkedHashSet<>();
		for (Transition transition : transitions){
			states.add(transition.frm);
			states.add(transition.to);
			inputSymbols.add(transition.label);
		}
		inputSymbols.remove(EPSILON);
		List<State> accepting = finalStates.stream().map(State::of).collect(Collectors.toList());
		return new Automaton(states, inputSymbols, transitions, q0, accepting);
	}

	/**
	 * Creates the automaton that accepts the language of a regular grammar.
	 *
	 * Each production <code>A -> a B</code> becomes a transition from <code>A</code> to <code>B</code>
	 * labeled <code>a</code>, <code>A -> B</code> an ε transition and <code>A -> a</code> (or
	 * <code>A -> ε</code>) a transition into the new accepting state ◇.
	 *
	 * @throws NotRegularException if a production has none of these forms
	 */
	public static Automaton fromRegularGrammar(Grammar grammar){
		if (!grammar.isContextFree()){
			throw new NotRegularException(null, "The grammar is not context-free, hence not regular");
		}
		if (grammar.getSymbols().contains(DIAMOND)){
			throw new NotRegularException(null, "The grammar already uses the symbol " + DIAMOND);
		}
		List<Transition> transitions = new ArrayList<>();
		for (Production production : grammar.getProductions()){
			String lhs = production.lhsSymbol();
			List<String> rhs = production.rhs;
			if (rhs.size() > 2){
				throw new NotRegularException(production,
						String.format("Production %s has more than two symbols on the righthand side", production));
			}
			if (rhs.size() == 2){
				if (!(grammar.isTerminal(rhs.get(0)) && grammar.isNonTerminal(rhs.get(1)))){
					throw new NotRegularException(production,
							String.format("Production %s right hand side is not of the aB form", production));
				}
				transitions.add(new Transition(lhs, rhs.get(0), rhs.get(1)));
			} else if (grammar.isNonTerminal(rhs.get(0))){
				transitions.add(new Transition(lhs, EPSILON, rhs.get(0)));
			} else {
				transitions.add(new Transition(lhs, rhs.get(0), DIAMOND));
			}
		}
		List<State> states = grammar.getNonTerminals().stream().map(State::of).collect(Collectors.toList());
		states.add(State.of(DIAMOND));
		Automaton automaton = new Automaton(states, grammar.getTerminals(), transitions, State.of(grammar.getStart()),
				ImmutableSet.of(State.of(DIAMOND)));
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine("Compiled " + grammar + " into " + automaton);
		}
		return automaton;
	}

	/**
	 * The transition function
	 *
	 * @return states reachable from the passed state with the passed symbol, in the order of the transitions
	 */
	public Set<State> delta(State state, String symbol){
		Set<State> next = new LinkedHashSet<>();
		for (Transition transition : transitions){
			if (transition.frm.equals(state) && transition.label.equals(symbol)){
				next.add(transition.to);
			}
		}
		return next;
	}

	public Set<State> delta(String state, String symbol){
		return delta(State.of(state), symbol);
	}

	/**
	 * The passed states and all states reachable from them via ε transitions
	 */
	public Set<State> epsilonClosure(Set<State> start){
		UnaryOperator<Set<State>> closure = Closure.of(current -> {
			Set<State> next = new HashSet<>(current);
			for (State state : current){
				next.addAll(delta(state, EPSILON));
			}
			return next;
		});
		return closure.apply(new HashSet<>(start));
	}

	/**
	 * Does the automaton accept the passed word (a sequence of input symbols)?
	 */
	public boolean accepts(List<String> word){
		Set<State> current = epsilonClosure(Collections.singleton(initialState));
		for (String symbol : word){
			Set<State> next = new HashSet<>();
			for (State state : current){
				next.addAll(delta(state, symbol));
			}
			current = epsilonClosure(next);
		}
		return current.stream().anyMatch(finalStates::contains);
	}

	/**
	 * Makes the powerset construction, each state of the resulting automaton is the set of the
	 * (single symbol) states it stands for. Only reachable, non empty sets become states.
	 *
	 * @throws IllegalStateException if this automaton has states that aren't single symbols
	 */
	public Automaton toDeterministic(){
		for (State state : states){
			if (!(state instanceof State.Single)){
				throw new IllegalStateException("The powerset construction needs single symbol states, but " + state + " isn't");
			}
		}
		List<String> labels = new ArrayList<>(new TreeSet<>(inputSymbols));
		State.SymbolSet start = toSymbolSet(epsilonClosure(Collections.singleton(initialState)));
		Set<State> newStates = new LinkedHashSet<>();
		List<Transition> newTransitions = new ArrayList<>();
		Deque<State.SymbolSet> queue = new ArrayDeque<>();
		newStates.add(start);
		queue.add(start);
		while (!queue.isEmpty()){
			State.SymbolSet current = queue.poll();
			for (String label : labels){
				Set<State> target = new HashSet<>();
				for (String symbol : current.symbols){
					target.addAll(delta(symbol, label));
				}
				if (target.isEmpty()){
					continue;
				}
				State.SymbolSet next = toSymbolSet(epsilonClosure(target));
				newTransitions.add(new Transition(current, label, next));
				if (newStates.add(next)){
					queue.add(next);
				}
			}
		}
		Set<State> newFinalStates = new LinkedHashSet<>();
		for (State state : newStates){
			for (String symbol : ((State.SymbolSet)state).symbols){
				if (finalStates.contains(State.of(symbol))){
					newFinalStates.add(state);
				}
			}
		}
		return new Automaton(newStates, inputSymbols, newTransitions, start, newFinalStates);
	}

	private static State.SymbolSet toSymbolSet(Set<State> states){
		return State.ofSymbols(states.stream().map(s -> ((State.Single)s).symbol).collect(Collectors.toList()));
	}

	public Set<State> getStates(){
		return states;
	}

	public Set<String> getInputSymbols(){
		return inputSymbols;
	}

	public List<Transition> getTransitions(){
		return transitions;
	}

	public State getInitialState(){
		return initialState;
	}

	public Set<State> getFinalStates(){
		return finalStates;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof Automaton)) return false;
		Automaton other = (Automaton)obj;
		return states.equals(other.states) && inputSymbols.equals(other.inputSymbols)
				&& transitions.equals(other.transitions) && initialState.equals(other.initialState)
				&& finalStates.equals(other.finalStates);
	}

	@Override
	public int hashCode() {
		return Objects.hash(states, inputSymbols, transitions, initialState, finalStates);
	}

	@Override
	public String toString() {
		return String.format("Automaton(N=%s, T=%s, transitions=%s, F=%s, q0=%s)", Utils.toString(states),
				Utils.toString(inputSymbols), Utils.tuple(transitions), Utils.toString(finalStates), initialState);
	}
}
