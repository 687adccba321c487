package gramlab.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import gramlab.util.Utils;

import static gramlab.grammar.Symbols.EPSILON;
import static gramlab.util.Utils.join;

/**
 * Grammar consisting of non terminals, terminals, productions and a start symbol, the
 * tuple <code>(N, T, P, S)</code>.
 *
 * The order of the productions matters, their indices identify them in derivations.
 * Instances are immutable and checked on construction.
 */
public class Grammar implements Serializable {

	private static final Logger LOG = Utils.logger("Grammar");

	/**
	 * Non terminals in the grammar
	 */
	private final ImmutableSet<String> nonTerminals;

	private final ImmutableSet<String> terminals;

	private final ImmutableList<Production> productions;

	private final String start;

	/**
	 * Are all left hand sides single symbols?
	 */
	private final boolean contextFree;

	/**
	 * Create a new Grammar object
	 *
	 * @param nonTerminals non terminal symbols
	 * @param terminals terminal symbols
	 * @param productions productions, their order defines their indices
	 * @param start start non terminal
	 * @throws InvalidGrammarException if the parts don't form a valid grammar
	 */
	public Grammar(Collection<String> nonTerminals, Collection<String> terminals, List<Production> productions,
	               String start) {
		this.nonTerminals = ImmutableSet.copyOf(nonTerminals);
		this.terminals = ImmutableSet.copyOf(terminals);
		this.productions = ImmutableList.copyOf(productions);
		this.start = start;
		this.contextFree = this.productions.stream().allMatch(Production::isContextFree);
		Set<String> common = Sets.intersection(this.nonTerminals, this.terminals);
		if (!common.isEmpty()){
			throw new InvalidGrammarException(InvalidGrammarException.Reason.NOT_DISJOINT,
					String.format("The set of terminals and nonterminals are not disjoint, but have %s in common.",
							Utils.toString(common)));
		}
		if (!this.nonTerminals.contains(start)){
			throw new InvalidGrammarException(InvalidGrammarException.Reason.START_NOT_NONTERMINAL,
					String.format("The start symbol %s is not a nonterminal.", start));
		}
		if (contextFree){
			List<Production> badProductions = this.productions.stream()
					.filter(p -> !this.nonTerminals.contains(p.lhsSymbol()))
					.collect(Collectors.toList());
			if (!badProductions.isEmpty()){
				throw new InvalidGrammarException(InvalidGrammarException.Reason.LHS_NOT_NONTERMINAL,
						String.format("The following productions have a lhs that is not a nonterminal: %s.",
								Utils.tuple(badProductions)));
			}
		}
		List<Production> badProductions = this.productions.stream()
				.filter(p -> !p.symbols().stream().allMatch(this::isSymbolOrEpsilon))
				.collect(Collectors.toList());
		if (!badProductions.isEmpty()){
			throw new InvalidGrammarException(InvalidGrammarException.Reason.UNKNOWN_SYMBOLS,
					String.format("The following productions contain symbols that are neither terminals or nonterminals: %s.",
							Utils.tuple(badProductions)));
		}
	}

	private boolean isSymbolOrEpsilon(String symbol){
		return nonTerminals.contains(symbol) || terminals.contains(symbol) || EPSILON.equals(symbol);
	}

	/**
	 * Parses a context free grammar
	 *
	 * @see #fromText(String, boolean)
	 */
	public static Grammar fromText(String text){
		return fromText(text, true);
	}

	/**
	 * Parses a grammar from lines of the form <code>lhs -> rhs1 | rhs2 | ...</code>.
	 *
	 * The start symbol is the (first symbol of the) left hand side of the first production.
	 * For context free grammars the non terminals are the left hand sides, otherwise the
	 * symbols that start with an uppercase letter. All other symbols (except ε) are terminals.
	 *
	 * @param text grammar description
	 * @param contextFree are all left hand sides single symbols?
	 * @throws MalformedGrammarException if the description doesn't describe a valid grammar
	 */
	public static Grammar fromText(String text, boolean contextFree){
		List<Production> productions = Production.fromText(text, contextFree);
		if (productions.isEmpty()){
			throw new MalformedGrammarException(null, "The grammar description contains no productions.");
		}
		Set<String> nonTerminals = new LinkedHashSet<>();
		Set<String> terminals = new LinkedHashSet<>();
		String start = productions.get(0).lhs.get(0);
		if (contextFree){
			for (Production production : productions){
				nonTerminals.add(production.lhsSymbol());
			}
			for (Production production : productions){
				terminals.addAll(production.rhs);
			}
		} else {
			for (Production production : productions){
				for (String symbol : production.symbols()){
					if (Character.isUpperCase(symbol.codePointAt(0))){
						nonTerminals.add(symbol);
					} else {
						terminals.add(symbol);
					}
				}
			}
		}
		terminals.removeAll(nonTerminals);
		terminals.remove(EPSILON);
		try {
			Grammar grammar = new Grammar(nonTerminals, terminals, productions, start);
			if (LOG.isLoggable(Level.FINE)){
				LOG.fine("Parsed " + grammar);
			}
			return grammar;
		} catch (InvalidGrammarException e) {
			throw new MalformedGrammarException(e);
		}
	}

	/**
	 * Right hand sides of the productions with the passed single symbol as their left hand side
	 *
	 * @return lazily evaluated right hand sides in the order of the productions
	 */
	public Iterable<List<String>> alternatives(String symbol){
		return alternatives(ImmutableList.of(symbol));
	}

	/**
	 * Right hand sides of the productions with the passed left hand side
	 * (compared in unrestricted form)
	 *
	 * @return lazily evaluated right hand sides in the order of the productions
	 */
	public Iterable<List<String>> alternatives(List<String> lhs){
		return () -> productions.stream()
				.filter(p -> p.lhs.equals(lhs))
				.<List<String>>map(p -> p.rhs)
				.iterator();
	}

	/**
	 * A grammar that only uses the passed symbols
	 *
	 * @param symbols the allowed symbols
	 * @return grammar without the symbols and productions that use other symbols
	 * @throws InvalidGrammarException if the start symbol isn't allowed
	 */
	public Grammar restrictTo(Set<String> symbols){
		List<Production> kept = new ArrayList<>();
		for (Production production : productions){
			boolean allowed = true;
			for (String symbol : production.symbols()){
				if (!symbols.contains(symbol) && !EPSILON.equals(symbol)){
					allowed = false;
					break;
				}
			}
			if (allowed){
				kept.add(production);
			}
		}
		return new Grammar(Sets.intersection(nonTerminals, symbols), Sets.intersection(terminals, symbols), kept, start);
	}

	public Set<String> getNonTerminals(){
		return nonTerminals;
	}

	public Set<String> getTerminals(){
		return terminals;
	}

	/**
	 * Non terminals and terminals
	 */
	public Set<String> getSymbols(){
		return Sets.union(nonTerminals, terminals);
	}

	public List<Production> getProductions(){
		return productions;
	}

	public Production getProduction(int index){
		if (index < 0 || index >= productions.size()){
			throw new IllegalArgumentException(String.format("There is no production with index %d, the grammar has %d.",
					index, productions.size()));
		}
		return productions.get(index);
	}

	/**
	 * Index of the first occurrence of the passed production
	 *
	 * @throws IllegalArgumentException if it isn't a production of this grammar
	 */
	public int indexOf(Production production){
		int index = productions.indexOf(production);
		if (index == -1){
			throw new IllegalArgumentException(production + " is not a production of the grammar");
		}
		return index;
	}

	public String getStart(){
		return start;
	}

	public boolean isContextFree(){
		return contextFree;
	}

	public boolean isNonTerminal(String symbol){
		return nonTerminals.contains(symbol);
	}

	public boolean isTerminal(String symbol){
		return terminals.contains(symbol);
	}

	public String longDescription(){
		List<String> lines = new ArrayList<>();
		for (int i = 0; i < productions.size(); i++){
			lines.add(i + ": " + productions.get(i));
		}
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + Utils.toString(nonTerminals) + "\n" +
				"Terminals: " + Utils.toString(terminals) + "\n" +
				"Productions: \n" + join(lines, "\n");
	}

	private List<Production> sortedProductions(){
		List<Production> sorted = new ArrayList<>(productions);
		Collections.sort(sorted);
		return sorted;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof Grammar)) return false;
		Grammar other = (Grammar)obj;
		return nonTerminals.equals(other.nonTerminals) && terminals.equals(other.terminals)
				&& start.equals(other.start) && sortedProductions().equals(other.sortedProductions());
	}

	@Override
	public int hashCode() {
		return Objects.hash(nonTerminals, terminals, sortedProductions(), start);
	}

	@Override
	public String toString() {
		return String.format("Grammar(N=%s, T=%s, P=%s, S=%s)", Utils.toString(nonTerminals),
				Utils.toString(terminals), Utils.tuple(productions), start);
	}
}
