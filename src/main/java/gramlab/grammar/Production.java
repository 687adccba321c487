package gramlab.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import com.google.common.collect.ImmutableList;

import static gramlab.grammar.Symbols.EPSILON;
import static gramlab.grammar.Symbols.HAIR_SPACE;

/**
 * A grammar production with a left and a right hand side.
 *
 * The left hand side is either a single symbol (the context free form) or a sequence of symbols
 * (the unrestricted form). A production that produces ε has ε as its only right hand side symbol.
 */
public class Production implements Serializable, Comparable<Production> {

	/**
	 * Left hand side of the production, a single element list for the context free form
	 */
	public final ImmutableList<String> lhs;

	/**
	 * Right hand side of the production, contains ε only if it is its single symbol
	 */
	public final ImmutableList<String> rhs;

	private final boolean contextFree;

	/**
	 * Creates a production in context free form
	 */
	public Production(String lhs, List<String> rhs) {
		this(ImmutableList.of(checkSymbol(lhs, "lhs")), rhs, true);
	}

	public Production(String lhs, String... rhs) {
		this(lhs, Arrays.asList(rhs));
	}

	/**
	 * Creates a production in unrestricted form
	 */
	public Production(List<String> lhs, List<String> rhs) {
		this(lhs, rhs, false);
	}

	private Production(List<String> lhs, List<String> rhs, boolean contextFree) {
		if (lhs == null || lhs.isEmpty()){
			throw new InvalidSymbolsException("The lhs is not a nonempty str, nor a nonempty sequence of nonempty str.");
		}
		for (String symbol : lhs){
			checkSymbol(symbol, "lhs");
		}
		if (rhs == null || rhs.isEmpty()){
			throw new InvalidSymbolsException("The rhs is not a nonempty sequence of nonempty str.");
		}
		for (String symbol : rhs){
			checkSymbol(symbol, "rhs");
		}
		if (rhs.contains(EPSILON) && rhs.size() != 1){
			throw new InvalidSymbolsException("The righthand side contains ε but has more than one symbol");
		}
		this.lhs = ImmutableList.copyOf(lhs);
		this.rhs = ImmutableList.copyOf(rhs);
		this.contextFree = contextFree;
	}

	private static String checkSymbol(String symbol, String side){
		if (symbol == null || symbol.isEmpty()){
			throw new InvalidSymbolsException("The " + side + " contains a symbol that is not a nonempty str.");
		}
		return symbol;
	}

	/**
	 * Is the left hand side a single symbol?
	 */
	public boolean isContextFree(){
		return contextFree;
	}

	/**
	 * The left hand side of a production in context free form
	 */
	public String lhsSymbol(){
		if (!contextFree){
			throw new IllegalStateException(this + " is not in context free form");
		}
		return lhs.get(0);
	}

	/**
	 * The same production with a left hand side in unrestricted form
	 */
	public Production asUnrestricted(){
		if (!contextFree){
			return this;
		}
		return new Production(lhs, rhs, false);
	}

	/**
	 * Does this production produce ε?
	 */
	public boolean isEpsilonProduction(){
		return rhs.size() == 1 && EPSILON.equals(rhs.get(0));
	}

	/**
	 * Symbols of both sides
	 */
	public List<String> symbols(){
		List<String> symbols = new ArrayList<>(lhs);
		symbols.addAll(rhs);
		return symbols;
	}

	protected static String formatSide(List<String> side){
		return String.join(HAIR_SPACE, side);
	}

	@Override
	public String toString() {
		return formatSide(lhs) + " -> " + formatSide(rhs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || obj.getClass() != getClass()) return false;
		Production other = (Production)obj;
		return contextFree == other.contextFree && lhs.equals(other.lhs) && rhs.equals(other.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, rhs, contextFree);
	}

	@Override
	public int compareTo(Production o) {
		int cmp = compareSymbols(lhs, o.lhs);
		if (cmp != 0){
			return cmp;
		}
		cmp = compareSymbols(rhs, o.rhs);
		if (cmp != 0){
			return cmp;
		}
		return Boolean.compare(o.contextFree, contextFree);
	}

	/**
	 * Lexicographic comparison of two symbol sequences
	 */
	static int compareSymbols(List<String> first, List<String> second){
		for (int i = 0; i < Math.min(first.size(), second.size()); i++){
			int cmp = first.get(i).compareTo(second.get(i));
			if (cmp != 0){
				return cmp;
			}
		}
		return Integer.compare(first.size(), second.size());
	}

	/**
	 * Parses productions from lines of the form <code>lhs -> rhs1 | rhs2 | ...</code>, the sides are
	 * whitespace separated symbols. Blank lines are ignored.
	 *
	 * @param text description of the productions
	 * @param contextFree are the left hand sides single symbols?
	 * @return productions in the order of their appearance
	 * @throws MalformedGrammarException if a line isn't of the required form
	 */
	public static List<Production> fromText(String text, boolean contextFree){
		List<Production> productions = new ArrayList<>();
		for (String line : text.split("\\R")){
			if (line.isBlank()){
				continue;
			}
			String[] sides = line.split("->", -1);
			if (sides.length != 2){
				throw new MalformedGrammarException(line,
						String.format("Line \"%s\" is not of the form lhs -> alternatives.", line.trim()));
			}
			List<String> lhs = splitSymbols(sides[0]);
			if (lhs.isEmpty()){
				throw new MalformedGrammarException(line,
						String.format("Production \"%s\" has an empty lefthand side.", line.trim()));
			}
			if (contextFree && lhs.size() != 1){
				throw new MalformedGrammarException(line, String.format("Production \"%s\" has more than one symbol as lefthand side, " +
						"that is forbidden in a context-free grammar.", line.trim()));
			}
			for (String alternative : sides[1].split("\\|", -1)){
				try {
					if (contextFree){
						productions.add(new Production(lhs.get(0), splitSymbols(alternative)));
					} else {
						productions.add(new Production(lhs, splitSymbols(alternative)));
					}
				} catch (InvalidSymbolsException e) {
					throw new MalformedGrammarException(line, String.format("Line \"%s\": %s", line.trim(), e.getMessage()));
				}
			}
		}
		return productions;
	}

	/**
	 * Symbols are separated by whitespace, including the hair space of the string forms
	 */
	private static List<String> splitSymbols(String side){
		String trimmed = side.strip();
		if (trimmed.isEmpty()){
			return new ArrayList<>();
		}
		return Arrays.asList(trimmed.split("\\p{javaWhitespace}+"));
	}

	/**
	 * Start a conjunction of conditions on productions, usable for filtering
	 */
	public static Condition suchThat(){
		return new Condition(ImmutableList.of());
	}

	/**
	 * A conjunction of conditions on a production, each method returns a new condition
	 * that additionally requires the passed property.
	 */
	public static class Condition implements Predicate<Production> {

		private final ImmutableList<Predicate<Production>> conditions;

		private Condition(ImmutableList<Predicate<Production>> conditions) {
			this.conditions = conditions;
		}

		private Condition with(Predicate<Production> condition){
			return new Condition(ImmutableList.<Predicate<Production>>builder().addAll(conditions).add(condition).build());
		}

		/**
		 * Left hand side is the passed single symbol
		 */
		public Condition lhs(String symbol){
			return with(p -> p.contextFree && p.lhs.get(0).equals(symbol));
		}

		/**
		 * Left hand side (in unrestricted form) is the passed sequence
		 */
		public Condition lhs(List<String> symbols){
			return with(p -> p.lhs.equals(symbols));
		}

		public Condition rhs(String... symbols){
			List<String> expected = Arrays.asList(symbols);
			return with(p -> p.rhs.equals(expected));
		}

		public Condition rhsLength(int length){
			return with(p -> p.rhs.size() == length);
		}

		/**
		 * The passed sequence ends with the right hand side
		 */
		public Condition rhsIsSuffixOf(List<String> symbols){
			return with(p -> symbols.size() >= p.rhs.size()
					&& symbols.subList(symbols.size() - p.rhs.size(), symbols.size()).equals(p.rhs));
		}

		@Override
		public boolean test(Production production) {
			for (Predicate<Production> condition : conditions){
				if (!condition.test(production)){
					return false;
				}
			}
			return true;
		}
	}
}
