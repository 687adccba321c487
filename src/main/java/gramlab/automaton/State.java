package gramlab.automaton;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableSet;

import gramlab.grammar.InvalidSymbolsException;
import gramlab.grammar.Item;
import gramlab.grammar.Production;
import gramlab.util.Utils;

/**
 * An automaton state: a single symbol, a set of symbols (as created by the subset construction)
 * or a set of items (as the states of an LR automaton).
 *
 * The three kinds are the only subclasses. States are immutable and totally ordered, first by
 * kind and then by their content.
 */
public abstract class State implements Serializable, Comparable<State> {

	private State() {
	}

	/**
	 * Kind of the state, used for ordering
	 */
	abstract int kind();

	/**
	 * Compare with a state of the same kind
	 */
	abstract int compareContent(State other);

	@Override
	public int compareTo(State o) {
		if (kind() != o.kind()){
			return Integer.compare(kind(), o.kind());
		}
		return compareContent(o);
	}

	public static Single of(String symbol){
		return (Single)from(symbol);
	}

	public static SymbolSet ofSymbols(Collection<String> symbols){
		return (SymbolSet)from(symbols);
	}

	public static ItemSet ofItems(Collection<? extends Item> items){
		return (ItemSet)from(items);
	}

	/**
	 * Creates the state that fits the passed value
	 *
	 * @param value a non empty string, a non empty collection of non empty strings or a non empty
	 *              collection of items
	 * @throws InvalidSymbolsException if the value has none of these shapes
	 */
	public static State from(Object value){
		if (value instanceof String){
			if (((String)value).isEmpty()){
				throw new InvalidSymbolsException("A state symbol must be a nonempty string");
			}
			return new Single((String)value);
		}
		if (value instanceof Collection && !((Collection<?>)value).isEmpty()){
			Collection<?> collection = (Collection<?>)value;
			if (collection.stream().allMatch(e -> e instanceof String && !((String)e).isEmpty())){
				List<String> symbols = new ArrayList<>();
				for (Object element : collection){
					symbols.add((String)element);
				}
				return new SymbolSet(ImmutableSet.copyOf(symbols));
			}
			if (collection.stream().allMatch(e -> e instanceof Item)){
				List<Item> items = new ArrayList<>();
				for (Object element : collection){
					items.add((Item)element);
				}
				return new ItemSet(ImmutableSet.copyOf(items));
			}
		}
		throw new InvalidSymbolsException(String.format("%s is not a nonempty string, or a nonempty set of nonempty strings or items",
				value));
	}

	private static <T extends Comparable<? super T>> int compareSorted(Collection<T> first, Collection<T> second){
		List<T> a = new ArrayList<>(first);
		List<T> b = new ArrayList<>(second);
		Collections.sort(a);
		Collections.sort(b);
		for (int i = 0; i < Math.min(a.size(), b.size()); i++){
			int cmp = a.get(i).compareTo(b.get(i));
			if (cmp != 0){
				return cmp;
			}
		}
		return Integer.compare(a.size(), b.size());
	}

	/**
	 * A state named by a single symbol
	 */
	public static final class Single extends State {

		public final String symbol;

		private Single(String symbol) {
			this.symbol = symbol;
		}

		@Override
		int kind() {
			return 0;
		}

		@Override
		int compareContent(State other) {
			return symbol.compareTo(((Single)other).symbol);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Single && ((Single)obj).symbol.equals(symbol);
		}

		@Override
		public int hashCode() {
			return symbol.hashCode();
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	/**
	 * A state that stands for a set of symbols
	 */
	public static final class SymbolSet extends State {

		public final ImmutableSet<String> symbols;

		private SymbolSet(ImmutableSet<String> symbols) {
			this.symbols = symbols;
		}

		@Override
		int kind() {
			return 1;
		}

		@Override
		int compareContent(State other) {
			return compareSorted(symbols, ((SymbolSet)other).symbols);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof SymbolSet && ((SymbolSet)obj).symbols.equals(symbols);
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind(), symbols);
		}

		@Override
		public String toString() {
			return Utils.toString(symbols);
		}
	}

	/**
	 * A state that stands for a set of items
	 */
	public static final class ItemSet extends State {

		public final ImmutableSet<Item> items;

		private ItemSet(ImmutableSet<Item> items) {
			this.items = items;
		}

		@Override
		int kind() {
			return 2;
		}

		@Override
		int compareContent(State other) {
			return State.<Production>compareSorted(new ArrayList<>(items), new ArrayList<>(((ItemSet)other).items));
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ItemSet && ((ItemSet)obj).items.equals(items);
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind(), items);
		}

		@Override
		public String toString() {
			return Utils.toString(items);
		}
	}
}
