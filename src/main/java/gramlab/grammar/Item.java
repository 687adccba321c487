package gramlab.grammar;

import java.util.List;
import java.util.Objects;

/**
 * A context free production with a dot in its right hand side.
 *
 * The dot is before the <code>pos</code>th right hand side symbol, the symbols before it
 * have already been recognized.
 */
public class Item extends Production {

	public final int pos;

	public Item(String lhs, List<String> rhs, int pos) {
		super(lhs, rhs);
		if (pos < 0 || pos > this.rhs.size()){
			throw new InvalidSymbolsException(String.format("The dot position %d is not in [0, %d].", pos, this.rhs.size()));
		}
		this.pos = pos;
	}

	public Item(String lhs, List<String> rhs) {
		this(lhs, rhs, 0);
	}

	/**
	 * Item with the dot at the passed position of the passed production
	 */
	public Item(Production production, int pos) {
		this(contextFreeLhs(production), production.rhs, pos);
	}

	public Item(Production production) {
		this(production, 0);
	}

	private static String contextFreeLhs(Production production){
		if (!production.isContextFree()){
			throw new InvalidSymbolsException("The lhs of an item must be a single symbol, but " + production + " has more.");
		}
		return production.lhsSymbol();
	}

	/**
	 * The symbol right after the dot or <code>null</code> if the dot is at the end
	 */
	public String symbolAfterDot(){
		return pos < rhs.size() ? rhs.get(pos) : null;
	}

	/**
	 * The item with the dot moved over the passed symbol
	 *
	 * @return <code>null</code> if the passed symbol isn't the one after the dot
	 */
	public Item advance(String symbol){
		if (pos < rhs.size() && rhs.get(pos).equals(symbol)){
			return new Item(lhsSymbol(), rhs, pos + 1);
		}
		return null;
	}

	public boolean atEnd(){
		return pos == rhs.size();
	}

	/**
	 * The production without the dot
	 */
	public Production production(){
		return new Production(lhsSymbol(), rhs);
	}

	@Override
	public String toString() {
		return formatSide(lhs) + " -> " + formatSide(rhs.subList(0, pos)) + "•" + formatSide(rhs.subList(pos, rhs.size()));
	}

	@Override
	public boolean equals(Object obj) {
		return super.equals(obj) && ((Item)obj).pos == pos;
	}

	@Override
	public int hashCode() {
		return Objects.hash(super.hashCode(), pos);
	}

	@Override
	public int compareTo(Production o) {
		int cmp = super.compareTo(o);
		if (cmp != 0 || !(o instanceof Item)){
			return cmp;
		}
		return Integer.compare(pos, ((Item)o).pos);
	}
}
