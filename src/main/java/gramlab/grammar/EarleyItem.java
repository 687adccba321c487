package gramlab.grammar;

import java.util.List;
import java.util.Objects;

/**
 * An item together with the position of the input where its recognition started.
 */
public class EarleyItem extends Item {

	public final int orig;

	public EarleyItem(String lhs, List<String> rhs, int pos, int orig) {
		super(lhs, rhs, pos);
		this.orig = orig;
	}

	public EarleyItem(Item item, int orig) {
		this(item.lhsSymbol(), item.rhs, item.pos, orig);
	}

	@Override
	public EarleyItem advance(String symbol) {
		Item advanced = super.advance(symbol);
		return advanced == null ? null : new EarleyItem(advanced, orig);
	}

	@Override
	public String toString() {
		return super.toString() + "@" + orig;
	}

	@Override
	public boolean equals(Object obj) {
		return super.equals(obj) && ((EarleyItem)obj).orig == orig;
	}

	@Override
	public int hashCode() {
		return Objects.hash(super.hashCode(), orig);
	}

	@Override
	public int compareTo(Production o) {
		int cmp = super.compareTo(o);
		if (cmp != 0 || !(o instanceof EarleyItem)){
			return cmp;
		}
		return Integer.compare(orig, ((EarleyItem)o).orig);
	}
}
