package gramlab.automaton;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import gramlab.grammar.InvalidSymbolsException;

/**
 * An automaton transition from one state to another one, labeled with an input symbol (or ε).
 */
public class Transition implements Serializable, Comparable<Transition> {

	public final State frm;

	public final String label;

	public final State to;

	public Transition(State frm, String label, State to) {
		if (frm == null){
			throw new InvalidSymbolsException("The frm state is missing");
		}
		if (label == null || label.isEmpty()){
			throw new InvalidSymbolsException("The label is not a nonempty string");
		}
		if (to == null){
			throw new InvalidSymbolsException("The to state is missing");
		}
		this.frm = frm;
		this.label = label;
		this.to = to;
	}

	/**
	 * Transition between two single symbol states
	 */
	public Transition(String frm, String label, String to) {
		this(State.of(frm), label, State.of(to));
	}

	/**
	 * Parses transitions from lines of the form <code>frm, label, to</code>, blank lines are ignored.
	 *
	 * @throws MalformedAutomatonException if a line isn't of this form
	 */
	public static List<Transition> fromText(String text){
		List<Transition> transitions = new ArrayList<>();
		for (String line : text.split("\\R")){
			if (line.trim().isEmpty()){
				continue;
			}
			String[] parts = line.split(",", -1);
			if (parts.length != 3){
				throw new MalformedAutomatonException(line,
						String.format("Line \"%s\" is not of the form frm, label, to.", line.trim()));
			}
			try {
				transitions.add(new Transition(parts[0].trim(), parts[1].trim(), parts[2].trim()));
			} catch (InvalidSymbolsException e) {
				throw new MalformedAutomatonException(line, String.format("Line \"%s\": %s", line.trim(), e.getMessage()));
			}
		}
		return transitions;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Transition)){
			return false;
		}
		Transition other = (Transition)obj;
		return frm.equals(other.frm) && label.equals(other.label) && to.equals(other.to);
	}

	@Override
	public int hashCode() {
		return Objects.hash(frm, label, to);
	}

	@Override
	public int compareTo(Transition o) {
		int cmp = frm.compareTo(o.frm);
		if (cmp != 0){
			return cmp;
		}
		cmp = label.compareTo(o.label);
		if (cmp != 0){
			return cmp;
		}
		return to.compareTo(o.to);
	}

	@Override
	public String toString() {
		return frm + "-" + label + "->" + to;
	}
}
