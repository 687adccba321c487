package gramlab;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import gramlab.automaton.Automaton;
import gramlab.grammar.Derivation;
import gramlab.grammar.Grammar;
import gramlab.grammar.Production;
import gramlab.parser.TopDownInstantaneousDescription;
import gramlab.util.Utils;

import static gramlab.grammar.Symbols.EPSILON;

/**
 * Small command line front end
 *
 * <pre>
 * grammar &lt;file&gt; [--unrestricted]
 * automaton &lt;file&gt;
 * derive &lt;file&gt; leftmost|rightmost &lt;production index&gt;...
 * parse &lt;file&gt; &lt;word&gt;
 * </pre>
 */
public class Main {

	private static final Logger LOG = Utils.logger("Main");

	static final String USAGE = "Usage: grammar <file> [--unrestricted] | automaton <file> | " +
			"derive <file> leftmost|rightmost <production index>... | parse <file> <word>";

	public static void main(String[] args) {
		System.exit(run(args, new PrintStream(System.out, true, StandardCharsets.UTF_8),
				new PrintStream(System.err, true, StandardCharsets.UTF_8)));
	}

	/**
	 * Runs a command
	 *
	 * @return exit status
	 */
	static int run(String[] args, PrintStream out, PrintStream err){
		if (args.length < 2){
			err.println(USAGE);
			return 1;
		}
		try {
			String text = new String(Files.readAllBytes(Paths.get(args[1])), StandardCharsets.UTF_8);
			switch (args[0]){
				case "grammar":
					Grammar grammar = Grammar.fromText(text, !Arrays.asList(args).contains("--unrestricted"));
					out.println(grammar.longDescription());
					return 0;
				case "automaton":
					out.println(Automaton.fromRegularGrammar(Grammar.fromText(text)));
					return 0;
				case "derive":
					if (args.length < 3){
						err.println(USAGE);
						return 1;
					}
					out.println(derive(Grammar.fromText(text), args[2], Arrays.copyOfRange(args, 3, args.length)));
					return 0;
				case "parse":
					if (args.length != 3){
						err.println(USAGE);
						return 1;
					}
					Grammar parsed = Grammar.fromText(text);
					Optional<TopDownInstantaneousDescription> accepted = parse(parsed, args[2], Config.maxSteps());
					if (accepted.isPresent()){
						List<Production> steps = accepted.get().getSteps();
						out.println(new Derivation(parsed).leftmost(steps.toArray(new Production[0])));
						return 0;
					}
					err.println("The word \"" + args[2] + "\" is not accepted within " + Config.maxSteps() + " steps");
					return 1;
				default:
					err.println(USAGE);
					return 1;
			}
		} catch (IOException e) {
			err.println("Can't read " + args[1] + ": " + e.getMessage());
			return 1;
		} catch (GramlabException | IllegalArgumentException e) {
			LOG.log(Level.FINE, "Command failed", e);
			err.println(e.getMessage());
			return 1;
		}
	}

	static Derivation derive(Grammar grammar, String kind, String[] indices){
		int[] productions = Arrays.stream(indices).mapToInt(Integer::parseInt).toArray();
		Derivation derivation = new Derivation(grammar);
		switch (kind){
			case "leftmost":
				return derivation.leftmost(productions);
			case "rightmost":
				return derivation.rightmost(productions);
			default:
				throw new IllegalArgumentException("Unknown derivation kind " + kind + ", expected leftmost or rightmost");
		}
	}

	/**
	 * Breadth first search over the predictions of a top-down automaton
	 *
	 * @param maxSteps maximum number of explored descriptions
	 * @return the first accepting description, if one is found in time
	 */
	static Optional<TopDownInstantaneousDescription> parse(Grammar grammar, String word, int maxSteps){
		Deque<TopDownInstantaneousDescription> queue = new ArrayDeque<>();
		Set<TopDownInstantaneousDescription> seen = new HashSet<>();
		TopDownInstantaneousDescription start = new TopDownInstantaneousDescription(grammar, word);
		queue.add(start);
		seen.add(start);
		int explored = 0;
		while (!queue.isEmpty() && explored < maxSteps){
			TopDownInstantaneousDescription current = queue.poll();
			explored++;
			if (current.isDone()){
				if (LOG.isLoggable(Level.FINE)){
					LOG.fine("Accepted " + word + " after exploring " + explored + " descriptions");
				}
				return Optional.of(current);
			}
			String top = current.top();
			if (grammar.isNonTerminal(top)){
				for (Production production : grammar.getProductions()){
					if (production.lhsSymbol().equals(top)){
						TopDownInstantaneousDescription next = current.predict(production);
						if (isViable(next) && seen.add(next)){
							queue.add(next);
						}
					}
				}
			} else if (EPSILON.equals(top) || top.equals(current.head())){
				TopDownInstantaneousDescription next = current.match();
				if (seen.add(next)){
					queue.add(next);
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Can the terminals on the stack still be matched by the rest of the tape?
	 */
	private static boolean isViable(TopDownInstantaneousDescription description){
		long terminals = description.getStack().stream().filter(description.getGrammar()::isTerminal).count();
		return terminals <= description.getTape().size() - 1 - description.getHeadPosition();
	}
}
