package gramlab.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DerivationTest {

	static final String SIMPLE = "S -> A B\nA -> a\nB -> b";

	static final String EXPRESSIONS = "E -> M | A | n\nM -> E * E\nA -> E + E";

	Grammar unrestricted;

	Grammar contextFree;

	@BeforeEach
	public void setUp(){
		unrestricted = Grammar.fromText(SIMPLE, false);
		contextFree = Grammar.fromText(SIMPLE);
	}

	private Derivation simpleDerivation(){
		return new Derivation(unrestricted).step(0, 0).step(1, 0).step(2, 1);
	}

	private static List<Derivation.Step> steps(int... values){
		List<Derivation.Step> steps = new ArrayList<>();
		for (int i = 0; i < values.length; i += 2){
			steps.add(new Derivation.Step(values[i], values[i + 1]));
		}
		return steps;
	}

	@Test
	public void testToString(){
		assertEquals("S -> A\u200aB -> a\u200aB -> a\u200ab", simpleDerivation().toString());
	}

	@Test
	public void testSententialForm(){
		assertEquals(Arrays.asList("a", "b"), simpleDerivation().sententialForm());
	}

	@Test
	public void testEqualsAndHash(){
		Set<Derivation> set = new HashSet<>(Arrays.asList(simpleDerivation(), simpleDerivation()));
		assertEquals(1, set.size());
		assertNotEquals(new Derivation(unrestricted), simpleDerivation());
	}

	@Test
	public void testSteps(){
		assertEquals(steps(0, 0, 1, 0, 2, 1), simpleDerivation().steps());
	}

	@Test
	public void testStepList(){
		assertEquals(steps(0, 0, 1, 0, 2, 1), new Derivation(unrestricted).step(steps(0, 0, 1, 0, 2, 1)).steps());
	}

	@Test
	public void testStepKeepsDerivation(){
		Derivation start = new Derivation(unrestricted).step(0, 0);
		Derivation left = start.step(1, 0);
		Derivation right = start.step(2, 1);
		assertEquals(Arrays.asList("A", "B"), start.sententialForm());
		assertEquals(Arrays.asList("a", "B"), left.sententialForm());
		assertEquals(Arrays.asList("A", "b"), right.sententialForm());
	}

	@Test
	public void testWrongStep(){
		Derivation derivation = new Derivation(unrestricted).step(0, 0);
		StepMismatchException e = assertThrows(StepMismatchException.class, () -> derivation.step(1, 1));
		assertTrue(e.getMessage().contains("at position"));
		assertEquals(1, e.production);
		assertEquals(1, e.position);
		assertThrows(StepMismatchException.class, () -> derivation.step(1, 5));
		assertThrows(StepMismatchException.class, () -> derivation.step(1, -1));
		assertThrows(StepMismatchException.class, () -> derivation.step(1, Integer.MAX_VALUE));
		assertThrows(StepMismatchException.class, () -> derivation.step(0, Integer.MAX_VALUE));
	}

	@Test
	public void testEpsilonStep(){
		Grammar grammar = Grammar.fromText("S -> a S b | ε");
		Derivation derivation = new Derivation(grammar).step(0, 0).step(1, 1);
		assertEquals(Arrays.asList("a", "b"), derivation.sententialForm());
		assertEquals("S -> a\u200aS\u200ab -> a\u200ab", derivation.toString());
	}

	@Test
	public void testUnrestrictedStep(){
		Grammar grammar = Grammar.fromText("S -> a B C\nB C -> b c", false);
		assertEquals(Arrays.asList("a", "b", "c"), new Derivation(grammar).step(0, 0).step(1, 1).sententialForm());
	}

	@Test
	public void testStartSymbol(){
		assertEquals(Arrays.asList("A"), new Derivation(contextFree, "A").sententialForm());
		assertThrows(IllegalArgumentException.class, () -> new Derivation(contextFree, "a"));
	}

	@Nested
	public class Leftmost {

		@Test
		public void testIndices(){
			assertEquals(steps(0, 0, 1, 0, 2, 1), new Derivation(contextFree).leftmost(0).leftmost(1).leftmost(2).steps());
			assertEquals(steps(0, 0, 1, 0, 2, 1), new Derivation(contextFree).leftmost(0, 1, 2).steps());
		}

		@Test
		public void testProductions(){
			Derivation derivation = new Derivation(contextFree);
			assertEquals(Arrays.asList("a", "B"),
					derivation.leftmost(new Production("S", "A", "B"), new Production("A", "a")).sententialForm());
			assertEquals(Arrays.asList("A", "B"), derivation.leftmost(new Production("S", "A", "B")).sententialForm());
			assertThrows(IllegalArgumentException.class, () -> derivation.leftmost(new Production("S", "B")));
		}

		@Test
		public void testNotContextFree(){
			NotContextFreeException e = assertThrows(NotContextFreeException.class,
					() -> new Derivation(Grammar.fromText("S -> s\nT U -> s", false)).leftmost(0));
			assertTrue(e.getMessage().contains("derivation on a non context-free grammar"));
		}

		@Test
		public void testAllTerminals(){
			Derivation derivation = new Derivation(Grammar.fromText(EXPRESSIONS)).leftmost(1, 4, 0, 3, 2, 2, 2);
			NoNonterminalException e = assertThrows(NoNonterminalException.class, () -> derivation.leftmost(2));
			assertTrue(e.getMessage().contains("there are no nonterminals"));
		}

		@Test
		public void testWrongSymbol(){
			Derivation derivation = new Derivation(Grammar.fromText(EXPRESSIONS)).leftmost(1, 4, 0, 3, 2);
			WrongNonterminalException e = assertThrows(WrongNonterminalException.class, () -> derivation.leftmost(3));
			assertTrue(e.getMessage().startsWith("Cannot apply M"));
			assertEquals("E", e.symbol);
			assertEquals(2, e.position);
		}
	}

	@Nested
	public class Rightmost {

		@Test
		public void testIndices(){
			assertEquals(steps(0, 0, 2, 1, 1, 0), new Derivation(contextFree).rightmost(0).rightmost(2).rightmost(1).steps());
			assertEquals(steps(0, 0, 2, 1, 1, 0), new Derivation(contextFree).rightmost(0, 2, 1).steps());
		}

		@Test
		public void testNotContextFree(){
			assertThrows(NotContextFreeException.class,
					() -> new Derivation(Grammar.fromText("S -> s\nT U -> s", false)).rightmost(0));
		}

		@Test
		public void testAllTerminals(){
			Derivation derivation = new Derivation(Grammar.fromText(EXPRESSIONS)).rightmost(0, 3, 2, 2);
			NoNonterminalException e = assertThrows(NoNonterminalException.class, () -> derivation.rightmost(2));
			assertTrue(e.getMessage().contains("there are no nonterminals"));
		}

		@Test
		public void testWrongSymbol(){
			Derivation derivation = new Derivation(Grammar.fromText(EXPRESSIONS)).rightmost(0, 3);
			WrongNonterminalException e = assertThrows(WrongNonterminalException.class, () -> derivation.rightmost(3));
			assertTrue(e.getMessage().startsWith("Cannot apply M"));
			assertEquals(2, e.position);
		}
	}

	@Nested
	public class PossibleSteps {

		Derivation derivation;

		@BeforeEach
		public void setUp(){
			derivation = new Derivation(unrestricted).step(0, 0);
		}

		private List<Derivation.Step> collect(Iterable<Derivation.Step> iterable){
			List<Derivation.Step> list = new ArrayList<>();
			iterable.forEach(list::add);
			return list;
		}

		@Test
		public void testAll(){
			assertEquals(steps(1, 0, 2, 1), collect(derivation.possibleSteps()));
		}

		@Test
		public void testProduction(){
			assertEquals(steps(1, 0), collect(derivation.possibleSteps(1, null)));
		}

		@Test
		public void testPosition(){
			assertEquals(steps(2, 1), collect(derivation.possibleSteps(null, 1)));
		}

		@Test
		public void testRestartable(){
			Iterable<Derivation.Step> steps = derivation.possibleSteps();
			assertEquals(collect(steps), collect(steps));
		}

		@Test
		public void testFollowingPossibleStepsNeverFails(){
			Derivation current = derivation;
			while (current.possibleSteps().iterator().hasNext()){
				current = current.step(current.possibleSteps().iterator().next());
			}
			assertEquals(Arrays.asList("a", "b"), current.sententialForm());
		}

		@Test
		public void testMultiSymbolLhs(){
			Grammar grammar = Grammar.fromText("S -> a B C\nB C -> b c", false);
			Derivation start = new Derivation(grammar).step(0, 0);
			assertEquals(steps(1, 1), collect(start.possibleSteps()));
			assertEquals(steps(1, 1), collect(start.possibleSteps(1, 1)));
			assertEquals(steps(), collect(start.possibleSteps(1, 2)));
			assertEquals(steps(), collect(start.possibleSteps(null, 2)));
			Derivation done = start.step(1, 1);
			assertEquals(Arrays.asList("a", "b", "c"), done.sententialForm());
			assertFalse(done.possibleSteps().iterator().hasNext());
		}
	}
}
