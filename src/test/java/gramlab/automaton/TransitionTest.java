package gramlab.automaton;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import gramlab.grammar.InvalidSymbolsException;

import static org.junit.jupiter.api.Assertions.*;

public class TransitionTest {

	@Test
	public void testInvalid(){
		assertThrows(InvalidSymbolsException.class, () -> new Transition("A", "", "B"));
		assertThrows(InvalidSymbolsException.class, () -> new Transition(null, "a", State.of("B")));
		assertThrows(InvalidSymbolsException.class, () -> new Transition("", "a", "B"));
	}

	@Test
	public void testEqualsAndHash(){
		assertEquals(1, new HashSet<>(Arrays.asList(new Transition("A", "a", "B"), new Transition("A", "a", "B"))).size());
		assertNotEquals(new Transition("A", "a", "B"), new Transition("A", "b", "B"));
	}

	@Test
	public void testOrder(){
		assertTrue(new Transition("A", "a", "B").compareTo(new Transition("A", "b", "A")) < 0);
		assertTrue(new Transition("B", "a", "A").compareTo(new Transition("A", "b", "A")) > 0);
	}

	@Test
	public void testToString(){
		assertEquals("S-a->A", new Transition("S", "a", "A").toString());
		assertEquals("{A, B}-0->{C}", new Transition(State.ofSymbols(Arrays.asList("B", "A")), "0",
				State.ofSymbols(Arrays.asList("C"))).toString());
	}

	@Test
	public void testFromText(){
		List<Transition> transitions = Transition.fromText("\n  A, 0, B\n\n  B , 1,C  \n");
		assertEquals(Arrays.asList(new Transition("A", "0", "B"), new Transition("B", "1", "C")), transitions);
	}

	@Test
	public void testMalformed(){
		MalformedAutomatonException e = assertThrows(MalformedAutomatonException.class, () -> Transition.fromText("A, 0"));
		assertEquals("A, 0", e.line);
		assertThrows(MalformedAutomatonException.class, () -> Transition.fromText("A, 0, B, C"));
		assertThrows(MalformedAutomatonException.class, () -> Transition.fromText("A, , B"));
	}
}
