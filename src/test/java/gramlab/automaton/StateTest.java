package gramlab.automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import gramlab.grammar.InvalidSymbolsException;
import gramlab.grammar.Item;

import static org.junit.jupiter.api.Assertions.*;

public class StateTest {

	@Test
	public void testKinds(){
		assertTrue(State.from("A") instanceof State.Single);
		assertTrue(State.from(Arrays.asList("A", "B")) instanceof State.SymbolSet);
		assertTrue(State.from(Arrays.asList(new Item("A", Arrays.asList("a")))) instanceof State.ItemSet);
	}

	@Test
	public void testInvalidShapes(){
		assertThrows(InvalidSymbolsException.class, () -> State.from(""));
		assertThrows(InvalidSymbolsException.class, () -> State.from(Collections.emptyList()));
		assertThrows(InvalidSymbolsException.class, () -> State.from(Arrays.asList("A", "")));
		assertThrows(InvalidSymbolsException.class, () -> State.from(Arrays.asList("A", new Item("A", Arrays.asList("a")))));
		assertThrows(InvalidSymbolsException.class, () -> State.from(42));
	}

	@Test
	public void testEquals(){
		assertEquals(State.of("A"), State.of("A"));
		assertEquals(State.ofSymbols(Arrays.asList("A", "B")), State.ofSymbols(Arrays.asList("B", "A")));
		assertNotEquals(State.of("A"), State.ofSymbols(Arrays.asList("A")));
	}

	@Test
	public void testToString(){
		assertEquals("A", State.of("A").toString());
		assertEquals("{A, B}", State.ofSymbols(Arrays.asList("B", "A")).toString());
		assertEquals("{A -> a•}", State.ofItems(Arrays.asList(new Item("A", Arrays.asList("a"), 1))).toString());
	}

	@Test
	public void testOrder(){
		List<State> states = new ArrayList<>(Arrays.asList(
				State.ofItems(Arrays.asList(new Item("A", Arrays.asList("a")))),
				State.ofSymbols(Arrays.asList("B", "C")),
				State.of("B"),
				State.ofSymbols(Arrays.asList("A", "C")),
				State.of("A")));
		Collections.sort(states);
		assertEquals(Arrays.asList(State.of("A"), State.of("B"), State.ofSymbols(Arrays.asList("A", "C")),
				State.ofSymbols(Arrays.asList("B", "C")), State.ofItems(Arrays.asList(new Item("A", Arrays.asList("a"))))),
				states);
	}
}
