package gramlab.grammar;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ItemTest {

	@Test
	public void testWrongPos(){
		assertThrows(InvalidSymbolsException.class, () -> new Item("a", Arrays.asList("b"), -1));
		assertThrows(InvalidSymbolsException.class, () -> new Item("a", Arrays.asList("b"), 2));
	}

	@Test
	public void testUnrestrictedProduction(){
		assertThrows(InvalidSymbolsException.class,
				() -> new Item(new Production(Arrays.asList("A", "B"), Arrays.asList("c"))));
	}

	@Test
	public void testInSet(){
		Set<Item> set = new HashSet<>(Arrays.asList(new Item("a", Arrays.asList("b"), 1), new Item("a", Arrays.asList("b"), 1)));
		assertEquals(1, set.size());
		assertNotEquals(new Item("a", Arrays.asList("b"), 0), new Item("a", Arrays.asList("b"), 1));
		assertNotEquals(new Production("a", "b"), new Item("a", Arrays.asList("b")));
	}

	@Test
	public void testTotalOrder(){
		assertTrue(new Item("a", Arrays.asList("b", "c"), 2).compareTo(new Item("a", Arrays.asList("b", "c"), 1)) > 0);
	}

	@Test
	public void testAdvance(){
		assertEquals(new Item("A", Arrays.asList("x", "B"), 1), new Item("A", Arrays.asList("x", "B")).advance("x"));
		assertNull(new Item("A", Arrays.asList("B", "C")).advance("x"));
		assertNull(new Item("A", Arrays.asList("B"), 1).advance("B"));
	}

	@Test
	public void testAdvanceDoesNotModify(){
		Item item = new Item("A", Arrays.asList("x", "B"));
		item.advance("x");
		assertEquals(0, item.pos);
	}

	@Test
	public void testSymbolAfterDot(){
		assertEquals("B", new Item("A", Arrays.asList("x", "B"), 1).symbolAfterDot());
		assertNull(new Item("A", Arrays.asList("B", "C"), 2).symbolAfterDot());
		assertTrue(new Item("A", Arrays.asList("B", "C"), 2).atEnd());
	}

	@Test
	public void testToString(){
		assertEquals("A -> x•B", new Item("A", Arrays.asList("x", "B"), 1).toString());
		assertEquals("A -> •x\u200aB", new Item("A", Arrays.asList("x", "B")).toString());
	}

	@Test
	public void testProduction(){
		Production production = new Production("A", "x", "B");
		assertEquals(production, new Item(production, 2).production());
	}

	@Test
	public void testEarleyItem(){
		EarleyItem item = new EarleyItem("A", Arrays.asList("x", "B"), 0, 3);
		EarleyItem advanced = item.advance("x");
		assertEquals(new EarleyItem("A", Arrays.asList("x", "B"), 1, 3), advanced);
		assertEquals("A -> x•B@3", advanced.toString());
		assertNull(item.advance("B"));
		assertNotEquals(item, new EarleyItem("A", Arrays.asList("x", "B"), 0, 2));
	}
}
