package gramlab.util;

import java.util.Arrays;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PersistentStackTest {

	@Test
	public void testEmpty(){
		PersistentStack<String> stack = PersistentStack.empty();
		assertTrue(stack.isEmpty());
		assertEquals(0, stack.size());
		assertThrows(NoSuchElementException.class, stack::peek);
		assertThrows(NoSuchElementException.class, stack::pop);
	}

	@Test
	public void testOf(){
		PersistentStack<String> stack = PersistentStack.of("a", "b", "c");
		assertEquals("c", stack.peek());
		assertEquals(Arrays.asList("c", "b", "a"), stack.toList());
		assertEquals("Stack(a, b, c)", stack.toString());
	}

	@Test
	public void testPushDoesNotModify(){
		PersistentStack<String> stack = PersistentStack.of("a");
		PersistentStack<String> first = stack.push("b");
		PersistentStack<String> second = stack.push("c");
		assertEquals(Arrays.asList("a"), stack.toList());
		assertEquals(Arrays.asList("b", "a"), first.toList());
		assertEquals(Arrays.asList("c", "a"), second.toList());
		assertSame(stack, first.pop());
	}

	@Test
	public void testNullIsRejected(){
		assertThrows(NullPointerException.class, () -> PersistentStack.empty().push(null));
	}

	@Test
	public void testEqualsAndHash(){
		assertEquals(PersistentStack.of("a", "b"), PersistentStack.of("a").push("b"));
		assertEquals(PersistentStack.of("a", "b").hashCode(), PersistentStack.of("a").push("b").hashCode());
		assertNotEquals(PersistentStack.of("a", "b"), PersistentStack.of("b", "a"));
		assertNotEquals(PersistentStack.of("a"), PersistentStack.of("a", "a"));
	}
}
