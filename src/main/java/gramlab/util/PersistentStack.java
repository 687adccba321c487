package gramlab.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * An immutable LIFO stack implemented as a singly linked list.
 *
 * Pushing and popping return new stacks that share their tail with this one, so several
 * stacks derived from the same one can be kept around at the cost of one node each.
 *
 * Iteration starts at the top.
 */
public final class PersistentStack<E> implements Iterable<E> {

	private static final PersistentStack<?> EMPTY = new PersistentStack<>(null, null, 0);

	private final E top;

	private final PersistentStack<E> rest;

	private final int size;

	private PersistentStack(E top, PersistentStack<E> rest, int size) {
		this.top = top;
		this.rest = rest;
		this.size = size;
	}

	@SuppressWarnings("unchecked")
	public static <E> PersistentStack<E> empty(){
		return (PersistentStack<E>)EMPTY;
	}

	/**
	 * Creates a stack by pushing the passed elements in order, the last one ends up on top.
	 */
	@SafeVarargs
	public static <E> PersistentStack<E> of(E... elements){
		PersistentStack<E> stack = empty();
		for (E element : elements){
			stack = stack.push(element);
		}
		return stack;
	}

	public PersistentStack<E> push(E element){
		Objects.requireNonNull(element, "Stack elements may not be null");
		return new PersistentStack<>(element, this, size + 1);
	}

	public E peek(){
		if (isEmpty()){
			throw new NoSuchElementException("The stack is empty");
		}
		return top;
	}

	public PersistentStack<E> pop(){
		if (isEmpty()){
			throw new NoSuchElementException("The stack is empty");
		}
		return rest;
	}

	public boolean isEmpty(){
		return size == 0;
	}

	public int size(){
		return size;
	}

	/**
	 * Elements from top to bottom
	 */
	public List<E> toList(){
		List<E> list = new ArrayList<>(size);
		for (E element : this){
			list.add(element);
		}
		return list;
	}

	@Override
	public Iterator<E> iterator() {
		return new Iterator<E>() {

			PersistentStack<E> current = PersistentStack.this;

			@Override
			public boolean hasNext() {
				return !current.isEmpty();
			}

			@Override
			public E next() {
				if (!hasNext()){
					throw new NoSuchElementException();
				}
				E element = current.top;
				current = current.rest;
				return element;
			}
		};
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof PersistentStack)) return false;
		PersistentStack<?> other = (PersistentStack<?>)obj;
		if (other.size != size) return false;
		Iterator<?> otherIt = other.iterator();
		for (E element : this){
			if (!element.equals(otherIt.next())){
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		int hash = 1;
		for (E element : this){
			hash = 31 * hash + element.hashCode();
		}
		return hash;
	}

	/**
	 * Elements from bottom to top, the way a stack is usually written down.
	 */
	@Override
	public String toString() {
		List<E> list = toList();
		StringBuilder builder = new StringBuilder("Stack(");
		for (int i = list.size() - 1; i >= 0; i--){
			builder.append(list.get(i));
			if (i > 0){
				builder.append(", ");
			}
		}
		return builder.append(")").toString();
	}
}
