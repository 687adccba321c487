package gramlab.util;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * Fixpoint computations: a function is applied to its own result until the result doesn't change
 * anymore (compared via <code>equals</code>).
 *
 * The passed functions must not modify their argument, they should return a new value instead.
 */
public class Closure {

	public static <T> UnaryOperator<T> of(UnaryOperator<T> function){
		return start -> {
			T current = start;
			while (true) {
				T next = function.apply(current);
				if (Objects.equals(next, current)){
					return current;
				}
				current = next;
			}
		};
	}

	/**
	 * Closure of a function with an additional argument that stays the same for all applications.
	 */
	public static <T, A> BiFunction<T, A, T> of(BiFunction<T, A, T> function){
		return (start, argument) -> of((UnaryOperator<T>)current -> function.apply(current, argument)).apply(start);
	}
}
