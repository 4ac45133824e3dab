package cfgprep.util;

import java.util.Objects;

/**
 * Simple implementation of an immutable pair
 */
public class Pair<T, V> {
	public final T first;

	public final V second;

	public Pair(T first, V second) {
		this.first = first;
		this.second = second;
	}

	public static <T, V> Pair<T, V> p(T first, V second){
		return new Pair<>(first, second);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(first) ^ Objects.hashCode(second);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Pair)){
			return false;
		}
		Pair<?, ?> pair = (Pair<?, ?>)obj;
		return Objects.equals(pair.first, first) && Objects.equals(pair.second, second);
	}

	@Override
	public String toString() {
		return "(" + first + ", " + second + ")";
	}
}
