package org.qondense;

import java.util.Objects;

/**
 * A binary predicate testing the equivalence of two objects in some context, paired with a hash function that is consistent with it.
 * Interning structures rely on both: two values that this equalizer considers equal must produce the same {@link #hash(Object) hash}.
 */
public interface Equalizer {
	/**
	 * @param o1 The first object to test
	 * @param o2 The second object to test
	 * @return Whether the two objects are equivalent in this context
	 */
	boolean equals(Object o1, Object o2);

	/**
	 * @param o The object to hash (may be null)
	 * @return A hash code for the object that is consistent with {@link #equals(Object, Object)}
	 */
	default int hash(Object o) {
		return Objects.hashCode(o);
	}

	/**
	 * @param <V> The type of the value
	 * @param value The value to make a node for
	 * @return An equalizer node for the given value using this equalizer
	 */
	default <V> EqualizerNode<V> nodeFor(V value) {
		return new EqualizerNode<>(this, value, hash(value));
	}

	/** An equalizer that uses {@link Object#equals(Object)} (allowing for nulls) */
	public static final Equalizer object = Objects::equals;

	/** An equalizer that uses == */
	public static final Equalizer id = new Equalizer() {
		@Override
		public boolean equals(Object o1, Object o2) {
			return o1 == o2;
		}

		@Override
		public int hash(Object o) {
			return System.identityHashCode(o);
		}

		@Override
		public String toString() {
			return "identity";
		}
	};

	/** An equalizer for {@link CharSequence}s (or anything else, by its {@link Object#toString() string} form) that ignores case */
	public static final Equalizer caseInsensitive = new Equalizer() {
		@Override
		public boolean equals(Object o1, Object o2) {
			if (o1 == null || o2 == null)
				return o1 == o2;
			return o1.toString().equalsIgnoreCase(o2.toString());
		}

		@Override
		public int hash(Object o) {
			if (o == null)
				return 0;
			// Folds each code point the way String.equalsIgnoreCase compares them, independent of the default locale
			int hash = 0;
			String str = o.toString();
			for (int i = 0; i < str.length();) {
				int cp = str.codePointAt(i);
				hash = hash * 31 + Character.toLowerCase(Character.toUpperCase(cp));
				i += Character.charCount(cp);
			}
			return hash;
		}

		@Override
		public String toString() {
			return "caseInsensitive";
		}
	};

	/**
	 * A node that encapsulates a value and uses an {@link Equalizer} for its {@link #equals(Object)} and {@link #hashCode()} methods, so
	 * that it can serve as a key in a standard hash map
	 *
	 * @param <V> The type of value stored in the node
	 */
	public static class EqualizerNode<V> {
		private final Equalizer theEqualizer;
		private final V theValue;
		private final int theHashCode;

		/**
		 * @param equalizer The equalizer for equals testing
		 * @param value The value to test
		 * @param hashCode The hash code for the value
		 */
		public EqualizerNode(Equalizer equalizer, V value, int hashCode) {
			theEqualizer = equalizer;
			theValue = value;
			theHashCode = hashCode;
		}

		/** @return The value in this node */
		public V get() {
			return theValue;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof EqualizerNode)
				return theEqualizer.equals(theValue, ((EqualizerNode<?>) o).get());
			else
				return theEqualizer.equals(theValue, o);
		}

		@Override
		public int hashCode() {
			return theHashCode;
		}

		@Override
		public String toString() {
			return String.valueOf(theValue);
		}
	}
}
