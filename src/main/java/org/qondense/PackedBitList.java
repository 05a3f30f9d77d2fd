package org.qondense;

import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * <p>
 * Acts like an {@link java.util.ArrayList} of booleans, but packs its values 64 to a <code>long</code> word. Unlike a
 * {@link java.util.BitSet}, this class is an ordered sequence with a definite {@link #size() size}: values may be inserted and removed at
 * any position, shifting the values after them.
 * </p>
 *
 * <p>
 * Capacity starts at zero. The first addition allocates a single word, and the word buffer doubles whenever more room is needed. Bits
 * in the buffer beyond the list's size are always kept clear.
 * </p>
 *
 * <p>
 * This class is NOT thread-safe. If an instance of this class is accessed by multiple threads and may be modified by one or more of them,
 * it MUST be synchronized externally.
 * </p>
 */
public class PackedBitList implements Iterable<Boolean> {
	private static final int ADDRESS_BITS_PER_WORD = 6;
	private static final int BITS_PER_WORD = 1 << ADDRESS_BITS_PER_WORD;
	private static final long WORD_MASK = 0xffffffffffffffffL;
	private static final long[] NO_WORDS = new long[0];

	private long[] theWords;
	private int theSize;
	private int theModCount;

	/** Creates an empty list with no capacity */
	public PackedBitList() {
		theWords = NO_WORDS;
	}

	/**
	 * Creates an empty list able to hold at least the given number of bits without re-allocating
	 *
	 * @param capacity The initial capacity of the list, in bits
	 */
	public PackedBitList(int capacity) {
		this(0, false, capacity);
	}

	/**
	 * Creates a list pre-populated with a number of identical values
	 *
	 * @param size The initial size of the list
	 * @param value The value for all of the list's initial bits
	 * @param capacity The initial capacity of the list, in bits. Must be at least <code>size</code>.
	 */
	public PackedBitList(int size, boolean value, int capacity) {
		if (size < 0)
			throw new IllegalArgumentException("size < 0: " + size);
		if (capacity < size)
			throw new IllegalArgumentException("Initial capacity " + capacity + " cannot be less than initial size " + size);
		theWords = capacity == 0 ? NO_WORDS : new long[wordsFor(capacity)];
		theSize = size;
		if (value && size > 0) {
			int fullWords = wordsFor(size);
			Arrays.fill(theWords, 0, fullWords, WORD_MASK);
			clearTail();
		}
	}

	private static int wordIndex(int bitIndex) {
		return bitIndex >> ADDRESS_BITS_PER_WORD;
	}

	private static int wordsFor(int bits) {
		return bits == 0 ? 0 : wordIndex(bits - 1) + 1;
	}

	/** Zeroes any bits in the last used word beyond the list's size */
	private void clearTail() {
		int lastBits = theSize & (BITS_PER_WORD - 1);
		if (lastBits != 0)
			theWords[wordIndex(theSize)] &= WORD_MASK >>> (BITS_PER_WORD - lastBits);
	}

	/** @return The number of bits in the list */
	public int size() {
		return theSize;
	}

	/** @return Whether this list is empty of bits */
	public boolean isEmpty() {
		return theSize == 0;
	}

	/** @return The number of bits this list can hold without re-allocating its storage */
	public int getCapacity() {
		return (int) Math.min((long) theWords.length * BITS_PER_WORD, Integer.MAX_VALUE);
	}

	/**
	 * Re-sizes this list's storage. The storage may grow or shrink, but never below the list's current size.
	 *
	 * @param capacity The number of bits this list should be able to hold without re-allocating its storage
	 * @throws IllegalArgumentException If <code>capacity</code> is less than this list's {@link #size() size}
	 */
	public void setCapacity(int capacity) {
		if (capacity < theSize)
			throw new IllegalArgumentException("Capacity " + capacity + " cannot be less than size " + theSize);
		int words = wordsFor(capacity);
		if (words != theWords.length)
			theWords = words == 0 ? NO_WORDS : Arrays.copyOf(theWords, words);
	}

	/**
	 * Ensures that this list can hold at least the given number of bits
	 *
	 * @param minCapacity The minimum capacity for the list, in bits
	 */
	public void ensureCapacity(int minCapacity) {
		int wordsRequired = wordsFor(minCapacity);
		if (theWords.length < wordsRequired) {
			// Allocate the larger of doubled size or required size
			int request = Math.max(Math.max(2 * theWords.length, 1), wordsRequired);
			theWords = Arrays.copyOf(theWords, request);
		}
	}

	private void checkIndex(int index, int limit) {
		if (index < 0 || index >= limit)
			throw new IndexOutOfBoundsException(index + " of " + theSize);
	}

	/**
	 * @param index The index of the bit to get
	 * @return The value of the bit at the given index
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;={@link #size()}</code>
	 */
	public boolean get(int index) {
		checkIndex(index, theSize);
		return (theWords[wordIndex(index)] & (1L << index)) != 0;
	}

	/**
	 * @param index The index of the bit to set
	 * @param value The new value for the bit
	 * @return The previous value of the bit
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;={@link #size()}</code>
	 */
	public boolean set(int index, boolean value) {
		checkIndex(index, theSize);
		int wordIndex = wordIndex(index);
		long mask = 1L << index;
		boolean old = (theWords[wordIndex] & mask) != 0;
		if (value)
			theWords[wordIndex] |= mask;
		else
			theWords[wordIndex] &= ~mask;
		return old;
	}

	/**
	 * Appends a bit to the end of this list
	 *
	 * @param value The value to add
	 */
	public void add(boolean value) {
		ensureCapacity(theSize + 1);
		if (value)
			theWords[wordIndex(theSize)] |= 1L << theSize;
		theSize++;
		theModCount++;
	}

	/**
	 * Inserts a bit into this list, shifting the bit currently at the index (if any) and all subsequent ones forward by one position
	 *
	 * @param index The index to insert the bit at. May be {@link #size()}, in which case this is the same as {@link #add(boolean)}.
	 * @param value The value to insert
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;{@link #size()}</code>
	 */
	public void add(int index, boolean value) {
		checkIndex(index, theSize + 1);
		ensureCapacity(theSize + 1);
		int firstWord = wordIndex(index);
		int lastWord = wordIndex(theSize);
		// Walk down from the highest affected word, carrying each lower word's top bit up
		for (int w = lastWord; w > firstWord; w--)
			theWords[w] = (theWords[w] << 1) | (theWords[w - 1] >>> (BITS_PER_WORD - 1));
		long word = theWords[firstWord];
		long lowMask = (1L << index) - 1;
		word = (word & lowMask) | ((word << 1) & (~lowMask << 1));
		if (value)
			word |= 1L << index;
		theWords[firstWord] = word;
		theSize++;
		theModCount++;
	}

	/**
	 * Removes a bit from this list, shifting all subsequent bits back by one position
	 *
	 * @param index The index of the bit to remove
	 * @return The value of the removed bit
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;={@link #size()}</code>
	 */
	public boolean remove(int index) {
		checkIndex(index, theSize);
		int firstWord = wordIndex(index);
		int lastWord = wordIndex(theSize - 1);
		long word = theWords[firstWord];
		long bit = 1L << index;
		boolean removed = (word & bit) != 0;
		long lowMask = bit - 1;
		word = (word & lowMask) | ((word >>> 1) & ~lowMask);
		if (firstWord < lastWord)
			word |= theWords[firstWord + 1] << (BITS_PER_WORD - 1);
		theWords[firstWord] = word;
		for (int w = firstWord + 1; w <= lastWord; w++) {
			long shifted = theWords[w] >>> 1;
			if (w < lastWord)
				shifted |= theWords[w + 1] << (BITS_PER_WORD - 1);
			theWords[w] = shifted;
		}
		theSize--;
		theModCount++;
		return removed;
	}

	/**
	 * Removes the first occurrence of the given value from this list
	 *
	 * @param value The value to remove
	 * @return Whether the value was found and removed
	 */
	public boolean removeValue(boolean value) {
		int index = indexOf(value);
		if (index < 0)
			return false;
		remove(index);
		return true;
	}

	/** Clears this list, setting its size to 0. The list's capacity is not affected. */
	public void clear() {
		Arrays.fill(theWords, 0, wordsFor(theSize), 0L);
		theSize = 0;
		theModCount++;
	}

	/**
	 * @param value The value to find
	 * @return The first index whose bit is the given value, or -1 if there is no such bit
	 */
	public int indexOf(boolean value) {
		int words = wordsFor(theSize);
		for (int w = 0; w < words; w++) {
			long word = value ? theWords[w] : ~theWords[w];
			if (word != 0) {
				int index = w * BITS_PER_WORD + Long.numberOfTrailingZeros(word);
				return index < theSize ? index : -1;
			}
		}
		return -1;
	}

	/**
	 * @param value The value to find
	 * @return The last index whose bit is the given value, or -1 if there is no such bit
	 */
	public int lastIndexOf(boolean value) {
		for (int w = wordsFor(theSize) - 1; w >= 0; w--) {
			long word = value ? theWords[w] : ~theWords[w];
			if (w == wordIndex(theSize - 1)) {
				int lastBits = theSize - w * BITS_PER_WORD;
				if (lastBits < BITS_PER_WORD)
					word &= WORD_MASK >>> (BITS_PER_WORD - lastBits);
			}
			if (word != 0)
				return w * BITS_PER_WORD + BITS_PER_WORD - 1 - Long.numberOfLeadingZeros(word);
		}
		return -1;
	}

	/**
	 * @param value The value to find
	 * @return Whether this list contains the given value
	 */
	public boolean contains(boolean value) {
		return indexOf(value) >= 0;
	}

	/** @return The number of <code>true</code> bits in this list */
	public int cardinality() {
		int count = 0;
		int words = wordsFor(theSize);
		for (int w = 0; w < words; w++)
			count += Long.bitCount(theWords[w]);
		return count;
	}

	/** @return The values currently in this list */
	public boolean[] toArray() {
		boolean[] ret = new boolean[theSize];
		for (int i = 0; i < theSize; i++)
			ret[i] = (theWords[wordIndex(i)] & (1L << i)) != 0;
		return ret;
	}

	@Override
	public Iterator<Boolean> iterator() {
		return new BitIterator();
	}

	@Override
	public int hashCode() {
		int hash = theSize;
		int words = wordsFor(theSize);
		for (int w = 0; w < words; w++)
			hash = hash * 31 + Long.hashCode(theWords[w]);
		return hash;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		else if (!(obj instanceof PackedBitList))
			return false;
		PackedBitList other = (PackedBitList) obj;
		if (theSize != other.theSize)
			return false;
		int words = wordsFor(theSize);
		for (int w = 0; w < words; w++) {
			if (theWords[w] != other.theWords[w])
				return false;
		}
		return true;
	}

	@Override
	public String toString() {
		StringBuilder ret = new StringBuilder(theSize + 2);
		ret.append('[');
		for (int i = 0; i < theSize; i++)
			ret.append((theWords[wordIndex(i)] & (1L << i)) != 0 ? '1' : '0');
		ret.append(']');
		return ret.toString();
	}

	private class BitIterator implements Iterator<Boolean> {
		private int theIndex;
		private int theLastReturned = -1;
		private int theExpectedModCount = theModCount;

		@Override
		public boolean hasNext() {
			return theIndex < theSize;
		}

		@Override
		public Boolean next() {
			if (theModCount != theExpectedModCount)
				throw new ConcurrentModificationException("List has been modified apart from this iterator");
			if (theIndex >= theSize)
				throw new NoSuchElementException();
			theLastReturned = theIndex++;
			return Boolean.valueOf((theWords[wordIndex(theLastReturned)] & (1L << theLastReturned)) != 0);
		}

		@Override
		public void remove() {
			if (theLastReturned < 0)
				throw new IllegalStateException("remove() can only be called once with each call to next()");
			if (theModCount != theExpectedModCount)
				throw new ConcurrentModificationException("List has been modified apart from this iterator");
			PackedBitList.this.remove(theLastReturned);
			theIndex = theLastReturned;
			theLastReturned = -1;
			theExpectedModCount = theModCount;
		}
	}
}
