package org.qondense.index;

/**
 * <p>
 * An ordered, growable sequence of non-negative integer codes, each stored in a fixed number of bits given by the index's
 * {@link #getWidth() width}.
 * </p>
 *
 * <p>
 * Every method that stores a code throws an {@link IllegalArgumentException} if the code is negative or larger than
 * {@link IndexWidth#getMaxCode()} for the index's width. Codes are never truncated to fit.
 * </p>
 *
 * <p>
 * Implementations are NOT thread-safe.
 * </p>
 */
public interface OffsetIndex {
	/** @return The width of codes stored in this index */
	IndexWidth getWidth();

	/** @return The number of codes in this index */
	int size();

	/** @return Whether this index is empty */
	default boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * @param index The position of the code to get
	 * @return The code at the given position
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;={@link #size()}</code>
	 */
	int get(int index);

	/**
	 * @param index The position of the code to replace
	 * @param code The new code for the position
	 * @return The code previously at the position
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;={@link #size()}</code>
	 * @throws IllegalArgumentException If the code cannot be stored in this index's width
	 */
	int set(int index, int code);

	/**
	 * @param code The code to append
	 * @throws IllegalArgumentException If the code cannot be stored in this index's width
	 */
	void add(int code);

	/**
	 * @param index The position to insert the code at, between 0 and {@link #size()}, inclusive
	 * @param code The code to insert
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;{@link #size()}</code>
	 * @throws IllegalArgumentException If the code cannot be stored in this index's width
	 */
	void add(int index, int code);

	/**
	 * @param index The position of the code to remove
	 * @return The removed code
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;={@link #size()}</code>
	 */
	int remove(int index);

	/**
	 * @param code The code to find
	 * @return The first position of the code in this index, or -1 if it is not present
	 */
	int indexOf(int code);

	/**
	 * @param code The code to find
	 * @return The last position of the code in this index, or -1 if it is not present
	 */
	int lastIndexOf(int code);

	/**
	 * @param code The code to find
	 * @return Whether this index contains the code
	 */
	default boolean contains(int code) {
		return indexOf(code) >= 0;
	}

	/** Removes all codes from this index, keeping its capacity */
	void clear();

	/** @return The number of codes this index can hold without re-allocating its storage */
	int getCapacity();

	/**
	 * @param capacity The number of codes this index should be able to hold without re-allocating its storage
	 * @throws IllegalArgumentException If <code>capacity</code> is less than this index's {@link #size() size}
	 */
	void setCapacity(int capacity);
}
