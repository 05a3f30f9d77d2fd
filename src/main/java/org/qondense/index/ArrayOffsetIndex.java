package org.qondense.index;

/**
 * Shared implementation for {@link OffsetIndex}es that keep their codes in a growable primitive array, in the manner of an
 * {@link java.util.ArrayList}. Subclasses supply the array and the conversion between codes and array elements.
 */
public abstract class ArrayOffsetIndex implements OffsetIndex {
	private int theSize;

	/** @return The length of the backing array */
	protected abstract int arrayLength();

	/** @param length The new length for the backing array, which will be at least {@link #size()} */
	protected abstract void resize(int length);

	/**
	 * @param index The array index to read
	 * @return The code stored at the index
	 */
	protected abstract int read(int index);

	/**
	 * @param index The array index to write
	 * @param code The code to store, already validated against this index's width
	 */
	protected abstract void write(int index, int code);

	/**
	 * Moves a range of elements within the backing array, as {@link System#arraycopy(Object, int, Object, int, int)}
	 *
	 * @param from The first index to move from
	 * @param to The index to move the first element to
	 * @param length The number of elements to move
	 */
	protected abstract void move(int from, int to, int length);

	@Override
	public int size() {
		return theSize;
	}

	private void checkIndex(int index, int limit) {
		if (index < 0 || index >= limit)
			throw new IndexOutOfBoundsException(index + " of " + theSize);
	}

	private int checkCode(int code) {
		if (!getWidth().canHold(code))
			throw new IllegalArgumentException("Code " + code + " cannot be stored in a " + getWidth() + " index");
		return code;
	}

	@Override
	public int get(int index) {
		checkIndex(index, theSize);
		return read(index);
	}

	@Override
	public int set(int index, int code) {
		checkIndex(index, theSize);
		checkCode(code);
		int old = read(index);
		write(index, code);
		return old;
	}

	@Override
	public void add(int code) {
		checkCode(code);
		ensureCapacity(theSize + 1);
		write(theSize++, code);
	}

	@Override
	public void add(int index, int code) {
		checkIndex(index, theSize + 1);
		checkCode(code);
		ensureCapacity(theSize + 1);
		if (index < theSize)
			move(index, index + 1, theSize - index);
		write(index, code);
		theSize++;
	}

	@Override
	public int remove(int index) {
		checkIndex(index, theSize);
		int old = read(index);
		if (index < theSize - 1)
			move(index + 1, index, theSize - index - 1);
		theSize--;
		return old;
	}

	@Override
	public int indexOf(int code) {
		if (!getWidth().canHold(code))
			return -1;
		for (int i = 0; i < theSize; i++) {
			if (read(i) == code)
				return i;
		}
		return -1;
	}

	@Override
	public int lastIndexOf(int code) {
		if (!getWidth().canHold(code))
			return -1;
		for (int i = theSize - 1; i >= 0; i--) {
			if (read(i) == code)
				return i;
		}
		return -1;
	}

	@Override
	public void clear() {
		theSize = 0;
	}

	@Override
	public int getCapacity() {
		return arrayLength();
	}

	@Override
	public void setCapacity(int capacity) {
		if (capacity < theSize)
			throw new IllegalArgumentException("Capacity " + capacity + " cannot be less than size " + theSize);
		if (capacity != arrayLength())
			resize(capacity);
	}

	/**
	 * Ensures that this index's capacity is at least the given value
	 *
	 * @param minCapacity The minimum capacity for the index
	 */
	public void ensureCapacity(int minCapacity) {
		int oldCapacity = arrayLength();
		if (minCapacity > oldCapacity) {
			int newCapacity = (int) Math.min((oldCapacity * 3L) / 2 + 1, Integer.MAX_VALUE - 8);
			if (newCapacity < minCapacity)
				newCapacity = minCapacity;
			resize(newCapacity);
		}
	}

	@Override
	public String toString() {
		StringBuilder ret = new StringBuilder();
		ret.append('[');
		for (int i = 0; i < theSize; i++) {
			if (i > 0)
				ret.append(", ");
			ret.append(read(i));
		}
		ret.append(']');
		return ret.toString();
	}
}
