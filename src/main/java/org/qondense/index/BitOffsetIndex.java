package org.qondense.index;

import org.qondense.PackedBitList;

/** An {@link OffsetIndex} of {@link IndexWidth#ONE_BIT} width, backed by a {@link PackedBitList} */
public class BitOffsetIndex implements OffsetIndex {
	private final PackedBitList theBits;

	/** @param capacity The initial capacity of the index */
	public BitOffsetIndex(int capacity) {
		if (capacity < 0)
			throw new IllegalArgumentException("capacity < 0: " + capacity);
		theBits = new PackedBitList(capacity);
	}

	private static boolean toBit(int code) {
		if (code == 0)
			return false;
		else if (code == 1)
			return true;
		else
			throw new IllegalArgumentException("Code " + code + " cannot be stored in a " + IndexWidth.ONE_BIT + " index");
	}

	@Override
	public IndexWidth getWidth() {
		return IndexWidth.ONE_BIT;
	}

	@Override
	public int size() {
		return theBits.size();
	}

	@Override
	public int get(int index) {
		return theBits.get(index) ? 1 : 0;
	}

	@Override
	public int set(int index, int code) {
		return theBits.set(index, toBit(code)) ? 1 : 0;
	}

	@Override
	public void add(int code) {
		theBits.add(toBit(code));
	}

	@Override
	public void add(int index, int code) {
		theBits.add(index, toBit(code));
	}

	@Override
	public int remove(int index) {
		return theBits.remove(index) ? 1 : 0;
	}

	@Override
	public int indexOf(int code) {
		if (code != 0 && code != 1)
			return -1;
		return theBits.indexOf(code == 1);
	}

	@Override
	public int lastIndexOf(int code) {
		if (code != 0 && code != 1)
			return -1;
		return theBits.lastIndexOf(code == 1);
	}

	@Override
	public void clear() {
		theBits.clear();
	}

	@Override
	public int getCapacity() {
		return theBits.getCapacity();
	}

	@Override
	public void setCapacity(int capacity) {
		theBits.setCapacity(capacity);
	}

	@Override
	public String toString() {
		return theBits.toString();
	}
}
