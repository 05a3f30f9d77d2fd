package org.qondense.index;

import java.util.Arrays;

/** An {@link OffsetIndex} of {@link IndexWidth#FOUR_BYTES} width */
public class IntOffsetIndex extends ArrayOffsetIndex {
	private int[] theCodes;

	/** @param capacity The initial capacity of the index */
	public IntOffsetIndex(int capacity) {
		if (capacity < 0)
			throw new IllegalArgumentException("capacity < 0: " + capacity);
		theCodes = new int[capacity];
	}

	@Override
	public IndexWidth getWidth() {
		return IndexWidth.FOUR_BYTES;
	}

	@Override
	protected int arrayLength() {
		return theCodes.length;
	}

	@Override
	protected void resize(int length) {
		theCodes = Arrays.copyOf(theCodes, length);
	}

	@Override
	protected int read(int index) {
		return theCodes[index];
	}

	@Override
	protected void write(int index, int code) {
		theCodes[index] = code;
	}

	@Override
	protected void move(int from, int to, int length) {
		System.arraycopy(theCodes, from, theCodes, to, length);
	}
}
