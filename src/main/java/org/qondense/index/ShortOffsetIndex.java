package org.qondense.index;

import java.util.Arrays;

/** An {@link OffsetIndex} of {@link IndexWidth#TWO_BYTES} width, storing each code as an unsigned short */
public class ShortOffsetIndex extends ArrayOffsetIndex {
	private short[] theCodes;

	/** @param capacity The initial capacity of the index */
	public ShortOffsetIndex(int capacity) {
		if (capacity < 0)
			throw new IllegalArgumentException("capacity < 0: " + capacity);
		theCodes = new short[capacity];
	}

	@Override
	public IndexWidth getWidth() {
		return IndexWidth.TWO_BYTES;
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
		return theCodes[index] & 0xffff;
	}

	@Override
	protected void write(int index, int code) {
		theCodes[index] = (short) code;
	}

	@Override
	protected void move(int from, int to, int length) {
		System.arraycopy(theCodes, from, theCodes, to, length);
	}
}
