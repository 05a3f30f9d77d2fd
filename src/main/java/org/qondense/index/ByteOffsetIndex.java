package org.qondense.index;

import java.util.Arrays;

/** An {@link OffsetIndex} of {@link IndexWidth#ONE_BYTE} width, storing each code as an unsigned byte */
public class ByteOffsetIndex extends ArrayOffsetIndex {
	private byte[] theCodes;

	/** @param capacity The initial capacity of the index */
	public ByteOffsetIndex(int capacity) {
		if (capacity < 0)
			throw new IllegalArgumentException("capacity < 0: " + capacity);
		theCodes = new byte[capacity];
	}

	@Override
	public IndexWidth getWidth() {
		return IndexWidth.ONE_BYTE;
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
		return theCodes[index] & 0xff;
	}

	@Override
	protected void write(int index, int code) {
		theCodes[index] = (byte) code;
	}

	@Override
	protected void move(int from, int to, int length) {
		System.arraycopy(theCodes, from, theCodes, to, length);
	}
}
