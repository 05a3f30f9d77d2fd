package org.qondense.index;

/** The storage widths available for an {@link OffsetIndex}, from narrowest to widest */
public enum IndexWidth {
	/** One bit per code, for at most 2 distinct codes */
	ONE_BIT(1, 1),
	/** One byte per code, for at most 256 distinct codes */
	ONE_BYTE(8, 0xff),
	/** Two bytes per code, for at most 65536 distinct codes */
	TWO_BYTES(16, 0xffff),
	/** Four bytes per code, bounded only by the size of the collection */
	FOUR_BYTES(32, Integer.MAX_VALUE);

	private final int theBitsPerCode;
	private final int theMaxCode;

	private IndexWidth(int bitsPerCode, int maxCode) {
		theBitsPerCode = bitsPerCode;
		theMaxCode = maxCode;
	}

	/** @return The number of bits each code occupies in an index of this width */
	public int getBitsPerCode() {
		return theBitsPerCode;
	}

	/** @return The largest code that an index of this width can store */
	public int getMaxCode() {
		return theMaxCode;
	}

	/** @return The number of distinct codes an index of this width can represent */
	public long getCodeCapacity() {
		return theMaxCode + 1L;
	}

	/**
	 * @param code The code to test
	 * @return Whether an index of this width can store the given code
	 */
	public boolean canHold(int code) {
		return code >= 0 && code <= theMaxCode;
	}

	/** @return The next wider width, or null if this is the widest */
	public IndexWidth wider() {
		IndexWidth[] widths = values();
		return ordinal() == widths.length - 1 ? null : widths[ordinal() + 1];
	}

	/**
	 * @param capacity The initial capacity for the index, in codes
	 * @return A new, empty index of this width
	 */
	public OffsetIndex create(int capacity) {
		switch (this) {
		case ONE_BIT:
			return new BitOffsetIndex(capacity);
		case ONE_BYTE:
			return new ByteOffsetIndex(capacity);
		case TWO_BYTES:
			return new ShortOffsetIndex(capacity);
		case FOUR_BYTES:
			return new IntOffsetIndex(capacity);
		}
		throw new IllegalStateException("Unrecognized width: " + this);
	}

	/**
	 * Creates an index of this width containing all the codes of another index, in order
	 *
	 * @param source The index to copy
	 * @param capacity The minimum initial capacity for the new index
	 * @return The new index
	 * @throws IllegalArgumentException If any code in the source cannot be stored in this width
	 */
	public OffsetIndex copyOf(OffsetIndex source, int capacity) {
		OffsetIndex copy = create(Math.max(capacity, source.size()));
		int size = source.size();
		for (int i = 0; i < size; i++)
			copy.add(source.get(i));
		return copy;
	}

	/**
	 * @param codeCount The number of distinct codes to represent
	 * @return The narrowest width that can represent codes <code>0</code> through <code>codeCount-1</code>
	 */
	public static IndexWidth forCodeCount(int codeCount) {
		if (codeCount < 0)
			throw new IllegalArgumentException("codeCount < 0: " + codeCount);
		for (IndexWidth width : values()) {
			if (codeCount <= width.getCodeCapacity())
				return width;
		}
		return FOUR_BYTES;
	}
}
