package org.qondense.collect;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

import com.google.common.primitives.Primitives;
import com.google.common.reflect.TypeToken;

/**
 * <p>
 * {@link CutoverPolicy Cutover policies} based on a rough memory model of a {@link CondensedList} versus a plain list of references.
 * </p>
 *
 * <p>
 * While codes fit in one or two bytes, a condensed list never uses more memory per element than a list of references, so these policies
 * only consider cutting over once the pool holds 65536 or more values and the index has gone to four bytes per element. At that point
 * the index costs as much as a reference, and the pool only pays for itself if enough elements share values.
 * </p>
 */
public class StandardCutoverPolicies {
	/** Estimated bookkeeping bytes per pooled value: its pool slot, hash entry, key node, boxed code and reference count */
	public static final int OVERHEAD_PER_UNIQUE_VALUE = 72;
	/** Estimated bytes of a reference (assuming compressed references) */
	public static final int REFERENCE_BYTES = 4;
	/** Bytes per element of the widest index */
	public static final int CODE_BYTES = 4;
	/** The number of distinct codes an index can hold before it must go to four bytes per element */
	public static final int WIDE_INDEX_THRESHOLD = 65536;

	private StandardCutoverPolicies() {}

	/**
	 * @param valueBytes The estimated size, in bytes, of each value object
	 * @return A policy that cuts over when a plain list of separately-allocated values of the given size would use less memory than the
	 *         condensed list
	 */
	public static CutoverPolicy forValueSize(int valueBytes) {
		if (valueBytes < 0)
			throw new IllegalArgumentException("valueBytes < 0: " + valueBytes);
		return stats -> {
			long unique = stats.getUniqueCount();
			long count = stats.getCount();
			if (unique < WIDE_INDEX_THRESHOLD)
				return false;
			else if (unique == WIDE_INDEX_THRESHOLD && count == WIDE_INDEX_THRESHOLD)
				return true; // Every value is distinct
			long plain = (REFERENCE_BYTES + valueBytes) * count;
			long condensed = CODE_BYTES * count + (OVERHEAD_PER_UNIQUE_VALUE + REFERENCE_BYTES + valueBytes) * unique;
			return plain < condensed;
		};
	}

	/**
	 * @param type The element type of the list
	 * @return A standard policy for the given type: {@link CutoverPolicy#NEVER} for booleans, enums and types this class has no estimate
	 *         for, or a {@link #forValueSize(int) size-based} policy for boxed primitives, strings and other common value types
	 */
	public static CutoverPolicy forType(TypeToken<?> type) {
		Class<?> raw = Primitives.wrap(type.getRawType());
		if (raw == Boolean.class || Enum.class.isAssignableFrom(raw))
			return CutoverPolicy.NEVER;
		else if (raw == Byte.class || raw == Character.class || raw == Short.class || raw == Integer.class || raw == Float.class)
			return forValueSize(16);
		else if (raw == Long.class || raw == Double.class)
			return forValueSize(24);
		else if (raw == UUID.class)
			return forValueSize(32);
		else if (raw == BigInteger.class || raw == BigDecimal.class)
			return forValueSize(40);
		else if (raw == String.class)
			return forValueSize(48); // A header, a hash and room for about 10 characters
		else
			return CutoverPolicy.NEVER;
	}
}
