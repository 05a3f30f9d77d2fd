package org.qondense.collect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.function.ObjIntConsumer;

import org.apache.log4j.Logger;
import org.qondense.Equalizer;
import org.qondense.Equalizer.EqualizerNode;

/**
 * <p>
 * Deduplicates values, assigning each distinct value (as determined by an {@link Equalizer}) a code. Codes are assigned consecutively
 * from zero and are stable until the pool is {@link #compact() compacted}.
 * </p>
 *
 * <p>
 * The pool also keeps a reference count for each code. Interning does not touch reference counts: callers
 * {@link #incrementRef(int) increment} and {@link #decrementRef(int) decrement} them separately, which allows a replacement value to be
 * interned before the value it replaces is released. A code whose count is zero is <b>reclaimable</b> and will be removed by the next
 * compaction. A reclaimable value that is interned again keeps its code.
 * </p>
 *
 * <p>
 * <code>null</code> is an ordinary value that may be interned like any other.
 * </p>
 *
 * <p>
 * This class is NOT thread-safe.
 * </p>
 *
 * @param <E> The type of values in the pool
 */
public class InternPool<E> {
	private static final Logger log = Logger.getLogger(InternPool.class);

	private final Equalizer theEqualizer;
	private ArrayList<E> theValues;
	private HashMap<EqualizerNode<E>, Integer> theCodes;
	private int[] theRefCounts;
	private int theLiveCount;
	private int theModCount;

	/** @param equalizer The equalizer to determine which values are duplicates */
	public InternPool(Equalizer equalizer) {
		if (equalizer == null)
			throw new NullPointerException("equalizer");
		theEqualizer = equalizer;
		theValues = new ArrayList<>();
		theCodes = new HashMap<>();
		theRefCounts = new int[10];
	}

	/** @return The equalizer this pool uses to determine which values are duplicates */
	public Equalizer getEqualizer() {
		return theEqualizer;
	}

	/** @return The number of values in this pool, including reclaimable ones */
	public int size() {
		return theValues.size();
	}

	/** @return The number of values in this pool with a positive reference count */
	public int getLiveCount() {
		return theLiveCount;
	}

	/** @return The number of values in this pool whose reference count is zero */
	public int getReclaimableCount() {
		return theValues.size() - theLiveCount;
	}

	/**
	 * Finds or creates the code for a value. If the value is new to this pool, it is assigned the next code with a reference count of
	 * zero.
	 *
	 * @param value The value to intern
	 * @return The code for the value
	 */
	public int intern(E value) {
		EqualizerNode<E> node = theEqualizer.nodeFor(value);
		Integer code = theCodes.get(node);
		if (code != null)
			return code.intValue();
		int newCode = theValues.size();
		if (newCode == theRefCounts.length)
			theRefCounts = Arrays.copyOf(theRefCounts, (int) Math.min(newCode * 2L, Integer.MAX_VALUE - 8));
		theValues.add(value);
		theCodes.put(node, newCode);
		theModCount++;
		return newCode;
	}

	/**
	 * @param value The value to find
	 * @return The code for the value, or -1 if no equivalent value is pooled
	 */
	public int find(Object value) {
		Integer code = theCodes.get(theEqualizer.nodeFor(value));
		return code == null ? -1 : code.intValue();
	}

	private void checkCode(int code) {
		if (code < 0 || code >= theValues.size()) {
			String msg = "Code " + code + " is not in the pool (size " + theValues.size() + ")";
			log.error(msg);
			throw new InternalCorruptionException(msg);
		}
	}

	/**
	 * @param code The code to resolve
	 * @return The pooled value with the given code
	 * @throws InternalCorruptionException If the code is unknown to this pool
	 */
	public E valueOf(int code) {
		checkCode(code);
		return theValues.get(code);
	}

	/**
	 * @param code The code to get the reference count of
	 * @return The number of references to the given code
	 * @throws InternalCorruptionException If the code is unknown to this pool
	 */
	public int getRefCount(int code) {
		checkCode(code);
		return theRefCounts[code];
	}

	/**
	 * Adds a reference to a pooled value, making it non-reclaimable if it was
	 *
	 * @param code The code of the value being referenced
	 * @throws InternalCorruptionException If the code is unknown to this pool
	 */
	public void incrementRef(int code) {
		checkCode(code);
		if (theRefCounts[code]++ == 0)
			theLiveCount++;
		theModCount++;
	}

	/**
	 * Releases a reference to a pooled value
	 *
	 * @param code The code of the value being released
	 * @return True if the value became reclaimable as a result of this call
	 * @throws InternalCorruptionException If the code is unknown to this pool or its reference count is already zero
	 */
	public boolean decrementRef(int code) {
		checkCode(code);
		if (theRefCounts[code] == 0) {
			String msg = "Reference count for code " + code + " (" + theValues.get(code) + ") would go negative";
			log.error(msg);
			throw new InternalCorruptionException(msg);
		}
		theModCount++;
		if (--theRefCounts[code] == 0) {
			theLiveCount--;
			return true;
		}
		return false;
	}

	/**
	 * Visits each value in this pool with a positive reference count, in code order
	 *
	 * @param action The action to receive each live value and its reference count
	 */
	public void forEachLive(ObjIntConsumer<? super E> action) {
		int size = theValues.size();
		for (int code = 0; code < size; code++) {
			if (theRefCounts[code] > 0)
				action.accept(theValues.get(code), theRefCounts[code]);
		}
	}

	/** Removes all values from this pool */
	public void clear() {
		theValues.clear();
		theCodes.clear();
		Arrays.fill(theRefCounts, 0);
		theLiveCount = 0;
		theModCount++;
	}

	/**
	 * Removes all reclaimable values from this pool and renumbers the remaining ones densely, preserving their order
	 *
	 * @return The map from old codes (the array index) to new ones. Removed codes map to -1.
	 * @throws CompactionFailedException If the new structures could not be allocated. The pool is unchanged in this case.
	 */
	public int[] compact() {
		Compaction compaction = prepareCompaction();
		compaction.commit();
		return compaction.getRemap();
	}

	/**
	 * Builds the result of compacting this pool without modifying the pool. The compaction takes effect when
	 * {@link Compaction#commit() committed}, which must happen before the pool is modified again. Changes to reference counts are
	 * modifications.
	 *
	 * @return The prepared compaction
	 * @throws CompactionFailedException If the new structures could not be allocated
	 */
	public Compaction prepareCompaction() {
		int oldSize = theValues.size();
		int[] remap;
		ArrayList<E> values;
		HashMap<EqualizerNode<E>, Integer> codes;
		int[] refCounts;
		try {
			remap = new int[oldSize];
			values = new ArrayList<>(theLiveCount);
			codes = new HashMap<>(theLiveCount * 4 / 3 + 1);
			refCounts = new int[Math.max(theLiveCount, 10)];
		} catch (OutOfMemoryError e) {
			throw new CompactionFailedException("Could not allocate the compacted pool for " + theLiveCount + " values", e);
		}
		int next = 0;
		for (int code = 0; code < oldSize; code++) {
			if (theRefCounts[code] == 0) {
				remap[code] = -1;
				continue;
			}
			E value = theValues.get(code);
			remap[code] = next;
			values.add(value);
			codes.put(theEqualizer.nodeFor(value), next);
			refCounts[next] = theRefCounts[code];
			next++;
		}
		if (next != theLiveCount) {
			String msg = "Live count " + theLiveCount + " does not match " + next + " referenced codes";
			log.error(msg);
			throw new InternalCorruptionException(msg);
		}
		return new Compaction(remap, values, codes, refCounts);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder("[");
		for (int code = 0; code < theValues.size(); code++) {
			if (code > 0)
				str.append(", ");
			str.append(code).append('=').append(theValues.get(code)).append('x').append(theRefCounts[code]);
		}
		return str.append(']').toString();
	}

	/** The prepared result of compacting an {@link InternPool}, which may be {@link #commit() committed} to take effect */
	public class Compaction {
		private final int[] theRemap;
		private final ArrayList<E> theNewValues;
		private final HashMap<EqualizerNode<E>, Integer> theNewCodes;
		private final int[] theNewRefCounts;
		private final int thePreparedModCount;
		private boolean isCommitted;

		Compaction(int[] remap, ArrayList<E> values, HashMap<EqualizerNode<E>, Integer> codes, int[] refCounts) {
			theRemap = remap;
			theNewValues = values;
			theNewCodes = codes;
			theNewRefCounts = refCounts;
			thePreparedModCount = theModCount;
		}

		/** @return The map from old codes (the array index) to new ones. Removed codes map to -1. */
		public int[] getRemap() {
			return theRemap;
		}

		/** @return The number of values in the pool after the compaction */
		public int getNewSize() {
			return theNewValues.size();
		}

		/** @return The number of values the compaction removes */
		public int getRemovedCount() {
			return theRemap.length - theNewValues.size();
		}

		/**
		 * Replaces the pool's contents with the compacted ones
		 *
		 * @throws IllegalStateException If this compaction has already been committed or the pool has changed since it was prepared
		 */
		public void commit() {
			if (isCommitted)
				throw new IllegalStateException("This compaction has already been committed");
			else if (theModCount != thePreparedModCount)
				throw new IllegalStateException("The pool has been modified since this compaction was prepared");
			isCommitted = true;
			theValues = theNewValues;
			theCodes = theNewCodes;
			theRefCounts = theNewRefCounts;
			theModCount++;
			if (log.isDebugEnabled())
				log.debug("Compacted intern pool from " + theRemap.length + " to " + theNewValues.size() + " values");
		}
	}
}
