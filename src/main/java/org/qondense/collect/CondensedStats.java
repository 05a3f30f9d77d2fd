package org.qondense.collect;

/** An immutable snapshot of the counts describing a {@link CondensedList}'s storage */
public final class CondensedStats {
	private final int theCount;
	private final int theUniqueCount;
	private final int thePoolCount;
	private final int theReclaimableCount;

	/**
	 * @param count The number of elements in the list
	 * @param uniqueCount The number of distinct values currently in the list
	 * @param poolCount The number of values in the list's intern pool, including reclaimable ones
	 * @param reclaimableCount The number of pooled values that are no longer referenced by any element
	 */
	public CondensedStats(int count, int uniqueCount, int poolCount, int reclaimableCount) {
		theCount = count;
		theUniqueCount = uniqueCount;
		thePoolCount = poolCount;
		theReclaimableCount = reclaimableCount;
	}

	/** @return The number of elements in the list */
	public int getCount() {
		return theCount;
	}

	/** @return The number of distinct values currently in the list */
	public int getUniqueCount() {
		return theUniqueCount;
	}

	/** @return The number of values in the list's intern pool, including reclaimable ones, or -1 if the list has cut over */
	public int getPoolCount() {
		return thePoolCount;
	}

	/** @return The number of pooled values that are no longer referenced by any element, or -1 if the list has cut over */
	public int getReclaimableCount() {
		return theReclaimableCount;
	}

	@Override
	public int hashCode() {
		return ((theCount * 31 + theUniqueCount) * 31 + thePoolCount) * 31 + theReclaimableCount;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		else if (!(obj instanceof CondensedStats))
			return false;
		CondensedStats other = (CondensedStats) obj;
		return theCount == other.theCount && theUniqueCount == other.theUniqueCount && thePoolCount == other.thePoolCount
			&& theReclaimableCount == other.theReclaimableCount;
	}

	@Override
	public String toString() {
		return "count=" + theCount + ", unique=" + theUniqueCount + ", pool=" + thePoolCount + ", reclaimable=" + theReclaimableCount;
	}
}
