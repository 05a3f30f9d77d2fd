package org.qondense.collect;

import java.util.function.IntPredicate;

/**
 * <p>
 * Decides when a {@link CondensedList} should {@link CondensedList#compact() compact} its intern pool. The policy is consulted
 * synchronously, from inside the modification that made a pooled value unreferenced, each time the list's reclaimable count grows.
 * </p>
 *
 * <p>
 * A policy must not modify the list that consulted it. The list has not finished the modification when the policy is called.
 * </p>
 */
@FunctionalInterface
public interface ReclaimPolicy {
	/**
	 * @param stats The list's current statistics, including {@link CondensedStats#getReclaimableCount() the reclaimable count}
	 * @return Whether the list should compact its pool now
	 */
	boolean shouldCompact(CondensedStats stats);

	/** Never compacts. Unreferenced values accumulate until the list is compacted explicitly or cleared. */
	public static final ReclaimPolicy NEVER = stats -> false;

	/** Compacts as soon as any value becomes unreferenced */
	public static final ReclaimPolicy ALWAYS = stats -> true;

	/**
	 * @param countTest The test to apply to the reclaimable count
	 * @return A policy that compacts when the number of reclaimable values passes the given test
	 */
	public static ReclaimPolicy ofCount(IntPredicate countTest) {
		return stats -> countTest.test(stats.getReclaimableCount());
	}

	/**
	 * @param reclaimable The minimum number of reclaimable values to trigger compaction
	 * @return A policy that compacts when at least the given number of values are reclaimable
	 */
	public static ReclaimPolicy atLeast(int reclaimable) {
		if (reclaimable < 1)
			throw new IllegalArgumentException("Reclaimable threshold must be at least 1: " + reclaimable);
		return ofCount(count -> count >= reclaimable);
	}

	/**
	 * @param fraction The fraction (between 0 and 1) of the pool that must be reclaimable to trigger compaction
	 * @return A policy that compacts when the given portion of the pool is reclaimable
	 */
	public static ReclaimPolicy fractionOfPool(double fraction) {
		if (Double.isNaN(fraction) || fraction < 0 || fraction > 1)
			throw new IllegalArgumentException("Fraction must be between 0 and 1: " + fraction);
		return stats -> stats.getReclaimableCount() >= fraction * stats.getPoolCount();
	}
}
