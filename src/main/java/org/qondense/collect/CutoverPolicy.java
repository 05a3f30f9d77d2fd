package org.qondense.collect;

/**
 * Decides when a {@link CondensedList} should give up deduplication and store its values directly. The policy is consulted whenever the
 * list's index would need to widen, and periodically as the pool grows once the index is at its widest.
 *
 * @see StandardCutoverPolicies
 */
@FunctionalInterface
public interface CutoverPolicy {
	/**
	 * @param stats The list's current statistics
	 * @return Whether the list should stop deduplicating its values
	 */
	boolean shouldCutover(CondensedStats stats);

	/** Never cuts over */
	public static final CutoverPolicy NEVER = stats -> false;
}
