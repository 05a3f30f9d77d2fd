package org.qondense.collect;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import java.util.function.ToLongFunction;

/**
 * Aggregate functions over {@link CondensedList}s. Each function is evaluated once per distinct value, with the result weighted by the
 * number of elements holding that value, so the cost depends on the number of distinct values rather than on the size of the list.
 */
public class CondensedAggregates {
	private CondensedAggregates() {}

	/**
	 * @param <E> The type of values in the list
	 * @param list The list to count in
	 * @param test The test for the values to count
	 * @return The number of elements in the list whose values pass the test
	 */
	public static <E> int count(CondensedList<E> list, Predicate<? super E> test) {
		int[] count = new int[1];
		list.forEachUnique((value, n) -> {
			if (test.test(value))
				count[0] += n;
		});
		return count[0];
	}

	/**
	 * @param <E> The type of values in the list
	 * @param list The list to search
	 * @param compare The ordering for values
	 * @return The first-added of the smallest values in the list, or null if the list is empty
	 */
	public static <E> E min(CondensedList<E> list, Comparator<? super E> compare) {
		return extreme(list, compare, false);
	}

	/**
	 * @param <E> The type of values in the list
	 * @param list The list to search
	 * @param compare The ordering for values
	 * @return The first-added of the largest values in the list, or null if the list is empty
	 */
	public static <E> E max(CondensedList<E> list, Comparator<? super E> compare) {
		return extreme(list, compare, true);
	}

	private static <E> E extreme(CondensedList<E> list, Comparator<? super E> compare, boolean max) {
		Object[] best = new Object[1];
		boolean[] found = new boolean[1];
		list.forEachUnique((value, n) -> {
			if (!found[0]) {
				found[0] = true;
				best[0] = value;
			} else {
				@SuppressWarnings("unchecked")
				int comp = compare.compare(value, (E) best[0]);
				if (max ? comp > 0 : comp < 0)
					best[0] = value;
			}
		});
		@SuppressWarnings("unchecked")
		E result = (E) best[0];
		return result;
	}

	/**
	 * @param <E> The type of values in the list
	 * @param list The list to sum
	 * @param map The function producing the number to sum for each value
	 * @return The sum of the function over every element in the list
	 */
	public static <E> long sumLong(CondensedList<E> list, ToLongFunction<? super E> map) {
		long[] sum = new long[1];
		list.forEachUnique((value, n) -> sum[0] += map.applyAsLong(value) * n);
		return sum[0];
	}

	/**
	 * @param <E> The type of values in the list
	 * @param list The list to sum
	 * @param map The function producing the number to sum for each value
	 * @return The sum of the function over every element in the list
	 */
	public static <E> double sumDouble(CondensedList<E> list, ToDoubleFunction<? super E> map) {
		double[] sum = new double[1];
		list.forEachUnique((value, n) -> sum[0] += map.applyAsDouble(value) * n);
		return sum[0];
	}

	/**
	 * @param <E> The type of values in the list
	 * @param list The list to average
	 * @param map The function producing the number to average for each value
	 * @return The mean of the function over every element in the list, or {@link Double#NaN} if the list is empty
	 */
	public static <E> double average(CondensedList<E> list, ToDoubleFunction<? super E> map) {
		int size = list.size();
		if (size == 0)
			return Double.NaN;
		return sumDouble(list, map) / size;
	}

	/**
	 * @param <E> The type of values in the list
	 * @param list The list to count
	 * @return Each distinct value in the list, mapped to the number of elements holding it, in the order the values were first added. The
	 *         map is keyed by {@link Object#equals(Object)}, so values that the list's equalizer distinguishes but that are
	 *         {@link Object#equals(Object) equal} share one entry holding their combined count.
	 */
	public static <E> LinkedHashMap<E, Integer> valueCounts(CondensedList<E> list) {
		LinkedHashMap<E, Integer> counts = new LinkedHashMap<>();
		list.forEachUnique((value, n) -> counts.merge(value, n, Integer::sum));
		return counts;
	}
}
