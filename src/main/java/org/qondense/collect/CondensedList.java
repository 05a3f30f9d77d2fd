package org.qondense.collect;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.RandomAccess;
import java.util.function.ObjIntConsumer;

import org.apache.log4j.Logger;
import org.qondense.Equalizer;
import org.qondense.Equalizer.EqualizerNode;
import org.qondense.index.IndexWidth;
import org.qondense.index.OffsetIndex;

import com.google.common.reflect.TypeToken;

/**
 * <p>
 * A {@link java.util.List} that stores each distinct value once. Values are {@link InternPool interned}, and each element is stored as
 * the code of its value in an {@link OffsetIndex} that is only as wide as the number of distinct values requires. A list holding two
 * distinct values uses one bit per element, one holding a few hundred uses one byte, and so on.
 * </p>
 *
 * <p>
 * Which values are duplicates is determined by the list's {@link #getEqualizer() equalizer}. <code>null</code> is allowed and pooled like
 * any other value.
 * </p>
 *
 * <p>
 * When the last element holding a value is removed or replaced, the value stays in the pool as <b>reclaimable</b>. Reclaimable values are
 * dropped by {@link #compact()}, which may be called explicitly or triggered by the list's {@link ReclaimPolicy}. The index widens
 * automatically as the pool grows, and only narrows during compaction.
 * </p>
 *
 * <p>
 * If the list's {@link CutoverPolicy} decides deduplication no longer pays for itself, the list <b>cuts over</b>: it copies its values
 * into a plain list and behaves as an ordinary list from then on (until {@link #clear() cleared}).
 * </p>
 *
 * <p>
 * Reclaim and cutover policies are consulted from inside modifications and must not modify the list themselves.
 * </p>
 *
 * <p>
 * This class is NOT thread-safe.
 * </p>
 *
 * @param <E> The type of values in the list
 */
public class CondensedList<E> extends AbstractList<E> implements RandomAccess {
	private static final Logger log = Logger.getLogger(CondensedList.class);

	/** Once the index is at its widest, the number of new pool entries between cutover checks */
	public static final int WIDE_CUTOVER_CHECK_INTERVAL = 1000;

	/**
	 * Builds {@link CondensedList}s
	 *
	 * @param <E> The type of values for the list
	 */
	public static class Builder<E> {
		private final TypeToken<E> theType;
		private int theInitCapacity;
		private Equalizer theEqualizer;
		private ReclaimPolicy theReclaimPolicy;
		private CutoverPolicy theCutoverPolicy;

		private Builder(TypeToken<E> type) {
			if (type == null)
				throw new NullPointerException("type");
			theType = type;
		}

		/**
		 * @param initCap The initial capacity for the list
		 * @return This builder
		 */
		public Builder<E> withInitCapacity(int initCap) {
			if (initCap < 0)
				throw new IllegalArgumentException(initCap + "<0");
			theInitCapacity = initCap;
			return this;
		}

		/**
		 * @param equalizer The equalizer to determine which values are duplicates
		 * @return This builder
		 */
		public Builder<E> withEqualizer(Equalizer equalizer) {
			if (equalizer == null)
				throw new NullPointerException("equalizer");
			theEqualizer = equalizer;
			return this;
		}

		/**
		 * @param policy The policy deciding when the list compacts its pool
		 * @return This builder
		 */
		public Builder<E> withReclaimPolicy(ReclaimPolicy policy) {
			if (policy == null)
				throw new NullPointerException("policy");
			theReclaimPolicy = policy;
			return this;
		}

		/**
		 * @param policy The policy deciding when the list stops deduplicating
		 * @return This builder
		 */
		public Builder<E> withCutoverPolicy(CutoverPolicy policy) {
			if (policy == null)
				throw new NullPointerException("policy");
			theCutoverPolicy = policy;
			return this;
		}

		/**
		 * Uses the {@link StandardCutoverPolicies#forType(TypeToken) standard cutover policy} for the list's type
		 *
		 * @return This builder
		 */
		public Builder<E> withStandardCutover() {
			return withCutoverPolicy(StandardCutoverPolicies.forType(theType));
		}

		/** @return A builder with the same settings as this one */
		public Builder<E> copy() {
			Builder<E> copy = new Builder<>(theType);
			copy.theInitCapacity = theInitCapacity;
			copy.theEqualizer = theEqualizer;
			copy.theReclaimPolicy = theReclaimPolicy;
			copy.theCutoverPolicy = theCutoverPolicy;
			return copy;
		}

		/** @return A new, empty list with this builder's settings */
		public CondensedList<E> build() {
			return new CondensedList<>(this, null);
		}

		/**
		 * Builds a list containing the given values. If the values are themselves a {@link CondensedList}, any of the equalizer and
		 * policies not set on this builder are taken from it. Otherwise, if no cutover policy was set, the
		 * {@link StandardCutoverPolicies#forType(TypeToken) standard policy} for the list's type is used.
		 *
		 * @param values The initial values for the list
		 * @return A new list with this builder's settings, containing the given values in order
		 */
		public CondensedList<E> buildFrom(Collection<? extends E> values) {
			if (values == null)
				throw new NullPointerException("values");
			return new CondensedList<>(this, values);
		}
	}

	/**
	 * @param <E> The type of values for the list
	 * @param type The type of values for the list
	 * @return A builder for a list of the given type
	 */
	public static <E> Builder<E> build(TypeToken<E> type) {
		return new Builder<>(type);
	}

	/**
	 * @param <E> The type of values for the list
	 * @param type The type of values for the list
	 * @return A builder for a list of the given type
	 */
	public static <E> Builder<E> build(Class<E> type) {
		return new Builder<>(TypeToken.of(type));
	}

	private final TypeToken<E> theType;
	private final Equalizer theEqualizer;
	private final ReclaimPolicy theReclaimPolicy;
	private final CutoverPolicy theCutoverPolicy;

	private InternPool<E> thePool;
	private OffsetIndex theIndex;
	/** Non-null only after cutover */
	private ArrayList<E> theValues;

	/** Creates an empty list of untyped values */
	@SuppressWarnings("unchecked")
	public CondensedList() {
		this((TypeToken<E>) (TypeToken<?>) TypeToken.of(Object.class));
	}

	/** @param type The type of values for the list */
	public CondensedList(TypeToken<E> type) {
		this(build(type), null);
	}

	/** @param type The type of values for the list */
	public CondensedList(Class<E> type) {
		this(TypeToken.of(type));
	}

	/**
	 * @param type The type of values for the list
	 * @param values The initial values for the list
	 * @see Builder#buildFrom(Collection)
	 */
	public CondensedList(TypeToken<E> type, Collection<? extends E> values) {
		this(build(type), values);
	}

	private CondensedList(Builder<E> builder, Collection<? extends E> values) {
		CondensedList<?> source = values instanceof CondensedList ? (CondensedList<?>) values : null;
		theType = builder.theType;
		if (builder.theEqualizer != null)
			theEqualizer = builder.theEqualizer;
		else
			theEqualizer = source != null ? source.getEqualizer() : Equalizer.object;
		if (builder.theReclaimPolicy != null)
			theReclaimPolicy = builder.theReclaimPolicy;
		else
			theReclaimPolicy = source != null ? source.getReclaimPolicy() : ReclaimPolicy.NEVER;
		if (builder.theCutoverPolicy != null)
			theCutoverPolicy = builder.theCutoverPolicy;
		else if (source != null)
			theCutoverPolicy = source.getCutoverPolicy();
		else if (values != null)
			theCutoverPolicy = StandardCutoverPolicies.forType(theType);
		else
			theCutoverPolicy = CutoverPolicy.NEVER;

		int capacity = builder.theInitCapacity;
		if (values != null)
			capacity = Math.max(capacity, values.size());
		thePool = new InternPool<>(theEqualizer);
		theIndex = IndexWidth.ONE_BIT.create(capacity);
		if (values != null) {
			for (E value : values)
				add(value);
		}
	}

	/** @return The type of values in this list */
	public TypeToken<E> getType() {
		return theType;
	}

	/** @return The equalizer this list uses to determine which values are duplicates */
	public Equalizer getEqualizer() {
		return theEqualizer;
	}

	/** @return The policy deciding when this list compacts its pool */
	public ReclaimPolicy getReclaimPolicy() {
		return theReclaimPolicy;
	}

	/** @return The policy deciding when this list stops deduplicating */
	public CutoverPolicy getCutoverPolicy() {
		return theCutoverPolicy;
	}

	/** @return Whether this list has stopped deduplicating its values */
	public boolean hasCutover() {
		return theValues != null;
	}

	/** @return The width of this list's index, or null if this list has cut over */
	public IndexWidth getIndexWidth() {
		return theIndex == null ? null : theIndex.getWidth();
	}

	/** @return The number of distinct values in this list */
	public int getUniqueCount() {
		if (theValues == null)
			return thePool.getLiveCount();
		HashSet<EqualizerNode<E>> unique = new HashSet<>();
		for (E value : theValues)
			unique.add(theEqualizer.nodeFor(value));
		return unique.size();
	}

	/** @return The number of values in this list's pool, including reclaimable ones, or -1 if this list has cut over */
	public int getPoolCount() {
		return thePool == null ? -1 : thePool.size();
	}

	/** @return The number of pooled values no longer held by any element, or -1 if this list has cut over */
	public int getReclaimableCount() {
		return thePool == null ? -1 : thePool.getReclaimableCount();
	}

	/** @return A snapshot of this list's storage counts */
	public CondensedStats getStats() {
		return new CondensedStats(size(), getUniqueCount(), getPoolCount(), getReclaimableCount());
	}

	/** @return The number of elements this list can hold without re-allocating its storage */
	public int getCapacity() {
		return theValues != null ? theValues.size() : theIndex.getCapacity();
	}

	/**
	 * @param capacity The number of elements this list should be able to hold without re-allocating its storage
	 * @throws IllegalArgumentException If <code>capacity</code> is less than this list's {@link #size() size}
	 */
	public void setCapacity(int capacity) {
		if (capacity < size())
			throw new IllegalArgumentException("Capacity " + capacity + " is less than size " + size());
		if (theValues == null)
			theIndex.setCapacity(capacity);
		else if (capacity == theValues.size())
			theValues.trimToSize();
		else
			theValues.ensureCapacity(capacity);
	}

	@Override
	public int size() {
		return theValues != null ? theValues.size() : theIndex.size();
	}

	@Override
	public boolean isEmpty() {
		return size() == 0;
	}

	private void checkIndex(int index, boolean forAdd) {
		int size = size();
		if (index < 0 || index > size || (!forAdd && index == size))
			throw new IndexOutOfBoundsException("Index " + index + ", size " + size);
	}

	@Override
	public E get(int index) {
		if (theValues != null)
			return theValues.get(index);
		checkIndex(index, false);
		return thePool.valueOf(theIndex.get(index));
	}

	@Override
	public E set(int index, E element) {
		if (theValues != null)
			return theValues.set(index, element);
		checkIndex(index, false);
		int code = codeFor(element);
		if (code < 0)
			return theValues.set(index, element);
		int oldCode = theIndex.set(index, code);
		E old = thePool.valueOf(oldCode);
		thePool.incrementRef(code);
		if (thePool.decrementRef(oldCode))
			reclaimed();
		return old;
	}

	@Override
	public boolean add(E e) {
		add(size(), e);
		return true;
	}

	@Override
	public void add(int index, E element) {
		if (theValues != null) {
			theValues.add(index, element);
			modCount++;
			return;
		}
		checkIndex(index, true);
		int code = codeFor(element);
		if (code < 0)
			theValues.add(index, element);
		else {
			theIndex.add(index, code);
			thePool.incrementRef(code);
		}
		modCount++;
	}

	@Override
	public E remove(int index) {
		if (theValues != null) {
			E old = theValues.remove(index);
			modCount++;
			return old;
		}
		checkIndex(index, false);
		int code = theIndex.remove(index);
		E old = thePool.valueOf(code);
		modCount++;
		if (thePool.decrementRef(code))
			reclaimed();
		return old;
	}

	@Override
	public int indexOf(Object o) {
		if (theValues != null) {
			for (int i = 0; i < theValues.size(); i++) {
				if (theEqualizer.equals(theValues.get(i), o))
					return i;
			}
			return -1;
		}
		int code = liveCode(o);
		return code < 0 ? -1 : theIndex.indexOf(code);
	}

	@Override
	public int lastIndexOf(Object o) {
		if (theValues != null) {
			for (int i = theValues.size() - 1; i >= 0; i--) {
				if (theEqualizer.equals(theValues.get(i), o))
					return i;
			}
			return -1;
		}
		int code = liveCode(o);
		return code < 0 ? -1 : theIndex.lastIndexOf(code);
	}

	@Override
	public boolean contains(Object o) {
		if (theValues != null)
			return indexOf(o) >= 0;
		return liveCode(o) >= 0;
	}

	private int liveCode(Object o) {
		int code = thePool.find(o);
		if (code < 0 || thePool.getRefCount(code) == 0)
			return -1;
		return code;
	}

	/** Removes all elements from this list, resuming deduplication if it had cut over. The capacity is kept. */
	@Override
	public void clear() {
		int capacity = getCapacity();
		if (theValues != null) {
			theValues = null;
			thePool = new InternPool<>(theEqualizer);
		} else
			thePool.clear();
		theIndex = IndexWidth.ONE_BIT.create(capacity);
		modCount++;
	}

	/**
	 * Passes each distinct value in this list, with the number of elements holding it, to an action. Values are visited in the order
	 * they were first added.
	 *
	 * @param action The action to receive each distinct value and its count
	 */
	public void forEachUnique(ObjIntConsumer<? super E> action) {
		if (theValues == null) {
			thePool.forEachLive(action);
			return;
		}
		Map<EqualizerNode<E>, int[]> counts = new LinkedHashMap<>();
		for (E value : theValues)
			counts.computeIfAbsent(theEqualizer.nodeFor(value), n -> new int[1])[0]++;
		for (Map.Entry<EqualizerNode<E>, int[]> entry : counts.entrySet())
			action.accept(entry.getKey().get(), entry.getValue()[0]);
	}

	/**
	 * Removes all reclaimable values from this list's pool, rewriting the index with the new codes and narrowing it if the remaining
	 * values allow. Either the whole compaction takes effect or, if it fails, none of it does.
	 *
	 * @return The number of values removed from the pool, or -1 if this list has cut over
	 * @throws CompactionFailedException If memory for the compacted structures could not be allocated
	 */
	public int compact() {
		if (theValues != null)
			return -1;
		else if (thePool.getReclaimableCount() == 0)
			return 0;
		InternPool<E>.Compaction compaction = thePool.prepareCompaction();
		int[] remap = compaction.getRemap();
		IndexWidth oldWidth = theIndex.getWidth();
		IndexWidth width = IndexWidth.forCodeCount(compaction.getNewSize());
		if (width.compareTo(oldWidth) > 0)
			width = oldWidth;
		OffsetIndex newIndex;
		try {
			newIndex = width.create(theIndex.getCapacity());
			int size = theIndex.size();
			for (int i = 0; i < size; i++) {
				int code = theIndex.get(i);
				int newCode = remap[code];
				if (newCode < 0) {
					String msg = "Element " + i + " references code " + code + ", which compaction would remove";
					log.error(msg);
					throw new InternalCorruptionException(msg);
				}
				newIndex.add(newCode);
			}
		} catch (OutOfMemoryError e) {
			throw new CompactionFailedException("Could not allocate a " + width + " index for " + theIndex.size() + " elements", e);
		}
		compaction.commit();
		theIndex = newIndex;
		if (log.isDebugEnabled()) {
			log.debug("Compacted " + compaction.getRemovedCount() + " reclaimable values; " + compaction.getNewSize() + " remain");
			if (width != oldWidth)
				log.debug("Narrowed index from " + oldWidth + " to " + width);
		}
		return compaction.getRemovedCount();
	}

	private void reclaimed() {
		if (theReclaimPolicy.shouldCompact(getStats()))
			compact();
	}

	/**
	 * Gets the code for a value about to be stored, widening the index if the value is new and its code would not fit
	 *
	 * @return The code for the value, which is interned but not yet referenced, or -1 if this list cut over instead
	 */
	private int codeFor(E value) {
		int code = thePool.find(value);
		if (code >= 0)
			return code;
		int newCode = thePool.size();
		IndexWidth width = theIndex.getWidth();
		if (!width.canHold(newCode)) {
			if (theCutoverPolicy.shouldCutover(getStats())) {
				cutover();
				return -1;
			}
			IndexWidth newWidth = width;
			while (!newWidth.canHold(newCode))
				newWidth = newWidth.wider();
			theIndex = newWidth.copyOf(theIndex, theIndex.getCapacity());
			if (log.isDebugEnabled())
				log.debug("Widened index from " + width + " to " + newWidth + " for " + size() + " elements");
		} else if (width == IndexWidth.FOUR_BYTES && newCode > StandardCutoverPolicies.WIDE_INDEX_THRESHOLD
			&& newCode % WIDE_CUTOVER_CHECK_INTERVAL == 0 && theCutoverPolicy.shouldCutover(getStats())) {
			cutover();
			return -1;
		}
		return thePool.intern(value);
	}

	private void cutover() {
		int size = theIndex.size();
		ArrayList<E> values = new ArrayList<>(Math.max(size, theIndex.getCapacity()));
		for (int i = 0; i < size; i++)
			values.add(thePool.valueOf(theIndex.get(i)));
		if (log.isDebugEnabled())
			log.debug("Cutting over to plain storage with " + thePool.getLiveCount() + " distinct values in " + size + " elements");
		theValues = values;
		thePool = null;
		theIndex = null;
	}
}
