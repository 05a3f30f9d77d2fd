package org.qondense.collect;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.qondense.Equalizer;

/** Tests {@link InternPool} */
public class InternPoolTest {
	/** Tests that equal values share a code and that codes are assigned consecutively */
	@Test
	public void testIntern() {
		InternPool<String> pool = new InternPool<>(Equalizer.object);
		assertEquals(0, pool.intern("a"));
		assertEquals(1, pool.intern("b"));
		assertEquals(0, pool.intern(new String("a")));
		assertEquals(2, pool.intern(null));
		assertEquals(2, pool.intern(null));
		assertEquals(3, pool.size());
		assertEquals(0, pool.find("a"));
		assertEquals(2, pool.find(null));
		assertEquals(-1, pool.find("c"));
		assertEquals(-1, pool.find(5));
		assertEquals("b", pool.valueOf(1));
		assertNull(pool.valueOf(2));

		// Interning alone does not reference anything
		assertEquals(0, pool.getLiveCount());
		assertEquals(3, pool.getReclaimableCount());
	}

	/** Tests deduplication by a custom equalizer */
	@Test
	public void testEqualizer() {
		InternPool<String> pool = new InternPool<>(Equalizer.caseInsensitive);
		assertEquals(0, pool.intern("Hello"));
		assertEquals(0, pool.intern("HELLO"));
		assertEquals(0, pool.find("hello"));
		assertEquals("Hello", pool.valueOf(0));

		InternPool<String> idPool = new InternPool<>(Equalizer.id);
		String a = "a";
		assertEquals(0, idPool.intern(a));
		assertEquals(1, idPool.intern(new String(a)));
		assertEquals(0, idPool.find(a));
	}

	/** Tests reference counting */
	@Test
	public void testRefCounts() {
		InternPool<String> pool = new InternPool<>(Equalizer.object);
		int a = pool.intern("a");
		int b = pool.intern("b");
		pool.incrementRef(a);
		pool.incrementRef(a);
		pool.incrementRef(b);
		assertEquals(2, pool.getRefCount(a));
		assertEquals(2, pool.getLiveCount());
		assertEquals(0, pool.getReclaimableCount());

		assertFalse(pool.decrementRef(a));
		assertTrue(pool.decrementRef(a));
		assertEquals(0, pool.getRefCount(a));
		assertEquals(1, pool.getLiveCount());
		assertEquals(1, pool.getReclaimableCount());

		// A reclaimable value keeps its code when interned again
		assertEquals(a, pool.intern("a"));
		pool.incrementRef(a);
		assertEquals(0, pool.getReclaimableCount());
	}

	/** Tests detection of broken invariants */
	@Test
	public void testCorruption() {
		InternPool<String> pool = new InternPool<>(Equalizer.object);
		int a = pool.intern("a");
		try {
			pool.decrementRef(a);
			Assert.fail("Decrementing an unreferenced code should be detected");
		} catch (InternalCorruptionException e) {
		}
		try {
			pool.valueOf(1);
			Assert.fail("Unknown codes should be detected");
		} catch (InternalCorruptionException e) {
		}
		try {
			pool.incrementRef(-1);
			Assert.fail("Unknown codes should be detected");
		} catch (InternalCorruptionException e) {
		}
		assertEquals(0, pool.getRefCount(a));
	}

	/** Tests that compaction drops unreferenced values and renumbers the rest in order */
	@Test
	public void testCompact() {
		InternPool<Integer> pool = new InternPool<>(Equalizer.object);
		for (int i = 0; i < 10; i++) {
			assertEquals(i, pool.intern(i));
			pool.incrementRef(i);
			pool.incrementRef(i);
		}
		for (int i = 0; i < 10; i += 3) {
			pool.decrementRef(i);
			pool.decrementRef(i);
		}
		assertEquals(4, pool.getReclaimableCount());
		int[] remap = pool.compact();
		assertArrayEquals(new int[] { -1, 0, 1, -1, 2, 3, -1, 4, 5, -1 }, remap);
		assertEquals(6, pool.size());
		assertEquals(0, pool.getReclaimableCount());
		List<Integer> live = new ArrayList<>();
		pool.forEachLive((value, count) -> {
			assertEquals(2, count);
			live.add(value);
		});
		assertEquals(Arrays.asList(1, 2, 4, 5, 7, 8), live);
		assertEquals(3, pool.find(5));
		assertEquals(-1, pool.find(3));
		assertEquals(2, pool.getRefCount(3));
		assertEquals(6, pool.intern(3));
	}

	/** Tests the two phases of compaction */
	@Test
	public void testPreparedCompaction() {
		InternPool<String> pool = new InternPool<>(Equalizer.object);
		pool.intern("a");
		pool.incrementRef(pool.intern("b"));
		InternPool<String>.Compaction compaction = pool.prepareCompaction();
		assertEquals(1, compaction.getRemovedCount());
		assertEquals(1, compaction.getNewSize());
		// Nothing changes until the compaction is committed
		assertEquals(2, pool.size());
		assertEquals(0, pool.find("a"));
		compaction.commit();
		assertEquals(1, pool.size());
		assertEquals(0, pool.find("b"));
		try {
			compaction.commit();
			Assert.fail("Compactions may only be committed once");
		} catch (IllegalStateException e) {
		}

		pool.intern("c");
		compaction = pool.prepareCompaction();
		pool.intern("d");
		try {
			compaction.commit();
			Assert.fail("A stale compaction should be rejected");
		} catch (IllegalStateException e) {
		}
		assertEquals(3, pool.size());
		assertEquals("d", pool.valueOf(2));

		// Reference count changes also make a prepared compaction stale
		InternPool<String> refPool = new InternPool<>(Equalizer.object);
		int a = refPool.intern("a");
		int b = refPool.intern("b");
		refPool.incrementRef(a);
		refPool.incrementRef(b);
		compaction = refPool.prepareCompaction();
		assertTrue(refPool.decrementRef(a));
		try {
			compaction.commit();
			Assert.fail("A compaction prepared before a reference change should be rejected");
		} catch (IllegalStateException e) {
		}
		assertEquals(0, refPool.getRefCount(a));
		assertEquals(1, refPool.getLiveCount());
		assertEquals(1, refPool.getReclaimableCount());
		compaction = refPool.prepareCompaction();
		refPool.incrementRef(b);
		try {
			compaction.commit();
			Assert.fail("A compaction prepared before a reference change should be rejected");
		} catch (IllegalStateException e) {
		}
		assertEquals(2, refPool.getRefCount(b));
		assertArrayEquals(new int[] { -1, 0 }, refPool.compact());
		assertEquals(2, refPool.getRefCount(0));
		assertEquals(1, refPool.size());
	}

	/** Tests clearing the pool */
	@Test
	public void testClear() {
		InternPool<String> pool = new InternPool<>(Equalizer.object);
		for (int i = 0; i < 50; i++)
			pool.incrementRef(pool.intern("v" + i));
		pool.clear();
		assertEquals(0, pool.size());
		assertEquals(0, pool.getLiveCount());
		assertEquals(-1, pool.find("v0"));
		assertEquals(0, pool.intern("x"));
		assertEquals(0, pool.getRefCount(0));
	}
}
