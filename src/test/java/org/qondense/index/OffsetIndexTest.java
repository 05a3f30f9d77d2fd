package org.qondense.index;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

/** Tests the {@link OffsetIndex} implementations and {@link IndexWidth} */
public class OffsetIndexTest {
	/** Tests width selection and ordering */
	@Test
	public void testWidths() {
		assertSame(IndexWidth.ONE_BIT, IndexWidth.forCodeCount(0));
		assertSame(IndexWidth.ONE_BIT, IndexWidth.forCodeCount(2));
		assertSame(IndexWidth.ONE_BYTE, IndexWidth.forCodeCount(3));
		assertSame(IndexWidth.ONE_BYTE, IndexWidth.forCodeCount(256));
		assertSame(IndexWidth.TWO_BYTES, IndexWidth.forCodeCount(257));
		assertSame(IndexWidth.TWO_BYTES, IndexWidth.forCodeCount(65536));
		assertSame(IndexWidth.FOUR_BYTES, IndexWidth.forCodeCount(65537));
		assertSame(IndexWidth.FOUR_BYTES, IndexWidth.forCodeCount(Integer.MAX_VALUE));

		assertSame(IndexWidth.ONE_BYTE, IndexWidth.ONE_BIT.wider());
		assertSame(IndexWidth.TWO_BYTES, IndexWidth.ONE_BYTE.wider());
		assertSame(IndexWidth.FOUR_BYTES, IndexWidth.TWO_BYTES.wider());
		assertNull(IndexWidth.FOUR_BYTES.wider());

		assertTrue(IndexWidth.ONE_BYTE.canHold(255));
		assertFalse(IndexWidth.ONE_BYTE.canHold(256));
		assertFalse(IndexWidth.FOUR_BYTES.canHold(-1));
		assertEquals(16, IndexWidth.TWO_BYTES.getBitsPerCode());
	}

	/** Tests storing the largest code of each width, and rejection of the next one */
	@Test
	public void testMaxCodes() {
		for (IndexWidth width : IndexWidth.values()) {
			OffsetIndex index = width.create(4);
			assertSame(width, index.getWidth());
			int max = width.getMaxCode();
			index.add(max);
			index.add(0);
			assertEquals(max, index.get(0));
			assertEquals(0, index.get(1));
			assertEquals(max, index.set(0, 0));
			assertEquals(0, index.get(0));
			if (width != IndexWidth.FOUR_BYTES) {
				try {
					index.add(max + 1);
					Assert.fail("Code " + (max + 1) + " should not fit in " + width);
				} catch (IllegalArgumentException e) {
				}
				try {
					index.set(0, max + 1);
					Assert.fail("Code " + (max + 1) + " should not fit in " + width);
				} catch (IllegalArgumentException e) {
				}
			}
			try {
				index.add(0, -1);
				Assert.fail("Negative codes should be rejected");
			} catch (IllegalArgumentException e) {
			}
			assertEquals(2, index.size());
			assertEquals(0, index.get(0));
			assertEquals(-1, index.indexOf(-1));
			assertEquals(-1, index.indexOf(max == 1 ? 5 : max));
		}
	}

	/** Tests insertion, removal and search in each width */
	@Test
	public void testInsertRemove() {
		Random random = new Random(1357);
		for (IndexWidth width : IndexWidth.values()) {
			OffsetIndex index = width.create(0);
			List<Integer> mirror = new ArrayList<>();
			int codeRange = (int) Math.min(width.getCodeCapacity(), 1000);
			for (int op = 0; op < 5000; op++) {
				int code = random.nextInt(codeRange);
				int size = mirror.size();
				switch (size == 0 ? 0 : random.nextInt(4)) {
				case 0:
					index.add(code);
					mirror.add(code);
					break;
				case 1:
					int i = random.nextInt(size + 1);
					index.add(i, code);
					mirror.add(i, code);
					break;
				case 2:
					i = random.nextInt(size);
					assertEquals(width + " @" + op, (int) mirror.remove(i), index.remove(i));
					break;
				default:
					i = random.nextInt(size);
					assertEquals(width + " @" + op, (int) mirror.set(i, code), index.set(i, code));
					break;
				}
				assertEquals(mirror.size(), index.size());
				assertEquals(mirror.indexOf(code), index.indexOf(code));
				assertEquals(mirror.lastIndexOf(code), index.lastIndexOf(code));
				assertEquals(mirror.contains(code), index.contains(code));
			}
			for (int i = 0; i < mirror.size(); i++)
				assertEquals(width + " @" + i, (int) mirror.get(i), index.get(i));
		}
	}

	/** Tests range checks on positions */
	@Test
	public void testBounds() {
		for (IndexWidth width : IndexWidth.values()) {
			OffsetIndex index = width.create(10);
			assertTrue(index.isEmpty());
			index.add(1);
			try {
				index.get(1);
				Assert.fail();
			} catch (IndexOutOfBoundsException e) {
			}
			try {
				index.add(2, 0);
				Assert.fail();
			} catch (IndexOutOfBoundsException e) {
			}
			try {
				index.remove(-1);
				Assert.fail();
			} catch (IndexOutOfBoundsException e) {
			}
			try {
				index.set(1, 0);
				Assert.fail();
			} catch (IndexOutOfBoundsException e) {
			}
			assertEquals(1, index.size());
			assertEquals(1, index.get(0));
		}
	}

	/** Tests capacity management */
	@Test
	public void testCapacity() {
		for (IndexWidth width : IndexWidth.values()) {
			OffsetIndex index = width.create(100);
			assertTrue(width + ": " + index.getCapacity(), index.getCapacity() >= 100);
			for (int i = 0; i < 50; i++)
				index.add(i % 2);
			index.setCapacity(50);
			assertTrue(index.getCapacity() >= 50);
			try {
				index.setCapacity(49);
				Assert.fail("Capacity below size should be rejected");
			} catch (IllegalArgumentException e) {
			}
			int capacity = index.getCapacity();
			index.clear();
			assertEquals(0, index.size());
			assertEquals(capacity, index.getCapacity());
			try {
				width.create(-1);
				Assert.fail("Negative capacity should be rejected");
			} catch (IllegalArgumentException e) {
			}
		}
	}

	/** Tests copying an index into a wider one */
	@Test
	public void testCopy() {
		OffsetIndex bits = IndexWidth.ONE_BIT.create(0);
		for (int i = 0; i < 200; i++)
			bits.add(i % 3 == 0 ? 1 : 0);
		OffsetIndex bytes = IndexWidth.ONE_BYTE.copyOf(bits, 500);
		assertSame(IndexWidth.ONE_BYTE, bytes.getWidth());
		assertEquals(200, bytes.size());
		assertTrue(bytes.getCapacity() >= 500);
		for (int i = 0; i < 200; i++)
			assertEquals(bits.get(i), bytes.get(i));
		bytes.add(255);

		OffsetIndex ints = IndexWidth.FOUR_BYTES.copyOf(bytes, 0);
		assertEquals(201, ints.size());
		assertEquals(255, ints.get(200));
		try {
			IndexWidth.ONE_BIT.copyOf(bytes, 0);
			Assert.fail("Codes too wide for the target should be rejected");
		} catch (IllegalArgumentException e) {
		}
	}
}
