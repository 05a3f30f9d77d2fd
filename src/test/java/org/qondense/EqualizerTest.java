package org.qondense;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.junit.Test;
import org.qondense.Equalizer.EqualizerNode;

/** Tests {@link Equalizer} */
public class EqualizerTest {
	/** Tests that nodes from the standard equalizers work as hash keys */
	@Test
	public void testNodes() {
		Map<EqualizerNode<String>, Integer> map = new HashMap<>();
		map.put(Equalizer.caseInsensitive.nodeFor("Key"), 1);
		assertEquals(Integer.valueOf(1), map.get(Equalizer.caseInsensitive.nodeFor("KEY")));
		map.put(Equalizer.caseInsensitive.nodeFor(null), 2);
		assertEquals(Integer.valueOf(2), map.get(Equalizer.caseInsensitive.nodeFor(null)));
		assertEquals(2, map.size());

		String a = "a";
		String otherA = new String(a);
		assertTrue(Equalizer.object.equals(a, otherA));
		assertFalse(Equalizer.id.equals(a, otherA));
		assertFalse(Equalizer.id.nodeFor(a).equals(Equalizer.id.nodeFor(otherA)));
		assertTrue(Equalizer.object.nodeFor(a).equals(Equalizer.object.nodeFor(otherA)));
		assertEquals(Equalizer.object.nodeFor(a).hashCode(), Equalizer.object.nodeFor(otherA).hashCode());
		assertTrue(Equalizer.object.equals(null, null));
		assertFalse(Equalizer.caseInsensitive.equals(null, "null"));
	}

	/** Tests that case-insensitive hashing agrees with case-insensitive equality regardless of the default locale */
	@Test
	public void testCaseInsensitiveHash() {
		Locale locale = Locale.getDefault();
		Locale.setDefault(new Locale("tr", "TR"));
		try {
			assertTrue(Equalizer.caseInsensitive.equals("TITLE", "title"));
			assertEquals(Equalizer.caseInsensitive.hash("TITLE"), Equalizer.caseInsensitive.hash("title"));
		} finally {
			Locale.setDefault(locale);
		}
		assertTrue(Equalizer.caseInsensitive.equals("\u0130", "i"));
		assertEquals(Equalizer.caseInsensitive.hash("\u0130"), Equalizer.caseInsensitive.hash("i"));
		assertTrue(Equalizer.caseInsensitive.equals("Stra\u00dfe", "STRA\u00dfE"));
		assertEquals(Equalizer.caseInsensitive.hash("Stra\u00dfe"), Equalizer.caseInsensitive.hash("STRA\u00dfE"));
		assertEquals(Equalizer.caseInsensitive.hash(new StringBuilder("Key")), Equalizer.caseInsensitive.hash("kEY"));
	}
}
