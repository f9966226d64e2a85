package org.lojban.analysis.lujvo;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

import junit.framework.TestCase;

/**
 * Test the FST backed rafsi lookup
 */
public class TestRafsiDictionary extends TestCase {

    private RafsiDictionary dictionary = null;

    public void setUp() {
        dictionary = RafsiDictionary.getDefault();
    }

    public void testRafsiInPriorityOrder() {
        assertEquals(Arrays.asList("zar", "zai"), dictionary.rafsiFor("zarci"));
        assertEquals(Arrays.asList("jat", "ja'a"), dictionary.rafsiFor("jatna"));
        assertEquals(Collections.singletonList("lat"), dictionary.rafsiFor("mlatu"));
    }

    public void testWordWithoutRafsi() {
        assertTrue(dictionary.contains("tcana"));
        assertTrue(dictionary.rafsiFor("tcana").isEmpty());
    }

    public void testUnknownWord() {
        assertFalse(dictionary.contains("spageti"));
        assertTrue(dictionary.rafsiFor("spageti").isEmpty());
        assertNull(dictionary.valsiForRafsi("xyz"));
        assertNull(dictionary.valsiForRafsi(""));
    }

    public void testReverseLookup() {
        assertEquals("jatna", dictionary.valsiForRafsi("ja'a"));
        assertEquals("mlatu", dictionary.valsiForRafsi("lat"));
        assertEquals("zarci", dictionary.valsiForRafsi("zai"));
    }

    public void testBuildFromMap() {
        TreeMap<String, List<String>> entries = new TreeMap<>();
        entries.put("gerku", Arrays.asList("ger", "ge'u"));
        entries.put("mlatu", Collections.singletonList("lat"));
        RafsiDictionary small = RafsiDictionary.build(entries);

        assertEquals(2, small.size());
        assertEquals(Arrays.asList("ger", "ge'u"), small.rafsiFor("gerku"));
        assertEquals("gerku", small.valsiForRafsi("ge'u"));
        assertFalse(small.contains("kerlo"));
    }

    public void testLoadSkipsCommentsAndDuplicates() throws IOException {
        String text = "# comment\n\nmlatu lat\nmlatu mla\nkerlo ker\n";
        RafsiDictionary loaded = RafsiDictionary.load(
                new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));

        assertEquals(2, loaded.size());
        assertEquals(Collections.singletonList("lat"), loaded.rafsiFor("mlatu"));
        assertNull(loaded.valsiForRafsi("mla"));
    }

    public void testLoadRejectsNonLojbanWord() {
        try {
            RafsiDictionary.load(new ByteArrayInputStream("k3rlo ker\n".getBytes(StandardCharsets.UTF_8)));
            fail("k3rlo is not a Lojban word");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("k3rlo"));
        }
    }
}
