package org.lojban.analysis.lujvo;

import java.util.Arrays;

import junit.framework.TestCase;

/**
 * Test cluster tables and syllable rules
 */
public class TestPhonotactics extends TestCase {

    private Phonotactics phonotactics = null;

    public void setUp() {
        phonotactics = LujvoMorphology.getDefault().phonotactics();
    }

    public void testClusterTables() {
        ClusterTables tables = phonotactics.tables();
        assertTrue(tables.isValid("tk", false));
        assertTrue(tables.isValid("rl", false));
        assertFalse(tables.isValid("ll", false));
        assertFalse(tables.isValid("mz", false));
        assertTrue(tables.isValid("mz", true));
        assertTrue(tables.isInitial("tc"));
        assertTrue(tables.isInitial("kl"));
        assertFalse(tables.isInitial("tk"));
    }

    public void testGismu() {
        assertTrue(phonotactics.isGismu("mlatu", false));
        assertTrue(phonotactics.isGismu("kerlo", false));
        assertFalse(phonotactics.isGismu("kello", false));
        assertFalse(phonotactics.isGismu("latkerlo", false));
    }

    public void testValidRafsi() {
        assertTrue(phonotactics.isValidRafsi("lat", false));
        assertTrue(phonotactics.isValidRafsi("ja'a", false));
        assertTrue(phonotactics.isValidRafsi("tcan", false));
        assertFalse(phonotactics.isValidRafsi("kell", false));
        assertFalse(phonotactics.isValidRafsi("y", false));
        assertFalse(phonotactics.isValidRafsi("spageti", false));
    }

    public void testSplitVowelCluster() throws Exception {
        assertEquals(Arrays.asList("a", "ia"), phonotactics.splitVowelCluster("aia"));
        assertEquals(Arrays.asList("a", "ii"), phonotactics.splitVowelCluster("aii"));
    }

    public void testSplitVowelClusterFails() {
        try {
            phonotactics.splitVowelCluster("aiia");
            fail("aiia has no valid syllable split");
        } catch (LujvoException e) {
            assertEquals(ErrorKind.DECOMPOSITION_FAILED, e.getKind());
        }
    }
}
