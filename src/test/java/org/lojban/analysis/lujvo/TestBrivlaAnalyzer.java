package org.lojban.analysis.lujvo;

import java.util.Arrays;
import java.util.List;

import junit.framework.TestCase;

import org.lojban.analysis.lujvo.MorphologySettings.ConsonantRule;
import org.lojban.analysis.lujvo.MorphologySettings.YHyphens;

/**
 * Test word classification
 */
public class TestBrivlaAnalyzer extends TestCase {

    private LujvoMorphology morphology = null;

    public void setUp() {
        morphology = LujvoMorphology.getDefault();
    }

    public void testRoot() throws Exception {
        assertAnalysis("mlatu", WordType.ROOT, "mlatu");
    }

    public void testCompound() throws Exception {
        assertAnalysis("latkerlo", WordType.COMPOUND, "lat", "kerlo");
        assertAnalysis("tcanyja'a", WordType.COMPOUND, "tcan", "y", "ja'a");
        assertAnalysis("zaikla", WordType.COMPOUND, "zai", "kla");
    }

    public void testCompoundWithSuperfluousHyphen() throws Exception {
        assertAnalysis("zairkla", WordType.COMPOUND, "zai", "r", "kla");
    }

    public void testName() throws Exception {
        assertAnalysis("latker", WordType.NAME, "lat", "ker");
    }

    public void testLoanWord() throws Exception {
        assertAnalysis("spageti", WordType.LOAN_SHAPE, "spageti");
    }

    public void testExtendedCompound() throws Exception {
        assertAnalysis("spageti'yja'a", WordType.EXTENDED_COMPOUND, "spageti", "'y", "ja'a");
    }

    public void testNotBrivla() {
        assertNotBrivla("latkello");
        assertNotBrivla("");
        assertNotBrivla("mi");
        // a root word with its vowel dropped cannot be a name
        assertNotBrivla("mlat");
    }

    public void testLoneRafsiIsNotBrivla() {
        assertNotBrivla("zda");
        assertNotBrivla("xra");
        assertNotBrivla("dri");
        assertNotBrivla("bes");
        assertNotBrivla("dun");
        assertNotBrivla("sik");
        assertFalse(morphology.isBrivla("zda", MorphologySettings.DEFAULT));
    }

    public void testLoanWordEndingInRafsiShape() throws Exception {
        assertAnalysis("e'aiazda", WordType.LOAN_SHAPE, "e'aiazda");
    }

    public void testNoClusters() {
        assertRejected("tosytos", MorphologySettings.DEFAULT, "no clusters");
    }

    public void testCmavoShaped() {
        MorphologySettings twoConsonants = MorphologySettings.builder()
                .consonants(ConsonantRule.TWO_CONSONANTS)
                .build();
        assertRejected("tosytos", twoConsonants, "cmavo shaped or maybe multiple cmavo shaped");
    }

    public void testNotEnoughConsonants() {
        MorphologySettings oneConsonant = MorphologySettings.builder()
                .expRafsiShapes(true)
                .consonants(ConsonantRule.ONE_CONSONANT)
                .build();
        assertRejected("ua'y'a'u", oneConsonant, "not enough consonants");
    }

    public void testFallsOffAtY() {
        assertRejected("zai'yzai", MorphologySettings.DEFAULT, "falls off because y");
        assertRejected("zai'ykla", MorphologySettings.DEFAULT, "falls off because y");
    }

    public void testTosmabru() {
        assertRejected("toskeryto", MorphologySettings.DEFAULT, "tosmabru");
    }

    public void testSlinkuhiRejected() throws Exception {
        assertTrue(morphology.isSlinkuhi("slujvyctu", false));
        assertRejected("slujvyctu", MorphologySettings.DEFAULT, "slinku'i");
    }

    public void testNonDecomposableName() {
        assertRejected("bes", MorphologySettings.DEFAULT, "non-decomposable cmevla: {bes}");
    }

    public void testApostropheYAllowed() throws Exception {
        MorphologySettings allowY = MorphologySettings.builder().yHyphens(YHyphens.ALLOW_Y).build();
        BrivlaAnalysis analysis = morphology.analyse("zai'ykla", allowY);
        assertEquals(WordType.EXTENDED_COMPOUND, analysis.getType());
        assertEquals(Arrays.asList("zai", "'y", "kla"), analysis.getPieces());
    }

    public void testForceYRejectsRHyphen() throws Exception {
        MorphologySettings forceY = MorphologySettings.builder().yHyphens(YHyphens.FORCE_Y).build();
        assertAnalysis("baurnau", WordType.COMPOUND, "bau", "r", "nau");
        assertEquals(WordType.LOAN_SHAPE, morphology.analyse("baurnau", forceY).getType());
        BrivlaAnalysis analysis = morphology.analyse("banynau", forceY);
        assertEquals(WordType.COMPOUND, analysis.getType());
        assertEquals(Arrays.asList("ban", "y", "nau"), analysis.getPieces());
    }

    public void testMzCluster() throws Exception {
        MorphologySettings mz = MorphologySettings.builder().allowMz(true).build();
        assertNotBrivla("mamzdani");
        BrivlaAnalysis analysis = morphology.analyse("mamzdani", mz);
        assertEquals(WordType.COMPOUND, analysis.getType());
        assertEquals(Arrays.asList("mam", "zdani"), analysis.getPieces());
    }

    public void testConsonantRules() throws Exception {
        MorphologySettings.Builder exp = MorphologySettings.builder().expRafsiShapes(true);
        assertRejected("keryua", exp.consonants(ConsonantRule.CLUSTER).build(), "no clusters");
        BrivlaAnalysis analysis = morphology.analyse("keryua", exp.consonants(ConsonantRule.TWO_CONSONANTS).build());
        assertEquals(WordType.EXTENDED_COMPOUND, analysis.getType());
        assertEquals(Arrays.asList("ker", "y", "ua"), analysis.getPieces());
    }

    public void testGlidesCountAsConsonants() throws Exception {
        MorphologySettings.Builder oneConsonant = MorphologySettings.builder()
                .expRafsiShapes(true)
                .consonants(ConsonantRule.ONE_CONSONANT);
        try {
            morphology.analyse("keryua'yua", oneConsonant.glides(false).build());
            fail("keryua'yua needs glides counted as consonants");
        } catch (LujvoException e) {
            assertEquals(ErrorKind.NOT_BRIVLA, e.getKind());
        }
        BrivlaAnalysis analysis = morphology.analyse("keryua'yua", oneConsonant.glides(true).build());
        assertEquals(WordType.EXTENDED_COMPOUND, analysis.getType());
        assertEquals(Arrays.asList("ker", "y", "ua", "'y", "ua"), analysis.getPieces());
    }

    public void testCompoundUnderAllSettings() throws Exception {
        List<MorphologySettings> all = MorphologySettings.allCombinations();
        assertEquals(72, all.size());
        for (MorphologySettings settings : all) {
            BrivlaAnalysis analysis = morphology.analyse("latkerlo", settings);
            assertEquals(settings.toString(), WordType.COMPOUND, analysis.getType());
        }
    }

    public void testIsBrivla() {
        assertTrue(morphology.isBrivla("mlatu", MorphologySettings.DEFAULT));
        assertTrue(morphology.isBrivla("latkerlo", MorphologySettings.DEFAULT));
        assertTrue(morphology.isBrivla("spageti", MorphologySettings.DEFAULT));
        assertFalse(morphology.isBrivla("latker", MorphologySettings.DEFAULT));
        assertFalse(morphology.isBrivla("latkello", MorphologySettings.DEFAULT));
    }

    public void testIsGismuOrLujvo() throws Exception {
        assertTrue(morphology.isGismuOrLujvo("mlatu", false, false));
        assertTrue(morphology.isGismuOrLujvo("latkerlo", false, false));
        assertFalse(morphology.isGismuOrLujvo("latker", false, false));
        assertFalse(morphology.isGismuOrLujvo("spageti", false, false));
        assertFalse(morphology.isGismuOrLujvo("mi", false, false));
    }

    public void testSlinkuhi() throws Exception {
        assertFalse(morphology.isSlinkuhi("spageti", false));
    }

    private void assertAnalysis(String word, WordType type, String... pieces) throws LujvoException {
        BrivlaAnalysis analysis = morphology.analyse(word, MorphologySettings.DEFAULT);
        assertEquals(type, analysis.getType());
        assertEquals(Arrays.asList(pieces), analysis.getPieces());
    }

    private void assertRejected(String word, MorphologySettings settings, String reason) {
        try {
            BrivlaAnalysis analysis = morphology.analyse(word, settings);
            fail(word + " classified as " + analysis);
        } catch (LujvoException e) {
            assertEquals(ErrorKind.NOT_BRIVLA, e.getKind());
            assertEquals(reason, e.getMessage());
        }
    }

    private void assertNotBrivla(String word) {
        try {
            BrivlaAnalysis analysis = morphology.analyse(word, MorphologySettings.DEFAULT);
            fail(word + " classified as " + analysis);
        } catch (LujvoException e) {
            assertEquals(ErrorKind.NOT_BRIVLA, e.getKind());
        }
    }
}
