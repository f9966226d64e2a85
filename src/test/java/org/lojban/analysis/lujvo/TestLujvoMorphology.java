package org.lojban.analysis.lujvo;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import junit.framework.TestCase;

import org.lojban.analysis.lujvo.MorphologySettings.YHyphens;

/**
 * Test source word recovery, scoring and normalisation
 */
public class TestLujvoMorphology extends TestCase {

    private static final String[] ROUND_TRIP_TANRU = {
        "mlatu kerlo", "zarci klama", "zarci klama prenu", "tcana jatna", "spageti jatna",
        "gerku zdani", "cmalu klama", "klama zdani", "zdani mamta", "mamta zdani",
        "bangu nanmu", "cmavo bangu", "cmavo cmalu"
    };

    private LujvoMorphology morphology = null;

    public void setUp() {
        morphology = LujvoMorphology.getDefault();
    }

    public void testNormalise() {
        assertEquals("tcanyja'a", LujvoMorphology.normalise(".TcanyJaha"));
        assertEquals("mlatu", LujvoMorphology.normalise("mla,tu"));
        assertEquals("", LujvoMorphology.normalise(""));
        assertEquals("", LujvoMorphology.normalise("."));
        // only one leading period is removed
        assertEquals(".mi", LujvoMorphology.normalise("..mi"));
    }

    public void testNormaliseIsIdempotent() {
        String once = LujvoMorphology.normalise(".Spage,ti'yjaha");
        assertEquals(once, LujvoMorphology.normalise(once));
    }

    public void testRafsiIndices() {
        assertEquals(Arrays.asList(new Span(0, 4), new Span(5, 9)),
                LujvoMorphology.rafsiIndices(Arrays.asList("tcan", "y", "ja'a")));
        assertEquals(Arrays.asList(new Span(0, 3), new Span(4, 7)),
                LujvoMorphology.rafsiIndices(Arrays.asList("zai", "r", "kla")));
        assertEquals(Arrays.asList(new Span(0, 7), new Span(9, 13)),
                LujvoMorphology.rafsiIndices(Arrays.asList("spageti", "'y", "ja'a")));
        assertTrue(LujvoMorphology.rafsiIndices(Collections.<String>emptyList()).isEmpty());
    }

    public void testVeljvo() throws Exception {
        assertEquals(Arrays.asList("mlatu", "kerlo"), morphology.getVeljvo("latkerlo", MorphologySettings.DEFAULT));
        assertEquals(Arrays.asList("tcana", "jatna"), morphology.getVeljvo("tcanyja'a", MorphologySettings.DEFAULT));
        assertEquals(Arrays.asList("zarci", "klama", "prenu"),
                morphology.getVeljvo("zarklapre", MorphologySettings.DEFAULT));
    }

    public void testVeljvoOfLoanWordCompound() throws Exception {
        assertEquals(Arrays.asList("spageti", "jatna"),
                morphology.getVeljvo("spageti'yja'a", MorphologySettings.DEFAULT));
    }

    public void testVeljvoOfName() throws Exception {
        assertEquals(Arrays.asList("mlatu", "kerlo"), morphology.getVeljvo("latker", MorphologySettings.DEFAULT));
    }

    public void testVeljvoOfRoot() {
        try {
            morphology.getVeljvo("mlatu", MorphologySettings.DEFAULT);
            fail("mlatu is not a lujvo");
        } catch (LujvoException e) {
            assertEquals(ErrorKind.DECOMPOSITION_FAILED, e.getKind());
        }
    }

    public void testSelrafsi() {
        assertEquals("tcana", morphology.selrafsi("tcan"));
        assertEquals("jatna", morphology.selrafsi("ja'a"));
        assertNull(morphology.selrafsi("kerlo"));
    }

    public void testScoreMatchesBuilder() throws Exception {
        assertEquals(7937, morphology.scoreLujvo("latkerlo", MorphologySettings.DEFAULT));
        assertEquals(8597, morphology.scoreLujvo("tcanyja'a", MorphologySettings.DEFAULT));
        assertEquals(12235, morphology.scoreLujvo("spageti'yja'a", MorphologySettings.DEFAULT));
    }

    public void testScoreCountsRHyphen() throws Exception {
        assertEquals(2918 + 1100 + 2929, morphology.scoreLujvo("zairkla", MorphologySettings.DEFAULT));
    }

    public void testHyphensRaiseTheScore() throws Exception {
        MorphologySettings allowY = MorphologySettings.builder().yHyphens(YHyphens.ALLOW_Y).build();
        int bare = morphology.scoreLujvo("zaikla", MorphologySettings.DEFAULT);
        int withR = morphology.scoreLujvo("zairkla", MorphologySettings.DEFAULT);
        int withApostropheY = morphology.scoreLujvo("zai'ykla", allowY);
        assertEquals(5847, bare);
        assertEquals(2918 + 1700 + 2929, withApostropheY);
        assertTrue(bare < withR);
        assertTrue(withR < withApostropheY);
    }

    public void testScoreOfRoot() {
        try {
            morphology.scoreLujvo("mlatu", MorphologySettings.DEFAULT);
            fail("mlatu is not a lujvo");
        } catch (LujvoException e) {
            assertEquals(ErrorKind.DECOMPOSITION_FAILED, e.getKind());
        }
    }

    /**
     * Every built word classifies as a lujvo or name, splits back into the pieces the
     * builder placed, scores the same and rebuilds from its source words.
     */
    public void testRoundTripUnderAllSettings() throws Exception {
        for (String tanru : ROUND_TRIP_TANRU) {
            for (MorphologySettings settings : MorphologySettings.allCombinations()) {
                for (boolean cmevla : new boolean[] {false, true}) {
                    String context = tanru + (cmevla ? " (name) " : " ") + settings;
                    LujvoResult result = morphology.getLujvoWithAnalytics(tanru, cmevla, settings);
                    String lujvo = result.getLujvo();

                    BrivlaAnalysis analysis = morphology.analyse(lujvo, settings);
                    WordType type = analysis.getType();
                    if (cmevla) {
                        assertEquals(context, WordType.NAME, type);
                    } else {
                        assertTrue(context + " is " + type,
                                type == WordType.COMPOUND || type == WordType.EXTENDED_COMPOUND);
                    }
                    assertEquals(context, lujvo, join(analysis.getPieces()));
                    assertEquals(context, result.getRafsiSpans(), LujvoMorphology.rafsiIndices(analysis.getPieces()));
                    if (type == WordType.COMPOUND) {
                        boolean allowRn = settings.getYHyphens() != YHyphens.FORCE_Y;
                        assertEquals(context, analysis.getPieces(), morphology.decompose(lujvo, allowRn, settings));
                    }

                    assertEquals(context, result.getScore(), morphology.scoreLujvo(lujvo, settings));
                    List<String> veljvo = morphology.getVeljvo(lujvo, settings);
                    assertEquals(context, lujvo, morphology.getLujvo(veljvo, cmevla, settings));
                }
            }
        }
    }

    private static String join(List<String> pieces) {
        StringBuilder sb = new StringBuilder();
        for (String piece : pieces) {
            sb.append(piece);
        }
        return sb.toString();
    }

    public void testPredicates() {
        assertTrue(morphology.isGismu("mlatu", false));
        assertFalse(morphology.isGismu("latkerlo", false));
        assertTrue(morphology.isValidRafsi("ja'a", false));
        assertTrue(morphology.isValidRafsi("jaha", false));
        assertFalse(morphology.isValidRafsi("kell", false));
    }

    public void testSettingsBuilder() {
        MorphologySettings settings = MorphologySettings.builder()
                .yHyphens(MorphologySettings.YHyphens.FORCE_Y)
                .allowMz(true)
                .build();
        assertEquals(MorphologySettings.YHyphens.FORCE_Y, settings.getYHyphens());
        assertTrue(settings.isAllowMz());
        assertEquals(settings, settings.toBuilder().build());
        assertFalse(settings.equals(MorphologySettings.DEFAULT));
        assertSame(MorphologySettings.DEFAULT, MorphologySettings.standard(false));
    }
}
