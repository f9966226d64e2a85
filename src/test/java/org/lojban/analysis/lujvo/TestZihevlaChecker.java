package org.lojban.analysis.lujvo;

import junit.framework.TestCase;

/**
 * Test loan word and experimental rafsi shape checks
 */
public class TestZihevlaChecker extends TestCase {

    private ZihevlaChecker checker = null;

    public void setUp() {
        checker = LujvoMorphology.getDefault().zihevlaChecker();
    }

    public void testLoanWord() throws Exception {
        assertEquals(WordShape.LOAN_SHAPE, checker.check("spageti", true, false, false));
    }

    public void testTailThatIsOnlyARafsi() throws Exception {
        // zda alone is not a word, so the loan word does not fall apart at its cluster
        assertEquals(WordShape.LOAN_SHAPE, checker.check("e'aiazda", true, false, false));
    }

    public void testExperimentalRafsiShape() throws Exception {
        assertEquals(WordShape.RAFSI_SHAPE, checker.check("ba", false, true, false));
    }

    public void testSingleSyllableNeedsExperimentalShapes() {
        assertNotZihevla("ba", false, false);
    }

    public void testTooShortForLoanWord() {
        assertNotZihevla("ba", true, true);
    }

    public void testInvalidCluster() {
        assertNotZihevla("latkello", true, false);
        assertNotZihevla("latkello", false, true);
    }

    public void testApostropheBetweenVowels() {
        assertNotZihevla("spage'", true, false);
    }

    private void assertNotZihevla(String valsi, boolean requireZihevla, boolean expRafsiShapes) {
        try {
            WordShape shape = checker.check(valsi, requireZihevla, expRafsiShapes, false);
            fail(valsi + " passed as " + shape);
        } catch (LujvoException e) {
            assertEquals(ErrorKind.NOT_ZIHEVLA, e.getKind());
        }
    }
}
