package org.lojban.analysis.lujvo;

import junit.framework.TestCase;

/**
 * Test rafsi shape classification
 */
public class TestShape extends TestCase {

    public void testRafsiShapes() {
        assertEquals(Shape.CVC, Shape.of("lat"));
        assertEquals(Shape.CCVC, Shape.of("tcan"));
        assertEquals(Shape.CVCC, Shape.of("kerl"));
        assertEquals(Shape.CVHV, Shape.of("ja'a"));
        assertEquals(Shape.CVV, Shape.of("zai"));
        assertEquals(Shape.CCV, Shape.of("bla"));
        assertEquals(Shape.CCVCV, Shape.of("mlatu"));
        assertEquals(Shape.CVCCV, Shape.of("kerlo"));
    }

    public void testHyphens() {
        assertEquals(Shape.HYPHEN, Shape.of("y"));
        assertEquals(Shape.HYPHEN, Shape.of("'y"));
    }

    public void testOther() {
        assertEquals(Shape.OTHER, Shape.of(""));
        assertEquals(Shape.OTHER, Shape.of("a"));
        assertEquals(Shape.OTHER, Shape.of("ua"));
        assertEquals(0, Shape.OTHER.rank());
    }

    public void testIgnoringHyphens() {
        assertEquals(Shape.CVC, Shape.ignoringHyphens("laty"));
        assertEquals(Shape.CVHV, Shape.ignoringHyphens("'ja'a"));
    }

    public void testGismuShape() {
        assertTrue(Shape.isGismuShape("mlatu"));
        assertTrue(Shape.isGismuShape("kerlo"));
        assertFalse(Shape.isGismuShape("lat"));
        assertFalse(Shape.isGismuShape("spageti"));
    }
}
