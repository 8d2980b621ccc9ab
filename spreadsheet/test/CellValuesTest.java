import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Cell text coercion tests.
 */
public class CellValuesTest {

    @Test
    public void testParseLeadingNumber() {
        assertEquals(12d, CellValues.parseLeadingNumber("12abc"), 0);
        assertEquals(3.5d, CellValues.parseLeadingNumber(" 3.5 "), 0);
        assertEquals(-2d, CellValues.parseLeadingNumber("-2"), 0);
        assertEquals(0.5d, CellValues.parseLeadingNumber(".5"), 0);
        assertEquals(1000d, CellValues.parseLeadingNumber("1e3"), 0);
        assertEquals(7d, CellValues.parseLeadingNumber("7."), 0);
    }

    @Test
    public void testParseLeadingNumberNaN() {
        assertTrue(Double.isNaN(CellValues.parseLeadingNumber("abc")));
        assertTrue(Double.isNaN(CellValues.parseLeadingNumber("")));
        assertTrue(Double.isNaN(CellValues.parseLeadingNumber(null)));
        assertTrue(Double.isNaN(CellValues.parseLeadingNumber("#DIV/0!")));
        assertTrue(Double.isNaN(CellValues.parseLeadingNumber("=A1+1")));
    }

    @Test
    public void testToNumber() {
        assertEquals(0d, CellValues.toNumber("#REF!"), 0);
        assertEquals(0d, CellValues.toNumber(""), 0);
        assertEquals(0d, CellValues.toNumber(null), 0);
        assertEquals(42d, CellValues.toNumber("42"), 0);
    }

    @Test
    public void testStripTags() {
        assertEquals("5", CellValues.stripTags("<b>5</b>"));
        assertEquals("a b", CellValues.stripTags("a<br/> b"));
        assertEquals("", CellValues.stripTags(null));
    }

    @Test
    public void testGridContextBounds() {
        String[][] data = {{"1", null}, {"3"}};
        CellContext context = CellContext.of(data, 2, 2);
        assertEquals(2, context.getRows());
        assertEquals(2, context.getCols());
        assertEquals(1d, context.getCellValue(0, 0), 0);
        assertEquals("", context.getCellText(0, 1));
        assertEquals("", context.getCellText(1, 1));
        assertEquals(0d, context.getCellValue(5, 0), 0);
        assertEquals(0d, context.getCellValue(-1, 0), 0);
    }
}
