import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 * Formula tokenizer tests.
 */
public class FormulaLexerTest {

    private static void assertKinds(List<Token> tokens, TokenKind... kinds) {
        assertEquals("Token count of " + tokens, kinds.length, tokens.size());
        for (int i = 0; i < kinds.length; i++) {
            assertEquals("Token " + i + " of " + tokens, kinds[i], tokens.get(i).getKind());
        }
    }

    @Test
    public void testArithmetic() {
        List<Token> tokens = FormulaLexer.tokenize("1 + 2.5*A1");
        assertKinds(tokens, TokenKind.NUMBER, TokenKind.OPERATOR, TokenKind.NUMBER,
                TokenKind.OPERATOR, TokenKind.CELL_REF);
        assertEquals(1d, tokens.get(0).getNumber(), 0);
        assertEquals('+', tokens.get(1).getOperator());
        assertEquals(2.5d, tokens.get(2).getNumber(), 0);
        assertEquals('*', tokens.get(3).getOperator());
        assertEquals("A1", tokens.get(4).getText());
    }

    @Test
    public void testFunctionCall() {
        List<Token> tokens = FormulaLexer.tokenize("sum(a1:bc22)");
        assertKinds(tokens, TokenKind.IDENTIFIER, TokenKind.LPAREN, TokenKind.CELL_REF,
                TokenKind.COLON, TokenKind.CELL_REF, TokenKind.RPAREN);
        assertEquals("SUM", tokens.get(0).getText());
        assertEquals("A1", tokens.get(2).getText());
        assertEquals("BC22", tokens.get(4).getText());
    }

    @Test
    public void testLettersGluedToDigitsAreReference() {
        List<Token> tokens = FormulaLexer.tokenize("SUM1");
        assertKinds(tokens, TokenKind.CELL_REF);
        assertEquals("SUM1", tokens.get(0).getText());
    }

    @Test
    public void testLeadingDotNumber() {
        List<Token> tokens = FormulaLexer.tokenize(".5-3");
        assertKinds(tokens, TokenKind.NUMBER, TokenKind.OPERATOR, TokenKind.NUMBER);
        assertEquals(0.5d, tokens.get(0).getNumber(), 0);
    }

    @Test
    public void testBlank() {
        assertTrue(FormulaLexer.tokenize("").isEmpty());
        assertTrue(FormulaLexer.tokenize("  \t ").isEmpty());
    }

    @Test
    public void testInvalidNumber() {
        try {
            FormulaLexer.tokenize("1.2.3 + 4");
            fail("Two decimal points must be rejected");
        } catch (InvalidFormulaException e) {
            assertEquals("Invalid number: 1.2.3", e.getMessage());
        }
    }

    @Test(expected = InvalidFormulaException.class)
    public void testTrailingDot() {
        FormulaLexer.tokenize("1.");
    }

    @Test(expected = InvalidFormulaException.class)
    public void testLoneDot() {
        FormulaLexer.tokenize(".");
    }

    @Test
    public void testUnexpectedCharacter() {
        try {
            FormulaLexer.tokenize("A1 $ 2");
            fail("Unknown character must be rejected");
        } catch (InvalidFormulaException e) {
            assertEquals("Unexpected character: $", e.getMessage());
        }
    }

    @Test
    public void testWellFormedNumber() {
        assertTrue(FormulaLexer.isWellFormedNumber("12"));
        assertTrue(FormulaLexer.isWellFormedNumber("12.05"));
        assertTrue(FormulaLexer.isWellFormedNumber(".5"));
        assertFalse(FormulaLexer.isWellFormedNumber("5."));
        assertFalse(FormulaLexer.isWellFormedNumber("1..2"));
    }
}
