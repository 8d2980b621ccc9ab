import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Formula whitelist tests.
 */
public class FormulaValidatorTest {

    @Test
    public void testAcceptedFormulas() {
        assertTrue(FormulaValidator.isValidFormula("=SUM(A1:B2)"));
        assertTrue(FormulaValidator.isValidFormula("=sum(a1:b2)"));
        assertTrue(FormulaValidator.isValidFormula("=AVG(C3)"));
        assertTrue(FormulaValidator.isValidFormula("=1+2*(A1-B1)"));
        assertTrue(FormulaValidator.isValidFormula("= -A1 / 4 "));
        assertTrue(FormulaValidator.isValidFormula("=2*SUM(A1:A9)+1"));
    }

    @Test
    public void testDeeplyNestedFormulasRejected() {
        assertTrue(FormulaValidator.isValidFormula("=" + "(".repeat(500) + "1" + ")".repeat(500)));
        assertFalse(FormulaValidator.isValidFormula("=" + "(".repeat(50000) + "1" + ")".repeat(50000)));
        assertFalse(FormulaValidator.isValidFormula("=" + "-".repeat(200000) + "1"));
    }

    @Test
    public void testRuntimeErrorsDoNotMakeFormulaInvalid() {
        assertTrue(FormulaValidator.isValidFormula("=1/0"));
        assertTrue(FormulaValidator.isValidFormula("=A1/B1"));
        // Grid bounds are not known at store time
        assertTrue(FormulaValidator.isValidFormula("=Z999"));
        assertTrue(FormulaValidator.isValidFormula("=SUM(A1:ZZ999)"));
    }

    @Test
    public void testRejectedFormulas() {
        assertFalse(FormulaValidator.isValidFormula("=1+*2"));
        assertFalse(FormulaValidator.isValidFormula("=FOO(A1)"));
        assertFalse(FormulaValidator.isValidFormula("=(1+2"));
        assertFalse(FormulaValidator.isValidFormula("=1+2)"));
        assertFalse(FormulaValidator.isValidFormula("=)1+2("));
        assertFalse(FormulaValidator.isValidFormula("=A1 B1"));
        assertFalse(FormulaValidator.isValidFormula("=A1:B2"));
        assertFalse(FormulaValidator.isValidFormula("=1.2.3"));
        assertFalse(FormulaValidator.isValidFormula("=alert(1)"));
        assertFalse(FormulaValidator.isValidFormula("=<script>"));
        assertFalse(FormulaValidator.isValidFormula("=SUM(1:2)"));
    }

    @Test
    public void testNotFormulas() {
        assertFalse(FormulaValidator.isValidFormula("plain text"));
        assertFalse(FormulaValidator.isValidFormula("1+2"));
        assertFalse(FormulaValidator.isValidFormula(" =1+2"));
        assertFalse(FormulaValidator.isValidFormula("="));
        assertFalse(FormulaValidator.isValidFormula("=   "));
        assertFalse(FormulaValidator.isValidFormula(""));
        assertFalse(FormulaValidator.isValidFormula(null));
    }

    @Test
    public void testVisualFormulas() {
        assertTrue(FormulaValidator.isValidFormula("=PROGRESS(A1, 100, 'Done', green)"));
        assertTrue(FormulaValidator.isValidFormula("=tag(\"urgent\", red)"));
        assertTrue(FormulaValidator.isValidFormula("= RATING (B2, 10)"));
        assertTrue(FormulaValidator.isVisualFormula("=PROGRESS(0.5)"));
        assertFalse(FormulaValidator.isVisualFormula("=SUM(A1:B2)"));
        assertFalse(FormulaValidator.isVisualFormula("=RATING"));
        assertFalse(FormulaValidator.isValidFormula("=RATING"));
        assertFalse(FormulaValidator.isVisualFormula(null));
    }

    @Test
    public void testBalancedParentheses() {
        assertTrue(FormulaValidator.hasBalancedParentheses(FormulaLexer.tokenize("((1))+(2)")));
        assertFalse(FormulaValidator.hasBalancedParentheses(FormulaLexer.tokenize("(1))(")));
        assertFalse(FormulaValidator.hasBalancedParentheses(FormulaLexer.tokenize("((1)")));
    }

    @Test
    public void testGateAgreesWithEvaluator() {
        String[] accepted = {"=1+2", "=SUM(A1:B2)", "=(A1)*-2", "=AVG(B2:A1)/3"};
        CellContext context = CellContext.of(new String[][]{{"1", "2"}, {"3", "4"}}, 2, 2);
        for (String formula : accepted) {
            assertTrue(formula, FormulaValidator.isValidFormula(formula));
            assertFalse(formula, "#ERROR!".equals(Formula.evaluate(formula, context)));
            assertFalse(formula, "#NAME?".equals(Formula.evaluate(formula, context)));
        }
    }
}
