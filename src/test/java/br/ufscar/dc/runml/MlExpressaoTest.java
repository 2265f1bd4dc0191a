package br.ufscar.dc.runml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MlExpressaoTest {

    private final MlExpressao expressao = new MlExpressao(MlLog.silencioso());

    @Test
    public void testAdditionPassesThrough() {
        assertEquals("a + b - 2", expressao.translate("a + b - 2"));
    }

    @Test
    public void testMultiplicationIsSplitAtFirstOperator() {
        assertEquals("a  *  b + 2", expressao.translate("a * b + 2"));
        assertEquals("a * b / c", expressao.translate("a*b/c"));
        assertEquals("x  *  x", expressao.translate("x * x"));
    }

    @Test
    public void testParenthesesRideAlongInFactors() {
        assertEquals("(a * b)+c", expressao.translate("(a*b)+c"));
        assertEquals("square(n)", expressao.translate("square(n)"));
    }

    @Test
    public void testStrayOperatorIsForwarded() {
        assertEquals("a +  *  b", expressao.translate("a + * b"));
    }

    @Test
    public void testInvalidCharacter() {
        MlException e = assertThrows(MlException.class, () -> expressao.translate("a % b"));
        assertEquals(MlException.Tipo.SYNTAX, e.getTipo());
        assertEquals("Invalid character in expression: %", e.getMessage());

        e = assertThrows(MlException.class, () -> expressao.translate("my_var + 1"));
        assertEquals("Invalid character in expression: _", e.getMessage());
    }

    @Test
    public void testUnbalancedParentheses() {
        MlException e = assertThrows(MlException.class, () -> expressao.translate("(a + b"));
        assertEquals("Unmatched opening parenthesis in expression: (a + b", e.getMessage());

        e = assertThrows(MlException.class, () -> expressao.translate("a + b)"));
        assertEquals("Unmatched closing parenthesis in expression: a + b)", e.getMessage());
    }
}
