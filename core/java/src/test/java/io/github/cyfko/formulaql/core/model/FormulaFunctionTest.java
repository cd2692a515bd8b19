package io.github.cyfko.formulaql.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class FormulaFunctionTest {

    @ParameterizedTest
    @CsvSource({
            "abs, 1",
            "sqrt, 1",
            "pow, 2",
            "atan2, 2",
            "IF, 3",
            "NOT, 1",
            "ISNOTNULL, 1"
    })
    void fixedArities(String name, int arity) {
        FormulaFunction function = FormulaFunction.fromName(name).orElseThrow();
        assertEquals(OptionalInt.of(arity), function.signature().fixedArity());
    }

    @Test
    void andOrAreVariadic() {
        assertTrue(FormulaFunction.AND.signature().isVariadic());
        assertTrue(FormulaFunction.OR.signature().fixedArity().isEmpty());
    }

    @Test
    void namesAreCaseSensitive() {
        assertTrue(FormulaFunction.fromName("SQRT").isEmpty());
        assertTrue(FormulaFunction.fromName("if").isEmpty());
        assertFalse(FormulaFunction.isFunctionName(null));
        assertEquals("sqrt", FormulaFunction.SQRT.toString());
    }

    @Test
    void slotLabels() {
        FunctionSignature pow = FormulaFunction.POW.signature();
        assertEquals("Base", pow.labelAt(0));
        assertEquals("Exponent", pow.labelAt(1));
        assertEquals("Argument 3", pow.labelAt(2));

        FunctionSignature and = FormulaFunction.AND.signature();
        assertEquals("Condition2", and.labelAt(1));
        assertEquals("Argument 3", and.labelAt(2));
    }

    @Test
    void families() {
        assertEquals(FormulaFunction.Family.ARITHMETIC, FormulaFunction.MIN.family());
        assertEquals(FormulaFunction.Family.LOGICAL, FormulaFunction.ISNULL.family());
    }
}
