package io.github.cyfko.formulaql.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class OperatorTest {

    @ParameterizedTest
    @CsvSource({
            "+, PLUS, ARITHMETIC",
            "**, POWER, ARITHMETIC",
            "%, MODULO, ARITHMETIC",
            "AND, AND, LOGICAL",
            "NOT, NOT, NEGATION",
            "!=, NE, EQUALITY",
            ">=, GTE, RELATIONAL"
    })
    void resolvesSymbols(String symbol, Operator expected, Operator.Family family) {
        Operator operator = Operator.fromSymbol(symbol).orElseThrow();
        assertEquals(expected, operator);
        assertEquals(family, operator.family());
        assertEquals(symbol, operator.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"^", "=", "and", "<>", ""})
    void rejectsUnknownSymbols(String symbol) {
        assertTrue(Operator.fromSymbol(symbol).isEmpty());
        assertFalse(Operator.isOperatorSymbol(symbol));
    }

    @Test
    void resultTypeFollowsFamily() {
        assertEquals(DataType.NUMBER, Operator.DIVIDE.resultType());
        assertEquals(DataType.BOOLEAN, Operator.LT.resultType());
        assertEquals(DataType.BOOLEAN, Operator.OR.resultType());
        assertEquals(DataType.BOOLEAN, Operator.NOT.resultType());
    }

    @Test
    void everyOperatorIsDocumented() {
        for (Operator operator : Operator.values()) {
            assertFalse(operator.description().isBlank(), operator.name());
            assertFalse(operator.example().isBlank(), operator.name());
        }
    }
}
