package io.github.cyfko.formulaql.core.parsing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionBoundaryScannerTest {

    @Test
    void nestedCallsAreSortedByStart() {
        List<FunctionBoundary> boundaries = FunctionBoundaryScanner.scan("max(abs({A}), 2)");

        assertEquals(List.of(
                new FunctionBoundary("max", 0, 3, 15, 0),
                new FunctionBoundary("abs", 4, 7, 11, 1)), boundaries);
    }

    @Test
    void plainParenthesesDoNotCountAsCalls() {
        List<FunctionBoundary> boundaries = FunctionBoundaryScanner.scan("(1 + sqrt((4)))");

        assertEquals(1, boundaries.size());
        FunctionBoundary sqrt = boundaries.get(0);
        assertEquals("sqrt", sqrt.functionName());
        assertEquals(0, sqrt.depth());
        assertEquals(13, sqrt.endIndex());
        assertTrue(sqrt.contains(5));
        assertFalse(sqrt.contains(14));
    }

    @Test
    void unclosedCallsAreNotReported() {
        assertTrue(FunctionBoundaryScanner.scan("sqrt(4").isEmpty());
        assertEquals(List.of("abs"), FunctionBoundaryScanner.scan("max(abs(1), 2").stream()
                .map(FunctionBoundary::functionName).toList());
    }
}
