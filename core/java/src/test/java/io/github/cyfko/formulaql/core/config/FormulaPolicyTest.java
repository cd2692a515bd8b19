package io.github.cyfko.formulaql.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaPolicyTest {

    @Test
    void presets() {
        FormulaPolicy defaults = FormulaPolicy.defaults();
        assertEquals(5000, defaults.maxExpressionLength());
        assertEquals(64, defaults.maxNestingDepth());
        assertFalse(defaults.rejectUnrecognizedInput());

        FormulaPolicy strict = FormulaPolicy.strict();
        assertEquals(1000, strict.maxExpressionLength());
        assertEquals(32, strict.maxNestingDepth());
        assertTrue(strict.rejectUnrecognizedInput());

        assertEquals(128, FormulaPolicy.relaxed().maxNestingDepth());
        assertEquals("RELAXED_POLICY", FormulaPolicy.relaxed().policyName());
    }

    @Test
    void builderStartsFromDefaults() {
        FormulaPolicy policy = FormulaPolicy.builder().maxNestingDepth(3).build();

        assertEquals("CUSTOM_POLICY", policy.policyName());
        assertEquals(5000, policy.maxExpressionLength());
        assertEquals(3, policy.maxNestingDepth());
    }

    @Test
    void invalidLimitsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().maxExpressionLength(0).build());
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().maxNestingDepth(-1).build());
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().policyName(" ").build());
    }
}
