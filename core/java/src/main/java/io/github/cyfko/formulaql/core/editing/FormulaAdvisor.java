package io.github.cyfko.formulaql.core.editing;

import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeStore;
import io.github.cyfko.formulaql.core.model.Operator;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory hints about a formula. Hints never make a formula invalid.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaAdvisor {

    public static final String DIVISION_BY_ZERO =
            "Consider adding a NULLIF or CASE statement to handle division by zero";
    public static final String TOO_MANY_ATTRIBUTES =
            "Consider breaking down complex formulas into smaller, reusable components";
    public static final String MISSING_PARENTHESES =
            "Consider using parentheses to clarify operator precedence";

    private static final int MAX_ATTRIBUTES = 5;
    private static final int MAX_UNGROUPED_OPERATORS = 2;

    private FormulaAdvisor() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Looks at the whole store, reachable or not.
     *
     * @param store the store to inspect
     * @return the hints, in a stable order, empty when there is nothing to suggest
     */
    public static List<String> suggest(NodeStore store) {
        boolean division = false;
        boolean zero = false;
        boolean group = false;
        int attributes = 0;
        int operators = 0;

        for (Node node : store) {
            switch (node.kind()) {
                case OPERATOR -> {
                    operators++;
                    division |= node.operator() == Operator.DIVIDE;
                }
                case VALUE -> zero |= node.value() != null && node.value().signum() == 0;
                case ATTRIBUTE -> attributes++;
                case GROUP -> group = true;
                case FUNCTION -> {
                    // functions do not take part in any hint
                }
            }
        }

        List<String> hints = new ArrayList<>();
        if (division && zero) {
            hints.add(DIVISION_BY_ZERO);
        }
        if (attributes > MAX_ATTRIBUTES) {
            hints.add(TOO_MANY_ATTRIBUTES);
        }
        if (operators > MAX_UNGROUPED_OPERATORS && !group) {
            hints.add(MISSING_PARENTHESES);
        }
        return hints;
    }
}
