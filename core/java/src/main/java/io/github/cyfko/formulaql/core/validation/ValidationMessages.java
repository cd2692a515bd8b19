package io.github.cyfko.formulaql.core.validation;

import io.github.cyfko.formulaql.core.model.DataType;
import io.github.cyfko.formulaql.core.model.FormulaFunction;
import io.github.cyfko.formulaql.core.model.NodeKind;
import io.github.cyfko.formulaql.core.model.Operator;

/**
 * Texts of every error reported by the structural validator and the type checker.
 * <p>
 * Both passes check the shape of operand/operator sequences; building their messages here
 * guarantees that the same problem is worded identically by both, which is what allows
 * {@link FormulaReport#merge(StructuralReport, TypeReport)} to report it once.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    // Sequence shape

    public static String missingOperator(NodeKind before, NodeKind after) {
        return String.format("Broken connection: missing operator between operands (%s followed by %s)",
                before.label(), after.label());
    }

    public static String missingLeftOperand(Operator operator) {
        return String.format("Operator '%s' is missing its left operand", symbol(operator));
    }

    public static String missingRightOperand(Operator operator) {
        return String.format("Operator '%s' is missing its right operand", symbol(operator));
    }

    public static String operatorsWithoutOperands() {
        return "Operators need operands (attributes, values, functions or groups)";
    }

    // Tree shape

    public static String arity(FormulaFunction function, int required, int actual) {
        return String.format("Function '%s' requires exactly %d argument%s, got %d",
                function.functionName(), required, required == 1 ? "" : "s", actual);
    }

    public static String emptyArgument(FormulaFunction function, int index) {
        return String.format("Function '%s' argument %d (%s) is empty",
                function.functionName(), ordinal(index), function.signature().labelAt(index));
    }

    public static String duplicateArgument(FormulaFunction function, int index) {
        return String.format("Function '%s' has more than one group for argument %d",
                function.functionName(), ordinal(index));
    }

    public static String argumentOutOfRange(FormulaFunction function, int index, int arity) {
        return String.format("Function '%s' has no argument %d (it takes %d)",
                function.functionName(), ordinal(index), arity);
    }

    public static String argumentGap(FormulaFunction function, long expected, int found) {
        return String.format("Function '%s' has no argument %d before argument %d",
                function.functionName(), expected + 1, ordinal(found));
    }

    public static String nonArgumentChild(FormulaFunction function, NodeKind childKind) {
        return String.format("Function '%s' has a %s child that is not an argument group",
                function.functionName(), childKind.label());
    }

    public static String detachedArgumentGroup(String groupId) {
        return String.format("Argument group %s is not attached to a function", groupId);
    }

    public static String leafWithChildren(NodeKind kind, String id) {
        return String.format("%s node %s cannot have children", capitalize(kind.label()), id);
    }

    public static String orphan(String id, String parentId) {
        return String.format("Node %s references missing parent %s", id, parentId);
    }

    public static String unreachable(String id) {
        return String.format("Node %s is not reachable from any root (cyclic parent chain)", id);
    }

    public static String incompleteOperator(String id) {
        return String.format("Operator node %s has no operator symbol", id);
    }

    public static String incompleteFunction(String id) {
        return String.format("Function node %s has no function name", id);
    }

    public static String missingAttributeReference(String id) {
        return String.format("Attribute node %s has no attribute reference", id);
    }

    public static String unresolvedAttribute(String attributeId) {
        return String.format("Attribute '%s' not found in catalog", attributeId);
    }

    // Types

    public static String emptyGroup() {
        return "Empty group";
    }

    public static String arithmeticOperand(Operator operator, String side, DataType actual) {
        return String.format("Arithmetic operator '%s' requires numeric operands, but the %s operand is %s",
                symbol(operator), side, actual.displayName());
    }

    public static String equalityMismatch(Operator operator, DataType left, DataType right) {
        return String.format("Equality operator '%s' requires operands of the same type, but got %s and %s",
                symbol(operator), left.displayName(), right.displayName());
    }

    public static String relationalOperand(Operator operator, String side, DataType actual) {
        return String.format("Relational operator '%s' requires numeric or string operands, but the %s operand is %s",
                symbol(operator), side, actual.displayName());
    }

    public static String relationalMismatch(Operator operator, DataType left, DataType right) {
        return String.format("Relational operator '%s' requires operands of the same type, but got %s and %s",
                symbol(operator), left.displayName(), right.displayName());
    }

    public static String logicalOperand(Operator operator, String side, DataType actual) {
        return String.format("Logical operator '%s' requires boolean operands, but the %s operand is %s",
                symbol(operator), side, actual.displayName());
    }

    public static String numericArgument(FormulaFunction function, int index, DataType actual) {
        return String.format("Arithmetic function '%s' requires numeric arguments, but argument %d is %s",
                function.functionName(), ordinal(index), actual.displayName());
    }

    public static String booleanArgument(FormulaFunction function, int index, DataType actual) {
        return String.format("Function '%s' requires boolean arguments, but argument %d is %s",
                function.functionName(), ordinal(index), actual.displayName());
    }

    public static String ifCondition(DataType actual) {
        return String.format("Function 'IF' requires a boolean condition as argument 1, but got %s",
                actual.displayName());
    }

    public static String ifBranches(DataType whenTrue, DataType whenFalse) {
        return String.format("Function 'IF' requires both branches to have the same type, but got %s and %s",
                whenTrue.displayName(), whenFalse.displayName());
    }

    /** One-based argument number; widened so the largest index does not wrap. */
    private static long ordinal(int index) {
        return (long) index + 1;
    }

    private static String symbol(Operator operator) {
        return operator == null ? "?" : operator.symbol();
    }

    private static String capitalize(String text) {
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
