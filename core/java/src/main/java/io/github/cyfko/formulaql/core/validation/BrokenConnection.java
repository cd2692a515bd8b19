package io.github.cyfko.formulaql.core.validation;

/**
 * Two adjacent root operands with no operator between them.
 * <p>
 * Editors use it to offer a one-click fix inserting an operator between the two nodes.
 * </p>
 *
 * @param before id of the left operand
 * @param after  id of the right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BrokenConnection(String before, String after) {
}
