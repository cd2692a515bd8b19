package io.github.cyfko.formulaql.core.exception;

/**
 * Exception thrown when a node store cannot be rendered as a SQL expression.
 * <p>
 * Unlike canonical text, SQL is only produced for complete formulas: the store must pass
 * structural validation against the catalog, every group must alternate operands and
 * operators, and each operator and function must have a SQL form.
 * </p>
 *
 * <p><strong>Typical causes:</strong></p>
 * <ul>
 *   <li>An attribute the catalog does not know</li>
 *   <li>A function with a missing argument, or an operator with a missing operand</li>
 *   <li>The infix {@code NOT} operator, which has no binary SQL form</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     SqlQuery query = SqlRenderer.renderQuery(store, catalog, "Discounted price", "orders");
 * } catch (SqlRenderException e) {
 *     log.warning(() -> "Cannot export formula: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SqlRenderException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message why the formula has no SQL rendering
     */
    public SqlRenderException(String message) {
        super(message);
    }
}
