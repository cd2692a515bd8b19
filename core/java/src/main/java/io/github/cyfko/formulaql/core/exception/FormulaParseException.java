package io.github.cyfko.formulaql.core.exception;

/**
 * Exception thrown when formula text cannot be turned into a node tree at all.
 * <p>
 * Parsing is lenient: unknown words, unresolved attribute names, unbalanced
 * parentheses and malformed function calls never raise this exception. They produce a
 * (possibly incomplete) node tree that the structural validator then reports on. This
 * exception is reserved for input the parser refuses to process:
 * </p>
 * <ul>
 *   <li><strong>Length limit:</strong> text longer than the policy allows</li>
 *   <li><strong>Depth limit:</strong> parentheses or calls nested deeper than the policy allows</li>
 *   <li><strong>Strict tokens:</strong> unrecognized input under a policy that rejects it</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     NodeStore store = engine.parse(text, catalog);
 * } catch (FormulaParseException e) {
 *     // e.getPosition() points into the text when the failure has a location
 *     return ResponseEntity.badRequest().body("Invalid formula: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.formulaql.core.config.FormulaPolicy
 */
public class FormulaParseException extends RuntimeException {

    private final int position;

    /**
     * Constructor with an explanatory message and no source position.
     *
     * @param message the message describing the cause of the exception
     */
    public FormulaParseException(String message) {
        this(message, -1);
    }

    /**
     * Constructor with an explanatory message and the offending source offset.
     *
     * @param message  the message describing the cause of the exception
     * @param position zero-based offset in the formula text, or -1 if unknown
     */
    public FormulaParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Offset in the formula text at which parsing failed.
     *
     * @return zero-based offset, or -1 when the failure has no location
     */
    public int getPosition() {
        return position;
    }
}
