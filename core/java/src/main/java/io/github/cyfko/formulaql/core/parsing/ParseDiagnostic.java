package io.github.cyfko.formulaql.core.parsing;

/**
 * Non-fatal observation made while parsing, pointing at the input it concerns.
 * <p>
 * Diagnostics describe input the parser dropped or could only partially honor: unrecognized
 * text, unknown attribute names, stray or unclosed parentheses, malformed numbers and function
 * names without an argument list.
 * </p>
 *
 * @param position zero-based offset in the formula text
 * @param text     the input concerned
 * @param message  human readable description
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParseDiagnostic(int position, String text, String message) {

    @Override
    public String toString() {
        return message + " at position " + position;
    }
}
