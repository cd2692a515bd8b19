package io.github.cyfko.formulaql.core.parsing;

/**
 * Location of one function call in formula text, used by editors to highlight calls.
 *
 * @param functionName     called function name as written
 * @param startIndex       offset of the function name
 * @param openParenIndex   offset of the opening parenthesis
 * @param closeParenIndex  offset of the matching closing parenthesis
 * @param depth            number of enclosing function calls, 0 for a top-level call
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionBoundary(String functionName, int startIndex, int openParenIndex, int closeParenIndex, int depth) {

    /**
     * Offset of the last character of the call.
     *
     * @return the closing parenthesis offset
     */
    public int endIndex() {
        return closeParenIndex;
    }

    /**
     * Whether the given offset falls inside this call, name and parentheses included.
     *
     * @param offset zero-based text offset
     * @return {@code true} if the offset is covered
     */
    public boolean contains(int offset) {
        return offset >= startIndex && offset <= closeParenIndex;
    }
}
