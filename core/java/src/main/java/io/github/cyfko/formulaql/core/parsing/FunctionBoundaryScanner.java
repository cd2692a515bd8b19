package io.github.cyfko.formulaql.core.parsing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Locates function calls in formula text without building a node tree.
 * <p>
 * Plain parentheses are tracked alongside calls so that a {@code )} closing a plain group never
 * closes the enclosing call. Calls left open at the end of the text are not reported.
 * </p>
 *
 * <pre>{@code
 * List<FunctionBoundary> calls = FunctionBoundaryScanner.scan("max(abs({A}), 2)");
 * // [max 0..15 depth 0, abs 4..11 depth 1]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FunctionBoundaryScanner {

    private FunctionBoundaryScanner() {}

    /**
     * Scans formula text for function calls.
     *
     * @param text formula text
     * @return the closed calls, sorted by start offset
     */
    public static List<FunctionBoundary> scan(String text) {
        List<Token> tokens = Tokenizer.tokenize(text).tokens();
        List<FunctionBoundary> boundaries = new ArrayList<>();
        Deque<Frame> frames = new ArrayDeque<>();
        int callDepth = 0;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(TokenType.PAREN_OPEN)) {
                Token previous = i > 0 ? tokens.get(i - 1) : null;
                if (previous != null && previous.is(TokenType.FUNCTION)) {
                    frames.push(new Frame(previous, token.position(), callDepth));
                    callDepth++;
                } else {
                    frames.push(new Frame(null, token.position(), callDepth));
                }
            } else if (token.is(TokenType.PAREN_CLOSE) && !frames.isEmpty()) {
                Frame frame = frames.pop();
                if (frame.function() != null) {
                    callDepth--;
                    boundaries.add(new FunctionBoundary(
                            frame.function().text(),
                            frame.function().position(),
                            frame.openParenIndex(),
                            token.position(),
                            frame.depth()));
                }
            }
        }

        boundaries.sort(Comparator.comparingInt(FunctionBoundary::startIndex));
        return boundaries;
    }

    private record Frame(Token function, int openParenIndex, int depth) {
    }
}
