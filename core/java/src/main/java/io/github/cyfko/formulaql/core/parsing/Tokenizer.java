package io.github.cyfko.formulaql.core.parsing;

import io.github.cyfko.formulaql.core.model.FormulaFunction;
import io.github.cyfko.formulaql.core.model.Operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass scanner turning formula text into a flat token list.
 * <p>
 * The tokenizer never fails. Input it cannot recognize is skipped and recorded in
 * {@link Result#skipped()} so that callers can surface it instead of losing it silently.
 * </p>
 *
 * <p><strong>Lexical rules:</strong></p>
 * <ul>
 *   <li>Whitespace separates tokens and produces none</li>
 *   <li>{@code (}, {@code )} and {@code ,} are single-character tokens</li>
 *   <li>{@code {Name}} is one attribute token carrying {@code Name}; a <code>{</code> without a
 *       closing brace is skipped</li>
 *   <li>A maximal run of {@code [0-9.]} is a value token (no sign, no exponent)</li>
 *   <li>A maximal identifier run {@code [A-Za-z_][A-Za-z0-9_]*} is looked up as a function
 *       name, then as an operator ({@code AND}, {@code OR}, {@code NOT})</li>
 *   <li>A maximal symbol run over {@code > < = ! + - * / ^ %} is looked up as an operator</li>
 * </ul>
 * <p>
 * {@code AND}, {@code OR} and {@code NOT} name both a function and an operator. They are read
 * as a function only when {@code (} follows immediately: {@code NOT(x)} is a call,
 * {@code NOT (x)} is the operator followed by a group.
 * </p>
 *
 * <pre>{@code
 * Tokenizer.Result result = Tokenizer.tokenize("sqrt({Area}) * 2");
 * // FUNCTION "sqrt", PAREN_OPEN, ATTRIBUTE "Area", PAREN_CLOSE, OPERATOR "*", VALUE "2"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Tokenizer {

    private Tokenizer() {}

    /**
     * Scans the given text.
     *
     * @param text formula text
     * @return tokens in source order plus the spans that were skipped
     * @throws NullPointerException if text is null
     */
    public static Result tokenize(String text) {
        Objects.requireNonNull(text, "Formula text cannot be null");

        List<Token> tokens = new ArrayList<>();
        List<SkippedInput> skipped = new ArrayList<>();
        int i = 0;
        int length = text.length();

        while (i < length) {
            char c = text.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (c == '(' || c == ')' || c == ',') {
                tokens.add(new Token(punctuation(c), String.valueOf(c), i));
                i++;
                continue;
            }

            if (c == '{') {
                int close = text.indexOf('}', i + 1);
                if (close >= 0) {
                    tokens.add(new Token(TokenType.ATTRIBUTE, text.substring(i + 1, close), i));
                    i = close + 1;
                } else {
                    skip(skipped, "{", i);
                    i++;
                }
                continue;
            }

            if (isNumberChar(c)) {
                int j = i;
                while (j < length && isNumberChar(text.charAt(j))) j++;
                tokens.add(new Token(TokenType.VALUE, text.substring(i, j), i));
                i = j;
                continue;
            }

            if (isIdentifierStart(c)) {
                int j = i + 1;
                while (j < length && isIdentifierPart(text.charAt(j))) j++;
                String word = text.substring(i, j);
                boolean callFollows = j < length && text.charAt(j) == '(';

                if (FormulaFunction.isFunctionName(word) && (callFollows || !Operator.isOperatorSymbol(word))) {
                    tokens.add(new Token(TokenType.FUNCTION, word, i));
                } else if (Operator.isOperatorSymbol(word)) {
                    tokens.add(new Token(TokenType.OPERATOR, word, i));
                } else {
                    skip(skipped, word, i);
                }
                i = j;
                continue;
            }

            if (isSymbolChar(c)) {
                int j = i + 1;
                while (j < length && isSymbolChar(text.charAt(j))) j++;
                String symbol = text.substring(i, j);
                if (Operator.isOperatorSymbol(symbol)) {
                    tokens.add(new Token(TokenType.OPERATOR, symbol, i));
                } else {
                    skip(skipped, symbol, i);
                }
                i = j;
                continue;
            }

            skip(skipped, String.valueOf(c), i);
            i++;
        }

        return new Result(List.copyOf(tokens), List.copyOf(skipped));
    }

    private static void skip(List<SkippedInput> skipped, String text, int position) {
        if (!skipped.isEmpty()) {
            SkippedInput last = skipped.get(skipped.size() - 1);
            if (last.position() + last.text().length() == position) {
                skipped.set(skipped.size() - 1, new SkippedInput(last.text() + text, last.position()));
                return;
            }
        }
        skipped.add(new SkippedInput(text, position));
    }

    private static TokenType punctuation(char c) {
        return switch (c) {
            case '(' -> TokenType.PAREN_OPEN;
            case ')' -> TokenType.PAREN_CLOSE;
            default -> TokenType.COMMA;
        };
    }

    private static boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    private static boolean isSymbolChar(char c) {
        return switch (c) {
            case '>', '<', '=', '!', '+', '-', '*', '/', '^', '%' -> true;
            default -> false;
        };
    }

    /**
     * Outcome of a scan.
     *
     * @param tokens  recognized tokens in source order
     * @param skipped unrecognized input, adjacent skipped characters merged into one span
     */
    public record Result(List<Token> tokens, List<SkippedInput> skipped) {
    }

    /**
     * A span of source text the tokenizer did not recognize.
     *
     * @param text     the skipped text
     * @param position zero-based offset of the span
     */
    public record SkippedInput(String text, int position) {
    }
}
