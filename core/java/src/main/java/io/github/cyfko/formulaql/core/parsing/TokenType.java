package io.github.cyfko.formulaql.core.parsing;

/**
 * Kinds of tokens produced by the {@link Tokenizer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    FUNCTION,
    OPERATOR,
    ATTRIBUTE,
    VALUE,
    PAREN_OPEN,
    PAREN_CLOSE,
    COMMA
}
