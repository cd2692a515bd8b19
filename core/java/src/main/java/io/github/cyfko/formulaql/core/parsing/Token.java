package io.github.cyfko.formulaql.core.parsing;

import java.util.Objects;

/**
 * One lexical unit of formula text.
 *
 * @param type     token kind
 * @param text     literal text; for attributes, the name without braces
 * @param position zero-based offset of the token's first character in the source text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}
