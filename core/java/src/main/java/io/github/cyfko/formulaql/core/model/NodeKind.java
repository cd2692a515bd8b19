package io.github.cyfko.formulaql.core.model;

import java.util.Locale;

/**
 * Closed set of node kinds a formula tree is made of.
 * <p>
 * Every pass over a {@link NodeStore} (serialization, structural validation, type inference)
 * switches exhaustively over this enum, so adding a kind is caught at compile time by each
 * switch expression.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum NodeKind {

    /** Reference to a catalog attribute, written {@code {Name}}. */
    ATTRIBUTE,

    /** Positional infix marker such as {@code +} or {@code AND}. */
    OPERATOR,

    /** Function call; its arguments are {@link #GROUP} children carrying an argument index. */
    FUNCTION,

    /** Numeric literal. */
    VALUE,

    /** Parenthesized sub-expression, or one argument slot of a function. */
    GROUP;

    /**
     * Whether nodes of this kind stand where an operand is expected.
     *
     * @return {@code true} for attributes, values, functions and groups
     */
    public boolean isOperandLike() {
        return switch (this) {
            case ATTRIBUTE, VALUE, FUNCTION, GROUP -> true;
            case OPERATOR -> false;
        };
    }

    /**
     * Whether nodes of this kind may never own children.
     *
     * @return {@code true} for attributes, values and operators
     */
    public boolean isLeaf() {
        return switch (this) {
            case ATTRIBUTE, VALUE, OPERATOR -> true;
            case FUNCTION, GROUP -> false;
        };
    }

    /**
     * Lowercase label used in messages.
     *
     * @return the display label of this kind
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
