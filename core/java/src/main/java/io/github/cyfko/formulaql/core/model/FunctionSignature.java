package io.github.cyfko.formulaql.core.model;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Fixed call shape of a {@link FormulaFunction}.
 * <p>
 * A signature is either fixed-arity ({@code arity >= 0}) or variadic ({@code arity == -1}).
 * Labels name the argument slots for editors and messages; a variadic signature lists the
 * labels of its first slots followed by {@code "..."}.
 * </p>
 *
 * @param arity       number of arguments, or {@link #VARIADIC}
 * @param labels      per-slot argument labels
 * @param description one-line description of what the function computes
 * @param example     usage example
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionSignature(int arity, List<String> labels, String description, String example) {

    /** Arity marker for functions accepting any number of arguments. */
    public static final int VARIADIC = -1;

    public FunctionSignature {
        if (arity < VARIADIC) {
            throw new IllegalArgumentException("arity must be non-negative or VARIADIC, got: " + arity);
        }
        labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(example, "example");
    }

    public static FunctionSignature fixed(String description, String example, String... labels) {
        return new FunctionSignature(labels.length, List.of(labels), description, example);
    }

    public static FunctionSignature variadic(String description, String example, String... labels) {
        return new FunctionSignature(VARIADIC, List.of(labels), description, example);
    }

    public boolean isVariadic() {
        return arity == VARIADIC;
    }

    /**
     * Fixed argument count.
     *
     * @return the arity, or empty for variadic signatures
     */
    public OptionalInt fixedArity() {
        return isVariadic() ? OptionalInt.empty() : OptionalInt.of(arity);
    }

    /**
     * Label of the given argument slot.
     * <p>
     * Slots past the declared labels (variadic tail) are labelled {@code "Argument N"}, N being
     * one-based.
     * </p>
     *
     * @param index zero-based slot index
     * @return the slot label
     */
    public String labelAt(int index) {
        if (index >= 0 && index < labels.size() && !"...".equals(labels.get(index))) {
            return labels.get(index);
        }
        return "Argument " + ((long) index + 1);
    }
}
