package io.github.cyfko.formulaql.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Enumeration of the infix operators a formula may contain.
 * <p>
 * Operators are positional markers: an {@link NodeKind#OPERATOR} node sits between two
 * operand-like siblings and never owns children. The {@link Family} of an operator decides
 * which operand types it accepts and which type it produces.
 * </p>
 *
 * <p><strong>Operator families:</strong></p>
 * <ul>
 *   <li><em>Arithmetic</em> {@code + - * / ** %}: numeric operands, numeric result</li>
 *   <li><em>Equality</em> {@code == !=}: operands of the same type, boolean result</li>
 *   <li><em>Relational</em> {@code > < >= <=}: numeric or string operands of the same type, boolean result</li>
 *   <li><em>Logical</em> {@code AND OR}: boolean operands, boolean result</li>
 *   <li><em>Negation</em> {@code NOT}: boolean result, operands not type checked</li>
 * </ul>
 *
 * <pre>{@code
 * Operator op = Operator.fromSymbol(">=").orElseThrow();
 * op.family();          // RELATIONAL
 * op.resultType();      // BOOLEAN
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Operator {

    /** Addition: "+" */
    PLUS("+", Family.ARITHMETIC, "Addition", "5 + 3 = 8"),

    /** Subtraction: "-" */
    MINUS("-", Family.ARITHMETIC, "Subtraction", "10 - 4 = 6"),

    /** Multiplication: "*" */
    MULTIPLY("*", Family.ARITHMETIC, "Multiplication", "6 * 7 = 42"),

    /** Division: "/" */
    DIVIDE("/", Family.ARITHMETIC, "Division", "15 / 3 = 5"),

    /** Exponentiation: "**" */
    POWER("**", Family.ARITHMETIC, "Exponentiation", "2 ** 3 = 8"),

    /** Remainder: "%" */
    MODULO("%", Family.ARITHMETIC, "Modulo (remainder)", "17 % 5 = 2"),

    /** Logical conjunction: "AND" */
    AND("AND", Family.LOGICAL, "Logical AND", "true AND false = false"),

    /** Logical disjunction: "OR" */
    OR("OR", Family.LOGICAL, "Logical OR", "true OR false = true"),

    /** Logical negation: "NOT" */
    NOT("NOT", Family.NEGATION, "Logical NOT", "NOT true = false"),

    /** Equality: "==" */
    EQ("==", Family.EQUALITY, "Equal to", "5 == 5 = true"),

    /** Inequality: "!=" */
    NE("!=", Family.EQUALITY, "Not equal to", "5 != 3 = true"),

    /** Greater than: "&gt;" */
    GT(">", Family.RELATIONAL, "Greater than", "10 > 5 = true"),

    /** Less than: "&lt;" */
    LT("<", Family.RELATIONAL, "Less than", "3 < 7 = true"),

    /** Greater than or equal: "&gt;=" */
    GTE(">=", Family.RELATIONAL, "Greater than or equal", "5 >= 5 = true"),

    /** Less than or equal: "&lt;=" */
    LTE("<=", Family.RELATIONAL, "Less than or equal", "4 <= 6 = true");

    private static final Map<String, Operator> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Operator::symbol, Function.identity()));

    private final String symbol;
    private final Family family;
    private final String description;
    private final String example;

    Operator(String symbol, Family family, String description, String example) {
        this.symbol = symbol;
        this.family = family;
        this.description = description;
        this.example = example;
    }

    /**
     * Resolves an operator from its literal symbol.
     * <p>
     * Lookup is exact: {@code "and"} does not resolve to {@link #AND}.
     * </p>
     *
     * @param symbol the literal symbol, e.g. {@code "**"}
     * @return the operator, or empty if the symbol is not an operator
     */
    public static Optional<Operator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }

    /**
     * Whether the given text is the literal symbol of an operator.
     *
     * @param symbol the text to test
     * @return {@code true} if {@link #fromSymbol(String)} would resolve it
     */
    public static boolean isOperatorSymbol(String symbol) {
        return symbol != null && BY_SYMBOL.containsKey(symbol);
    }

    public String symbol() {
        return symbol;
    }

    public Family family() {
        return family;
    }

    public String description() {
        return description;
    }

    public String example() {
        return example;
    }

    /**
     * Nominal type produced by this operator, regardless of its operands.
     *
     * @return {@link DataType#NUMBER} for arithmetic operators, {@link DataType#BOOLEAN} otherwise
     */
    public DataType resultType() {
        return family == Family.ARITHMETIC ? DataType.NUMBER : DataType.BOOLEAN;
    }

    @Override
    public String toString() {
        return symbol;
    }

    /**
     * Operator families, each with its own operand type rule.
     */
    public enum Family {
        ARITHMETIC,
        EQUALITY,
        RELATIONAL,
        LOGICAL,
        NEGATION
    }
}
