package io.github.cyfko.formulaql.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Enumeration of the functions a formula may call.
 * <p>
 * Each constant carries its textual name, as written in formulas, and its
 * {@link FunctionSignature}. Names are case-sensitive: arithmetic functions are lowercase,
 * logical functions uppercase.
 * </p>
 *
 * <p><strong>Result type rules by family:</strong></p>
 * <ul>
 *   <li>{@link Family#ARITHMETIC}: every argument numeric, numeric result</li>
 *   <li>{@code AND}, {@code OR}: every argument boolean, boolean result</li>
 *   <li>{@code NOT}: one boolean argument, boolean result</li>
 *   <li>{@code ISNULL}, {@code ISNOTNULL}: any argument, boolean result</li>
 *   <li>{@code IF}: boolean condition, both branches of the same type, result of the branches</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum FormulaFunction {

    ABS("abs", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the absolute value of a number", "abs(-5) = 5", "Number")),
    SIN("sin", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the sine of an angle", "sin(3.14) ≈ 0", "Angle (radians)")),
    COS("cos", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the cosine of an angle", "cos(0) = 1", "Angle (radians)")),
    TAN("tan", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the tangent of an angle", "tan(0.785) ≈ 1", "Angle (radians)")),
    SQRT("sqrt", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the square root of a number", "sqrt(16) = 4", "Number")),
    LOG("log", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the natural logarithm of a number", "log(2.718) ≈ 1", "Number")),
    EXP("exp", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns e raised to the power of a number", "exp(1) ≈ 2.718", "Number")),
    FLOOR("floor", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the largest integer less than or equal to a number", "floor(3.7) = 3", "Number")),
    CEIL("ceil", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the smallest integer greater than or equal to a number", "ceil(3.2) = 4", "Number")),
    ROUND("round", Family.ARITHMETIC, FunctionSignature.fixed(
            "Rounds a number to the nearest integer", "round(3.5) = 4", "Number")),
    POW("pow", Family.ARITHMETIC, FunctionSignature.fixed(
            "Raises a number to the power of another number", "pow(2, 3) = 8", "Base", "Exponent")),
    MIN("min", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the smaller of two numbers", "min(5, 3) = 3", "Number1", "Number2")),
    MAX("max", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the larger of two numbers", "max(5, 3) = 5", "Number1", "Number2")),
    ATAN2("atan2", Family.ARITHMETIC, FunctionSignature.fixed(
            "Returns the angle in radians whose tangent is the quotient of its arguments",
            "atan2(1, 1) ≈ 0.785", "Y", "X")),

    IF("IF", Family.LOGICAL, FunctionSignature.fixed(
            "Returns one value if condition is true, another if false",
            "IF({Age} > 18, 1, 0)", "Condition", "True Value", "False Value")),
    AND("AND", Family.LOGICAL, FunctionSignature.variadic(
            "Returns true if all conditions are true",
            "AND({Age} > 18, {Income} > 50000)", "Condition1", "Condition2", "...")),
    OR("OR", Family.LOGICAL, FunctionSignature.variadic(
            "Returns true if any condition is true",
            "OR({VIP} == {Member}, {Income} > 100000)", "Condition1", "Condition2", "...")),
    NOT("NOT", Family.LOGICAL, FunctionSignature.fixed(
            "Returns the opposite of the condition", "NOT({VIP})", "Condition")),
    ISNULL("ISNULL", Family.LOGICAL, FunctionSignature.fixed(
            "Returns true if the value is null or empty", "ISNULL({Email})", "Value")),
    ISNOTNULL("ISNOTNULL", Family.LOGICAL, FunctionSignature.fixed(
            "Returns true if the value is not null or empty", "ISNOTNULL({Email})", "Value"));

    private static final Map<String, FormulaFunction> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FormulaFunction::functionName, Function.identity()));

    private final String functionName;
    private final Family family;
    private final FunctionSignature signature;

    FormulaFunction(String functionName, Family family, FunctionSignature signature) {
        this.functionName = functionName;
        this.family = family;
        this.signature = signature;
    }

    /**
     * Resolves a function from its name as written in formulas.
     *
     * @param name the function name, e.g. {@code "sqrt"} or {@code "IF"}
     * @return the function, or empty if no function has that exact name
     */
    public static Optional<FormulaFunction> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static boolean isFunctionName(String name) {
        return name != null && BY_NAME.containsKey(name);
    }

    public String functionName() {
        return functionName;
    }

    public Family family() {
        return family;
    }

    public FunctionSignature signature() {
        return signature;
    }

    @Override
    public String toString() {
        return functionName;
    }

    /**
     * Function families.
     */
    public enum Family {
        ARITHMETIC,
        LOGICAL
    }
}
