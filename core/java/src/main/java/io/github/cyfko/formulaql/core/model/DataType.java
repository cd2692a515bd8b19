package io.github.cyfko.formulaql.core.model;

import java.util.Locale;

/**
 * Four-way type lattice used by the type checker.
 * <p>
 * {@link #UNKNOWN} is permissive: any requirement on an operand or argument is considered
 * satisfied when its type is unknown.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum DataType {
    NUMBER,
    BOOLEAN,
    STRING,
    UNKNOWN;

    /**
     * Maps a catalog declared type onto the lattice.
     * <p>
     * Matching is case-insensitive:
     * </p>
     * <ul>
     *   <li>{@code number, integer, float, double, decimal} → {@link #NUMBER}</li>
     *   <li>{@code boolean, bool} → {@link #BOOLEAN}</li>
     *   <li>{@code string, text, varchar} → {@link #STRING}</li>
     *   <li>anything else, including {@code null} and {@code date} → {@link #UNKNOWN}</li>
     * </ul>
     *
     * @param declaredType the type string declared by the catalog, may be null
     * @return the mapped data type, never null
     */
    public static DataType fromDeclaredType(String declaredType) {
        if (declaredType == null) {
            return UNKNOWN;
        }
        return switch (declaredType.trim().toLowerCase(Locale.ROOT)) {
            case "number", "integer", "float", "double", "decimal" -> NUMBER;
            case "boolean", "bool" -> BOOLEAN;
            case "string", "text", "varchar" -> STRING;
            default -> UNKNOWN;
        };
    }

    /**
     * Whether a value of this type satisfies a requirement for {@code required}.
     *
     * @param required the required type
     * @return {@code true} if this type equals {@code required} or is {@link #UNKNOWN}
     */
    public boolean satisfies(DataType required) {
        return this == UNKNOWN || this == required;
    }

    /**
     * Whether two types may meet in an operation that requires both sides to agree.
     *
     * @param other the other side's type
     * @return {@code true} if the types are equal or either one is {@link #UNKNOWN}
     */
    public boolean agreesWith(DataType other) {
        return this == UNKNOWN || other == UNKNOWN || this == other;
    }

    /**
     * Lowercase name used in messages, e.g. {@code "boolean"}.
     *
     * @return the display name
     */
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
