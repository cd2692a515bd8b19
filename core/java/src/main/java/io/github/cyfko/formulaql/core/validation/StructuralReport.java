package io.github.cyfko.formulaql.core.validation;

import java.util.List;

/**
 * Outcome of {@link StructuralValidator}.
 * <p>
 * Usage example:
 * </p>
 * <pre>{@code
 * StructuralReport report = StructuralValidator.validate(store, catalog);
 * if (!report.isValid()) {
 *     report.errors().forEach(System.out::println);
 *     report.brokenConnections().forEach(c -> offerOperatorBetween(c.before(), c.after()));
 * }
 * }</pre>
 *
 * @param errors            error messages in detection order
 * @param brokenConnections adjacent root operands lacking an operator
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record StructuralReport(List<String> errors, List<BrokenConnection> brokenConnections) {

    public StructuralReport {
        errors = List.copyOf(errors);
        brokenConnections = List.copyOf(brokenConnections);
    }

    /**
     * Indicates whether the store is structurally sound.
     *
     * @return true when no error was found
     */
    public boolean isValid() {
        return errors.isEmpty();
    }
}
