package io.github.cyfko.formulaql.core.validation;

import io.github.cyfko.formulaql.core.model.DataType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Combined outcome of structural validation and type inference.
 * <p>
 * Both passes check the shape of the root sequence, so a broken shape would otherwise be
 * reported twice. {@link #merge(StructuralReport, TypeReport)} drops each type error that
 * repeats a structural error, one occurrence per structural occurrence.
 * </p>
 *
 * @param errors            structural errors followed by the remaining type errors
 * @param brokenConnections adjacent root operands lacking an operator
 * @param types             the full type report
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaReport(List<String> errors, List<BrokenConnection> brokenConnections, TypeReport types) {

    public FormulaReport {
        errors = List.copyOf(errors);
        brokenConnections = List.copyOf(brokenConnections);
    }

    public static FormulaReport merge(StructuralReport structure, TypeReport types) {
        Map<String, Integer> pending = new HashMap<>();
        for (String error : structure.errors()) {
            pending.merge(error, 1, Integer::sum);
        }

        List<String> errors = new ArrayList<>(structure.errors());
        for (String error : types.errors()) {
            Integer count = pending.get(error);
            if (count != null && count > 0) {
                pending.put(error, count - 1);
            } else {
                errors.add(error);
            }
        }
        return new FormulaReport(errors, structure.brokenConnections(), types);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public DataType resultType() {
        return types.resultType();
    }
}
