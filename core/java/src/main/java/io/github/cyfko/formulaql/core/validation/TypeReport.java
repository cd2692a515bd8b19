package io.github.cyfko.formulaql.core.validation;

import io.github.cyfko.formulaql.core.model.DataType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link TypeChecker}: the type of every node, the type errors found and the type
 * of the whole expression.
 *
 * @param perNode    inferred type keyed by node id, in store order
 * @param errors     type errors in detection order
 * @param resultType type of the root sequence, {@link DataType#UNKNOWN} when it cannot be inferred
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TypeReport(Map<String, DataType> perNode, List<String> errors, DataType resultType) {

    public TypeReport {
        perNode = Collections.unmodifiableMap(new LinkedHashMap<>(perNode));
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Type inferred for one node.
     *
     * @param nodeId the node id
     * @return the type, {@link DataType#UNKNOWN} for ids absent from the checked store
     */
    public DataType typeOf(String nodeId) {
        return perNode.getOrDefault(nodeId, DataType.UNKNOWN);
    }
}
