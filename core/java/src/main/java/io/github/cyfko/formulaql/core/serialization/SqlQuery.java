package io.github.cyfko.formulaql.core.serialization;

import java.util.List;

/**
 * A formula rendered as a query selecting its inputs and its computed column.
 *
 * @param sql          the full {@code SELECT} statement
 * @param columnName   alias of the computed column, derived from the formula name
 * @param dependencies ids of the attributes the formula reads, in order of first use
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SqlQuery(String sql, String columnName, List<String> dependencies) {

    public SqlQuery {
        dependencies = List.copyOf(dependencies);
    }
}
