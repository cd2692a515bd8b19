package io.github.cyfko.formulaql.core.parsing;

import io.github.cyfko.formulaql.core.model.NodeStore;

import java.util.List;
import java.util.Objects;

/**
 * Node tree produced from formula text, with everything the parser had to drop on the way.
 *
 * @param store       the parsed nodes
 * @param diagnostics parse diagnostics in source order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParseOutcome(NodeStore store, List<ParseDiagnostic> diagnostics) {

    public ParseOutcome {
        Objects.requireNonNull(store, "store");
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    /**
     * Whether the whole input was honored.
     *
     * @return {@code true} if no diagnostic was recorded
     */
    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
