package io.github.cyfko.formulaql.core.impl;

import io.github.cyfko.formulaql.core.api.AttributeCatalog;
import io.github.cyfko.formulaql.core.api.FormulaParser;
import io.github.cyfko.formulaql.core.config.FormulaPolicy;
import io.github.cyfko.formulaql.core.exception.FormulaParseException;
import io.github.cyfko.formulaql.core.model.NodeStore;
import io.github.cyfko.formulaql.core.parsing.NodeTreeBuilder;
import io.github.cyfko.formulaql.core.parsing.ParseDiagnostic;
import io.github.cyfko.formulaql.core.parsing.ParseOutcome;
import io.github.cyfko.formulaql.core.parsing.Tokenizer;
import io.github.cyfko.formulaql.core.spi.NodeIdGenerator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link FormulaParser}: a two-phase tokenizer + recursive-descent parser guarded by a
 * {@link FormulaPolicy}.
 *
 * <h2>Phases</h2>
 * <ol>
 *   <li><strong>Phase 1</strong>: {@link Tokenizer#tokenize(String)}. Single pass, never fails;
 *       unrecognized input is kept aside as skipped spans.</li>
 *   <li><strong>Phase 2</strong>: {@link NodeTreeBuilder#build(List)}. Builds the flat node
 *       tree, resolving attribute names against the catalog.</li>
 * </ol>
 *
 * <h2>DoS Protection</h2>
 * <ul>
 *   <li><strong>Expression Length</strong>: text longer than the policy allows is rejected</li>
 *   <li><strong>Nesting Depth</strong>: parentheses nested deeper than the policy allows are
 *       rejected, bounding the recursion of phase 2</li>
 * </ul>
 *
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 * FormulaParser strictParser = new BasicFormulaParser(FormulaPolicy.strict(), NodeIdGenerator.random());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFormulaParser implements FormulaParser {

    private static final Logger log = Logger.getLogger(BasicFormulaParser.class.getName());

    private final FormulaPolicy policy;
    private final NodeIdGenerator idGenerator;

    /**
     * Default constructor using {@link FormulaPolicy#defaults()} and random node ids.
     */
    public BasicFormulaParser() {
        this(FormulaPolicy.defaults(), NodeIdGenerator.random());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param policy      the parse limits
     * @param idGenerator source of node ids
     * @throws IllegalArgumentException if any argument is null
     */
    public BasicFormulaParser(FormulaPolicy policy, NodeIdGenerator idGenerator) {
        if (policy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("Node id generator is required");
        }
        this.policy = policy;
        this.idGenerator = idGenerator;
    }

    public FormulaPolicy getPolicy() {
        return policy;
    }

    @Override
    public ParseOutcome parseWithDiagnostics(String text, AttributeCatalog catalog) throws FormulaParseException {
        Objects.requireNonNull(text, "Formula text cannot be null");
        Objects.requireNonNull(catalog, "Attribute catalog cannot be null");

        if (text.isBlank()) {
            return new ParseOutcome(new NodeStore(), List.of());
        }

        if (text.length() > policy.maxExpressionLength()) {
            log.warning(() -> String.format("Formula rejected: %d characters, policy %s",
                    text.length(), policy.policyName()));
            throw new FormulaParseException(String.format(
                    "Formula too long (%d characters, max: %d). Policy applied: %s",
                    text.length(), policy.maxExpressionLength(), policy.policyName()));
        }

        // Phase 1: tokens + skipped spans
        Tokenizer.Result scan = Tokenizer.tokenize(text);
        if (policy.rejectUnrecognizedInput() && !scan.skipped().isEmpty()) {
            Tokenizer.SkippedInput first = scan.skipped().get(0);
            log.warning(() -> String.format("Formula rejected: unrecognized input '%s', policy %s",
                    first.text(), policy.policyName()));
            throw new FormulaParseException(String.format(
                    "Unrecognized input '%s' at position %d. Policy applied: %s",
                    first.text(), first.position(), policy.policyName()), first.position());
        }

        // Phase 2: node tree
        NodeTreeBuilder builder = new NodeTreeBuilder(catalog, idGenerator, policy.maxNestingDepth(), policy.policyName());
        ParseOutcome built;
        try {
            built = builder.build(scan.tokens());
        } catch (FormulaParseException e) {
            log.warning(() -> "Formula rejected: " + e.getMessage());
            throw e;
        }

        List<ParseDiagnostic> diagnostics = new ArrayList<>(built.diagnostics());
        for (Tokenizer.SkippedInput skipped : scan.skipped()) {
            diagnostics.add(new ParseDiagnostic(skipped.position(), skipped.text(),
                    String.format("Unrecognized input '%s'", skipped.text())));
        }
        diagnostics.sort(Comparator.comparingInt(ParseDiagnostic::position));

        log.fine(() -> String.format("Parsed formula: %d tokens, %d nodes, %d diagnostics",
                scan.tokens().size(), built.store().size(), diagnostics.size()));

        return new ParseOutcome(built.store(), diagnostics);
    }
}
