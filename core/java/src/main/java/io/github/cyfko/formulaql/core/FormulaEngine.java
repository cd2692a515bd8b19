package io.github.cyfko.formulaql.core;

import io.github.cyfko.formulaql.core.api.AttributeCatalog;
import io.github.cyfko.formulaql.core.api.FormulaParser;
import io.github.cyfko.formulaql.core.config.FormulaPolicy;
import io.github.cyfko.formulaql.core.exception.FormulaParseException;
import io.github.cyfko.formulaql.core.exception.SqlRenderException;
import io.github.cyfko.formulaql.core.impl.BasicFormulaParser;
import io.github.cyfko.formulaql.core.model.NodeStore;
import io.github.cyfko.formulaql.core.parsing.ParseOutcome;
import io.github.cyfko.formulaql.core.serialization.FormulaSerializer;
import io.github.cyfko.formulaql.core.serialization.SqlQuery;
import io.github.cyfko.formulaql.core.serialization.SqlRenderer;
import io.github.cyfko.formulaql.core.spi.NodeIdGenerator;
import io.github.cyfko.formulaql.core.validation.FormulaReport;
import io.github.cyfko.formulaql.core.validation.StructuralReport;
import io.github.cyfko.formulaql.core.validation.StructuralValidator;
import io.github.cyfko.formulaql.core.validation.TypeChecker;
import io.github.cyfko.formulaql.core.validation.TypeReport;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade over the formula pipeline: parse, serialize, validate and type.
 * <p>
 * The engine holds no per-formula state. The attribute catalog is passed to each call, so one
 * engine serves any number of catalogs and threads.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * AttributeCatalog catalog = SimpleAttributeCatalog.builder()
 *     .attribute("a1", "Price", "number")
 *     .attribute("a2", "Quantity", "integer")
 *     .build();
 *
 * FormulaEngine engine = FormulaEngine.create();
 * NodeStore store = engine.parse("{Price} * {Quantity}", catalog);
 *
 * FormulaReport report = engine.validate(store, catalog);
 * report.isValid();      // true
 * report.resultType();   // NUMBER
 *
 * engine.serialize(store, catalog);   // "{Price} * {Quantity}"
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link FormulaParseException} - a parse limit of the {@link FormulaPolicy} was exceeded</li>
 *   <li>{@link SqlRenderException} - SQL export of a formula that is incomplete</li>
 *   <li>Structural, reference and type problems are returned in reports, never thrown</li>
 * </ul>
 *
 * @see FormulaParser
 * @see StructuralValidator
 * @see TypeChecker
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaEngine {

    private static final Logger log = Logger.getLogger(FormulaEngine.class.getName());

    private final FormulaParser parser;

    private FormulaEngine(FormulaParser parser) {
        this.parser = parser;
    }

    /**
     * Creates an engine with the default policy and random node ids.
     *
     * @return a new engine
     */
    public static FormulaEngine create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses formula text into a node store, dropping what cannot be understood.
     *
     * @param text    the formula text
     * @param catalog catalog resolving {@code {Name}} references
     * @return the parsed store
     * @throws FormulaParseException if a policy limit is exceeded
     */
    public NodeStore parse(String text, AttributeCatalog catalog) {
        return parser.parse(text, catalog);
    }

    /**
     * Parses formula text and reports every piece of input that did not make it into the store.
     *
     * @param text    the formula text
     * @param catalog catalog resolving {@code {Name}} references
     * @return the store and the diagnostics
     * @throws FormulaParseException if a policy limit is exceeded
     */
    public ParseOutcome parseWithDiagnostics(String text, AttributeCatalog catalog) {
        ParseOutcome outcome = parser.parseWithDiagnostics(text, catalog);
        if (!outcome.isClean()) {
            log.fine(() -> String.format("Parsed with %d diagnostic(s)", outcome.diagnostics().size()));
        }
        return outcome;
    }

    public String serialize(NodeStore store, AttributeCatalog catalog) {
        return FormulaSerializer.serialize(store, catalog);
    }

    public StructuralReport validateStructure(NodeStore store) {
        return StructuralValidator.validate(store);
    }

    public StructuralReport validateStructure(NodeStore store, AttributeCatalog catalog) {
        return StructuralValidator.validate(store, catalog);
    }

    public TypeReport inferTypes(NodeStore store, AttributeCatalog catalog) {
        return TypeChecker.inferTypes(store, catalog);
    }

    /**
     * Runs structural validation with reference resolution, then type inference, and merges
     * both into one report.
     *
     * @param store   the store to check
     * @param catalog the attribute catalog
     * @return the combined report
     */
    public FormulaReport validate(NodeStore store, AttributeCatalog catalog) {
        Objects.requireNonNull(catalog, "Attribute catalog cannot be null");
        FormulaReport report = FormulaReport.merge(
                StructuralValidator.validate(store, catalog),
                TypeChecker.inferTypes(store, catalog));
        log.fine(() -> String.format("Validated %d nodes: %d error(s), result %s",
                store.size(), report.errors().size(), report.resultType().displayName()));
        return report;
    }

    /**
     * Rewrites formula text in its normal form: tokens separated by single spaces, arguments
     * separated by {@code ", "}, unrecognized input dropped. Applying it twice changes nothing.
     *
     * @param text    the formula text
     * @param catalog the attribute catalog
     * @return the canonical text
     * @throws FormulaParseException if a policy limit is exceeded
     */
    public String canonicalize(String text, AttributeCatalog catalog) {
        return FormulaSerializer.serialize(parse(text, catalog), catalog);
    }

    /**
     * Ids of the catalog attributes the formula reads, in order of first use.
     *
     * @param store   the formula
     * @param catalog the attribute catalog
     * @return distinct attribute ids
     */
    public List<String> dependencies(NodeStore store, AttributeCatalog catalog) {
        return SqlRenderer.dependencies(store, catalog);
    }

    /**
     * Renders a structurally valid formula as a {@code SELECT} over {@code tableName}.
     *
     * @param store       the formula
     * @param catalog     the attribute catalog, whose ids are the column names
     * @param formulaName display name of the formula, turned into the column alias
     * @param tableName   table holding the attribute columns
     * @return the query
     * @throws SqlRenderException if the formula is incomplete or has no SQL form
     */
    public SqlQuery toSql(NodeStore store, AttributeCatalog catalog, String formulaName, String tableName) {
        return SqlRenderer.renderQuery(store, catalog, formulaName, tableName);
    }

    /**
     * The parser this engine delegates to, either the one given to the builder or the default
     * {@link BasicFormulaParser} configured from the policy.
     *
     * @return the parser
     */
    public FormulaParser getParser() {
        return parser;
    }

    /**
     * Fluent configuration of a {@link FormulaEngine}. A custom parser takes precedence over
     * the policy and id generator, which only configure the default {@link BasicFormulaParser}.
     */
    public static final class Builder {
        private FormulaPolicy _policy = FormulaPolicy.defaults();
        private NodeIdGenerator _idGenerator = NodeIdGenerator.random();
        private FormulaParser _parser;

        private Builder() {}

        public Builder policy(FormulaPolicy policy) { this._policy = Objects.requireNonNull(policy, "policy"); return this; }
        public Builder idGenerator(NodeIdGenerator idGenerator) { this._idGenerator = Objects.requireNonNull(idGenerator, "idGenerator"); return this; }
        public Builder parser(FormulaParser parser) { this._parser = Objects.requireNonNull(parser, "parser"); return this; }

        public FormulaEngine build() {
            FormulaParser parser = _parser != null ? _parser : new BasicFormulaParser(_policy, _idGenerator);
            return new FormulaEngine(parser);
        }
    }
}
