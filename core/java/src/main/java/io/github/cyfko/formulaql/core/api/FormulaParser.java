package io.github.cyfko.formulaql.core.api;

import io.github.cyfko.formulaql.core.exception.FormulaParseException;
import io.github.cyfko.formulaql.core.model.NodeStore;
import io.github.cyfko.formulaql.core.parsing.ParseOutcome;

/**
 * Parser transforming formula text into a flat node tree.
 *
 * <h2>Grammar</h2>
 * <pre>
 * expr      := term (op term)*
 * term      := attribute | value | funcCall | group
 * funcCall  := FUNCNAME '(' argList? ')'
 * argList   := expr (',' expr)*
 * group     := '(' expr ')'
 * attribute := '{' NAME '}'
 * </pre>
 * <p>
 * There is no operator precedence: an expression is a flat left-to-right sequence of operands
 * and operators. Parentheses are the only source of nesting.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 *
 * NodeStore store = parser.parse("{Price} * {Quantity}", catalog);
 * NodeStore call  = parser.parse("IF({VIP}, {Price} * 0.9, {Price})", catalog);
 *
 * ParseOutcome outcome = parser.parseWithDiagnostics("{Price} ?? 2", catalog);
 * outcome.diagnostics(); // [Unrecognized input '??' at position 8]
 * }</pre>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Parsing must be total over structurally odd input; shape errors are left to validation</li>
 *   <li>Siblings must keep their source order in the resulting store</li>
 *   <li>Blank text parses to an empty store</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FormulaParser {

    /**
     * Parses formula text into a node store.
     *
     * @param text    the formula text, must not be null
     * @param catalog catalog resolving {@code {Name}} references
     * @return a new store whose roots are the top-level expression nodes in source order
     * @throws FormulaParseException if the text exceeds the configured limits
     */
    default NodeStore parse(String text, AttributeCatalog catalog) throws FormulaParseException {
        return parseWithDiagnostics(text, catalog).store();
    }

    /**
     * Parses formula text and reports the input that could not be honored.
     *
     * @param text    the formula text, must not be null
     * @param catalog catalog resolving {@code {Name}} references
     * @return the node store and the parse diagnostics
     * @throws FormulaParseException if the text exceeds the configured limits
     */
    ParseOutcome parseWithDiagnostics(String text, AttributeCatalog catalog) throws FormulaParseException;
}
