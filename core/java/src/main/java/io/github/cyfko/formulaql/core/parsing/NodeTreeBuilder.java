package io.github.cyfko.formulaql.core.parsing;

import io.github.cyfko.formulaql.core.api.AttributeCatalog;
import io.github.cyfko.formulaql.core.api.AttributeDescriptor;
import io.github.cyfko.formulaql.core.exception.FormulaParseException;
import io.github.cyfko.formulaql.core.model.FormulaFunction;
import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeStore;
import io.github.cyfko.formulaql.core.model.Operator;
import io.github.cyfko.formulaql.core.spi.NodeIdGenerator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recursive-descent builder turning a token list into a flat {@link NodeStore}.
 * <p>
 * The grammar is flat: a sequence is read left to right without operator precedence, each
 * token becoming one node at the current level. Nesting only comes from parentheses:
 * </p>
 * <ul>
 *   <li>A function token followed by {@code (} opens an argument list. The list is split on
 *       commas at its own depth only; each segment becomes a {@code Group} child carrying its
 *       argument index, filled by a recursive call. {@code f()} yields no argument group.</li>
 *   <li>Any other {@code (} opens a plain {@code Group} whose children are the enclosed
 *       sequence.</li>
 * </ul>
 *
 * <p><strong>Leniency:</strong> the builder never fails on odd structure. A function without an
 * argument list becomes a bare function node, an unclosed parenthesis extends to the end of the
 * input, a stray {@code )} or a top-level comma is dropped, an unknown attribute name is
 * dropped and a malformed number becomes a value node without a value. Each of these is
 * recorded as a {@link ParseDiagnostic}; the resulting shape problems are left to the
 * structural validator. The only failure is exceeding the nesting depth limit.</p>
 *
 * <p>Nodes are emitted in pre-order, so siblings keep their source order in the store.</p>
 *
 * <p>Instances are single-use and not thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NodeTreeBuilder {

    private final AttributeCatalog catalog;
    private final NodeIdGenerator idGenerator;
    private final int maxNestingDepth;
    private final String policyName;

    private final List<Node> nodes = new ArrayList<>();
    private final List<ParseDiagnostic> diagnostics = new ArrayList<>();

    /**
     * @param catalog         catalog used to resolve attribute names
     * @param idGenerator     source of node ids
     * @param maxNestingDepth maximum depth of groups and argument lists
     * @param policyName      policy name quoted when the depth limit is exceeded
     */
    public NodeTreeBuilder(AttributeCatalog catalog, NodeIdGenerator idGenerator, int maxNestingDepth, String policyName) {
        this.catalog = Objects.requireNonNull(catalog, "Attribute catalog is required");
        this.idGenerator = Objects.requireNonNull(idGenerator, "Id generator is required");
        this.maxNestingDepth = maxNestingDepth;
        this.policyName = policyName;
    }

    /**
     * Builds the node tree for the given tokens.
     *
     * @param tokens tokens in source order
     * @return the nodes and the diagnostics collected while building them
     * @throws FormulaParseException if nesting exceeds the depth limit
     */
    public ParseOutcome build(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens cannot be null");
        parseSequence(tokens, 0, tokens.size(), null, 0);
        diagnostics.sort(Comparator.comparingInt(ParseDiagnostic::position));
        return new ParseOutcome(new NodeStore(nodes), diagnostics);
    }

    private void parseSequence(List<Token> tokens, int from, int to, String parentId, int depth) {
        int i = from;
        while (i < to) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case FUNCTION -> i = parseFunction(tokens, i, to, parentId, depth);
                case PAREN_OPEN -> i = parseGroup(tokens, i, to, parentId, depth);
                case PAREN_CLOSE -> {
                    report(token, "Unmatched ')'");
                    i++;
                }
                case COMMA -> {
                    report(token, "Unexpected ',' outside of a function argument list");
                    i++;
                }
                case OPERATOR -> {
                    Optional<Operator> operator = Operator.fromSymbol(token.text());
                    nodes.add(Node.operator(idGenerator.nextId(), parentId, operator.orElse(null)));
                    i++;
                }
                case ATTRIBUTE -> {
                    emitAttribute(token, parentId);
                    i++;
                }
                case VALUE -> {
                    emitValue(token, parentId);
                    i++;
                }
            }
        }
    }

    private int parseFunction(List<Token> tokens, int index, int to, String parentId, int depth) {
        Token token = tokens.get(index);
        FormulaFunction function = FormulaFunction.fromName(token.text()).orElse(null);
        Node functionNode = Node.function(idGenerator.nextId(), parentId, function);
        nodes.add(functionNode);

        int open = index + 1;
        if (open >= to || !tokens.get(open).is(TokenType.PAREN_OPEN)) {
            report(token, String.format("Function '%s' is not followed by an argument list", token.text()));
            return index + 1;
        }

        enter(tokens.get(open), depth + 1);
        int close = findClosing(tokens, open, to);
        int end = close < 0 ? to : close;
        if (close < 0) {
            report(tokens.get(open), String.format("Unclosed '(' of function '%s'", token.text()));
        }

        int contentStart = open + 1;
        if (contentStart < end) {
            int argumentIndex = 0;
            int segmentStart = contentStart;
            int nested = 0;
            for (int i = contentStart; i <= end; i++) {
                boolean atEnd = i == end;
                if (!atEnd) {
                    Token current = tokens.get(i);
                    if (current.is(TokenType.PAREN_OPEN)) {
                        nested++;
                    } else if (current.is(TokenType.PAREN_CLOSE)) {
                        nested--;
                    }
                }
                if (atEnd || (nested == 0 && tokens.get(i).is(TokenType.COMMA))) {
                    Node argument = Node.argument(idGenerator.nextId(), functionNode.id(), argumentIndex++);
                    nodes.add(argument);
                    parseSequence(tokens, segmentStart, i, argument.id(), depth + 1);
                    segmentStart = i + 1;
                }
            }
        }

        return close < 0 ? to : close + 1;
    }

    private int parseGroup(List<Token> tokens, int open, int to, String parentId, int depth) {
        enter(tokens.get(open), depth + 1);
        int close = findClosing(tokens, open, to);
        int end = close < 0 ? to : close;
        if (close < 0) {
            report(tokens.get(open), "Unclosed '('");
        }

        Node group = Node.group(idGenerator.nextId(), parentId);
        nodes.add(group);
        parseSequence(tokens, open + 1, end, group.id(), depth + 1);

        return close < 0 ? to : close + 1;
    }

    private void emitAttribute(Token token, String parentId) {
        Optional<AttributeDescriptor> descriptor = catalog.findByName(token.text());
        if (descriptor.isPresent()) {
            nodes.add(Node.attribute(idGenerator.nextId(), parentId, descriptor.get().id()));
        } else {
            report(token, String.format("Unknown attribute '{%s}'", token.text()));
        }
    }

    private void emitValue(Token token, String parentId) {
        BigDecimal value = null;
        try {
            value = new BigDecimal(token.text());
        } catch (NumberFormatException e) {
            report(token, String.format("Malformed number '%s'", token.text()));
        }
        nodes.add(Node.value(idGenerator.nextId(), parentId, value));
    }

    private void enter(Token token, int depth) {
        if (depth > maxNestingDepth) {
            throw new FormulaParseException(String.format(
                    "Nesting depth exceeds maximum of %d at position %d. Policy applied: %s",
                    maxNestingDepth, token.position(), policyName), token.position());
        }
    }

    /**
     * Index of the parenthesis closing the one at {@code open}, or -1 if the input ends first.
     */
    private static int findClosing(List<Token> tokens, int open, int to) {
        int depth = 0;
        for (int i = open; i < to; i++) {
            Token token = tokens.get(i);
            if (token.is(TokenType.PAREN_OPEN)) {
                depth++;
            } else if (token.is(TokenType.PAREN_CLOSE)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private void report(Token token, String message) {
        String text = token.is(TokenType.ATTRIBUTE) ? "{" + token.text() + "}" : token.text();
        diagnostics.add(new ParseDiagnostic(token.position(), text, message));
    }
}
