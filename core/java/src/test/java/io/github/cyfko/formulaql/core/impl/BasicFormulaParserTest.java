package io.github.cyfko.formulaql.core.impl;

import io.github.cyfko.formulaql.core.api.AttributeCatalog;
import io.github.cyfko.formulaql.core.api.AttributeDescriptor;
import io.github.cyfko.formulaql.core.api.SimpleAttributeCatalog;
import io.github.cyfko.formulaql.core.config.FormulaPolicy;
import io.github.cyfko.formulaql.core.exception.FormulaParseException;
import io.github.cyfko.formulaql.core.model.FormulaFunction;
import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeKind;
import io.github.cyfko.formulaql.core.model.NodeStore;
import io.github.cyfko.formulaql.core.model.Operator;
import io.github.cyfko.formulaql.core.parsing.ParseDiagnostic;
import io.github.cyfko.formulaql.core.parsing.ParseOutcome;
import io.github.cyfko.formulaql.core.spi.NodeIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link BasicFormulaParser}: tree shape, lenient recovery with diagnostics, and
 * policy limits.
 */
class BasicFormulaParserTest {

    private static final AttributeCatalog CATALOG = SimpleAttributeCatalog.builder()
            .attribute("a1", "Price", "number")
            .attribute("a2", "Quantity", "integer")
            .attribute("a3", "VIP", "boolean")
            .build();

    private BasicFormulaParser parser;

    @BeforeEach
    void setUp() {
        parser = new BasicFormulaParser(FormulaPolicy.defaults(), NodeIdGenerator.sequential("n"));
    }

    private static List<NodeKind> kinds(List<Node> nodes) {
        return nodes.stream().map(Node::kind).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Tree shape")
    class TreeShape {

        @Test
        void flatExpression() {
            NodeStore store = parser.parse("{Price} * {Quantity}", CATALOG);

            assertEquals(3, store.size());
            assertEquals(List.of(NodeKind.ATTRIBUTE, NodeKind.OPERATOR, NodeKind.ATTRIBUTE), kinds(store.roots()));
            assertEquals("a1", store.roots().get(0).attributeId());
            assertEquals(Operator.MULTIPLY, store.roots().get(1).operator());
            assertEquals("a2", store.roots().get(2).attributeId());
        }

        @Test
        @DisplayName("Nodes are emitted in pre-order with generated ids")
        void functionArgumentsBecomeIndexedGroups() {
            NodeStore store = parser.parse("pow({Price}, 2)", CATALOG);

            assertEquals(List.of(
                    Node.function("n1", null, FormulaFunction.POW),
                    Node.argument("n2", "n1", 0),
                    Node.attribute("n3", "n2", "a1"),
                    Node.argument("n4", "n1", 1),
                    Node.value("n5", "n4", new BigDecimal("2"))), store.nodes());
        }

        @Test
        void commasInsideNestedCallsBelongToTheNestedCall() {
            NodeStore store = parser.parse("max(min(1, 2), 3)", CATALOG);

            Node max = store.roots().get(0);
            List<Node> maxArguments = store.childrenOf(max.id());
            assertEquals(2, maxArguments.size());

            Node min = store.childrenOf(maxArguments.get(0).id()).get(0);
            assertEquals(FormulaFunction.MIN, min.function());
            assertEquals(2, store.childrenOf(min.id()).size());
            assertEquals(new BigDecimal("3"), store.childrenOf(maxArguments.get(1).id()).get(0).value());
        }

        @Test
        void plainParenthesesBecomeAGroup() {
            NodeStore store = parser.parse("({Price} + 1) * 2", CATALOG);

            assertEquals(List.of(NodeKind.GROUP, NodeKind.OPERATOR, NodeKind.VALUE), kinds(store.roots()));
            Node group = store.roots().get(0);
            assertFalse(group.isArgumentGroup());
            assertEquals(List.of(NodeKind.ATTRIBUTE, NodeKind.OPERATOR, NodeKind.VALUE), kinds(store.childrenOf(group.id())));
        }

        @Test
        void emptyCallHasNoArgumentGroups() {
            NodeStore store = parser.parse("sqrt()", CATALOG);
            assertEquals(1, store.size());
        }

        @Test
        void everyCommaSegmentGetsAGroupEvenWhenEmpty() {
            NodeStore store = parser.parse("pow(, 2)", CATALOG);

            List<Node> groups = store.childrenOf(store.roots().get(0).id());
            assertEquals(2, groups.size());
            assertTrue(store.childrenOf(groups.get(0).id()).isEmpty());
            assertEquals(1, store.childrenOf(groups.get(1).id()).size());
        }

        @Test
        void blankTextGivesAnEmptyStore() {
            ParseOutcome outcome = parser.parseWithDiagnostics("   ", CATALOG);
            assertTrue(outcome.store().isEmpty());
            assertTrue(outcome.isClean());
        }

        @Test
        void nullTextIsRejected() {
            assertThrows(NullPointerException.class, () -> parser.parse(null, CATALOG));
        }
    }

    @Nested
    @DisplayName("Lenient recovery")
    class Recovery {

        @Test
        void unknownAttributeIsDroppedAndReported() {
            ParseOutcome outcome = parser.parseWithDiagnostics("{Unknown} + 1", CATALOG);

            assertEquals(List.of(NodeKind.OPERATOR, NodeKind.VALUE), kinds(outcome.store().roots()));
            assertEquals(List.of(new ParseDiagnostic(0, "{Unknown}", "Unknown attribute '{Unknown}'")),
                    outcome.diagnostics());
        }

        @Test
        void unrecognizedInputIsReportedWithItsOffset() {
            ParseOutcome outcome = parser.parseWithDiagnostics("{Price} $ 2", CATALOG);

            assertEquals(2, outcome.store().size());
            ParseDiagnostic diagnostic = outcome.diagnostics().get(0);
            assertEquals(8, diagnostic.position());
            assertEquals("$", diagnostic.text());
            assertTrue(diagnostic.message().startsWith("Unrecognized input"));
        }

        @Test
        void strayClosingParenthesisIsDropped() {
            ParseOutcome outcome = parser.parseWithDiagnostics("1 ) + 2", CATALOG);

            assertEquals(3, outcome.store().size());
            assertEquals("Unmatched ')'", outcome.diagnostics().get(0).message());
        }

        @Test
        void unclosedCallRunsToTheEndOfInput() {
            ParseOutcome outcome = parser.parseWithDiagnostics("sqrt(4", CATALOG);

            Node sqrt = outcome.store().roots().get(0);
            assertEquals(1, outcome.store().childrenOf(sqrt.id()).size());
            assertEquals("Unclosed '(' of function 'sqrt'", outcome.diagnostics().get(0).message());
        }

        @Test
        void functionWithoutArgumentListIsKeptBare() {
            ParseOutcome outcome = parser.parseWithDiagnostics("sqrt + 1", CATALOG);

            assertEquals(List.of(NodeKind.FUNCTION, NodeKind.OPERATOR, NodeKind.VALUE), kinds(outcome.store().roots()));
            assertEquals("Function 'sqrt' is not followed by an argument list", outcome.diagnostics().get(0).message());
        }

        @Test
        void malformedNumberKeepsAValueWithoutValue() {
            ParseOutcome outcome = parser.parseWithDiagnostics("1.2.3", CATALOG);

            assertNull(outcome.store().roots().get(0).value());
            assertEquals("Malformed number '1.2.3'", outcome.diagnostics().get(0).message());
        }

        @Test
        void diagnosticsAreSortedByPosition() {
            ParseOutcome outcome = parser.parseWithDiagnostics("# {Nope} , $", CATALOG);

            List<Integer> positions = outcome.diagnostics().stream()
                    .map(ParseDiagnostic::position)
                    .collect(Collectors.toList());
            assertEquals(List.of(0, 2, 9, 11), positions);
        }
    }

    @Nested
    @DisplayName("Policy limits")
    class PolicyLimits {

        @Test
        void tooLongExpressionIsRejected() {
            BasicFormulaParser small = new BasicFormulaParser(
                    FormulaPolicy.builder().maxExpressionLength(10).build(), NodeIdGenerator.random());

            FormulaParseException exception = assertThrows(FormulaParseException.class,
                    () -> small.parse("{Price} + 100", CATALOG));
            assertTrue(exception.getMessage().contains("Formula too long"));
            assertEquals(-1, exception.getPosition());
        }

        @Test
        void nestingDepthIsEnforced() {
            BasicFormulaParser shallow = new BasicFormulaParser(
                    FormulaPolicy.builder().maxNestingDepth(2).build(), NodeIdGenerator.random());

            assertEquals(3, shallow.parse("((1))", CATALOG).size());
            FormulaParseException exception = assertThrows(FormulaParseException.class,
                    () -> shallow.parse("(((1)))", CATALOG));
            assertEquals(2, exception.getPosition());
            assertThrows(FormulaParseException.class, () -> shallow.parse("abs(abs(abs(1)))", CATALOG));
        }

        @Test
        void strictPolicyRejectsUnrecognizedInput() {
            BasicFormulaParser strict = new BasicFormulaParser(FormulaPolicy.strict(), NodeIdGenerator.random());

            FormulaParseException exception = assertThrows(FormulaParseException.class,
                    () -> strict.parse("{Price} $ 2", CATALOG));
            assertEquals(8, exception.getPosition());
            assertTrue(exception.getMessage().contains("STRICT_POLICY"));
        }

        @Test
        void nullCollaboratorsAreRejected() {
            assertThrows(IllegalArgumentException.class, () -> new BasicFormulaParser(null, NodeIdGenerator.random()));
            assertThrows(IllegalArgumentException.class, () -> new BasicFormulaParser(FormulaPolicy.defaults(), null));
        }
    }

    @Nested
    @DisplayName("Catalog interaction")
    class CatalogInteraction {

        @Mock
        private AttributeCatalog catalog;

        @BeforeEach
        void openMocks() {
            MockitoAnnotations.openMocks(this);
        }

        @Test
        void namesAreResolvedThroughFindByName() {
            when(catalog.findByName("Price")).thenReturn(Optional.of(new AttributeDescriptor("a1", "Price", "number")));

            NodeStore store = parser.parse("{Price} + {Price}", catalog);

            assertEquals("a1", store.roots().get(2).attributeId());
            verify(catalog, times(2)).findByName("Price");
            verify(catalog, never()).lookup(anyString());
        }
    }
}
