package io.github.cyfko.formulaql.core.validation;

import io.github.cyfko.formulaql.core.api.AttributeCatalog;
import io.github.cyfko.formulaql.core.api.AttributeDescriptor;
import io.github.cyfko.formulaql.core.impl.BasicFormulaParser;
import io.github.cyfko.formulaql.core.model.DataType;
import io.github.cyfko.formulaql.core.model.FormulaFunction;
import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeStore;
import io.github.cyfko.formulaql.core.model.Operator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TypeCheckerTest {

    @Mock
    private AttributeCatalog catalog;

    private final BasicFormulaParser parser = new BasicFormulaParser();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        register("a1", "Price", "number");
        register("a2", "VIP", "boolean");
        register("a3", "Name", "string");
        register("a4", "Birthday", "date");
    }

    private void register(String id, String name, String type) {
        AttributeDescriptor descriptor = new AttributeDescriptor(id, name, type);
        when(catalog.lookup(id)).thenReturn(Optional.of(descriptor));
        when(catalog.findByName(name)).thenReturn(Optional.of(descriptor));
    }

    private TypeReport check(String text) {
        return TypeChecker.inferTypes(parser.parse(text, catalog), catalog);
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        void numericProductIsANumber() {
            TypeReport report = check("{Price} * {Price}");

            assertTrue(report.isValid());
            assertEquals(DataType.NUMBER, report.resultType());
        }

        @Test
        void arithmeticOnABooleanNamesTheOperatorAndTheSide() {
            TypeReport report = check("{Price} + {VIP}");

            assertEquals(1, report.errors().size());
            String error = report.errors().get(0);
            assertTrue(error.contains("'+'"));
            assertTrue(error.contains("boolean"));
            assertTrue(error.contains("right"));
            assertEquals(DataType.NUMBER, report.resultType());
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "{Price} == 3          | BOOLEAN | 0",
                "{Name} != {Price}     | BOOLEAN | 1",
                "{Name} > {Name}       | BOOLEAN | 0",
                "{VIP} < 1             | BOOLEAN | 1",
                "{Name} >= 2           | BOOLEAN | 1",
                "{VIP} AND {VIP}       | BOOLEAN | 0",
                "{VIP} OR {Price}      | BOOLEAN | 1",
                "{Birthday} + {VIP}    | NUMBER  | 1",
                "{Birthday} AND {VIP}  | BOOLEAN | 0",
                "{Price} % 2 ** 3      | NUMBER  | 0"
        })
        void operatorRules(String text, DataType result, int errorCount) {
            TypeReport report = check(text);

            assertEquals(result, report.resultType(), text);
            assertEquals(errorCount, report.errors().size(), () -> text + " -> " + report.errors());
        }

        @Test
        @DisplayName("Folding is strictly left to right")
        void leftToRightFolding() {
            // ({Price} > 1) + 2: the boolean comparison feeds the addition
            TypeReport report = check("{Price} > 1 + 2");

            assertEquals(List.of(ValidationMessages.arithmeticOperand(Operator.PLUS, "left", DataType.BOOLEAN)),
                    report.errors());
        }
    }

    @Nested
    @DisplayName("Functions")
    class Functions {

        @Test
        void ifWithBooleanConditionTakesTheBranchType() {
            TypeReport report = check("IF({VIP}, {Price}, {Price})");

            assertTrue(report.isValid());
            assertEquals(DataType.NUMBER, report.resultType());
        }

        @Test
        void ifWithNumericConditionGivesExactlyOneError() {
            TypeReport report = check("IF({Price}, {Price}, {Price})");

            assertEquals(1, report.errors().size());
            assertTrue(report.errors().get(0).contains("IF"));
            assertTrue(report.errors().get(0).contains("condition"));
        }

        @Test
        void ifBranchesMustAgree() {
            TypeReport report = check("IF({VIP}, {Name}, 1)");

            assertEquals(List.of(ValidationMessages.ifBranches(DataType.STRING, DataType.NUMBER)), report.errors());
        }

        @Test
        void ifResultFallsBackToTheFalseBranch() {
            assertEquals(DataType.STRING, check("IF({VIP}, {Birthday}, {Name})").resultType());
            assertEquals(DataType.UNKNOWN, check("IF({VIP}, 1)").resultType());
        }

        @Test
        void arithmeticFunctionsNeedNumbers() {
            TypeReport report = check("sqrt({VIP})");

            assertEquals(List.of("Arithmetic function 'sqrt' requires numeric arguments, but argument 1 is boolean"),
                    report.errors());
            assertEquals(DataType.NUMBER, report.resultType());
        }

        @Test
        void logicalFunctions() {
            assertTrue(check("AND({VIP}, {Price} > 1, NOT({VIP}))").isValid());
            assertEquals(1, check("OR({VIP}, {Name})").errors().size());
            assertEquals(1, check("NOT({Price})").errors().size());
            assertEquals(DataType.BOOLEAN, check("ISNULL({Name})").resultType());
            assertTrue(check("ISNOTNULL({Price})").isValid());
        }

        @Test
        @DisplayName("Errors inside arguments are reported in the same list")
        void nestedErrorsAreAggregated() {
            TypeReport report = check("max(abs({VIP}), {Name} + 1)");

            assertEquals(2, report.errors().size(), () -> report.errors().toString());
            assertEquals(DataType.NUMBER, report.resultType());
        }

        @Test
        @DisplayName("Argument groups at the largest index are typed by the group, not by position")
        void largestArgumentIndexIsTyped() {
            NodeStore store = NodeStore.of(
                    Node.function("or", null, FormulaFunction.OR),
                    Node.argument("g", "or", Integer.MAX_VALUE),
                    Node.attribute("p", "g", "a1"));

            TypeReport report = assertDoesNotThrow(() -> TypeChecker.inferTypes(store, catalog));

            assertEquals(DataType.BOOLEAN, report.resultType());
            assertEquals(List.of(ValidationMessages.booleanArgument(FormulaFunction.OR, Integer.MAX_VALUE, DataType.NUMBER)),
                    report.errors());
            assertTrue(report.errors().get(0).contains("argument 2147483648"));
        }

        @Test
        void ifWithMissingBranchSlotStillTypesTheOtherBranch() {
            NodeStore store = NodeStore.of(
                    Node.function("if", null, FormulaFunction.IF),
                    Node.argument("c", "if", 0),
                    Node.attribute("vip", "c", "a2"),
                    Node.argument("f", "if", 2),
                    Node.attribute("p", "f", "a1"));

            TypeReport report = TypeChecker.inferTypes(store, catalog);

            assertTrue(report.isValid(), () -> report.errors().toString());
            assertEquals(DataType.NUMBER, report.resultType());
        }

        @Test
        void emptyArgumentSlotIsUnknownWithoutTypeError() {
            TypeReport report = check("pow(, 2)");

            assertTrue(report.isValid());
            assertEquals(DataType.NUMBER, report.resultType());
        }
    }

    @Nested
    @DisplayName("Sequences and groups")
    class Sequences {

        @Test
        void groupTakesTheTypeOfItsContent() {
            NodeStore store = parser.parse("({Price} > 1) AND {VIP}", catalog);
            TypeReport report = TypeChecker.inferTypes(store, catalog);

            assertTrue(report.isValid());
            assertEquals(DataType.BOOLEAN, report.typeOf(store.roots().get(0).id()));
        }

        @Test
        void emptyPlainGroupIsAnError() {
            TypeReport report = check("()");

            assertEquals(List.of(ValidationMessages.emptyGroup()), report.errors());
            assertEquals(DataType.UNKNOWN, report.resultType());
        }

        @Test
        void brokenNestedSequenceIsReportedAndUnknown() {
            NodeStore store = parser.parse("({Price} {Price}) + 1", catalog);
            TypeReport report = TypeChecker.inferTypes(store, catalog);

            assertEquals(1, report.errors().size());
            assertTrue(report.errors().get(0).contains("missing operator"));
            Node group = store.roots().get(0);
            assertEquals(DataType.UNKNOWN, report.typeOf(group.id()));
            assertEquals(DataType.NUMBER, report.typeOf(store.childrenOf(group.id()).get(0).id()));
        }

        @Test
        void unresolvedAttributeIsUnknownWithoutError() {
            NodeStore store = NodeStore.of(
                    Node.attribute("x", null, "missing"),
                    Node.operator("plus", null, Operator.PLUS),
                    Node.value("v", null, BigDecimal.ONE));

            TypeReport report = TypeChecker.inferTypes(store, catalog);

            assertTrue(report.isValid());
            assertEquals(DataType.UNKNOWN, report.typeOf("x"));
            assertEquals(DataType.NUMBER, report.resultType());
        }

        @Test
        void nullCatalogTreatsAttributesAsUnknown() {
            NodeStore store = NodeStore.of(Node.attribute("x", null, "a1"));

            assertEquals(DataType.UNKNOWN, TypeChecker.inferTypes(store, null).resultType());
        }

        @Test
        @DisplayName("Every node is typed, cyclic and orphaned ones included")
        void everyNodeIsTyped() {
            NodeStore store = NodeStore.of(
                    Node.value("v", null, BigDecimal.ONE),
                    Node.group("a", "b"),
                    Node.group("b", "a"),
                    Node.function("lost", "ghost", FormulaFunction.ABS),
                    Node.argument("g", "lost", 0),
                    Node.attribute("x", "g", "a2"));

            TypeReport report = TypeChecker.inferTypes(store, catalog);

            assertEquals(6, report.perNode().size());
            assertEquals(DataType.NUMBER, report.typeOf("lost"));
            assertEquals(DataType.BOOLEAN, report.typeOf("g"));
            assertEquals(DataType.UNKNOWN, report.typeOf("a"));
            assertTrue(report.errors().contains(ValidationMessages.numericArgument(FormulaFunction.ABS, 0, DataType.BOOLEAN)));
        }

        @Test
        void inferenceIsIdempotent() {
            NodeStore store = parser.parse("IF({VIP}, {Name}, 1) + {Price}", catalog);

            assertEquals(TypeChecker.inferTypes(store, catalog), TypeChecker.inferTypes(store, catalog));
            verify(catalog, atLeastOnce()).lookup("a1");
        }
    }
}
