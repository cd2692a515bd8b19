package io.github.cyfko.formulaql.core.validation;

import io.github.cyfko.formulaql.core.api.AttributeCatalog;
import io.github.cyfko.formulaql.core.api.AttributeDescriptor;
import io.github.cyfko.formulaql.core.model.DataType;
import io.github.cyfko.formulaql.core.model.FormulaFunction;
import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeStore;
import io.github.cyfko.formulaql.core.model.Operator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Infers the {@link DataType} of every node and reports operator and function misuse.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Attributes take the type declared in the catalog, {@link DataType#UNKNOWN} when unresolved</li>
 *   <li>Values are numbers</li>
 *   <li>A sequence is folded left to right over operand-operator-operand triples</li>
 *   <li>Arithmetic operators and functions need numbers; logical ones need booleans</li>
 *   <li>Equality needs both sides to agree; relational operators also need numbers or strings</li>
 *   <li>{@code IF} needs a boolean condition and branches that agree</li>
 * </ul>
 * {@link DataType#UNKNOWN} satisfies every requirement, so an unresolved reference never
 * produces a cascade of type errors.
 * <p>
 * A sequence whose shape is broken is reported with the same messages as
 * {@link StructuralValidator}, typed {@link DataType#UNKNOWN}, and its members are still typed.
 * Nodes unreachable from the roots are typed as the roots of their own subtree. Cyclic parent
 * chains terminate: a node met again while its own type is being computed counts as unknown.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeChecker {

    private static final Logger log = Logger.getLogger(TypeChecker.class.getName());

    private static final String LEFT = "left";
    private static final String RIGHT = "right";

    private TypeChecker() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Infers the types of a store.
     *
     * @param store   the store to check
     * @param catalog catalog resolving attribute types, or null to treat every attribute as unknown
     * @return the type report
     */
    public static TypeReport inferTypes(NodeStore store, AttributeCatalog catalog) {
        Objects.requireNonNull(store, "store");
        TypeReport report = new Inference(store, catalog).run();
        log.fine(() -> String.format("Type inference of %d nodes: result %s, %d error(s)",
                store.size(), report.resultType().displayName(), report.errors().size()));
        return report;
    }

    /** State of one inference run. */
    private static final class Inference {

        private final NodeStore store;
        private final AttributeCatalog catalog;
        private final Map<String, List<Node>> children = new HashMap<>();
        private final Map<String, DataType> types = new HashMap<>();
        private final Set<String> inProgress = new HashSet<>();
        private final List<String> errors = new ArrayList<>();

        Inference(NodeStore store, AttributeCatalog catalog) {
            this.store = store;
            this.catalog = catalog;
            for (Node node : store) {
                if (node.parentId() != null) {
                    children.computeIfAbsent(node.parentId(), key -> new ArrayList<>()).add(node);
                }
            }
        }

        TypeReport run() {
            List<Node> roots = store.roots();
            DataType result = roots.isEmpty() ? DataType.UNKNOWN : sequenceType(roots);

            for (Node node : store) {
                typeOf(node);
            }

            Map<String, DataType> perNode = new LinkedHashMap<>();
            for (Node node : store) {
                perNode.put(node.id(), types.get(node.id()));
            }
            return new TypeReport(perNode, errors, result);
        }

        private DataType typeOf(Node node) {
            DataType known = types.get(node.id());
            if (known != null) {
                return known;
            }
            if (!inProgress.add(node.id())) {
                return DataType.UNKNOWN;
            }
            DataType type = switch (node.kind()) {
                case ATTRIBUTE -> attributeType(node);
                case VALUE -> DataType.NUMBER;
                case OPERATOR -> node.operator() == null ? DataType.UNKNOWN : node.operator().resultType();
                case FUNCTION -> functionType(node);
                case GROUP -> groupType(node);
            };
            inProgress.remove(node.id());
            types.put(node.id(), type);
            return type;
        }

        private DataType attributeType(Node node) {
            if (catalog == null || node.attributeId() == null) {
                return DataType.UNKNOWN;
            }
            return catalog.lookup(node.attributeId())
                    .map(AttributeDescriptor::dataType)
                    .orElse(DataType.UNKNOWN);
        }

        private DataType groupType(Node group) {
            List<Node> members = childrenOf(group);
            if (members.isEmpty()) {
                if (!group.isArgumentGroup()) {
                    errors.add(ValidationMessages.emptyGroup());
                }
                return DataType.UNKNOWN;
            }
            return sequenceType(members);
        }

        private DataType sequenceType(List<Node> sequence) {
            List<DataType> memberTypes = new ArrayList<>(sequence.size());
            for (Node member : sequence) {
                memberTypes.add(typeOf(member));
            }

            SequenceShape shape = SequenceShape.check(sequence);
            if (!shape.isValid()) {
                errors.addAll(shape.errors());
                return DataType.UNKNOWN;
            }

            DataType accumulated = memberTypes.get(0);
            for (int i = 1; i + 1 < sequence.size(); i += 2) {
                accumulated = applyOperator(sequence.get(i).operator(), accumulated, memberTypes.get(i + 1));
            }
            return accumulated;
        }

        private DataType applyOperator(Operator operator, DataType left, DataType right) {
            if (operator == null) {
                return DataType.UNKNOWN;
            }
            switch (operator.family()) {
                case ARITHMETIC -> {
                    if (!left.satisfies(DataType.NUMBER)) {
                        errors.add(ValidationMessages.arithmeticOperand(operator, LEFT, left));
                    }
                    if (!right.satisfies(DataType.NUMBER)) {
                        errors.add(ValidationMessages.arithmeticOperand(operator, RIGHT, right));
                    }
                }
                case EQUALITY -> {
                    if (!left.agreesWith(right)) {
                        errors.add(ValidationMessages.equalityMismatch(operator, left, right));
                    }
                }
                case RELATIONAL -> {
                    boolean leftComparable = isComparable(left);
                    boolean rightComparable = isComparable(right);
                    if (!leftComparable) {
                        errors.add(ValidationMessages.relationalOperand(operator, LEFT, left));
                    }
                    if (!rightComparable) {
                        errors.add(ValidationMessages.relationalOperand(operator, RIGHT, right));
                    }
                    if (leftComparable && rightComparable && !left.agreesWith(right)) {
                        errors.add(ValidationMessages.relationalMismatch(operator, left, right));
                    }
                }
                case LOGICAL -> {
                    if (!left.satisfies(DataType.BOOLEAN)) {
                        errors.add(ValidationMessages.logicalOperand(operator, LEFT, left));
                    }
                    if (!right.satisfies(DataType.BOOLEAN)) {
                        errors.add(ValidationMessages.logicalOperand(operator, RIGHT, right));
                    }
                }
                case NEGATION -> {
                    // infix NOT has no operand contract of its own
                }
            }
            return operator.resultType();
        }

        private static boolean isComparable(DataType type) {
            return type == DataType.NUMBER || type == DataType.STRING || type == DataType.UNKNOWN;
        }

        private DataType functionType(Node node) {
            SortedMap<Integer, DataType> arguments = argumentTypes(node);
            FormulaFunction function = node.function();
            if (function == null) {
                return DataType.UNKNOWN;
            }
            return switch (function) {
                case ABS, SIN, COS, TAN, SQRT, LOG, EXP, FLOOR, CEIL, ROUND, POW, MIN, MAX, ATAN2 -> {
                    arguments.forEach((index, type) -> {
                        if (!type.satisfies(DataType.NUMBER)) {
                            errors.add(ValidationMessages.numericArgument(function, index, type));
                        }
                    });
                    yield DataType.NUMBER;
                }
                case AND, OR -> {
                    arguments.forEach((index, type) -> {
                        if (!type.satisfies(DataType.BOOLEAN)) {
                            errors.add(ValidationMessages.booleanArgument(function, index, type));
                        }
                    });
                    yield DataType.BOOLEAN;
                }
                case NOT -> {
                    DataType operand = arguments.getOrDefault(0, DataType.UNKNOWN);
                    if (!operand.satisfies(DataType.BOOLEAN)) {
                        errors.add(ValidationMessages.booleanArgument(function, 0, operand));
                    }
                    yield DataType.BOOLEAN;
                }
                case ISNULL, ISNOTNULL -> DataType.BOOLEAN;
                case IF -> ifType(arguments);
            };
        }

        private DataType ifType(SortedMap<Integer, DataType> arguments) {
            DataType condition = arguments.getOrDefault(0, DataType.UNKNOWN);
            if (!condition.satisfies(DataType.BOOLEAN)) {
                errors.add(ValidationMessages.ifCondition(condition));
            }
            if (arguments.isEmpty() || arguments.lastKey() < 2) {
                return DataType.UNKNOWN;
            }
            DataType whenTrue = arguments.getOrDefault(1, DataType.UNKNOWN);
            DataType whenFalse = arguments.getOrDefault(2, DataType.UNKNOWN);
            if (!whenTrue.agreesWith(whenFalse)) {
                errors.add(ValidationMessages.ifBranches(whenTrue, whenFalse));
            }
            return whenTrue != DataType.UNKNOWN ? whenTrue : whenFalse;
        }

        /**
         * Types of a function's argument groups keyed by index; a slot without a group is absent.
         * Children that are not argument groups are typed but do not take part.
         */
        private SortedMap<Integer, DataType> argumentTypes(Node function) {
            SortedMap<Integer, DataType> slots = new TreeMap<>();
            for (Node child : childrenOf(function)) {
                DataType type = typeOf(child);
                if (child.isArgumentGroup()) {
                    slots.putIfAbsent(child.argumentIndex(), type);
                }
            }
            return slots;
        }

        private List<Node> childrenOf(Node node) {
            return children.getOrDefault(node.id(), List.of());
        }
    }
}
