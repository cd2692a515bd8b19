package io.github.cyfko.formulaql.core.serialization;

import io.github.cyfko.formulaql.core.api.AttributeCatalog;
import io.github.cyfko.formulaql.core.exception.SqlRenderException;
import io.github.cyfko.formulaql.core.model.FormulaFunction;
import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeKind;
import io.github.cyfko.formulaql.core.model.NodeStore;
import io.github.cyfko.formulaql.core.model.Operator;
import io.github.cyfko.formulaql.core.validation.StructuralReport;
import io.github.cyfko.formulaql.core.validation.StructuralValidator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Renders a complete formula as a SQL expression over the catalog's attribute columns.
 *
 * <h2>Rendering Rules</h2>
 * <ul>
 *   <li>Attribute: its catalog id, used as the column name</li>
 *   <li>Sequence: folded left to right like the type checker, so {@code 1 + 2 * 3} becomes
 *       {@code (1 + 2) * 3} and SQL precedence cannot regroup it</li>
 *   <li>Operators: {@code ==} as {@code =}, {@code !=} as {@code <>}, {@code **} as
 *       {@code POWER(l, r)}, the others unchanged</li>
 *   <li>Functions: scalar SQL equivalents; {@code min}/{@code max} as {@code LEAST}/{@code GREATEST},
 *       {@code IF} as {@code CASE WHEN}, {@code AND}/{@code OR} joined with the keyword</li>
 * </ul>
 *
 * <pre>{@code
 * SqlRenderer.renderExpression(engine.parse("IF({VIP}, {Price} * 0.9, {Price})", catalog), catalog);
 * // "CASE WHEN vip THEN price * 0.9 ELSE price END"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SqlRenderer {

    private static final Logger log = Logger.getLogger(SqlRenderer.class.getName());

    private SqlRenderer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Ids of the catalog attributes a formula reads, in order of first use from the roots.
     * Unresolved references and unreachable nodes are ignored.
     *
     * @param store   the formula
     * @param catalog the attribute catalog
     * @return distinct attribute ids
     */
    public static List<String> dependencies(NodeStore store, AttributeCatalog catalog) {
        Objects.requireNonNull(store, "Node store cannot be null");
        Objects.requireNonNull(catalog, "Attribute catalog cannot be null");

        Set<String> ids = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        Deque<Node> pending = new ArrayDeque<>();
        List<Node> roots = store.roots();
        for (int i = roots.size() - 1; i >= 0; i--) {
            pending.push(roots.get(i));
        }
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (!visited.add(node.id())) {
                continue;
            }
            if (node.kind() == NodeKind.ATTRIBUTE && catalog.lookup(node.attributeId()).isPresent()) {
                ids.add(node.attributeId());
            }
            List<Node> children = store.childrenOf(node.id());
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return List.copyOf(ids);
    }

    /**
     * Renders the formula as one SQL expression.
     *
     * @param store   a structurally valid formula
     * @param catalog the attribute catalog
     * @return the SQL expression
     * @throws SqlRenderException if the formula is incomplete or uses the infix {@code NOT}
     */
    public static String renderExpression(NodeStore store, AttributeCatalog catalog) {
        Objects.requireNonNull(store, "Node store cannot be null");
        Objects.requireNonNull(catalog, "Attribute catalog cannot be null");

        StructuralReport report = StructuralValidator.validate(store, catalog);
        if (!report.isValid()) {
            log.warning(() -> "Refusing to render an invalid formula as SQL: " + report.errors());
            throw new SqlRenderException("Formula is not structurally valid: " + String.join("; ", report.errors()));
        }
        if (store.roots().isEmpty()) {
            throw new SqlRenderException("Formula is empty");
        }
        return renderSequence(store.roots(), store);
    }

    /**
     * Renders a {@code SELECT} of the formula's inputs and of the formula itself.
     *
     * @param store       a structurally valid formula
     * @param catalog     the attribute catalog
     * @param formulaName display name of the formula, turned into the column alias
     * @param tableName   table holding the attribute columns
     * @return the query with its column alias and dependencies
     * @throws IllegalArgumentException if the table name is blank or the formula name yields no
     *                                  usable alias
     * @throws SqlRenderException       if the formula cannot be rendered
     */
    public static SqlQuery renderQuery(NodeStore store, AttributeCatalog catalog, String formulaName, String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name is required");
        }
        String columnName = columnName(formulaName);
        String expression = renderExpression(store, catalog);
        List<String> dependencies = dependencies(store, catalog);

        List<String> selected = new ArrayList<>(dependencies);
        selected.add(expression + " AS " + columnName);
        String sql = "SELECT " + String.join(", ", selected) + " FROM " + tableName;

        log.fine(() -> String.format("Rendered formula '%s' as %s", formulaName, sql));
        return new SqlQuery(sql, columnName, dependencies);
    }

    /**
     * Lower-cases a display name and reduces it to {@code [a-z0-9_]}, collapsing and trimming
     * underscores.
     *
     * @param formulaName the display name
     * @return the column alias
     * @throws IllegalArgumentException if nothing usable remains
     */
    public static String columnName(String formulaName) {
        String column = formulaName == null ? "" : formulaName.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_]", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
        if (column.isEmpty()) {
            throw new IllegalArgumentException("Formula name '" + formulaName + "' yields no column name");
        }
        return column;
    }

    private static String renderSequence(List<Node> sequence, NodeStore store) {
        if (sequence.isEmpty() || sequence.size() % 2 == 0) {
            throw new SqlRenderException("Expected operands separated by operators, got " + describe(sequence));
        }

        String accumulated = renderOperand(sequence.get(0), store);
        boolean compound = false;
        for (int i = 1; i < sequence.size(); i += 2) {
            Node operator = sequence.get(i);
            if (operator.kind() != NodeKind.OPERATOR || operator.operator() == null) {
                throw new SqlRenderException("Expected operands separated by operators, got " + describe(sequence));
            }
            String left = compound ? "(" + accumulated + ")" : accumulated;
            String right = renderOperand(sequence.get(i + 1), store);
            accumulated = renderOperator(operator.operator(), left, right);
            compound = operator.operator() != Operator.POWER;
        }
        return accumulated;
    }

    private static String renderOperand(Node node, NodeStore store) {
        return switch (node.kind()) {
            case ATTRIBUTE -> node.attributeId();
            case VALUE -> node.value() == null ? "0" : node.value().stripTrailingZeros().toPlainString();
            case FUNCTION -> renderFunction(node, store);
            case GROUP -> "(" + renderSequence(store.childrenOf(node.id()), store) + ")";
            case OPERATOR -> throw new SqlRenderException(
                    "Operator '" + (node.operator() == null ? "?" : node.operator().symbol()) + "' is missing an operand");
        };
    }

    private static String renderOperator(Operator operator, String left, String right) {
        return switch (operator) {
            case POWER -> "POWER(" + left + ", " + right + ")";
            case EQ -> left + " = " + right;
            case NE -> left + " <> " + right;
            case NOT -> throw new SqlRenderException("Operator 'NOT' cannot join two operands, use NOT(...)");
            default -> left + " " + operator.symbol() + " " + right;
        };
    }

    private static String renderFunction(Node node, NodeStore store) {
        FormulaFunction function = node.function();
        List<String> arguments = new ArrayList<>();
        for (Node group : argumentGroups(node, store).values()) {
            arguments.add(renderSequence(store.childrenOf(group.id()), store));
        }

        return switch (function) {
            case ABS, SIN, COS, TAN, SQRT, EXP, FLOOR, CEIL, ROUND, ATAN2 -> call(function.name(), arguments);
            case LOG -> call("LN", arguments);
            case POW -> call("POWER", arguments);
            case MIN -> call("LEAST", arguments);
            case MAX -> call("GREATEST", arguments);
            case IF -> "CASE WHEN " + arguments.get(0) + " THEN " + arguments.get(1)
                    + " ELSE " + arguments.get(2) + " END";
            case AND -> arguments.isEmpty() ? "TRUE" : joinLogical(" AND ", arguments);
            case OR -> arguments.isEmpty() ? "FALSE" : joinLogical(" OR ", arguments);
            case NOT -> "NOT (" + arguments.get(0) + ")";
            case ISNULL -> "(" + arguments.get(0) + ") IS NULL";
            case ISNOTNULL -> "(" + arguments.get(0) + ") IS NOT NULL";
        };
    }

    /** Argument groups by index; structural validation guarantees one group per slot. */
    private static SortedMap<Integer, Node> argumentGroups(Node function, NodeStore store) {
        SortedMap<Integer, Node> groups = new TreeMap<>();
        for (Node child : store.childrenOf(function.id())) {
            groups.put(child.argumentIndex(), child);
        }
        return groups;
    }

    private static String call(String name, List<String> arguments) {
        return name + "(" + String.join(", ", arguments) + ")";
    }

    private static String joinLogical(String keyword, List<String> arguments) {
        return arguments.stream().map(argument -> "(" + argument + ")").collect(Collectors.joining(keyword, "(", ")"));
    }

    private static String describe(List<Node> sequence) {
        return sequence.stream().map(node -> node.kind().label()).collect(Collectors.joining(" ", "[", "]"));
    }
}
