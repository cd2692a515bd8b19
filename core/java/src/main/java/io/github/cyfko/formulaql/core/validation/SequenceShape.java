package io.github.cyfko.formulaql.core.validation;

import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape rules of one flat operand/operator sequence (the roots, or the children of a group).
 * <ul>
 *   <li>Operators without any operand in the sequence: one summary error</li>
 *   <li>Two adjacent operands: a broken connection</li>
 *   <li>An operator without an operand on its left or right: one error per missing side</li>
 * </ul>
 * A sequence passing these rules alternates operand, operator, operand, ... and starts and
 * ends with an operand.
 */
final class SequenceShape {

    private final List<String> errors;
    private final List<BrokenConnection> brokenConnections;

    private SequenceShape(List<String> errors, List<BrokenConnection> brokenConnections) {
        this.errors = errors;
        this.brokenConnections = brokenConnections;
    }

    static SequenceShape check(List<Node> sequence) {
        List<String> errors = new ArrayList<>();
        List<BrokenConnection> broken = new ArrayList<>();

        boolean hasOperator = sequence.stream().anyMatch(node -> node.kind() == NodeKind.OPERATOR);
        boolean hasOperand = sequence.stream().anyMatch(node -> node.kind().isOperandLike());

        if (hasOperator && !hasOperand) {
            errors.add(ValidationMessages.operatorsWithoutOperands());
            return new SequenceShape(errors, broken);
        }

        for (int i = 0; i + 1 < sequence.size(); i++) {
            Node current = sequence.get(i);
            Node next = sequence.get(i + 1);
            if (current.kind().isOperandLike() && next.kind().isOperandLike()) {
                broken.add(new BrokenConnection(current.id(), next.id()));
                errors.add(ValidationMessages.missingOperator(current.kind(), next.kind()));
            }
        }

        for (int i = 0; i < sequence.size(); i++) {
            Node node = sequence.get(i);
            if (node.kind() != NodeKind.OPERATOR) {
                continue;
            }
            boolean left = i > 0 && sequence.get(i - 1).kind().isOperandLike();
            boolean right = i + 1 < sequence.size() && sequence.get(i + 1).kind().isOperandLike();
            if (!left) {
                errors.add(ValidationMessages.missingLeftOperand(node.operator()));
            }
            if (!right) {
                errors.add(ValidationMessages.missingRightOperand(node.operator()));
            }
        }

        return new SequenceShape(errors, broken);
    }

    boolean isValid() {
        return errors.isEmpty();
    }

    List<String> errors() {
        return errors;
    }

    List<BrokenConnection> brokenConnections() {
        return brokenConnections;
    }
}
