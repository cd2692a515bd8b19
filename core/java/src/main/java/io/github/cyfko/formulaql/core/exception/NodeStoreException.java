package io.github.cyfko.formulaql.core.exception;

/**
 * Exception thrown when a caller hands a {@link io.github.cyfko.formulaql.core.model.NodeStore}
 * state that cannot be represented.
 * <p>
 * Shape problems of a formula (missing operands, wrong argument counts, dangling parents) are
 * never reported through this exception: they are the expected state of a formula being edited
 * and come back as validation reports. This exception only covers misuse of the store itself.
 * </p>
 *
 * <p><strong>Typical causes:</strong></p>
 * <ul>
 *   <li>Two nodes sharing the same id</li>
 *   <li>A mutation addressing an id the store does not contain</li>
 *   <li>An update that changes the id of the node being updated</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     store.insertAfter(targetId, node);
 * } catch (NodeStoreException e) {
 *     log.warning(() -> "Edit rejected: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class NodeStoreException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the rejected store operation
     */
    public NodeStoreException(String message) {
        super(message);
    }
}
