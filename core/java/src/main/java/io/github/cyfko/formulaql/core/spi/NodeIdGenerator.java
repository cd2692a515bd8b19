package io.github.cyfko.formulaql.core.spi;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of node identifiers.
 * <p>
 * Implementations must never hand out the same id twice for the lifetime of the generator.
 * The default, {@link #random()}, derives ids from random UUIDs so that nodes produced by
 * independent parses can be merged into one store without collisions.
 * </p>
 *
 * <pre>{@code
 * NodeIdGenerator ids = NodeIdGenerator.sequential("n");
 * ids.nextId(); // "n1"
 * ids.nextId(); // "n2"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface NodeIdGenerator {

    /**
     * Produces a fresh identifier.
     *
     * @return a non-blank id not returned before by this generator
     */
    String nextId();

    /**
     * Generator producing {@code node_<uuid>} ids.
     *
     * @return a random id generator
     */
    static NodeIdGenerator random() {
        return () -> "node_" + UUID.randomUUID();
    }

    /**
     * Thread-safe generator producing {@code prefix1, prefix2, ...}.
     *
     * @param prefix id prefix, must not be blank
     * @return a sequential id generator
     */
    static NodeIdGenerator sequential(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Id prefix is required");
        }
        AtomicLong counter = new AtomicLong();
        return () -> prefix + counter.incrementAndGet();
    }
}
