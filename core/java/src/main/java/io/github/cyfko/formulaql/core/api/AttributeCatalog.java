package io.github.cyfko.formulaql.core.api;

import java.util.Optional;

/**
 * Read-only registry of the attributes formulas may reference.
 * <p>
 * The catalog is supplied by the caller and never mutated by the engine. Attribute nodes store
 * ids; formula text uses names. The parser resolves names through {@link #findByName(String)},
 * the serializer and the type checker resolve ids through {@link #lookup(String)}.
 * </p>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Lookups must be side-effect free and return the same answer for the same catalog state</li>
 *   <li>A miss is an empty result, never an exception</li>
 *   <li>Names are matched exactly (case-sensitive)</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see SimpleAttributeCatalog
 */
public interface AttributeCatalog {

    /**
     * Resolves an attribute by id.
     *
     * @param id the attribute id stored in a node
     * @return the descriptor, or empty if the id is unknown
     */
    Optional<AttributeDescriptor> lookup(String id);

    /**
     * Resolves an attribute by its display name.
     *
     * @param name the name as written between braces in formula text
     * @return the descriptor, or empty if no attribute has that name
     */
    Optional<AttributeDescriptor> findByName(String name);
}
