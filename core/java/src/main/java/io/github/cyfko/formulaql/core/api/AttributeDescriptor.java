package io.github.cyfko.formulaql.core.api;

import io.github.cyfko.formulaql.core.model.DataType;

/**
 * Catalog entry describing one attribute a formula may reference.
 *
 * @param id           stable identifier stored in attribute nodes
 * @param name         display name, written {@code {name}} in formula text, so it cannot contain a closing brace
 * @param declaredType type string declared by the catalog, e.g. {@code "number"}
 * @param description  optional human readable description, may be null
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AttributeDescriptor(String id, String name, String declaredType, String description) {

    public AttributeDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Attribute id is required");
        }
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Attribute name is required for attribute " + id);
        }
        if (name.indexOf('}') >= 0) {
            throw new IllegalArgumentException("Attribute name cannot contain '}': " + name);
        }
    }

    public AttributeDescriptor(String id, String name, String declaredType) {
        this(id, name, declaredType, null);
    }

    /**
     * Declared type mapped onto the formula type lattice.
     *
     * @return the data type, {@link DataType#UNKNOWN} for unrecognized declarations
     */
    public DataType dataType() {
        return DataType.fromDeclaredType(declaredType);
    }
}
