package io.github.cyfko.formulaql.core.api;

import java.util.*;

/**
 * Immutable in-memory {@link AttributeCatalog}.
 *
 * <pre>{@code
 * AttributeCatalog catalog = SimpleAttributeCatalog.builder()
 *     .attribute("price", "Price", "number")
 *     .attribute("vip", "VIP", "boolean")
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SimpleAttributeCatalog implements AttributeCatalog {

    private final Map<String, AttributeDescriptor> byId;
    private final Map<String, AttributeDescriptor> byName;

    private SimpleAttributeCatalog(Collection<AttributeDescriptor> descriptors) {
        Map<String, AttributeDescriptor> ids = new LinkedHashMap<>();
        Map<String, AttributeDescriptor> names = new HashMap<>();
        for (AttributeDescriptor descriptor : descriptors) {
            if (ids.putIfAbsent(descriptor.id(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate attribute id: " + descriptor.id());
            }
            if (names.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate attribute name: " + descriptor.name());
            }
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.byName = Collections.unmodifiableMap(names);
    }

    public static SimpleAttributeCatalog of(Collection<AttributeDescriptor> descriptors) {
        return new SimpleAttributeCatalog(Objects.requireNonNull(descriptors, "descriptors cannot be null"));
    }

    public static SimpleAttributeCatalog empty() {
        return new SimpleAttributeCatalog(List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<AttributeDescriptor> lookup(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<AttributeDescriptor> findByName(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }

    /**
     * All descriptors in registration order.
     *
     * @return unmodifiable collection of descriptors
     */
    public Collection<AttributeDescriptor> attributes() {
        return byId.values();
    }

    public static final class Builder {
        private final List<AttributeDescriptor> descriptors = new ArrayList<>();

        private Builder() {}

        public Builder attribute(String id, String name, String declaredType) {
            descriptors.add(new AttributeDescriptor(id, name, declaredType));
            return this;
        }

        public Builder attribute(AttributeDescriptor descriptor) {
            descriptors.add(Objects.requireNonNull(descriptor, "descriptor"));
            return this;
        }

        public SimpleAttributeCatalog build() {
            return new SimpleAttributeCatalog(descriptors);
        }
    }
}
