package org.scoringapi.gateway.domain.request;

import org.scoringapi.gateway.domain.field.Field;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, ordered set of named field descriptors describing a request shape.
 * A schema built from a parent starts with all of the parent's fields, in the
 * parent's order, followed by its own.
 */
public final class Schema {

    private final String name;
    private final Map<String, Field> fields;

    private Schema(Builder builder) {
        this.name = builder.name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    }

    public static Builder builder(String name) {
        return new Builder(name, null);
    }

    /**
     * Start a schema that inherits every field of {@code parent}.
     */
    public static Builder builder(String name, Schema parent) {
        return new Builder(name, Objects.requireNonNull(parent, "parent must not be null"));
    }

    public String getName() {
        return name;
    }

    /**
     * Fields in declaration order, ancestors first.
     */
    public Map<String, Field> getFields() {
        return fields;
    }

    public Set<String> getFieldNames() {
        return fields.keySet();
    }

    public Field getField(String fieldName) {
        return fields.get(fieldName);
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    @Override
    public String toString() {
        return "Schema{" + name + ", fields=" + fields.keySet() + '}';
    }

    /**
     * Builder for Schema.
     */
    public static final class Builder {
        private final String name;
        private final Map<String, Field> fields = new LinkedHashMap<>();

        private Builder(String name, Schema parent) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            if (parent != null) {
                fields.putAll(parent.fields);
            }
        }

        public Builder field(String fieldName, Field field) {
            Objects.requireNonNull(fieldName, "fieldName must not be null");
            Objects.requireNonNull(field, "field must not be null");
            if (fields.containsKey(fieldName)) {
                throw new IllegalArgumentException("Duplicate field '" + fieldName + "' in schema " + name);
            }
            fields.put(fieldName, field);
            return this;
        }

        public Schema build() {
            return new Schema(this);
        }
    }
}
