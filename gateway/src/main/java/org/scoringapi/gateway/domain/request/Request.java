package org.scoringapi.gateway.domain.request;

import org.scoringapi.gateway.domain.field.Field;
import org.scoringapi.gateway.domain.field.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for requests described by a {@link Schema}.
 *
 * The constructor only copies raw values: every declared attribute takes the value
 * found under its key, or {@link Field#UNSET} when the key is absent. Keys that the
 * schema does not declare are ignored. {@link #validate()} is a separate step and
 * never changes the instance, so it can be called any number of times.
 */
public abstract class Request {

    private final Schema schema;
    private final Map<String, Object> values;

    protected Request(Schema schema, Map<String, ?> raw) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        Map<String, ?> source = raw == null ? Collections.emptyMap() : raw;
        Map<String, Object> assigned = new LinkedHashMap<>();
        for (String name : schema.getFieldNames()) {
            assigned.put(name, source.containsKey(name) ? source.get(name) : Field.UNSET);
        }
        this.values = Collections.unmodifiableMap(assigned);
    }

    public Schema getSchema() {
        return schema;
    }

    /**
     * Validate declared attributes in schema order and stop at the first failure.
     * Attributes left unset are checked only when their field is required.
     */
    public void validate() throws ValidationException {
        for (Map.Entry<String, Field> entry : schema.getFields().entrySet()) {
            String name = entry.getKey();
            Field field = entry.getValue();
            Object value = values.get(name);
            if (value != Field.UNSET || field.isRequired()) {
                field.validate(name, value);
            }
        }
    }

    /**
     * Raw value of a declared attribute; {@link Field#UNSET} when it was absent.
     */
    public Object get(String name) {
        if (!schema.hasField(name)) {
            throw new IllegalArgumentException("Unknown field '" + name + "' for " + schema.getName());
        }
        return values.get(name);
    }

    public boolean isSet(String name) {
        return get(name) != Field.UNSET;
    }

    /**
     * Whether the attribute carries a value: set, not null and not the empty form of its field.
     */
    public boolean isPresent(String name) {
        Object value = get(name);
        return value != Field.UNSET && !schema.getField(name).isEmpty(value);
    }

    /**
     * Names of the attributes that carry a value, in schema order.
     */
    public List<String> getPresentFields() {
        List<String> present = new ArrayList<>();
        for (String name : schema.getFieldNames()) {
            if (isPresent(name)) {
                present.add(name);
            }
        }
        return present;
    }

    protected String getText(String name) {
        Object value = get(name);
        return value instanceof String ? (String) value : null;
    }

    /**
     * Value or null; unset and explicit null read the same.
     */
    protected Object getValue(String name) {
        Object value = get(name);
        return value == Field.UNSET ? null : value;
    }

    @Override
    public String toString() {
        return "<" + getClass().getSimpleName() + ": " + values + ">";
    }
}
