package com.autotask.simpleSDK.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An Autotask resource as the API returns it: an open set of fields in response order. Entity-specific
 * subclasses add no fields.
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class AutotaskRecord {
    public static final String ID = "id";
    public static final String ITEM_ID = "itemId";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public AutotaskRecord() {
    }

    public AutotaskRecord(Map<String, ?> fields) {
        if (fields != null) {
            this.fields.putAll(fields);
        }
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @JsonAnySetter
    public AutotaskRecord set(String field, Object value) {
        fields.put(field, value);
        return this;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Object remove(String field) {
        return fields.remove(field);
    }

    /**
     * The numeric identifier: {@code id}, or {@code itemId} for the {@code {itemId: n}} body that
     * creation calls answer with.
     */
    public Optional<Long> getId() {
        Object value = fields.containsKey(ID) ? fields.get(ID) : fields.get(ITEM_ID);
        if (value instanceof Number) {
            return Optional.of(((Number) value).longValue());
        }
        if (value instanceof String) {
            try {
                return Optional.of(Long.parseLong((String) value));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return fields.equals(((AutotaskRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), fields);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + fields;
    }
}
