package com.culicidaelab.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Untyped document row as returned by a {@link TableHandle}.
 * Field order is preserved; typed interpretation belongs to the repository layer.
 */
public class Row {

    private final Map<String, Object> fields;

    public Row() {
        this.fields = new LinkedHashMap<>();
    }

    public Row(Map<String, ?> fields) {
        this.fields = new LinkedHashMap<>();
        if (fields != null) {
            this.fields.putAll(fields);
        }
    }

    public static Row of(Map<String, ?> fields) {
        return new Row(fields);
    }

    /**
     * Set a field value, a null value removes the field
     */
    public Row put(String key, Object value) {
        if (value == null) {
            fields.remove(key);
        } else {
            fields.put(key, value);
        }
        return this;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public boolean has(String key) {
        return fields.get(key) != null;
    }

    /**
     * Get field as String
     */
    public String getString(String key) {
        Object value = fields.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Get field as Number, parsing numeric strings
     */
    public Number getNumber(String key) {
        Object value = fields.get(key);
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public Integer getInteger(String key) {
        Number number = getNumber(key);
        return number != null ? number.intValue() : null;
    }

    public Double getDouble(String key) {
        Number number = getNumber(key);
        return number != null ? number.doubleValue() : null;
    }

    /**
     * Get field as a list of strings; non-list values yield an empty list
     */
    public List<String> getStringList(String key) {
        Object value = fields.get(key);
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    /**
     * Read-only view of all fields
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    public int size() {
        return fields.size();
    }

    public Row copy() {
        return new Row(fields);
    }

    @Override
    public String toString() {
        return "Row" + fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return fields.equals(((Row) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }
}
