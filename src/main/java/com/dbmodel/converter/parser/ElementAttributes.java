package com.dbmodel.converter.parser;

import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Value;

/**
 * Ordered, typed attributes decoded from one workbench element.
 *
 * Every getter checks the declared wire type of the attribute, so an entity asking for
 * an {@code int} where the document carries a {@code string} fails instead of guessing.
 * Values of {@code list} and {@code dict} attributes are kept as empty placeholders only.
 */
public final class ElementAttributes {

    private final String id;
    private final String structName;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    ElementAttributes(String id, String structName) {
        this.id = id;
        this.structName = structName;
    }

    void put(String key, AttributeType type, Object value) {
        if (entries.containsKey(key)) {
            throw new ConversionException(ConversionError.DUPLICATE_KEY,
                    "Attribute '" + key + "' appears twice in element " + describe());
        }
        entries.put(key, new Entry(type, value));
    }

    public String getId() {
        return id;
    }

    public String getStructName() {
        return structName;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public AttributeType typeOf(String key) {
        return entry(key).getType();
    }

    public Map<String, AttributeType> types() {
        Map<String, AttributeType> types = new LinkedHashMap<>();
        entries.forEach((key, entry) -> types.put(key, entry.getType()));
        return Collections.unmodifiableMap(types);
    }

    /**
     * String value, or null when the element text was empty.
     */
    public String getString(String key) {
        return (String) typed(key, AttributeType.STRING).getValue();
    }

    public Optional<String> findString(String key) {
        if (!contains(key)) {
            return Optional.empty();
        }
        return Optional.ofNullable(getString(key));
    }

    public String getRequiredString(String key) {
        String value = getString(key);
        if (value == null) {
            throw new ConversionException(ConversionError.MALFORMED_ATTRIBUTE,
                    "Attribute '" + key + "' of " + describe() + " is empty");
        }
        return value;
    }

    public long getInt(String key) {
        return (Long) required(typed(key, AttributeType.INT), key);
    }

    public long getInt(String key, long defaultValue) {
        return contains(key) ? getInt(key) : defaultValue;
    }

    /**
     * Workbench stores booleans as ints; any non-zero value is true.
     */
    public boolean getFlag(String key) {
        return getInt(key) != 0;
    }

    public boolean getFlag(String key, boolean defaultValue) {
        return contains(key) ? getFlag(key) : defaultValue;
    }

    public double getReal(String key) {
        return (Double) required(typed(key, AttributeType.REAL), key);
    }

    public double getReal(String key, double defaultValue) {
        return contains(key) ? getReal(key) : defaultValue;
    }

    /**
     * Identifier of the linked object, or null for an empty link.
     */
    public String getLink(String key) {
        return (String) typed(key, AttributeType.OBJECT).getValue();
    }

    public Optional<String> findLink(String key) {
        if (!contains(key)) {
            return Optional.empty();
        }
        return Optional.ofNullable(getLink(key));
    }

    private Entry entry(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            throw new ConversionException(ConversionError.KEY_NOT_FOUND,
                    "No attribute '" + key + "' in " + describe());
        }
        return entry;
    }

    private Entry typed(String key, AttributeType expected) {
        Entry entry = entry(key);
        if (entry.getType() != expected) {
            throw new ConversionException(ConversionError.ATTRIBUTE_TYPE_MISMATCH,
                    "Attribute '" + key + "' of " + describe() + " is " + entry.getType().getWireName()
                            + ", expected " + expected.getWireName());
        }
        return entry;
    }

    private Object required(Entry entry, String key) {
        if (entry.getValue() == null) {
            throw new ConversionException(ConversionError.MALFORMED_ATTRIBUTE,
                    "Attribute '" + key + "' of " + describe() + " has no value");
        }
        return entry.getValue();
    }

    String describe() {
        return (structName != null ? structName : "element") + (id != null ? " [" + id + "]" : "");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<").append(describe());
        entries.forEach((key, entry) -> sb.append(' ').append(key).append('=').append(entry.getValue()));
        return sb.append('>').toString();
    }

    @Value
    private static class Entry {
        AttributeType type;
        Object value;
    }
}
