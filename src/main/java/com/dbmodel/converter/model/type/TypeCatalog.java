package com.dbmodel.converter.model.type;

import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * All data types declared by a catalog, indexed by identifier.
 */
public class TypeCatalog {

    private static final Pattern NATIVE_TYPE_PATTERN =
            Pattern.compile("^com\\.mysql\\.rdbms\\.mysql\\.datatype\\.([a-z_]+)$");

    private final Map<String, DataType> typesById = new LinkedHashMap<>();

    public void add(DataType type) {
        if (typesById.containsKey(type.getId())) {
            throw new ConversionException(ConversionError.DUPLICATE_TYPE_ID,
                    "Type id declared twice: " + type.getId());
        }
        typesById.put(type.getId(), type);
    }

    public DataType resolve(String typeId) {
        DataType type = typesById.get(typeId);
        if (type == null) {
            throw new ConversionException(ConversionError.TYPE_NOT_FOUND, "Unknown type id: " + typeId);
        }
        return type;
    }

    public Optional<DataType> find(String typeId) {
        return Optional.ofNullable(typesById.get(typeId));
    }

    public Optional<SimpleType> findSimple(String nativeType) {
        DataType type = typesById.get(nativeType);
        return type instanceof SimpleType simple ? Optional.of(simple) : Optional.empty();
    }

    public Collection<DataType> all() {
        return Collections.unmodifiableCollection(typesById.values());
    }

    public int size() {
        return typesById.size();
    }

    /**
     * Builds the identity type for a native type name, validating its shape.
     */
    public static SimpleType simpleTypeOf(String nativeType) {
        return new SimpleType(nativeType, categoryOf(nativeType));
    }

    public static String categoryOf(String nativeType) {
        Matcher m = NATIVE_TYPE_PATTERN.matcher(nativeType == null ? "" : nativeType);
        if (!m.matches()) {
            throw new ConversionException(ConversionError.UNRECOGNIZED_NATIVE_TYPE,
                    "Unrecognized native type: " + nativeType);
        }
        return m.group(1).toUpperCase(Locale.ROOT);
    }
}
