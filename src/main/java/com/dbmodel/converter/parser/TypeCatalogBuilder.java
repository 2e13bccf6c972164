package com.dbmodel.converter.parser;

import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import com.dbmodel.converter.model.type.SimpleType;
import com.dbmodel.converter.model.type.TypeCatalog;
import com.dbmodel.converter.model.type.UserType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Builds the {@link TypeCatalog} of a workbench catalog element: simple types first,
 * then user types, which must alias an already declared simple type.
 */
public class TypeCatalogBuilder {
    private static final Logger log = LoggerFactory.getLogger(TypeCatalogBuilder.class);

    public TypeCatalog build(Element catalog) {
        Element simpleTypes = XmlElements.findValue(catalog, "simpleDatatypes")
                .orElseThrow(() -> missing("simpleDatatypes"));
        Element userTypes = XmlElements.findValue(catalog, "userDatatypes")
                .orElseThrow(() -> missing("userDatatypes"));

        TypeCatalog types = new TypeCatalog();

        for (Element link : XmlElements.childElements(simpleTypes, "link")) {
            String nativeType = XmlElements.text(link);
            types.add(TypeCatalog.simpleTypeOf(nativeType));
        }

        for (Element value : XmlElements.childElements(userTypes, "value")) {
            types.add(readUserType(value, types));
        }

        log.debug("Type catalog holds {} types", types.size());
        return types;
    }

    private UserType readUserType(Element value, TypeCatalog types) {
        ElementAttributes attrs = AttributeReader.read(value);
        String actual = attrs.findLink("actualType")
                .orElseThrow(() -> new ConversionException(ConversionError.INVALID_DOCUMENT,
                        "User type " + attrs.getId() + " has no actualType"));

        // validates the pattern before checking that it is known
        TypeCatalog.categoryOf(actual);
        SimpleType actualType = types.findSimple(actual)
                .orElseThrow(() -> new ConversionException(ConversionError.UNRECOGNIZED_NATIVE_TYPE,
                        "User type " + attrs.findString("name").orElse(attrs.getId())
                                + " aliases undeclared type " + actual));

        return UserType.builder()
                .id(attrs.getId())
                .name(attrs.findString("name").orElse(null))
                .sqlDefinition(attrs.findString("sqlDefinition").orElse(null))
                .actualType(actualType)
                .build();
    }

    private static ConversionException missing(String key) {
        return new ConversionException(ConversionError.INVALID_DOCUMENT, "Catalog has no '" + key + "' list");
    }
}
