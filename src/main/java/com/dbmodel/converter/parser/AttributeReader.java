package com.dbmodel.converter.parser;

import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;

/**
 * Decodes the direct {@code value}/{@code link} children of a workbench element into
 * {@link ElementAttributes}. Shared by every entity of the schema graph; it knows nothing
 * about its callers.
 */
public final class AttributeReader {

    private AttributeReader() {
        // Utility class
    }

    public static ElementAttributes read(Element element) {
        ElementAttributes attributes = new ElementAttributes(
                emptyToNull(element.getAttribute("id")),
                emptyToNull(element.getAttribute("struct-name")));

        for (Element child : XmlElements.childElements(element)) {
            String tag = child.getTagName();
            if (!"value".equals(tag) && !"link".equals(tag)) {
                continue;
            }
            if (!child.hasAttribute("key") || !child.hasAttribute("type")) {
                continue;
            }

            String key = child.getAttribute("key");
            String wireType = child.getAttribute("type");
            AttributeType type = AttributeType.fromWireName(wireType)
                    .orElseThrow(() -> new ConversionException(ConversionError.UNSUPPORTED_ATTRIBUTE_TYPE,
                            "Unknown attribute type '" + wireType + "' for key '" + key + "' in "
                                    + attributes.describe()));

            attributes.put(key, type, decode(type, key, child));
        }
        return attributes;
    }

    private static Object decode(AttributeType type, String key, Element child) {
        return switch (type) {
            case STRING -> XmlElements.text(child);
            case OBJECT -> reference(child);
            case INT -> parseInt(key, XmlElements.text(child));
            case REAL -> parseReal(key, XmlElements.text(child));
            // placeholders; entities read their collections from the element itself
            case LIST -> List.of();
            case DICT -> Map.of();
        };
    }

    /**
     * Identifier of a link, or of an object value nested in place.
     */
    private static String reference(Element child) {
        if ("value".equals(child.getTagName()) && child.hasAttribute("id")) {
            return emptyToNull(child.getAttribute("id"));
        }
        return XmlElements.ownText(child);
    }

    private static Long parseInt(String key, String text) {
        if (text == null) {
            return null;
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new ConversionException(ConversionError.MALFORMED_ATTRIBUTE,
                    "Attribute '" + key + "' is not an int: " + text, e);
        }
    }

    private static Double parseReal(String key, String text) {
        if (text == null) {
            return null;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new ConversionException(ConversionError.MALFORMED_ATTRIBUTE,
                    "Attribute '" + key + "' is not a real: " + text, e);
        }
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
