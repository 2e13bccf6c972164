package com.dbmodel.converter.codegen.dbm;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Element construction helpers for the destination document.
 */
public final class DbmElements {

    private DbmElements() {
        // Utility class
    }

    /**
     * Creates a detached element; {@code attributes} are name/value pairs.
     */
    public static Element create(Document doc, String tag, String... attributes) {
        if (attributes.length % 2 != 0) {
            throw new IllegalArgumentException("Attributes must be name/value pairs: " + tag);
        }
        Element element = doc.createElement(tag);
        for (int i = 0; i < attributes.length; i += 2) {
            element.setAttribute(attributes[i], attributes[i + 1]);
        }
        return element;
    }

    public static Element append(Element parent, String tag, String... attributes) {
        Element element = create(parent.getOwnerDocument(), tag, attributes);
        parent.appendChild(element);
        return element;
    }

    public static Element appendText(Element parent, String tag, String text) {
        Element element = append(parent, tag);
        element.setTextContent(text);
        return element;
    }

    public static Element appendCData(Element parent, String tag, String text) {
        Element element = append(parent, tag);
        element.appendChild(parent.getOwnerDocument().createCDATASection(text));
        return element;
    }

    /**
     * Appends the {@code schema} and {@code role} references most objects carry.
     */
    public static void appendOwnership(Element parent, String schema, String owner) {
        append(parent, "schema", "name", schema);
        append(parent, "role", "name", owner);
    }

    public static String bool(boolean value) {
        return value ? "true" : "false";
    }
}
