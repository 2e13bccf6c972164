package com.dbmodel.converter.parser;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Small DOM navigation helpers for workbench documents, where children are addressed
 * by their {@code key} and {@code struct-name} attributes.
 */
public final class XmlElements {

    private XmlElements() {
        // Utility class
    }

    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static List<Element> childElements(Element parent, String tag) {
        return childElements(parent).stream()
                .filter(e -> tag.equals(e.getTagName()))
                .toList();
    }

    /**
     * First direct child with the given tag and {@code key} attribute.
     */
    public static Optional<Element> findKeyed(Element parent, String tag, String key) {
        return childElements(parent).stream()
                .filter(e -> tag.equals(e.getTagName()) && key.equals(e.getAttribute("key")))
                .findFirst();
    }

    public static Optional<Element> findValue(Element parent, String key) {
        return findKeyed(parent, "value", key);
    }

    public static Optional<Element> findLink(Element parent, String key) {
        return findKeyed(parent, "link", key);
    }

    public static List<Element> childrenWithStruct(Element parent, String structName) {
        return childElements(parent).stream()
                .filter(e -> structName.equals(e.getAttribute("struct-name")))
                .toList();
    }

    /**
     * Element text, or null when empty.
     */
    public static String text(Element element) {
        String text = element.getTextContent();
        return text == null || text.isEmpty() ? null : text;
    }

    /**
     * Text of the direct text children only, or null when empty.
     */
    public static String ownText(Element element) {
        StringBuilder sb = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
                sb.append(node.getNodeValue());
            }
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
