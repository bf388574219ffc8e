package dev.sfc.xml;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Small helpers over DOM elements: direct children by tag, path lookups
 * and structured-text line extraction.
 */
public final class Elements {

    private Elements() {}

    /**
     * Direct child elements with the given tag name, in document order.
     * A null parent has no children.
     */
    public static List<Element> children(Element parent, String tag) {
        var result = new ArrayList<Element>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element child && tag.equals(child.getTagName())) {
                result.add(child);
            }
        }
        return result;
    }

    public static Element firstChild(Element parent, String tag) {
        List<Element> matches = children(parent, tag);
        return matches.isEmpty() ? null : matches.get(0);
    }

    /**
     * All elements reached by following a slash-separated path of tag names,
     * e.g. {@code "Action/Body/STContent"}, in document order.
     */
    public static List<Element> path(Element parent, String path) {
        List<Element> current = new ArrayList<>();
        if (parent == null) {
            return current;
        }
        current.add(parent);
        for (String tag : path.split("/")) {
            var next = new ArrayList<Element>();
            for (Element element : current) {
                next.addAll(children(element, tag));
            }
            current = next;
        }
        return current;
    }

    public static Element firstPath(Element parent, String path) {
        List<Element> matches = path(parent, path);
        return matches.isEmpty() ? null : matches.get(0);
    }

    /**
     * Attribute value, or null when the attribute is absent or blank.
     */
    public static String attribute(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        String value = element.getAttribute(name).trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Text of each {@code Line} child of an {@code STContent} element, exactly
     * as written (indentation kept). Blank lines are dropped; CDATA and plain
     * text read the same.
     */
    public static List<String> stLines(Element stContent) {
        var lines = new ArrayList<String>();
        for (Element line : children(stContent, "Line")) {
            String text = line.getTextContent();
            if (text != null && !text.isBlank()) {
                lines.add(text);
            }
        }
        return lines;
    }

    /**
     * First descendant (not the element itself) carrying {@code attribute="value"}.
     */
    public static Element findDescendant(Element parent, String attribute, String value) {
        if (parent == null) {
            return null;
        }
        NodeList nodes = parent.getElementsByTagName("*");
        for (int i = 0; i < nodes.getLength(); i++) {
            Element element = (Element) nodes.item(i);
            if (value.equals(element.getAttribute(attribute))) {
                return element;
            }
        }
        return null;
    }
}
