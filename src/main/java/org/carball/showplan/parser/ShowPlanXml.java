package org.carball.showplan.parser;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * DOM helpers for the showplan namespace. Absent attributes read as null, zero or false and
 * numbers that do not parse read as zero.
 */
final class ShowPlanXml {

    static final String NAMESPACE = "http://schemas.microsoft.com/sqlserver/2004/07/showplan";
    static final String ROOT_ELEMENT = "ShowPlanXML";

    private ShowPlanXml() {
        // Utility class - prevent instantiation
    }

    static boolean is(Node node, String localName) {
        return node instanceof Element
                && NAMESPACE.equals(node.getNamespaceURI())
                && localName.equals(node.getLocalName());
    }

    static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element) {
                result.add(element);
            }
        }
        return result;
    }

    static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (is(child, localName)) {
                result.add((Element) child);
            }
        }
        return result;
    }

    static Element child(Element parent, String localName) {
        if (parent == null) {
            return null;
        }
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (is(child, localName)) {
                return (Element) child;
            }
        }
        return null;
    }

    static List<Element> descendants(Element parent, String localName) {
        return descendantsOutside(parent, localName, Set.of());
    }

    /**
     * Descendants that belong to this operator: the walk never enters a nested RelOp, so a parent
     * never picks up objects or predicates of its children.
     */
    static List<Element> scopedDescendants(Element parent, String localName) {
        return descendantsOutside(parent, localName, Set.of("RelOp"));
    }

    /**
     * Statements of the document itself. UDF and StoredProc subtrees belong to the function plan of the
     * statement that invokes them and are not entered.
     */
    static List<Element> ownStatements(Element parent, String localName) {
        return descendantsOutside(parent, localName, Set.of("UDF", "StoredProc"));
    }

    private static List<Element> descendantsOutside(Element parent, String localName, Set<String> boundaries) {
        List<Element> result = new ArrayList<>();
        collectDescendants(parent, localName, boundaries, result);
        return result;
    }

    private static void collectDescendants(Element parent, String localName, Set<String> boundaries, List<Element> result) {
        for (Element child : childElements(parent)) {
            if (NAMESPACE.equals(child.getNamespaceURI()) && boundaries.contains(child.getLocalName())) {
                continue;
            }
            if (is(child, localName)) {
                result.add(child);
            }
            collectDescendants(child, localName, boundaries, result);
        }
    }

    static Element firstDescendant(Element parent, String localName) {
        if (parent == null) {
            return null;
        }
        List<Element> found = descendants(parent, localName);
        return found.isEmpty() ? null : found.get(0);
    }

    static String attr(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        return element.getAttribute(name);
    }

    static String attr(Element element, String name, String defaultValue) {
        String value = attr(element, name);
        return value != null ? value : defaultValue;
    }

    static double attrDouble(Element element, String name) {
        return parseDouble(attr(element, name));
    }

    static long attrLong(Element element, String name) {
        return parseLong(attr(element, name));
    }

    static int attrInt(Element element, String name) {
        return (int) parseDouble(attr(element, name));
    }

    static boolean attrBool(Element element, String name) {
        String value = attr(element, name);
        return "true".equals(value) || "1".equals(value);
    }

    static double parseDouble(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static String stripBrackets(String value) {
        if (value == null) {
            return null;
        }
        return value.replace("[", "").replace("]", "");
    }

    static String bracketFreeAttr(Element element, String name) {
        return stripBrackets(attr(element, name));
    }

    /**
     * ScalarString of the first ScalarOperator below the element, or null.
     */
    static String scalarString(Element element) {
        Element scalar = firstDescendant(element, "ScalarOperator");
        return attr(scalar, "ScalarString");
    }

    static String formatColumnRef(Element columnRef) {
        String column = attr(columnRef, "Column", "");
        String table = attr(columnRef, "Table", "");
        String result = table.isEmpty() ? column : table + "." + column;
        return stripBrackets(result);
    }

    /**
     * Comma separated ColumnReference children of the named child element, or null when there are none.
     */
    static String columnList(Element parent, String localName) {
        Element list = child(parent, localName);
        if (list == null) {
            return null;
        }
        String joined = children(list, "ColumnReference").stream()
                .map(ShowPlanXml::formatColumnRef)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? null : joined;
    }

    /**
     * Joins the non-empty parts with dots, or returns null when all parts are empty.
     */
    static String dotted(String... parts) {
        String joined = Arrays.stream(parts)
                .filter(p -> p != null && !p.isEmpty())
                .collect(Collectors.joining("."));
        return joined.isEmpty() ? null : joined;
    }
}
