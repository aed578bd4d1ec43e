package org.carball.showplan.parser;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DOM helpers for show-plan documents. Elements are matched by local name so
 * every showplan namespace version, and documents with no namespace, read the same.
 */
final class ShowPlanElements {

    static final String REL_OP = "RelOp";
    static final String SCALAR_OPERATOR = "ScalarOperator";
    static final String COLUMN_REFERENCE = "ColumnReference";

    private ShowPlanElements() {
    }

    static String localName(Node node) {
        String name = node.getLocalName();
        if (name != null) {
            return name;
        }
        String qualified = node.getNodeName();
        int colon = qualified.indexOf(':');
        return colon >= 0 ? qualified.substring(colon + 1) : qualified;
    }

    static boolean is(Element element, String name) {
        return element != null && name.equals(localName(element));
    }

    static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element) {
                result.add(element);
            }
        }
        return result;
    }

    static List<Element> children(Element parent, String name) {
        return children(parent).stream()
                .filter(child -> is(child, name))
                .collect(Collectors.toList());
    }

    static Element child(Element parent, String name) {
        for (Element child : children(parent)) {
            if (is(child, name)) {
                return child;
            }
        }
        return null;
    }

    static Element child(Element parent, String name, String nested) {
        return child(child(parent, name), nested);
    }

    /**
     * Every descendant with the given name, in document order.
     */
    static List<Element> descendants(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        collectDescendants(parent, name, result, false);
        return result;
    }

    /**
     * Descendants with the given name that belong to this operator. The walk never
     * enters a nested RelOp, so a child operator's objects and predicates are not
     * attributed to its ancestor.
     */
    static List<Element> scopedDescendants(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        collectDescendants(parent, name, result, true);
        return result;
    }

    private static void collectDescendants(Element parent, String name, List<Element> result, boolean stopAtRelOp) {
        for (Element child : children(parent)) {
            if (stopAtRelOp && is(child, REL_OP)) {
                continue;
            }
            if (is(child, name)) {
                result.add(child);
            }
            collectDescendants(child, name, result, stopAtRelOp);
        }
    }

    static Element firstDescendant(Element parent, String name) {
        List<Element> found = descendants(parent, name);
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

    static String unbracketed(Element element, String name) {
        return stripBrackets(attr(element, name));
    }

    static double doubleAttr(Element element, String name) {
        return parseDouble(attr(element, name));
    }

    static long longAttr(Element element, String name) {
        return parseLong(attr(element, name));
    }

    static int intAttr(Element element, String name) {
        return (int) parseDouble(attr(element, name));
    }

    static boolean boolAttr(Element element, String name) {
        return parseBool(attr(element, name));
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
            return (long) parseDouble(value);
        }
    }

    static boolean parseBool(String value) {
        return "true".equals(value) || "1".equals(value);
    }

    static String stripBrackets(String value) {
        return value == null ? null : value.replace("[", "").replace("]", "");
    }

    static boolean isNullOrEmpty(String value) {
        return value == null || value.isEmpty();
    }

    /**
     * ScalarString of the first ScalarOperator at or below the element.
     */
    static String scalarString(Element element) {
        if (element == null) {
            return null;
        }
        Element scalar = firstDescendant(element, SCALAR_OPERATOR);
        return attr(scalar, "ScalarString");
    }

    static String formatColumnRef(Element columnRef) {
        String column = attr(columnRef, "Column", "");
        String table = attr(columnRef, "Table", "");
        String formatted = table.isEmpty() ? column : table + "." + column;
        return stripBrackets(formatted);
    }

    /**
     * Comma-joined column references under the named child, or null when there are none.
     */
    static String columnList(Element parent, String name) {
        Element list = child(parent, name);
        if (list == null) {
            return null;
        }
        String joined = children(list, COLUMN_REFERENCE).stream()
                .map(ShowPlanElements::formatColumnRef)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? null : joined;
    }

    static String joinNonEmpty(String separator, String... parts) {
        List<String> present = new ArrayList<>();
        for (String part : parts) {
            if (!isNullOrEmpty(part)) {
                present.add(part);
            }
        }
        return String.join(separator, present);
    }
}
