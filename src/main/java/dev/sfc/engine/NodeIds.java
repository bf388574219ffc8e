package dev.sfc.engine;

import java.util.Comparator;

/**
 * Ordering of element IDs. Numeric IDs sort by value, with equal values
 * ("7", "07") ordered by their text; anything else sorts after every numeric
 * ID, lexicographically.
 */
public final class NodeIds {

    public static final Comparator<String> NUMERIC_ORDER = NodeIds::compare;

    private NodeIds() {}

    /**
     * Numeric value of an ID, or null when it is not a plain decimal integer.
     */
    public static Long numericValue(String id) {
        if (id == null || id.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int compare(String a, String b) {
        Long left = numericValue(a);
        Long right = numericValue(b);
        if (left != null && right != null) {
            int byValue = Long.compare(left, right);
            return byValue != 0 ? byValue : a.compareTo(b);
        }
        if (left != null) {
            return -1;
        }
        if (right != null) {
            return 1;
        }
        return a.compareTo(b);
    }
}
