package com.yuzhi.dts.iac.service.diff;

import com.yuzhi.dts.iac.domain.FieldType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Typed comparison of a live value against a desired value.
 */
public final class FieldComparator {

    private FieldComparator() {}

    public static boolean equivalent(FieldType type, Object live, Object desired) {
        return switch (type) {
            case NUMERIC -> numericEquals(live, desired);
            case ORDERED_LIST -> Objects.equals(asStringList(live), asStringList(desired));
            case UNORDERED_LIST -> Objects.equals(new TreeSet<>(asStringList(live)), new TreeSet<>(asStringList(desired)));
            case SCALAR -> Objects.equals(normalizeScalar(live), normalizeScalar(desired));
        };
    }

    /**
     * Stable rendering for change descriptions; unordered lists are sorted so descriptions do not flap.
     */
    public static Object display(FieldType type, Object value) {
        if (value == null) {
            return null;
        }
        if (type == FieldType.UNORDERED_LIST) {
            return new ArrayList<>(new TreeSet<>(asStringList(value)));
        }
        if (type == FieldType.ORDERED_LIST) {
            return asStringList(value);
        }
        return value;
    }

    static boolean numericEquals(Object live, Object desired) {
        BigDecimal left = toDecimal(live);
        BigDecimal right = toDecimal(desired);
        if (left == null || right == null) {
            if (left == null && right == null) {
                return Objects.equals(normalizeScalar(live), normalizeScalar(desired));
            }
            return false;
        }
        return left.compareTo(right) == 0;
    }

    static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static List<String> asStringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            List<String> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(item == null ? "" : item.toString().trim());
            }
            return items;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? List.of() : List.of(text);
    }

    static Object normalizeScalar(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool.toString();
        }
        String text = value.toString().trim();
        String lower = text.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "false".equals(lower)) {
            return lower;
        }
        return text;
    }
}
