package com.production.pdf_analysis.normalize;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Coercions from the loosely typed values Jackson produces for {@code Object} targets
 * (maps, lists, strings, numbers, booleans, nulls) to the types of the result model.
 */
final class LooseValues {

    private LooseValues() {
    }

    /** First value present under any of the keys, in key order. Null values count as absent. */
    static Object first(Map<String, Object> map, String... keys) {
        if (map == null) {
            return null;
        }
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    /** Non-blank string form of a scalar; lists are joined with ", ". */
    static Optional<String> asText(Object value) {
        if (value == null || value instanceof Map) {
            return Optional.empty();
        }
        String text;
        if (value instanceof Collection<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                asText(item).ifPresent(parts::add);
            }
            text = String.join(", ", parts);
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            text = d == Math.rint(d) && !Double.isInfinite(d) ? String.valueOf((long) d) : String.valueOf(d);
        } else {
            text = String.valueOf(value);
        }
        text = text.trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /** Numbers as is; numeric strings parsed (comma decimal separator accepted). */
    static Optional<Double> asNumber(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
        }
        if (value instanceof String s) {
            String t = s.trim().replace(',', '.');
            if (t.endsWith("%")) {
                t = t.substring(0, t.length() - 1).trim();
            }
            try {
                double d = Double.parseDouble(t);
                return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /** True when the value was written as a JSON integer or an integral numeric string. */
    static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long
                || value instanceof java.math.BigInteger || value instanceof Short) {
            return true;
        }
        if (value instanceof String s) {
            return s.trim().matches("[+-]?\\d+");
        }
        return false;
    }

    static Optional<Boolean> asBoolean(Object value) {
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue() != 0);
        }
        if (value instanceof String s) {
            String t = s.trim().toLowerCase(Locale.ROOT);
            if (t.equals("true") || t.equals("yes") || t.equals("да")) return Optional.of(true);
            if (t.equals("false") || t.equals("no") || t.equals("нет")) return Optional.of(false);
        }
        return Optional.empty();
    }

    /** A list of non-blank strings; a single string becomes a one-element list. */
    static List<String> asStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> list) {
            for (Object item : list) {
                asText(item).ifPresent(result::add);
            }
        } else if (value instanceof String) {
            asText(value).ifPresent(result::add);
        }
        return result;
    }

    /** Scores in [0,1]; values above 1 are read as percentages. */
    static double asUnitScore(Object value, double defaultValue) {
        Optional<Double> number = asNumber(value);
        if (number.isEmpty()) {
            return defaultValue;
        }
        double d = number.get();
        if (d > 1.0) {
            d = d / 100.0;
        }
        return Math.max(0.0, Math.min(1.0, d));
    }
}
