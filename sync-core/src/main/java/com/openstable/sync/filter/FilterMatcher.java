package com.openstable.sync.filter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Client-side evaluation of filter conditions against raw column values.
 * Null column values only match {@code is.null}, following SQL comparison rules.
 */
final class FilterMatcher {

    private FilterMatcher() {
    }

    static boolean matches(Object actual, FilterOperator operator, Object expected) {
        if (operator == FilterOperator.IS) {
            return matchesIs(actual, expected);
        }
        if (actual == null) {
            return false;
        }
        return switch (operator) {
            case EQ -> valuesEqual(actual, expected);
            case NEQ -> !valuesEqual(actual, expected);
            case GT -> compare(actual, expected) > 0;
            case GTE -> compare(actual, expected) >= 0;
            case LT -> compare(actual, expected) < 0;
            case LTE -> compare(actual, expected) <= 0;
            case IN -> expected instanceof List<?> options && options.stream().anyMatch(o -> valuesEqual(actual, o));
            case LIKE -> likePattern(String.valueOf(expected), false).matcher(String.valueOf(actual)).matches();
            case ILIKE -> likePattern(String.valueOf(expected), true).matcher(String.valueOf(actual)).matches();
            case IS -> matchesIs(actual, expected);
        };
    }

    private static boolean matchesIs(Object actual, Object expected) {
        if (expected == null || "null".equalsIgnoreCase(String.valueOf(expected))) {
            return actual == null;
        }
        return actual != null && String.valueOf(actual).equalsIgnoreCase(String.valueOf(expected));
    }

    static boolean valuesEqual(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        BigDecimal left = asNumber(actual);
        BigDecimal right = asNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        if (actual instanceof Boolean || expected instanceof Boolean) {
            return String.valueOf(actual).equalsIgnoreCase(String.valueOf(expected));
        }
        if (actual instanceof Enum<?> e) {
            return e.name().equals(String.valueOf(expected));
        }
        return Objects.equals(String.valueOf(actual), String.valueOf(expected));
    }

    private static int compare(Object actual, Object expected) {
        BigDecimal left = asNumber(actual);
        BigDecimal right = asNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right);
        }
        // ISO-8601 dates and timestamps order correctly as text
        return String.valueOf(actual).compareTo(String.valueOf(expected));
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Pattern likePattern(String pattern, boolean ignoreCase) {
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            switch (c) {
                case '%', '*' -> regex.append(".*");
                case '_' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return ignoreCase
                ? Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL)
                : Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
