package com.nesh.catalog.common;

public final class JdbcUtils {
    private JdbcUtils() {
    }

    public static String asString(Object value) {
        if (value == null) {
            return null;
        }
        return String.valueOf(value);
    }

    public static String asTrimmedString(Object value) {
        String text = asString(value);
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static Integer asInt(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Chapter numbers arrive as "1", "01" or 1; the catalog uses two digits.
     */
    public static String asChapterNumber(Object value) {
        Integer number = asInt(value);
        if (number == null || number < 0 || number > 99) {
            return null;
        }
        return String.format("%02d", number);
    }
}
