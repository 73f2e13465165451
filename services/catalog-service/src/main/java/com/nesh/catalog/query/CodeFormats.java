package com.nesh.catalog.query;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CodeFormats {
    public static final int MIN_DIGITS = 2;
    public static final int MAX_DIGITS = 8;

    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern EXCEPTION_SUFFIX = Pattern.compile("(?i)^(.*?\\d)\\s*ex\\.?\\s*(\\d{1,3})$");

    private CodeFormats() {
    }

    public static String clean(String code) {
        if (code == null) {
            return "";
        }
        return NON_DIGIT.matcher(code).replaceAll("");
    }

    /**
     * Groups digits in pairs from the left: {@code 851713} becomes {@code 85.17.13}.
     */
    public static String dotted(String digits) {
        if (digits == null || digits.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(digits.length() + digits.length() / 2);
        for (int i = 0; i < digits.length(); i += 2) {
            if (i > 0) {
                builder.append('.');
            }
            builder.append(digits, i, Math.min(i + 2, digits.length()));
        }
        return builder.toString();
    }

    /**
     * Tariff table grouping: 4.2.2 for full codes, 2.2 for headings.
     */
    public static String tariff(String digits) {
        if (digits == null) {
            return "";
        }
        switch (digits.length()) {
            case 4:
                return digits.substring(0, 2) + "." + digits.substring(2);
            case 5:
            case 6:
                return digits.substring(0, 4) + "." + digits.substring(4);
            case 7:
            case 8:
                return digits.substring(0, 4) + "." + digits.substring(4, 6) + "." + digits.substring(6);
            default:
                return digits;
        }
    }

    public static String chapterOf(String digits) {
        if (digits == null || digits.length() < MIN_DIGITS) {
            return null;
        }
        return digits.substring(0, 2);
    }

    /**
     * Splits a trailing exception marker ({@code "8413.11.00 Ex 01"}) from the numeric code.
     * Returns {@code null} when the value carries no marker.
     */
    public static String[] splitException(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = EXCEPTION_SUFFIX.matcher(value.trim());
        if (!matcher.matches()) {
            return null;
        }
        return new String[] {matcher.group(1).trim(), matcher.group(2)};
    }

    public static Integer parseExceptionIndex(String marker) {
        if (marker == null) {
            return null;
        }
        String digits = clean(marker);
        if (digits.isEmpty() || digits.length() > 3) {
            return null;
        }
        return Integer.parseInt(digits);
    }
}
