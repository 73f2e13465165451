package com.nesh.catalog.model;

import java.util.Locale;
import java.util.regex.Pattern;

public final class AnchorIds {
    public static final String POSITION_PREFIX = "pos-";

    private static final Pattern NON_ALNUM = Pattern.compile("[^A-Za-z0-9]+");

    private AnchorIds() {
    }

    public static String forCode(String code) {
        if (code == null) {
            return null;
        }
        String body = NON_ALNUM.matcher(code.trim()).replaceAll("-");
        body = trimDashes(body).toLowerCase(Locale.ROOT);
        if (body.isEmpty()) {
            return null;
        }
        return POSITION_PREFIX + body;
    }

    public static String forNote(String chapter, String noteNumber) {
        return "chapter-" + chapter + "-note-" + noteNumber;
    }

    private static String trimDashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }
}
