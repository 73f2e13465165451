package com.nesh.catalog.query;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class QueryClassifier {
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,;]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CODE_SHAPE = Pattern.compile("^\\d+(?:[./-]\\d+)*$");

    public ClassifiedQuery classify(String raw) {
        if (raw == null || raw.isBlank()) {
            return ClassifiedQuery.text("");
        }
        String trimmed = raw.trim();
        List<CodeToken> tokens = new ArrayList<>();
        for (String piece : LIST_SEPARATOR.split(trimmed)) {
            String candidate = piece.trim();
            if (candidate.isEmpty()) {
                continue;
            }
            CodeToken token = parseToken(candidate);
            if (token != null) {
                tokens.add(token);
                continue;
            }
            List<CodeToken> parts = splitOnWhitespace(candidate);
            if (parts.isEmpty()) {
                return ClassifiedQuery.text(trimmed);
            }
            tokens.addAll(parts);
        }
        if (tokens.isEmpty()) {
            return ClassifiedQuery.text(trimmed);
        }
        return ClassifiedQuery.code(trimmed, tokens);
    }

    public boolean isCodeShaped(String value) {
        return parseToken(value == null ? "" : value.trim()) != null;
    }

    CodeToken parseToken(String value) {
        if (value.isEmpty()) {
            return null;
        }
        String code = value;
        Integer exceptionIndex = null;
        String[] exception = CodeFormats.splitException(value);
        if (exception != null) {
            code = exception[0];
            exceptionIndex = CodeFormats.parseExceptionIndex(exception[1]);
        }
        if (!CODE_SHAPE.matcher(code).matches()) {
            return null;
        }
        int digits = CodeFormats.clean(code).length();
        if (digits < CodeFormats.MIN_DIGITS || digits > CodeFormats.MAX_DIGITS) {
            return null;
        }
        return new CodeToken(value, code, exceptionIndex);
    }

    private List<CodeToken> splitOnWhitespace(String value) {
        String[] parts = WHITESPACE.split(value);
        if (parts.length < 2) {
            return List.of();
        }
        List<CodeToken> tokens = new ArrayList<>(parts.length);
        for (String part : parts) {
            CodeToken token = parseToken(part);
            if (token == null) {
                return List.of();
            }
            tokens.add(token);
        }
        return tokens;
    }
}
