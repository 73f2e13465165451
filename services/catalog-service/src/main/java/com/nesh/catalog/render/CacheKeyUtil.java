package com.nesh.catalog.render;

import com.nesh.catalog.model.Chapter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

public final class CacheKeyUtil {
    private static final char FIELD_SEPARATOR = '\u001f';

    private CacheKeyUtil() {
    }

    /**
     * Hash over everything that shapes a chapter's rendered output.
     */
    public static String chapterHash(Chapter chapter) {
        StringBuilder builder = new StringBuilder(chapter.getContent().length() + 512);
        builder.append(chapter.getNumber()).append(FIELD_SEPARATOR);
        builder.append(chapter.getContent()).append(FIELD_SEPARATOR);
        for (Map.Entry<String, String> note : chapter.getNotes().entrySet()) {
            builder.append(note.getKey()).append('=').append(note.getValue()).append(FIELD_SEPARATOR);
        }
        chapter.getPositions().forEach(position -> builder.append(position.code()).append(FIELD_SEPARATOR));
        return sha256(builder.toString());
    }

    public static String sha256(String value) {
        if (value == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
