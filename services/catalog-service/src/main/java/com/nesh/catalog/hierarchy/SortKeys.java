package com.nesh.catalog.hierarchy;

/**
 * Order-preserving keys for tariff codes of any length.
 * <p>
 * Layout: {@code NN.NN.NN.NN.NN|d|xxx} where the digits are right-padded with zeros,
 * {@code d} is the digit count in base 36 ({@code z} for exception lines) and {@code xxx}
 * is the exception index. Exception lines pad with nines so they follow every descendant of
 * their numeric row. Plain string comparison yields hierarchical order.
 */
public final class SortKeys {
    static final int PADDED_DIGITS = 10;
    static final char EXCEPTION_DEPTH = 'z';

    private SortKeys() {
    }

    public static String of(String digits) {
        return of(digits, null);
    }

    public static String of(String digits, Integer exceptionIndex) {
        if (digits == null || digits.isEmpty() || digits.length() > PADDED_DIGITS) {
            throw new IllegalArgumentException("digits must have 1.." + PADDED_DIGITS + " characters: " + digits);
        }
        char pad = exceptionIndex == null ? '0' : '9';
        StringBuilder builder = new StringBuilder(24);
        for (int i = 0; i < PADDED_DIGITS; i++) {
            if (i > 0 && i % 2 == 0) {
                builder.append('.');
            }
            builder.append(i < digits.length() ? digits.charAt(i) : pad);
        }
        builder.append('|');
        builder.append(exceptionIndex == null ? Character.forDigit(digits.length(), 36) : EXCEPTION_DEPTH);
        builder.append('|');
        builder.append(String.format("%03d", exceptionIndex == null ? 0 : exceptionIndex));
        return builder.toString();
    }
}
