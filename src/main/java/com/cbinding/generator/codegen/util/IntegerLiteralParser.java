package com.cbinding.generator.codegen.util;

import java.math.BigInteger;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses C integer literals: decimal, hex ({@code 0x}), binary ({@code 0b}) and octal
 * (leading {@code 0}), with optional {@code u}/{@code l} suffixes.
 */
public final class IntegerLiteralParser {

    private static final Pattern LITERAL = Pattern.compile(
            "(?:0[xX](?<hex>[0-9a-fA-F]+)|0[bB](?<bin>[01]+)|(?<oct>0[0-7]*)|(?<dec>[1-9][0-9]*))[uUlL]*");

    private IntegerLiteralParser() {
        // Utility class
    }

    /**
     * Returns the literal's value, or empty when the text is not an integer literal
     * or does not fit in a signed 64-bit value.
     */
    public static OptionalLong parse(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        Matcher m = LITERAL.matcher(text.trim());
        if (!m.matches()) {
            return OptionalLong.empty();
        }
        BigInteger value;
        if (m.group("hex") != null) {
            value = new BigInteger(m.group("hex"), 16);
        } else if (m.group("bin") != null) {
            value = new BigInteger(m.group("bin"), 2);
        } else if (m.group("oct") != null) {
            value = new BigInteger(m.group("oct"), 8);
        } else {
            value = new BigInteger(m.group("dec"));
        }
        if (value.bitLength() > 63) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(value.longValue());
    }
}
