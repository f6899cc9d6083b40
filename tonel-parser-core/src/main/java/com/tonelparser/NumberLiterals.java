package com.tonelparser;

import java.math.BigInteger;

/**
 * Decodes numeric token lexemes into Java numbers.
 *
 * <ul>
 *   <li>radix integers ({@code 16rFF}, {@code -2r101}) decode to an integer</li>
 *   <li>scaled decimals ({@code 3.14s2}) decode to a {@link Double}; the scale is ignored</li>
 *   <li>a fraction or exponent ({@code 1.5}, {@code 2e3}) decodes to a {@link Double}</li>
 *   <li>anything else decodes to a {@link Long}, or a {@link BigInteger} when it does not fit</li>
 * </ul>
 */
public final class NumberLiterals {
    private static final int MIN_RADIX = 2;
    private static final int MAX_RADIX = 36;

    private NumberLiterals() {
    }

    public static Number decode(Token token) {
        String text = token.lexeme();
        if (text.isEmpty()) {
            throw new InvalidNumberLiteralException("Empty number literal", token);
        }

        int radixMarker = text.indexOf('r');
        if (radixMarker >= 0) {
            return decodeRadix(token, text, radixMarker);
        }

        int scaleMarker = text.indexOf('s');
        if (scaleMarker >= 0) {
            return decodeFloat(token, text.substring(0, scaleMarker), "Invalid scaled decimal: " + text);
        }

        if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
            return decodeFloat(token, text, "Invalid float: " + text);
        }

        try {
            return narrow(new BigInteger(text));
        } catch (NumberFormatException e) {
            throw new InvalidNumberLiteralException("Invalid integer: " + text, token);
        }
    }

    private static Number decodeRadix(Token token, String text, int radixMarker) {
        String basePart = text.substring(0, radixMarker);
        String digits = text.substring(radixMarker + 1);
        boolean negative = basePart.startsWith("-");
        if (negative) {
            basePart = basePart.substring(1);
        }

        int base;
        try {
            base = Integer.parseInt(basePart);
        } catch (NumberFormatException e) {
            throw new InvalidNumberLiteralException("Invalid radix number: " + text, token);
        }
        if (base < MIN_RADIX || base > MAX_RADIX) {
            throw new InvalidNumberLiteralException(
                "Radix " + base + " is outside " + MIN_RADIX + ".." + MAX_RADIX + ": " + text, token);
        }

        try {
            BigInteger value = new BigInteger(digits, base);
            return narrow(negative ? value.negate() : value);
        } catch (NumberFormatException e) {
            throw new InvalidNumberLiteralException("Invalid radix number: " + text, token);
        }
    }

    private static Double decodeFloat(Token token, String text, String message) {
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            throw new InvalidNumberLiteralException(message, token);
        }
    }

    private static Number narrow(BigInteger value) {
        if (value.bitLength() < Long.SIZE) {
            return value.longValue();
        }
        return value;
    }

    /** True for values a byte array may hold. */
    public static boolean isByte(Number value) {
        if (value instanceof Long l) {
            return l >= 0 && l <= 255;
        }
        return false;
    }
}
