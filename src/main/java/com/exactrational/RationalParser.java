package com.exactrational;

import java.math.BigInteger;
import java.util.Objects;

/** Text forms accepted by {@link Rational#from(String)}: {@code "a/b"} and decimal numerals. */
final class RationalParser {
    /** Largest accepted |exponent| in decimal text; {@code 1e10000} is already a 33k-bit integer. */
    static final int MAX_EXPONENT = 10_000;

    private RationalParser() {}

    static Rational parse(String input) {
        Objects.requireNonNull(input, "input");
        String t = input.trim();
        if (t.indexOf('/') >= 0) return parseFraction(t, input);
        return parseDecimal(t, input);
    }

    /** Left of the slash is the numerator, right of it the denominator. */
    static Rational parseFraction(String t, String input) {
        String[] parts = t.split("/", -1);
        if (parts.length != 2) {
            throw new RationalParseException(input, "expected exactly one '/' but found " + (parts.length - 1));
        }
        String left = parts[0].trim();
        String right = parts[1].trim();
        if (left.isEmpty()) throw new RationalParseException(input, "empty numerator");
        if (right.isEmpty()) throw new RationalParseException(input, "empty denominator");
        BigInteger num, den;
        try {
            num = integer(left);
            den = integer(right);
        } catch (NumberFormatException e) {
            throw new RationalParseException(input, "not an integer fraction", e);
        }
        return new Rational(num, den).normalize();
    }

    /** Optional sign and ASCII digits only, the same digit set the decimal scan accepts. */
    private static BigInteger integer(String s) {
        int start = s.charAt(0) == '-' || s.charAt(0) == '+' ? 1 : 0;
        if (start == s.length()) throw new NumberFormatException("No digits: \"" + s + "\"");
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') throw new NumberFormatException("For input string: \"" + s + "\"");
        }
        return new BigInteger(s);
    }

    /**
     * Optional sign, digits with at most one '.', optional exponent. Each digit is
     * folded in as {@code value*10 + digit}; digits after the point count decimal places.
     */
    static Rational parseDecimal(String t, String input) {
        int len = t.length();
        int i = 0;
        boolean negative = false;
        if (i < len && (t.charAt(i) == '-' || t.charAt(i) == '+')) {
            negative = t.charAt(i) == '-';
            i++;
        }

        BigInteger value = BigInteger.ZERO;
        long places = 0;
        int digits = 0;
        boolean foundDot = false;
        for (; i < len; i++) {
            char c = t.charAt(i);
            if (c == '.') {
                if (foundDot) throw new RationalParseException(input, "more than one '.'");
                foundDot = true;
                continue;
            }
            if (c == 'e' || c == 'E') break;
            if (c < '0' || c > '9') throw new RationalParseException(input, "unexpected character '" + c + "'");
            value = value.multiply(BigInteger.TEN).add(BigInteger.valueOf(c - '0'));
            if (foundDot) places++;
            digits++;
        }
        if (digits == 0) throw new RationalParseException(input, "no digits");

        long exponent = 0;
        if (i < len) {
            String exp = t.substring(i + 1);
            try {
                exponent = Integer.parseInt(exp);
            } catch (NumberFormatException e) {
                throw new RationalParseException(input, "malformed exponent '" + exp + "'", e);
            }
        }

        if (Math.abs(exponent) > MAX_EXPONENT) {
            throw new RationalParseException(input, "exponent out of range (|e| <= " + MAX_EXPONENT + ")");
        }

        if (negative) value = value.negate();
        long scale = places - exponent;
        if (scale > Integer.MAX_VALUE) throw new RationalParseException(input, "too many decimal places");
        if (scale >= 0) return new Rational(value, BigInteger.TEN.pow((int) scale)).normalize();
        return new Rational(value.multiply(BigInteger.TEN.pow((int) -scale)), BigInteger.ONE);
    }
}
