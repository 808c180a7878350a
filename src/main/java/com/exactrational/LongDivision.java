package com.exactrational;

import java.math.BigInteger;

/**
 * Digit-by-digit long division of a fraction into a decimal string.
 * <p>
 * Each step scales the running remainder by just enough powers of ten to make it
 * at least the divisor, so one step yields a block of {@code extraZeros} digits
 * (leading zeros included). Blocks are cut at the digit budget; output is truncated,
 * never rounded.
 */
final class LongDivision {

    private LongDivision() {}

    /**
     * @param numerator   any sign
     * @param denominator strictly positive
     * @param precision   maximum number of fractional digits; {@code <= 0} means none
     */
    static String render(BigInteger numerator, BigInteger denominator, int precision) {
        if (denominator.signum() <= 0) throw new IllegalArgumentException("denominator must be positive: " + denominator);
        BigInteger[] qr = numerator.abs().divideAndRemainder(denominator);
        StringBuilder sb = new StringBuilder();
        sb.append(qr[0]);
        if (qr[1].signum() != 0 && precision > 0) {
            sb.append('.');
            appendFraction(sb, qr[1], denominator, precision);
        }
        if (numerator.signum() < 0 && !isAllZeros(sb)) sb.insert(0, '-');
        return sb.toString();
    }

    private static void appendFraction(StringBuilder sb, BigInteger remainder, BigInteger denominator, int precision) {
        int divisorDigits = digitCount(denominator.subtract(BigInteger.ONE));
        int budget = precision;
        while (budget > 0) {
            // remainder < denominator, so carry gets exactly divisorDigits + 1 digits
            int extraZeros = divisorDigits - digitCount(remainder) + 1;
            BigInteger carry = remainder.multiply(BigInteger.TEN.pow(extraZeros));
            BigInteger nextDigit = carry.divide(denominator);

            StringBuilder block = new StringBuilder(extraZeros);
            for (int z = extraZeros - digitCount(nextDigit); z > 0; z--) block.append('0');
            block.append(nextDigit);

            if (block.length() > budget) {
                sb.append(block, 0, budget);
                return;
            }
            remainder = carry.subtract(nextDigit.multiply(denominator));
            if (remainder.signum() == 0) {
                int end = block.length();
                while (block.charAt(end - 1) == '0') end--;
                sb.append(block, 0, end);
                return;
            }
            sb.append(block);
            budget -= extraZeros;
        }
    }

    /** Number of base-10 digits of a non-negative value; 1 for zero. */
    static int digitCount(BigInteger value) {
        return value.toString().length();
    }

    private static boolean isAllZeros(CharSequence s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '0' && c != '.') return false;
        }
        return true;
    }
}
