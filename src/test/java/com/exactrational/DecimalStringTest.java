package com.exactrational;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Long-division rendering: {@link Rational#toDecimalString(int)}.
 */
public class DecimalStringTest {

    private static Rational r(long n, long d) {
        return new Rational(BigInteger.valueOf(n), BigInteger.valueOf(d));
    }

    @ParameterizedTest(name = "{0}/{1} @ {2} -> {3}")
    @CsvSource({
            "1, 1000, 5, 0.001",
            "1, 1000, 2, 0.00",
            "-1, 1000, 2, 0.00",
            "13, 25, 16, 0.52",
            "1, 3, 5, 0.33333",
            "2, 3, 4, 0.6666",
            "1, 12, 2, 0.08",
            "1, 12, 3, 0.083",
            "1, 7, 16, 0.1428571428571428",
            "22, 7, 3, 3.142",
            "-1, 2, 16, -0.5",
            "1, -2, 16, -0.5",
            "10, 2, 16, 5",
            "0, 5, 16, 0",
            "1, 3, 0, 0",
            "7, 2, 0, 3",
            "-7, 2, 0, -3",
            "1, 3, -4, 0",
            "1, 1024, 20, 0.0009765625",
            "3, 40, 16, 0.075",
            "1, 16, 16, 0.0625",
            "101, 100, 1, 1.0",
            "1001, 1000, 3, 1.001",
    })
    public void testRendering(long n, long d, int precision, String expected) {
        assertEquals(expected, r(n, d).toDecimalString(precision));
    }

    @Test
    public void testDefaultPrecisionIsSixteen() {
        assertEquals("0.3333333333333333", r(1, 3).toDecimalString());
        assertEquals("0.25", r(1, 4).toDecimalString());
    }

    @Test
    public void testDigitCount() {
        assertEquals(1, LongDivision.digitCount(BigInteger.ZERO));
        assertEquals(1, LongDivision.digitCount(BigInteger.valueOf(9)));
        assertEquals(3, LongDivision.digitCount(BigInteger.valueOf(999)));
        assertEquals(4, LongDivision.digitCount(BigInteger.valueOf(1000)));
    }

    @Test
    public void testLargeOperands() {
        BigInteger big = BigInteger.TEN.pow(40).add(BigInteger.ONE);
        Rational x = new Rational(big, BigInteger.TEN.pow(40));
        assertEquals("1." + "0".repeat(39) + "1", x.toDecimalString(50));
        assertEquals("1." + "0".repeat(30), x.toDecimalString(30));
    }

    @Test
    public void testAgreesWithTruncatingBigDecimalDivision() {
        Random rnd = new Random(99);
        for (int i = 0; i < 1000; i++) {
            long n = rnd.nextInt(199999) - 99999;
            long d = rnd.nextInt(9999999) + 1;
            int precision = rnd.nextInt(41);
            String s = r(n, d).toDecimalString(precision);

            BigDecimal expected = new BigDecimal(n).divide(new BigDecimal(d), precision, RoundingMode.DOWN);
            assertEquals(0, new BigDecimal(s).compareTo(expected), n + "/" + d + " @ " + precision + " -> " + s);
            int dot = s.indexOf('.');
            if (dot >= 0) assertTrue(s.length() - dot - 1 <= precision, s);
        }
    }

    @Test
    public void testParsesBackToSameDouble() {
        Random rnd = new Random(1);
        for (int i = 1; i < 1000; i++) {
            long n = rnd.nextInt(99999);
            long d = rnd.nextInt(9999998) + 1;
            Rational x = r(n, d);
            assertEquals(x.toDouble(), Double.parseDouble(x.toDecimalString(32)), x.toFractionString());
        }
    }
}
