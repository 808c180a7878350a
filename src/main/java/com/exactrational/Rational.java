package com.exactrational;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;

/**
 * Immutable arbitrary-precision rational number {@code numerator / denominator}.
 * <p>
 * Raw construction keeps the pair exactly as given; every arithmetic operation
 * returns a normalized result (gcd-reduced, positive denominator). Decimal output
 * is produced by long division and never goes through {@code double}.
 */
public final class Rational extends Number implements Numeric<Rational> {
    private static final long serialVersionUID = 1L;

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE  = new Rational(BigInteger.ONE,  BigInteger.ONE);

    public static final int DEFAULT_PRECISION = 16;

    private final BigInteger n;        // numerator
    private final BigInteger d;        // denominator != 0, sign not canonicalized until normalize()

    /** Stores the pair as-is; the denominator must be nonzero. */
    public Rational(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (denominator.signum() == 0) throw new DivisionByZeroException("Cannot divide by zero");
        this.n = numerator;
        this.d = denominator;
    }

    /** Factories; all of them normalize. */
    public static Rational of(long k) { return new Rational(BigInteger.valueOf(k), BigInteger.ONE); }
    public static Rational of(long num, long den) { return normalized(BigInteger.valueOf(num), BigInteger.valueOf(den)); }
    public static Rational of(BigInteger k) { return new Rational(k, BigInteger.ONE); }
    public static Rational of(BigInteger num, BigInteger den) { return normalized(num, den); }

    private static Rational normalized(BigInteger num, BigInteger den) {
        return new Rational(num, den).normalize();
    }

    public BigInteger numerator()   { return n; }
    public BigInteger denominator() { return d; }

    /**
     * Returns the equal rational in lowest terms with a positive denominator.
     * {@code 0/d} becomes {@code 0/1}.
     */
    public Rational normalize() {
        BigInteger g = n.gcd(d);            // > 0 because d != 0
        BigInteger num = n.divide(g);
        BigInteger den = d.divide(g);
        if (den.signum() < 0) { num = num.negate(); den = den.negate(); }
        if (num.equals(n) && den.equals(d)) return this;
        return new Rational(num, den);
    }

    // ---- conversion ----

    /** Copy of another rational. */
    public static Rational from(Rational other) {
        Objects.requireNonNull(other, "other");
        return new Rational(other.n, other.d);
    }

    public static Rational from(BigInteger value) {
        return of(Objects.requireNonNull(value, "value"));
    }

    public static Rational from(long value) { return of(value); }

    /**
     * Reads a double through its shortest decimal form ({@link Double#toString(double)}),
     * so {@code from(0.1)} is exactly {@code 1/10}.
     *
     * @throws RationalParseException for NaN and infinities
     */
    public static Rational from(double value) {
        String text = Double.toString(value);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new RationalParseException(text, "not a finite number");
        }
        return RationalParser.parseDecimal(text, text);
    }

    public static Rational from(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        int scale = value.scale();
        if (scale >= 0) return normalized(value.unscaledValue(), BigInteger.TEN.pow(scale));
        return of(value.unscaledValue().multiply(BigInteger.TEN.pow(-scale)));
    }

    /**
     * Parses {@code "a/b"} (integer numerator and denominator) or a decimal numeral
     * such as {@code "-12.5"} or {@code "1.5e-3"}. Surrounding whitespace is ignored.
     *
     * @throws RationalParseException if the text is neither form
     * @throws DivisionByZeroException for a fraction with a zero denominator
     */
    public static Rational from(String text) {
        return RationalParser.parse(text);
    }

    // ---- Numeric ----

    @Override public Rational add(Rational o) {
        return normalized(n.multiply(o.d).add(o.n.multiply(d)), d.multiply(o.d));
    }

    @Override public Rational subtract(Rational o) {
        return add(o.negate());
    }

    @Override public Rational multiply(Rational o) {
        return normalized(n.multiply(o.n), d.multiply(o.d));
    }

    @Override public Rational divide(Rational o) {
        if (o.isZero()) throw new DivisionByZeroException("Divide by zero rational " + o);
        return normalized(n.multiply(o.d), d.multiply(o.n));
    }

    /**
     * Integer power. A negative exponent raises the reciprocal, anything to the
     * power 0 is 1.
     *
     * @throws ArithmeticException if the exponent is not an integer or does not fit an {@code int}
     * @throws DivisionByZeroException for zero raised to a negative power
     */
    @Override public Rational pow(Rational exponent) {
        Rational e = exponent.normalize();
        if (!e.d.equals(BigInteger.ONE)) {
            throw new ArithmeticException("Non-integer exponent " + e + " is not supported");
        }
        if (e.isZero()) return ONE;
        int k = e.n.abs().intValueExact();
        Rational base = e.n.signum() < 0 ? inverse() : this;
        return normalized(base.n.pow(k), base.d.pow(k));
    }

    public Rational inverse() {
        if (isZero()) throw new DivisionByZeroException("Zero has no inverse");
        return normalized(d, n);
    }

    @Override public Rational negate() { return new Rational(n.negate(), d); }
    @Override public Rational abs()    { return signum() < 0 ? negate() : this; }
    @Override public int signum()      { return n.signum() * d.signum(); }
    @Override public boolean isZero()  { return n.signum() == 0; }

    // Operand overloads: the argument goes through the matching from(...).

    public Rational add(long o)        { return add(from(o)); }
    public Rational add(double o)      { return add(from(o)); }
    public Rational add(String o)      { return add(from(o)); }
    public Rational subtract(long o)   { return subtract(from(o)); }
    public Rational subtract(double o) { return subtract(from(o)); }
    public Rational subtract(String o) { return subtract(from(o)); }
    public Rational multiply(long o)   { return multiply(from(o)); }
    public Rational multiply(double o) { return multiply(from(o)); }
    public Rational multiply(String o) { return multiply(from(o)); }
    public Rational divide(long o)     { return divide(from(o)); }
    public Rational divide(double o)   { return divide(from(o)); }
    public Rational divide(String o)   { return divide(from(o)); }
    public Rational pow(long o)        { return pow(from(o)); }
    public Rational pow(double o)      { return pow(from(o)); }
    public Rational pow(String o)      { return pow(from(o)); }

    // ---- comparison ----

    @Override public int compareTo(Rational o) {
        // a/b ? c/d  <=>  ad ? cb, flipped when exactly one denominator is negative
        int c = n.multiply(o.d).compareTo(o.n.multiply(d));
        return d.signum() * o.d.signum() < 0 ? -c : c;
    }

    public boolean isEqualTo(Rational o)            { return compareTo(o) == 0; }
    public boolean isLessThan(Rational o)           { return compareTo(o) < 0; }
    public boolean isLessThanOrEqual(Rational o)    { return compareTo(o) <= 0; }
    public boolean isGreaterThan(Rational o)        { return compareTo(o) > 0; }
    public boolean isGreaterThanOrEqual(Rational o) { return compareTo(o) >= 0; }

    public boolean isEqualTo(long o)              { return isEqualTo(from(o)); }
    public boolean isEqualTo(double o)            { return isEqualTo(from(o)); }
    public boolean isEqualTo(String o)            { return isEqualTo(from(o)); }
    public boolean isLessThan(long o)             { return isLessThan(from(o)); }
    public boolean isLessThan(double o)           { return isLessThan(from(o)); }
    public boolean isLessThan(String o)           { return isLessThan(from(o)); }
    public boolean isLessThanOrEqual(long o)      { return isLessThanOrEqual(from(o)); }
    public boolean isLessThanOrEqual(double o)    { return isLessThanOrEqual(from(o)); }
    public boolean isLessThanOrEqual(String o)    { return isLessThanOrEqual(from(o)); }
    public boolean isGreaterThan(long o)          { return isGreaterThan(from(o)); }
    public boolean isGreaterThan(double o)        { return isGreaterThan(from(o)); }
    public boolean isGreaterThan(String o)        { return isGreaterThan(from(o)); }
    public boolean isGreaterThanOrEqual(long o)   { return isGreaterThanOrEqual(from(o)); }
    public boolean isGreaterThanOrEqual(double o) { return isGreaterThanOrEqual(from(o)); }
    public boolean isGreaterThanOrEqual(String o) { return isGreaterThanOrEqual(from(o)); }

    // ---- rendering ----

    private static final MathContext APPROX = new MathContext(40);

    /**
     * Lossy. Components that are exact doubles are divided directly; larger ones go
     * through a 40-digit {@link BigDecimal} quotient so {@code 10^400/10^399} is 10, not NaN.
     */
    public double toDouble() {
        if (n.bitLength() <= 53 && d.bitLength() <= 53) return n.doubleValue() / d.doubleValue();
        return new BigDecimal(n).divide(new BigDecimal(d), APPROX).doubleValue();
    }

    @Override public double doubleValue() { return toDouble(); }
    @Override public float floatValue()   { return (float) toDouble(); }
    @Override public long longValue()     { return n.divide(d).longValue(); }
    @Override public int intValue()       { return n.divide(d).intValue(); }

    /** {@code "numerator/denominator"} exactly as stored. */
    public String toFractionString() { return n + "/" + d; }

    public String toDecimalString() { return toDecimalString(DEFAULT_PRECISION); }

    /**
     * Exact decimal expansion truncated to {@code precision} fractional digits.
     * A terminating expansion stops early; {@code precision <= 0} gives the
     * integer part only.
     */
    public String toDecimalString(int precision) {
        Rational r = normalize();
        return LongDivision.render(r.n, r.d, precision);
    }

    // ---- Object ----

    /** Value equality: {@code 2/4} equals {@code 1/2}. */
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Rational)) return false;
        return compareTo((Rational) obj) == 0;
    }

    @Override public int hashCode() {
        Rational r = normalize();
        return r.n.hashCode() * 31 + r.d.hashCode();
    }

    /** Same as {@link #toFractionString()}. */
    @Override public String toString() { return toFractionString(); }
}
