package com.exactrational;

/** Minimal exact-number abstraction. */
public interface Numeric<T extends Numeric<T>> extends Comparable<T> {
    T add(T o);
    T subtract(T o);
    T multiply(T o);
    T divide(T o);
    T pow(T exponent);
    T negate();
    T abs();
    int signum();
    boolean isZero();
}
