package com.exactrational;

/** Thrown whenever a rational with a zero denominator would result. */
public class DivisionByZeroException extends ArithmeticException {

    public DivisionByZeroException(String message) {
        super(message);
    }
}
