package com.exactrational;

import java.util.*;

public final class CalcOptions {
    public final int precision;             // fractional digits for the decimal line
    public final boolean printFraction;     // also print num/den
    public final boolean printApprox;       // also print the double approximation
    public final List<String> expression;   // operand (op operand)*

    private CalcOptions(Builder b) {
        this.precision = b.precision;
        this.printFraction = b.printFraction;
        this.printApprox = b.printApprox;
        this.expression = Collections.unmodifiableList(new ArrayList<>(b.expression));
    }

    public static final class Builder {
        private int precision = Rational.DEFAULT_PRECISION;
        private boolean printFraction, printApprox;
        private final List<String> expression = new ArrayList<>();

        public Builder precision(int v){ this.precision=Math.max(0,v); return this; }
        public Builder printFraction(boolean v){ this.printFraction=v; return this; }
        public Builder printApprox(boolean v){ this.printApprox=v; return this; }
        public Builder addToken(String t){ this.expression.add(t); return this; }
        public CalcOptions build(){ return new CalcOptions(this); }
    }
}
