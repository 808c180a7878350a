package com.exactrational;

import java.util.List;

/**
 * Evaluates {@code operand (op operand)*} strictly left to right, no precedence.
 * Arithmetic operators are {@code + - * / ^}; one comparison ({@code = < <= > >=})
 * may close the expression and turns the result into a boolean.
 */
public final class ExpressionEvaluator {
    private static final System.Logger LOG = System.getLogger(ExpressionEvaluator.class.getName());

    /** Either a number or, when the expression ended in a comparison, a truth value. */
    public static final class Result {
        private final Rational value;
        private final Boolean comparison;

        private Result(Rational value, Boolean comparison) {
            this.value = value;
            this.comparison = comparison;
        }

        public boolean isComparison() { return comparison != null; }
        public Rational value() {
            if (value == null) throw new IllegalStateException("Result is a comparison");
            return value;
        }
        public boolean comparison() {
            if (comparison == null) throw new IllegalStateException("Result is a number");
            return comparison;
        }
    }

    private ExpressionEvaluator() {}

    public static Result evaluate(List<String> tokens) {
        if (tokens.isEmpty()) throw new IllegalArgumentException("Empty expression");
        if (tokens.size() % 2 == 0) throw new IllegalArgumentException("Operator without right operand: " + tokens.get(tokens.size() - 1));

        Rational acc = Rational.from(tokens.get(0));
        for (int i = 1; i < tokens.size(); i += 2) {
            String op = tokens.get(i);
            Rational rhs = Rational.from(tokens.get(i + 1));
            boolean last = i + 2 >= tokens.size();
            if (isComparison(op)) {
                if (!last) throw new IllegalArgumentException("Comparison '" + op + "' must be the last operator");
                boolean b = compare(acc, op, rhs);
                LOG.log(System.Logger.Level.DEBUG, "{0} {1} {2} -> {3}", acc, op, rhs, b);
                return new Result(null, b);
            }
            Rational next = apply(acc, op, rhs);
            LOG.log(System.Logger.Level.DEBUG, "{0} {1} {2} -> {3}", acc, op, rhs, next);
            acc = next;
        }
        return new Result(acc, null);
    }

    private static Rational apply(Rational a, String op, Rational b) {
        switch (op) {
            case "+": return a.add(b);
            case "-": return a.subtract(b);
            case "*":
            case "x": return a.multiply(b);
            case "/": return a.divide(b);
            case "^": return a.pow(b);
            default: throw new IllegalArgumentException("Unknown operator: " + op);
        }
    }

    private static boolean isComparison(String op) {
        switch (op) {
            case "=": case "<": case "<=": case ">": case ">=": return true;
            default: return false;
        }
    }

    private static boolean compare(Rational a, String op, Rational b) {
        switch (op) {
            case "=": return a.isEqualTo(b);
            case "<": return a.isLessThan(b);
            case "<=": return a.isLessThanOrEqual(b);
            case ">": return a.isGreaterThan(b);
            case ">=": return a.isGreaterThanOrEqual(b);
            default: throw new IllegalArgumentException("Unknown comparison: " + op);
        }
    }
}
