package com.exactrational;

import java.io.PrintStream;

public class Main {
    private static final System.Logger LOG = System.getLogger(Main.class.getName());

    private static void usage(PrintStream err) {
        err.println(
                "Usage: rational-calc [options] <operand> [<op> <operand>]...\n" +
                        "Operands:\n" +
                        "  integers, decimals (-1.25, 3e-2) or fractions (7/3)\n" +
                        "Operators (left to right, no precedence):\n" +
                        "  +  -  *  /  ^          arithmetic ('x' also multiplies)\n" +
                        "  =  <  <=  >  >=        comparison, last operator only\n" +
                        "Options:\n" +
                        "  -precision N   fractional digits of the decimal output [16]\n" +
                        "  -fraction      also print the result as num/den\n" +
                        "  -approx        also print the double approximation\n" +
                        "  --             end of options\n"
        );
    }

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    /** @return process exit code: 0 ok, 1 evaluation error, 2 bad arguments */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CalcOptions opts;
        try {
            opts = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage(err);
            err.println("Argument error: " + e.getMessage());
            return 2;
        }
        LOG.log(System.Logger.Level.DEBUG, "expression={0} precision={1}", opts.expression, opts.precision);

        ExpressionEvaluator.Result result;
        try {
            result = ExpressionEvaluator.evaluate(opts.expression);
        } catch (DivisionByZeroException e) {
            err.println("Division by zero: " + e.getMessage());
            return 1;
        } catch (RationalParseException e) {
            err.println("Bad operand: " + e.getMessage());
            return 1;
        } catch (ArithmeticException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (result.isComparison()) {
            out.println(result.comparison());
            return 0;
        }
        Rational value = result.value();
        out.println(value.toDecimalString(opts.precision));
        if (opts.printFraction) out.println(value.toFractionString());
        if (opts.printApprox) out.println(value.toDouble());
        return 0;
    }
}
