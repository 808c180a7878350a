package com.exactrational;

public final class OptionsParser {

    private OptionsParser() {}

    public static CalcOptions parse(String[] args){
        CalcOptions.Builder b = new CalcOptions.Builder();
        boolean tokens = false;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            if (tokens) { b.addToken(a); continue; }
            switch (a) {
                case "-precision": b.precision(Integer.parseInt(next(args, ++i, a))); break;
                case "-fraction": b.printFraction(true); break;
                case "-approx": b.printApprox(true); break;
                case "--": tokens = true; break;     // everything after is expression, e.g. negative operands
                default:
                    if (a.startsWith("-") && a.length() > 1 && !isNumberStart(a.charAt(1))) {
                        throw new IllegalArgumentException("Unknown option: " + a);
                    }
                    tokens = true;
                    b.addToken(a);
            }
        }
        CalcOptions opts = b.build();
        if (opts.expression.isEmpty()) throw new IllegalArgumentException("Missing expression");
        return opts;
    }

    private static String next(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }

    private static boolean isNumberStart(char c){
        return (c >= '0' && c <= '9') || c == '.';
    }
}
