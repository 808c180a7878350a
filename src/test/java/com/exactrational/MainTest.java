package com.exactrational;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

/**
 * End-to-end runs of the calculator through {@link Main#run}.
 */
public class MainTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return Main.run(args, out, err);
    }

    private List<String> outLines() {
        return outBytes.toString(StandardCharsets.UTF_8).lines().collect(Collectors.toList());
    }

    @Test
    public void printsDecimalResult() {
        assertEquals(0, run("1/3", "+", "1/6"));
        assertEquals(List.of("0.5"), outLines());
    }

    @Test
    public void honoursPrecisionAndExtraForms() {
        assertEquals(0, run("-precision", "3", "-fraction", "-approx", "1", "/", "8"));
        assertEquals(List.of("0.125", "1/8", "0.125"), outLines());
    }

    @Test
    public void truncatesAtPrecision() {
        assertEquals(0, run("-precision", "5", "2/3"));
        assertEquals(List.of("0.66666"), outLines());
    }

    @Test
    public void printsComparison() {
        assertEquals(0, run("1/2", "<", "3/4"));
        assertEquals(List.of("true"), outLines());
    }

    @Test
    public void reportsEvaluationErrors() {
        assertEquals(1, run("1", "/", "0"));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("Division by zero"));
        assertEquals(1, run("1/2/3"));
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("Bad operand"));
        assertEquals(1, run("2", "^", "1/2"));
    }

    @Test
    public void reportsArgumentErrors() {
        assertEquals(2, run("-nope", "1"));
        String err = errBytes.toString(StandardCharsets.UTF_8);
        assertTrue(err.contains("Usage: rational-calc"));
        assertTrue(err.contains("Unknown option: -nope"));
        assertEquals(2, run());
    }
}
