package com.contentpool.memory;

public class DimensionMismatchException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Query vector has dimension " + actual + ", expected " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() { return expected; }

    public int actual() { return actual; }
}
