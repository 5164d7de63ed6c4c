package com.flamingo.ai.researchcache.exception;

/** Exception thrown when a vector's width differs from the width the caller expects. */
public class DimensionMismatchException extends RuntimeException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    super("Vector dimension mismatch: expected " + expected + " but got " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public DimensionMismatchException(int expected, int actual, String context) {
    super(
        "Vector dimension mismatch ("
            + context
            + "): expected "
            + expected
            + " but got "
            + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
