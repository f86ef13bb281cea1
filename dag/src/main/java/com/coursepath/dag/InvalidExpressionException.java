package com.coursepath.dag;

/** A requirement that cannot be evaluated, such as a one-of with nothing to choose from. */
public final class InvalidExpressionException extends RuntimeException {
    public InvalidExpressionException(String message) { super(message); }
}
