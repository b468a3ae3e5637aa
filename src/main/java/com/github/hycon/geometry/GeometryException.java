package com.github.hycon.geometry;

/**
 * Raised by an oracle when a geometric query cannot be answered: unsupported or unbounded
 * sets, dimension mismatches, numerical failure of an underlying solver.
 */
public class GeometryException extends RuntimeException {

    public GeometryException(String message) {
        super(message);
    }

    public GeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
