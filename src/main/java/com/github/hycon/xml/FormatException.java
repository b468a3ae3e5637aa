package com.github.hycon.xml;

import java.io.IOException;

/**
 * Structured input is malformed: wrong tags, missing or unsupported version, values of the
 * wrong type, inconsistent content.
 */
public class FormatException extends IOException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
