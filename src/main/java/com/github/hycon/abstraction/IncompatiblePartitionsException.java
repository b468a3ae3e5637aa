package com.github.hycon.abstraction;

/**
 * Two abstractions cannot be merged: different propositions, domains or original regions.
 */
public class IncompatiblePartitionsException extends IllegalArgumentException {

    public IncompatiblePartitionsException(String message) {
        super(message);
    }
}
