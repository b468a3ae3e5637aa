package com.github.hycon.geometry.box;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Discrete-time dynamics {@code x[t+1] = x[t] + u[t]} with the input bounded by the box
 * {@code inputLow <= u <= inputHigh}.
 */
public final class TranslationDynamics {

    @NotNull
    private final double[] inputLow;

    @NotNull
    private final double[] inputHigh;

    public TranslationDynamics(@NotNull double[] inputLow, @NotNull double[] inputHigh) {
        if (inputLow.length != inputHigh.length) {
            throw new IllegalArgumentException("Input bounds have different dimensions");
        }
        for (int i=0; i < inputLow.length; i++) {
            if (inputLow[i] > inputHigh[i]) {
                throw new IllegalArgumentException("Empty input range in dimension " + i);
            }
        }
        this.inputLow = Arrays.copyOf(inputLow, inputLow.length);
        this.inputHigh = Arrays.copyOf(inputHigh, inputHigh.length);
    }

    public int getDimension() {
        return inputLow.length;
    }

    public double getInputLow(int dim) {
        return inputLow[dim];
    }

    public double getInputHigh(int dim) {
        return inputHigh[dim];
    }

    @Override
    public String toString() {
        return "TranslationDynamics{u in " + Arrays.toString(inputLow) + " .. " + Arrays.toString(inputHigh) + "}";
    }
}
