package com.github.hycon.abstraction;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings of the transition computation and of partition merging.
 *
 * Instances are immutable, use the {@code with*} methods to derive a modified copy.
 */
public final class AbstractionConfig {

    public static final String RESOURCE = "hycon.properties";

    public static final String HORIZON = "hycon.horizon";
    public static final String CLOSED_LOOP = "hycon.closed-loop";
    public static final String TRANS_LENGTH = "hycon.trans-length";
    public static final String ABS_TOL = "hycon.abs-tol";
    public static final String CHEBY_TOL = "hycon.cheby-tol";

    private static final AbstractionConfig DEFAULTS = new AbstractionConfig(10, true, 1, 1e-7, 1e-5);

    /** number of steps the feasibility solver may use */
    private final int horizon;
    /** re-choose the input after each step */
    private final boolean closedLoop;
    /** candidate pairs are cells at most this many adjacency hops apart */
    private final int transLength;
    /** a transition exists when the unreachable part of the source is smaller than this */
    private final double absTol;
    /** product cells with a smaller inscribed radius are dropped when merging */
    private final double chebyTol;

    private AbstractionConfig(int horizon, boolean closedLoop, int transLength, double absTol, double chebyTol) {
        if (horizon < 0) {
            throw new IllegalArgumentException("Horizon must be non-negative, got " + horizon);
        }
        if (transLength < 1) {
            throw new IllegalArgumentException("Transition length must be at least 1, got " + transLength);
        }
        if (absTol < 0 || chebyTol < 0) {
            throw new IllegalArgumentException("Tolerances must be non-negative");
        }
        this.horizon = horizon;
        this.closedLoop = closedLoop;
        this.transLength = transLength;
        this.absTol = absTol;
        this.chebyTol = chebyTol;
    }

    @NotNull
    public static AbstractionConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Read settings from properties, keys which are not present keep their default value.
     */
    @NotNull
    public static AbstractionConfig fromProperties(@NotNull Properties properties) {
        try {
            return new AbstractionConfig(
                    Integer.parseInt(properties.getProperty(HORIZON, String.valueOf(DEFAULTS.horizon)).trim()),
                    Boolean.parseBoolean(properties.getProperty(CLOSED_LOOP, String.valueOf(DEFAULTS.closedLoop)).trim()),
                    Integer.parseInt(properties.getProperty(TRANS_LENGTH, String.valueOf(DEFAULTS.transLength)).trim()),
                    Double.parseDouble(properties.getProperty(ABS_TOL, String.valueOf(DEFAULTS.absTol)).trim()),
                    Double.parseDouble(properties.getProperty(CHEBY_TOL, String.valueOf(DEFAULTS.chebyTol)).trim())
            );
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed abstraction settings: " + e.getMessage(), e);
        }
    }

    /**
     * Settings from the {@value #RESOURCE} classpath resource, or the defaults if there is none.
     */
    @NotNull
    public static AbstractionConfig load() {
        return load(AbstractionConfig.class.getClassLoader());
    }

    @NotNull
    static AbstractionConfig load(@Nullable ClassLoader loader) {
        if (loader == null) return DEFAULTS;
        try (InputStream stream = loader.getResourceAsStream(RESOURCE)) {
            if (stream == null) return DEFAULTS;
            Properties properties = new Properties();
            properties.load(stream);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    public int getHorizon() {
        return horizon;
    }

    public boolean isClosedLoop() {
        return closedLoop;
    }

    public int getTransLength() {
        return transLength;
    }

    public double getAbsTol() {
        return absTol;
    }

    public double getChebyTol() {
        return chebyTol;
    }

    @NotNull
    public AbstractionConfig withHorizon(int horizon) {
        return new AbstractionConfig(horizon, closedLoop, transLength, absTol, chebyTol);
    }

    @NotNull
    public AbstractionConfig withClosedLoop(boolean closedLoop) {
        return new AbstractionConfig(horizon, closedLoop, transLength, absTol, chebyTol);
    }

    @NotNull
    public AbstractionConfig withTransLength(int transLength) {
        return new AbstractionConfig(horizon, closedLoop, transLength, absTol, chebyTol);
    }

    @NotNull
    public AbstractionConfig withAbsTol(double absTol) {
        return new AbstractionConfig(horizon, closedLoop, transLength, absTol, chebyTol);
    }

    @NotNull
    public AbstractionConfig withChebyTol(double chebyTol) {
        return new AbstractionConfig(horizon, closedLoop, transLength, absTol, chebyTol);
    }

    @Override
    public String toString() {
        return "AbstractionConfig{horizon=" + horizon + ", closedLoop=" + closedLoop + ", transLength=" + transLength
                + ", absTol=" + absTol + ", chebyTol=" + chebyTol + "}";
    }
}
