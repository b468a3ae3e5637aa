package com.github.hycon.automaton;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reader of the line oriented automaton format written by the synthesis tool:
 *
 * <pre>
 * State 0 with rank 0 -&gt; &lt;x:0, y:1&gt;
 *     With successors : 1, 2
 * </pre>
 *
 * A line containing {@code State N} starts (or updates) state N and assigns the
 * {@code var:value} pairs found on it. A later line containing {@code successors} sets the
 * successors of the most recent state.
 *
 * When expected variable names are given, unknown and unassigned variables are reported as
 * warnings. So are numbers out of the int range: a state with such an id is skipped together
 * with its successors line, such a value or successor is left out. Warnings never stop the load, they are logged and collected in
 * {@link #getWarnings()}.
 */
public final class AutFileReader {

    private static final Logger LOG = LoggerFactory.getLogger(AutFileReader.class);

    private static final Pattern STATE = Pattern.compile("State (\\d+)");
    private static final Pattern ASSIGNMENT = Pattern.compile("(\\w+):([-+]?\\d+)");
    private static final Pattern SUCCESSOR = Pattern.compile(" (\\d+)");

    // Set while the lines of a state that could not be read are skipped.
    private static final int SKIPPED = -2;

    @NotNull
    private final List<String> expectedVariables;

    @NotNull
    private final List<String> warnings = new ArrayList<>();

    public AutFileReader(@NotNull Collection<String> expectedVariables) {
        this.expectedVariables = new ArrayList<>(expectedVariables);
    }

    public AutFileReader() {
        this(Collections.emptyList());
    }

    @NotNull
    public Automaton read(@NotNull Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    @NotNull
    public Automaton read(@NotNull Reader input) throws IOException {
        warnings.clear();
        final Automaton automaton = new Automaton(new VariableTable(expectedVariables));
        final BufferedReader reader = input instanceof BufferedReader
                ? (BufferedReader) input : new BufferedReader(input);
        int stateId = -1;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber += 1;
            if (line.contains("State ")) {
                final Matcher id = STATE.matcher(line);
                if (!id.find()) {
                    warn("Line " + lineNumber + " mentions a state but has no id: " + line.trim());
                    continue;
                }
                final Integer parsedId = parse(id.group(1), lineNumber, "state id");
                if (parsedId == null) {
                    stateId = SKIPPED;
                    continue;
                }
                stateId = parsedId;
                final Map<String, Integer> state = new LinkedHashMap<>();
                final Matcher assignment = ASSIGNMENT.matcher(line);
                while (assignment.find()) {
                    final Integer value = parse(assignment.group(2), lineNumber, "value of " + assignment.group(1));
                    if (value != null) {
                        state.put(assignment.group(1), value);
                    }
                }
                checkVariables(stateId, state);
                automaton.setStateValuation(stateId, state);
            }
            if (line.contains("successors")) {
                if (stateId == SKIPPED) {
                    warn("Line " + lineNumber + " lists successors of a skipped state, ignoring it");
                    continue;
                }
                if (stateId < 0) {
                    warn("Line " + lineNumber + " lists successors before any state, ignoring it");
                    continue;
                }
                final Set<Integer> successors = new LinkedHashSet<>();
                final Matcher successor = SUCCESSOR.matcher(line);
                while (successor.find()) {
                    final Integer target = parse(successor.group(1), lineNumber, "successor");
                    if (target != null) {
                        successors.add(target);
                    }
                }
                automaton.setTransitions(stateId, successors);
            }
        }
        return automaton;
    }

    /**
     * Warnings of the last {@link #read} call.
     */
    @NotNull
    public List<String> getWarnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    private void checkVariables(int stateId, @NotNull Map<String, Integer> state) {
        if (expectedVariables.isEmpty()) return;
        for (String name : state.keySet()) {
            if (!expectedVariables.contains(name)) {
                warn("Unknown variable " + name + " in state " + stateId);
            }
        }
        for (String name : expectedVariables) {
            if (!state.containsKey(name)) {
                warn("Variable " + name + " not assigned in state " + stateId);
            }
        }
    }

    /**
     * Digits which do not fit an int are reported and give null.
     */
    @Nullable
    private Integer parse(@NotNull String digits, int lineNumber, @NotNull String what) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            warn("Line " + lineNumber + " has " + what + " " + digits + " out of range, ignoring it");
            return null;
        }
    }

    private void warn(@NotNull String message) {
        LOG.warn(message);
        warnings.add(message);
    }

}
