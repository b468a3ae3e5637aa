package com.github.hycon.automaton;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Graphviz export of an automaton. Every node is labelled by its id followed by the variables
 * with a nonzero value, which reads well for boolean variables. Nodes are only emitted as
 * edge endpoints, so a state without transitions does not show up.
 */
final class DotWriter {

    private static final Logger LOG = LoggerFactory.getLogger(DotWriter.class);

    // Only provides static methods.
    private DotWriter() {}

    static void write(@NotNull Automaton automaton, @NotNull Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(automaton, writer);
        }
        LOG.debug("Wrote {} states to {}", automaton.size(), path);
    }

    static void write(@NotNull Automaton automaton, @NotNull Appendable out) throws IOException {
        final Map<Integer, String> labels = new HashMap<>();
        for (AutomatonState state : automaton.getStates()) {
            labels.put(state.getId(), label(state));
        }
        out.append("digraph A {\n");
        for (AutomatonState state : automaton.getStates()) {
            for (int target : state.getTransitions()) {
                final String targetLabel = labels.get(target);
                if (targetLabel == null) {
                    LOG.warn("State {} has a transition to missing state {}, not drawn", state.getId(), target);
                    continue;
                }
                out.append("    \"").append(labels.get(state.getId()))
                        .append("\" -> \"").append(targetLabel).append("\";\n");
            }
        }
        out.append("\n}\n");
    }

    @NotNull
    static String label(@NotNull AutomatonState state) {
        final StringBuilder label = new StringBuilder();
        for (Map.Entry<String, Integer> entry : state.getState().entrySet()) {
            if (entry.getValue() == 0) continue;
            if (label.length() == 0) {
                label.append(state.getId()).append(";\\n");
            } else {
                label.append(", ");
            }
            label.append(escape(entry.getKey())).append(": ").append(entry.getValue());
        }
        if (label.length() == 0) {
            label.append(state.getId()).append("\\n; {}");
        }
        return label.toString();
    }

    @NotNull
    private static String escape(@NotNull String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

}
