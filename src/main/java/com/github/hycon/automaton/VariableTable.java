package com.github.hycon.automaton;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered variable names of one automaton. The position of a name is the index of its value
 * in every {@link Valuation} built on this table. Names can only be appended, so indices of
 * already registered names never change.
 */
public final class VariableTable {

    @NotNull
    private final List<String> names = new ArrayList<>();

    @NotNull
    private final Map<String, Integer> indices = new HashMap<>();

    public VariableTable() {}

    public VariableTable(@NotNull Collection<String> names) {
        for (String name : names) {
            register(name);
        }
    }

    /**
     * Index of the variable, adding it to the end of the table if it is not known yet.
     */
    public int register(@NotNull String name) {
        Integer index = indices.get(name);
        if (index == null) {
            index = names.size();
            names.add(name);
            indices.put(name, index);
        }
        return index;
    }

    /**
     * Index of the variable or -1 if it is not in the table.
     */
    public int indexOf(@NotNull String name) {
        Integer index = indices.get(name);
        return index == null ? -1 : index;
    }

    public boolean contains(@NotNull String name) {
        return indices.containsKey(name);
    }

    @NotNull
    public String getName(int index) {
        return names.get(index);
    }

    @NotNull
    public List<String> getNames() {
        return Collections.unmodifiableList(new ArrayList<>(names));
    }

    public int size() {
        return names.size();
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
