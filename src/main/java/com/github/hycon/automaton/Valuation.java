package com.github.hycon.automaton;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Integer values of the variables of a {@link VariableTable}, i.e. one snapshot of the
 * environment and system variables. Variables can be left unassigned, which happens for
 * partial records of the textual format.
 *
 * Valuations are immutable. Two valuations are equal if they assign the same variables (by
 * name) the same values.
 */
public final class Valuation {

    @NotNull
    private final VariableTable table;

    @NotNull
    private final int[] values;

    @NotNull
    private final BitSet assigned;

    private final int hash;

    private Valuation(@NotNull VariableTable table, @NotNull int[] values, @NotNull BitSet assigned) {
        this.table = table;
        this.values = values;
        this.assigned = assigned;
        int h = 0;
        for (int i = assigned.nextSetBit(0); i >= 0; i = assigned.nextSetBit(i + 1)) {
            // same value Map.hashCode() gives for toMap()
            h += table.getName(i).hashCode() ^ Integer.hashCode(values[i]);
        }
        this.hash = h;
    }

    /**
     * Valuation over {@code table}, variables missing from the table are registered.
     */
    @NotNull
    public static Valuation of(@NotNull VariableTable table, @NotNull Map<String, Integer> values) {
        for (String name : values.keySet()) {
            table.register(name);
        }
        final int[] array = new int[table.size()];
        final BitSet assigned = new BitSet(table.size());
        for (Map.Entry<String, Integer> entry : values.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Variable " + entry.getKey() + " has no value");
            }
            final int index = table.indexOf(entry.getKey());
            array[index] = entry.getValue();
            assigned.set(index);
        }
        return new Valuation(table, array, assigned);
    }

    @NotNull
    public static Valuation empty(@NotNull VariableTable table) {
        return new Valuation(table, new int[0], new BitSet());
    }

    @NotNull
    public VariableTable getTable() {
        return table;
    }

    /**
     * Value of the variable, null when it is unknown or unassigned.
     */
    @Nullable
    public Integer get(@NotNull String name) {
        final int index = table.indexOf(name);
        if (index < 0 || !assigned.get(index)) return null;
        return values[index];
    }

    public boolean isAssigned(@NotNull String name) {
        final int index = table.indexOf(name);
        return index >= 0 && assigned.get(index);
    }

    public int assignedCount() {
        return assigned.cardinality();
    }

    /**
     * True if every variable of the table has a value.
     */
    public boolean isComplete() {
        return assigned.cardinality() == table.size();
    }

    /**
     * True if every entry of {@code partial} is assigned the same value here. Variables not
     * mentioned in {@code partial} are unconstrained.
     */
    public boolean agreesWith(@NotNull Map<String, Integer> partial) {
        for (Map.Entry<String, Integer> entry : partial.entrySet()) {
            final int index = table.indexOf(entry.getKey());
            if (index < 0 || !assigned.get(index)) return false;
            if (entry.getValue() == null || values[index] != entry.getValue()) return false;
        }
        return true;
    }

    /**
     * True if this valuation assigns exactly the variables of {@code full}, with the same values.
     */
    public boolean matches(@NotNull Map<String, Integer> full) {
        return full.size() == assigned.cardinality() && agreesWith(full);
    }

    /**
     * Same values, expressed over another table.
     */
    @NotNull
    public Valuation rebase(@NotNull VariableTable other) {
        if (other == table) return this;
        return of(other, toMap());
    }

    /**
     * Assigned variables in table order.
     */
    @NotNull
    public Map<String, Integer> toMap() {
        final Map<String, Integer> result = new LinkedHashMap<>();
        for (int i = assigned.nextSetBit(0); i >= 0; i = assigned.nextSetBit(i + 1)) {
            result.put(table.getName(i), values[i]);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Valuation)) return false;
        final Valuation other = (Valuation) o;
        if (hash != other.hash) return false;
        if (table == other.table) {
            if (!assigned.equals(other.assigned)) return false;
            for (int i = assigned.nextSetBit(0); i >= 0; i = assigned.nextSetBit(i + 1)) {
                if (values[i] != other.values[i]) return false;
            }
            return true;
        }
        return toMap().equals(other.toMap());
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

}
