package com.github.hycon.automaton;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ValuationTest {

    @Test
    void equalityDoesNotDependOnTable() {
        VariableTable first = new VariableTable(Arrays.asList("a", "b"));
        VariableTable second = new VariableTable(Arrays.asList("b", "a", "c"));
        Map<String, Integer> values = Map.of("a", 1, "b", 2);

        Valuation x = Valuation.of(first, values);
        Valuation y = Valuation.of(second, values);

        assertThat(x).isEqualTo(y);
        assertThat(x.hashCode()).isEqualTo(y.hashCode()).isEqualTo(values.hashCode());
        assertThat(x).isNotEqualTo(Valuation.of(first, Map.of("a", 1)));
        assertThat(x).isNotEqualTo(Valuation.of(first, Map.of("a", 1, "b", 3)));
    }

    @Test
    void valuesCreatedBeforeTableGrows() {
        VariableTable table = new VariableTable();
        Valuation early = Valuation.of(table, Map.of("a", 1));
        Valuation late = Valuation.of(table, Map.of("a", 1, "b", 0));

        assertThat(early.get("b")).isNull();
        assertThat(early.isComplete()).isFalse();
        assertThat(late.isComplete()).isTrue();
        assertThat(early).isNotEqualTo(late);
        assertThat(early).isEqualTo(Valuation.of(table, Map.of("a", 1)));
    }

    @Test
    void partialAgreement() {
        Valuation v = Valuation.of(new VariableTable(), Map.of("env", 1, "sys", 0));

        assertThat(v.agreesWith(Collections.emptyMap())).isTrue();
        assertThat(v.agreesWith(Map.of("env", 1))).isTrue();
        assertThat(v.agreesWith(Map.of("env", 0))).isFalse();
        assertThat(v.agreesWith(Map.of("other", 1))).isFalse();
        assertThat(v.matches(Map.of("env", 1))).isFalse();
        assertThat(v.matches(Map.of("env", 1, "sys", 0))).isTrue();
    }

    @Test
    void missingValueIsRejected() {
        Map<String, Integer> values = new HashMap<>();
        values.put("a", null);
        assertThatThrownBy(() -> Valuation.of(new VariableTable(), values))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("a");
    }

    @Test
    void mapFollowsTableOrder() {
        VariableTable table = new VariableTable(Arrays.asList("z", "a"));
        Map<String, Integer> values = new LinkedHashMap<>();
        values.put("a", 1);
        values.put("z", 2);

        Valuation v = Valuation.of(table, values);

        assertThat(v.toMap()).containsExactly(entry("z", 2), entry("a", 1));
        assertThat(v.rebase(new VariableTable()).toMap()).containsOnly(entry("z", 2), entry("a", 1));
        assertThat(v.rebase(table)).isSameAs(v);
    }

    @Test
    void variableTableAppendsOnly() {
        VariableTable table = new VariableTable(Arrays.asList("a", "b"));
        assertThat(table.register("b")).isEqualTo(1);
        assertThat(table.register("c")).isEqualTo(2);
        assertThat(table.indexOf("missing")).isEqualTo(-1);
        assertThat(table.getNames()).containsExactly("a", "b", "c");
        assertThat(table.contains("c")).isTrue();
    }

}
