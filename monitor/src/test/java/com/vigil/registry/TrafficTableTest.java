package com.vigil.registry;

import com.vigil.MutableClock;
import com.vigil.model.TrafficRule;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrafficTableTest {

    private final TrafficTable table = new TrafficTable(MutableClock.startingAt("2024-01-01T00:00:00Z"));

    @Test
    void assignsSequentialIdsInInsertionOrder() {
        TrafficRule first = table.addRule("old-server", "new-server", 70, null);
        TrafficRule second = table.addRule("api-v1", "api-v2", 30, "canary");

        assertThat(first.getId()).isEqualTo(1);
        assertThat(second.getId()).isEqualTo(2);
        assertThat(second.getCondition()).isEqualTo("canary");
        assertThat(table.rules()).containsExactly(first, second);
    }

    @Test
    void clampsWeightIntoPercentRange() {
        assertThat(table.addRule("a", "b", 150, null).getWeight()).isEqualTo(100);
        assertThat(table.addRule("a", "b", -5, null).getWeight()).isZero();
        assertThat(table.addRule("a", "b", 0, null).getWeight()).isZero();
        assertThat(table.addRule("a", "b", 100, null).getWeight()).isEqualTo(100);
    }

    @Test
    void rulesViewIsImmutableSnapshot() {
        table.addRule("a", "b", 50, null);
        var rules = table.rules();

        table.addRule("c", "d", 50, null);

        assertThat(rules).hasSize(1);
        assertThat(table.size()).isEqualTo(2);
    }

    @Test
    void clearEmptiesTable() {
        table.addRule("a", "b", 50, null);

        table.clear();

        assertThat(table.size()).isZero();
        assertThat(table.addRule("a", "b", 50, null).getId()).isEqualTo(1);
    }
}
