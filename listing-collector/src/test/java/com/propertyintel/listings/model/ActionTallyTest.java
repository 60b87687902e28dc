package com.propertyintel.listings.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ActionTallyTest {

    @Test
    void tallyKeysFollowActionNames() {
        ActionTally tally = new ActionTally();
        tally.increment(ReconcileAction.NEW);
        tally.increment(ReconcileAction.PRICE_CHANGE);
        tally.increment(ReconcileAction.PRICE_CHANGE);

        assertThat(tally.asMap()).containsExactly(
                Map.entry("new", 1),
                Map.entry("price_change", 2),
                Map.entry("republished", 0),
                Map.entry("active", 0),
                Map.entry("skipped", 0));
        assertThat(tally.get(ReconcileAction.PRICE_CHANGE)).isEqualTo(2);
        assertThat(tally.total()).isEqualTo(3);
    }
}
