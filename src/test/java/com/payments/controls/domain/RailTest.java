package com.payments.controls.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RailTest {

    @Test
    void fromStringNormalizes() {
        assertThat(Rail.fromString(" crypto ")).isEqualTo(Rail.CRYPTO);
        assertThat(Rail.fromString("Ach")).isEqualTo(Rail.ACH);
        assertThat(Rail.fromString("WIRE")).isNull();
        assertThat(Rail.fromString(null)).isNull();
    }

    @Test
    void rowRailIsComparedExactly() {
        assertThat(Rail.CARD.matches("CARD")).isTrue();
        assertThat(Rail.CARD.matches("card")).isFalse();
        assertThat(Rail.CARD.matches(null)).isFalse();
    }
}
