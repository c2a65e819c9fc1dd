package com.kpisentinel.core.decision;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PredictionBandTest {

    @Test
    @DisplayName("Should clamp the prediction before deciding on the lower bound")
    void shouldClampInOrder() {
        assertThat(new PredictionBand(-1, 5, -2).clamped()).isEqualTo(new PredictionBand(0, 0, 0));
        assertThat(new PredictionBand(3, -1, 6).clamped()).isEqualTo(new PredictionBand(3, 0, 6));
        assertThat(new PredictionBand(3, 1, 6).clamped()).isEqualTo(new PredictionBand(3, 1, 6));
    }

    @Test
    @DisplayName("Should register the identity adjustment when nothing else is registered")
    void shouldDefaultToIdentity() {
        PredictionBand band = new PredictionBand(10, 8, 12);

        List<PredictionAdjustment> registered = PredictionAdjustments.registered();

        assertThat(registered).containsExactly(PredictionAdjustments.IDENTITY);
        assertThat(registered.get(0).adjust(List.of(), "orders", band)).isSameAs(band);
    }
}
