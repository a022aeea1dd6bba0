package com.example.blockalert.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertResponseTest {

    @Test
    void shouldDecodeKnownStoredValues() {
        assertThat(AlertResponse.fromWireValue("moving_now")).isEqualTo(AlertResponse.MOVING_NOW);
        assertThat(AlertResponse.fromWireValue("5_minutes")).isEqualTo(AlertResponse.FIVE_MINUTES);
        assertThat(AlertResponse.fromWireValue("cant_move")).isEqualTo(AlertResponse.CANT_MOVE);
        assertThat(AlertResponse.fromWireValue("wrong_car")).isEqualTo(AlertResponse.WRONG_CAR);
    }

    @Test
    void shouldDecodeUnknownStoredValueAsUnrecognized() {
        assertThat(AlertResponse.fromWireValue("on_my_way")).isEqualTo(AlertResponse.UNRECOGNIZED);
        assertThat(AlertResponse.fromWireValue(null)).isNull();
    }

    @Test
    void shouldRejectUnknownSubmittedValues() {
        assertThat(AlertResponse.parse("on_my_way")).isEmpty();
        assertThat(AlertResponse.parse("unrecognized")).isEmpty();
        assertThat(AlertResponse.parse(null)).isEmpty();
        assertThat(AlertResponse.parse(" MOVING_NOW ")).contains(AlertResponse.MOVING_NOW);
    }

    @Test
    void shouldExposeDisplayText() {
        assertThat(AlertResponse.FIVE_MINUTES.getDisplayText()).isEqualTo("Give me 5 minutes");
        assertThat(AlertResponse.CANT_MOVE.getDisplayText()).isEqualTo("Can't move right now");
    }
}
