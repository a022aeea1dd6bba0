package com.example.blockalert.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The fixed set of replies a receiver can give. Values written by another client version that this
 * build does not know decode to {@link #UNRECOGNIZED} instead of failing.
 */
public enum AlertResponse {
    MOVING_NOW("moving_now", "Moving now"),
    FIVE_MINUTES("5_minutes", "Give me 5 minutes"),
    CANT_MOVE("cant_move", "Can't move right now"),
    WRONG_CAR("wrong_car", "Wrong car"),
    UNRECOGNIZED("unrecognized", "Responded");

    private final String wireValue;
    private final String displayText;

    AlertResponse(String wireValue, String displayText) {
        this.wireValue = wireValue;
        this.displayText = displayText;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public String getDisplayText() {
        return displayText;
    }

    /**
     * Lenient decoding for stored rows. Null stays null.
     */
    public static AlertResponse fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return parse(value).orElse(UNRECOGNIZED);
    }

    /**
     * Strict parsing for submitted values; {@link #UNRECOGNIZED} is never a valid submission.
     */
    public static Optional<AlertResponse> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim();
        for (AlertResponse response : values()) {
            if (response != UNRECOGNIZED && response.wireValue.equalsIgnoreCase(candidate)) {
                return Optional.of(response);
            }
        }
        return Optional.empty();
    }
}
