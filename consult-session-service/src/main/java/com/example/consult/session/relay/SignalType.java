package com.example.consult.session.relay;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * WebRTC negotiation messages the relay forwards. The wire names double as SSE event names.
 */
public enum SignalType {
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("ice_candidate");

    private final String wireName;

    SignalType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SignalType fromWireName(String value) {
        for (SignalType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown signal type: " + value);
    }
}
