package com.example.consult.session.relay;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Opaque signaling message. The payload (SDP or ICE candidate) is never inspected.
 */
public record SignalFrame(SignalType type, JsonNode payload) {
}
