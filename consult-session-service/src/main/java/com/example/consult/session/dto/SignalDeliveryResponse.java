package com.example.consult.session.dto;

import com.example.consult.session.relay.SignalDelivery;

public record SignalDeliveryResponse(boolean delivered, SignalDelivery outcome) {

    public static SignalDeliveryResponse of(SignalDelivery outcome) {
        return new SignalDeliveryResponse(outcome == SignalDelivery.DELIVERED, outcome);
    }
}
