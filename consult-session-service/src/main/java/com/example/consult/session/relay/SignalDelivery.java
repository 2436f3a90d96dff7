package com.example.consult.session.relay;

public enum SignalDelivery {
    DELIVERED,
    PEER_NOT_CONNECTED
}
