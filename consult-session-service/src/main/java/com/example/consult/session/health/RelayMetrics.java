package com.example.consult.session.health;

import com.example.consult.session.relay.SignalingRelay;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RelayMetrics implements MeterBinder {

    private final SignalingRelay signalingRelay;

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("consult.relay.rooms.active", signalingRelay, relay -> relay.stats().activeRooms())
                .description("Rooms with at least one bound connection")
                .register(registry);
        Gauge.builder("consult.relay.connections", signalingRelay, relay -> relay.stats().doctorConnections())
                .tag("role", "doctor")
                .register(registry);
        Gauge.builder("consult.relay.connections", signalingRelay, relay -> relay.stats().patientConnections())
                .tag("role", "patient")
                .register(registry);
    }
}
