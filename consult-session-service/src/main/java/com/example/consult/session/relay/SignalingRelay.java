package com.example.consult.session.relay;

import com.example.consult.session.security.RoomCapability;
import com.example.consult.shared.config.AppProperties;
import com.example.consult.shared.config.MonitoringConfig.ConsultMetricsCollector;
import com.example.consult.shared.exception.RelayRefusedException;
import com.example.consult.shared.model.MeetingSession;
import com.example.consult.shared.repository.MeetingSessionRepository;
import com.example.consult.shared.util.Constants.CloseReason;
import com.example.consult.shared.util.Constants.ParticipantRole;
import com.example.consult.shared.util.Constants.SessionState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory signaling relay. Each room holds at most one doctor and one patient connection and
 * forwards frames from one slot to the other. Slot changes for a room are serialized through
 * {@link ConcurrentHashMap#compute}; rooms never share locks.
 * <p>
 * The relay never changes session state. It reports connections that went away by publishing
 * {@link ParticipantDisconnectedEvent}, and is told to tear rooms down through {@link #closeRoom}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SignalingRelay {

    private static final String NOT_CONNECTED = "NOT_CONNECTED";

    private final Map<String, RoomChannel> rooms = new ConcurrentHashMap<>();

    private final MeetingSessionRepository sessionRepository;
    private final SignalEventFactory eventFactory;
    private final ApplicationEventPublisher eventPublisher;
    private final AppProperties appProperties;
    private final ConsultMetricsCollector metricsCollector;
    private final Scheduler jdbcScheduler;
    private final Clock clock;

    private Disposable serverHeartbeatSubscription;

    @PostConstruct
    public void init() {
        startServerHeartbeat();
    }

    @PreDestroy
    public void cleanup() {
        log.info("Commencing SignalingRelay graceful shutdown...");
        if (serverHeartbeatSubscription != null && !serverHeartbeatSubscription.isDisposed()) {
            serverHeartbeatSubscription.dispose();
            log.info("Relay heartbeat task stopped.");
        }

        // Sessions stay ACTIVE: participants reconnect to another instance within the grace window.
        List<RoomChannel> channels = new ArrayList<>(rooms.values());
        rooms.clear();
        if (!channels.isEmpty()) {
            ServerSentEvent<String> shutdownEvent = eventFactory.createShutdownEvent();
            int notified = 0;
            for (RoomChannel channel : channels) {
                for (ParticipantBinding binding : channel.bindings()) {
                    binding.emit(shutdownEvent);
                    binding.complete();
                    notified++;
                }
            }
            log.info("Sent shutdown notice to {} relay connections in {} rooms.", notified, channels.size());
        }
        log.info("SignalingRelay cleanup complete.");
    }

    /**
     * Binds the caller's connection to its slot and returns the connection's event stream.
     * Any older connection in the same slot is told it was replaced and closed. The binding is
     * checked against the stored session after it is published, so a room that ended concurrently
     * never keeps a connection.
     *
     * @throws RelayRefusedException if the session does not allow the caller to be present
     */
    public Flux<ServerSentEvent<String>> admit(RoomCapability capability, String connectionId) {
        String roomId = capability.roomId();
        ParticipantRole role = capability.role();
        ParticipantBinding binding = new ParticipantBinding(connectionId, role, capability.userId(), now());

        AtomicReference<ParticipantBinding> replaced = new AtomicReference<>();
        rooms.compute(roomId, (id, channel) -> {
            RoomChannel target = channel != null ? channel : new RoomChannel(id);
            replaced.set(target.bind(binding));
            return target;
        });

        Optional<MeetingSession> session = sessionRepository.findByRoomId(roomId);
        if (session.isEmpty() || !session.get().permitsPresenceOf(role)) {
            String state = session.map(s -> s.getState().name()).orElse(SessionState.SCHEDULED.name());
            unbind(roomId, role, candidate -> candidate == binding);
            binding.complete();
            if (replaced.get() != null) {
                replaced.get().complete();
            }
            metricsCollector.incrementCounter("consult.relay.admissions", "role", role.name(), "outcome", "refused");
            log.warn("Refused {} connection {} for room {}: session is {}", role, connectionId, roomId, state);
            throw new RelayRefusedException(roomId, role, state, "Consultation is not active");
        }

        ParticipantBinding previous = replaced.get();
        if (previous != null && previous != binding) {
            previous.emit(eventFactory.createReplacedEvent(previous.getConnectionId()));
            previous.complete();
            log.info("Connection {} replaced {} connection {} in room {}", connectionId, role, previous.getConnectionId(), roomId);
        }

        RoomChannel channel = rooms.get(roomId);
        ParticipantBinding peer = channel != null ? channel.get(role.peer()) : null;
        binding.emit(eventFactory.createConnectedEvent(roomId, connectionId, role, peer != null));
        if (peer != null) {
            peer.emit(eventFactory.createPeerJoinedEvent(role));
        }

        metricsCollector.incrementCounter("consult.relay.admissions", "role", role.name(), "outcome", "admitted");
        log.info("Admitted {} {} to room {} with connection {}", role, capability.userId(), roomId, connectionId);

        return binding.asFlux()
                .doOnCancel(() -> release(roomId, binding))
                .doOnTerminate(() -> release(roomId, binding));
    }

    /**
     * Forwards {@code frame} to the other participant of the room.
     *
     * @throws RelayRefusedException if {@code connectionId} is not the caller's current connection
     */
    public SignalDelivery send(RoomCapability capability, String connectionId, SignalFrame frame) {
        String roomId = capability.roomId();
        ParticipantRole role = capability.role();
        RoomChannel channel = rooms.get(roomId);
        ParticipantBinding sender = channel != null ? channel.get(role) : null;
        if (sender == null || !sender.getConnectionId().equals(connectionId)) {
            metricsCollector.incrementCounter("consult.relay.frames", "type", frame.type().wireName(), "outcome", "refused");
            throw new RelayRefusedException(roomId, role, NOT_CONNECTED, "Connection is not admitted to this consultation");
        }

        ParticipantBinding peer = channel.get(role.peer());
        if (peer == null) {
            metricsCollector.incrementCounter("consult.relay.frames", "type", frame.type().wireName(), "outcome", "no_peer");
            log.debug("Dropped {} from {} in room {}: peer not connected", frame.type().wireName(), role, roomId);
            return SignalDelivery.PEER_NOT_CONNECTED;
        }

        boolean delivered = peer.emit(eventFactory.createSignalEvent(frame, role));
        metricsCollector.incrementCounter("consult.relay.frames", "type", frame.type().wireName(), "outcome", delivered ? "delivered" : "failed");
        if (!delivered) {
            log.warn("Failed to relay {} from {} to {} in room {}", frame.type().wireName(), role, role.peer(), roomId);
        }
        return delivered ? SignalDelivery.DELIVERED : SignalDelivery.PEER_NOT_CONNECTED;
    }

    /**
     * Explicit leave. Removes the binding only if {@code connectionId} still holds the slot.
     *
     * @return true if a binding was removed
     */
    public boolean evict(RoomCapability capability, String connectionId) {
        ParticipantBinding removed = unbind(capability.roomId(), capability.role(),
                candidate -> candidate.getConnectionId().equals(connectionId));
        if (removed == null) {
            return false;
        }
        removed.complete();
        announceDeparture(capability.roomId(), removed);
        return true;
    }

    /**
     * Tears the room down after its session closed: both participants receive SESSION_ENDED and their
     * streams complete. No disconnect events are published for these connections.
     */
    public void closeRoom(String roomId, SessionState finalState, CloseReason reason) {
        RoomChannel channel = rooms.remove(roomId);
        if (channel == null) {
            return;
        }
        ServerSentEvent<String> endedEvent = eventFactory.createSessionEndedEvent(finalState, reason);
        List<ParticipantBinding> bindings = channel.bindings();
        for (ParticipantBinding binding : bindings) {
            binding.emit(endedEvent);
            binding.complete();
        }
        log.info("Closed relay room {} ({}, {}), evicted {} connection(s)", roomId, finalState, reason, bindings.size());
    }

    public boolean isBound(String roomId, ParticipantRole role) {
        RoomChannel channel = rooms.get(roomId);
        return channel != null && channel.get(role) != null;
    }

    public RelayStats stats() {
        int doctors = 0;
        int patients = 0;
        for (RoomChannel channel : rooms.values()) {
            if (channel.get(ParticipantRole.DOCTOR) != null) {
                doctors++;
            }
            if (channel.get(ParticipantRole.PATIENT) != null) {
                patients++;
            }
        }
        return new RelayStats(rooms.size(), doctors, patients);
    }

    Set<String> roomsWithPatient() {
        return rooms.values().stream()
                .filter(channel -> channel.get(ParticipantRole.PATIENT) != null)
                .map(RoomChannel::roomId)
                .collect(Collectors.toSet());
    }

    private void release(String roomId, ParticipantBinding binding) {
        ParticipantBinding removed = unbind(roomId, binding.getRole(), candidate -> candidate == binding);
        if (removed != null) {
            announceDeparture(roomId, removed);
        }
    }

    private ParticipantBinding unbind(String roomId, ParticipantRole role, Predicate<ParticipantBinding> matches) {
        AtomicReference<ParticipantBinding> removed = new AtomicReference<>();
        rooms.computeIfPresent(roomId, (id, channel) -> {
            ParticipantBinding current = channel.get(role);
            if (current != null && matches.test(current)) {
                channel.clear(role);
                removed.set(current);
            }
            return channel.isEmpty() ? null : channel;
        });
        return removed.get();
    }

    private void announceDeparture(String roomId, ParticipantBinding departed) {
        RoomChannel channel = rooms.get(roomId);
        ParticipantBinding peer = channel != null ? channel.get(departed.getRole().peer()) : null;
        if (peer != null) {
            peer.emit(eventFactory.createPeerLeftEvent(departed.getRole()));
        }
        log.info("{} {} left room {} (connection {})", departed.getRole(), departed.getUserId(), roomId, departed.getConnectionId());
        eventPublisher.publishEvent(new ParticipantDisconnectedEvent(this, roomId, departed.getRole(),
                departed.getUserId(), departed.getConnectionId(), now()));
    }

    private void startServerHeartbeat() {
        serverHeartbeatSubscription = Flux.interval(Duration.ofMillis(appProperties.getRelay().getHeartbeatInterval()), jdbcScheduler)
            .doOnNext(tick -> {
                try {
                    if (rooms.isEmpty()) return;

                    ServerSentEvent<String> heartbeatEvent = eventFactory.createHeartbeatEvent();
                    for (RoomChannel channel : new ArrayList<>(rooms.values())) {
                        for (ParticipantBinding binding : channel.bindings()) {
                            binding.emit(heartbeatEvent);
                        }
                    }

                    // A connected patient keeps its grace window fresh
                    Set<String> patientRooms = roomsWithPatient();
                    if (!patientRooms.isEmpty()) {
                        sessionRepository.touchPatientsSeen(patientRooms, now());
                    }
                } catch (Exception e) {
                    log.error("Error in relay heartbeat task: {}", e.getMessage());
                }
            })
            .subscribe();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
