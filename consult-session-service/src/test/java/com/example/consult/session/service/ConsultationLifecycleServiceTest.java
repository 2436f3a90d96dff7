package com.example.consult.session.service;

import com.example.consult.session.relay.ParticipantDisconnectedEvent;
import com.example.consult.session.relay.SignalingRelay;
import com.example.consult.session.security.CallerIdentity;
import com.example.consult.session.security.RoomCapability;
import com.example.consult.session.security.TestCapabilities;
import com.example.consult.session.support.MutableClock;
import com.example.consult.shared.config.AppProperties;
import com.example.consult.shared.config.MonitoringConfig.ConsultMetricsCollector;
import com.example.consult.shared.exception.ForbiddenException;
import com.example.consult.shared.exception.NotYetStartedException;
import com.example.consult.shared.exception.SessionClosedException;
import com.example.consult.shared.exception.SessionConflictException;
import com.example.consult.shared.model.AppointmentRef;
import com.example.consult.shared.model.MeetingSession;
import com.example.consult.shared.repository.MeetingSessionRepository;
import com.example.consult.shared.util.Constants.CloseReason;
import com.example.consult.shared.util.Constants.ParticipantRole;
import com.example.consult.shared.util.Constants.SessionOperation;
import com.example.consult.shared.util.Constants.SessionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConsultationLifecycleServiceTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2026, 3, 2, 9, 0, 0, 0, ZoneOffset.UTC);
    private static final String ROOM = "apt-42-0123456789abcdef";

    @Mock
    private SignalingRelay signalingRelay;

    @Mock
    private AppointmentDirectory appointmentDirectory;

    private EmbeddedDatabase database;
    private MeetingSessionRepository repository;
    private MutableClock clock;
    private ConsultMetricsCollector metricsCollector;
    private ConsultationLifecycleService lifecycleService;
    private AppointmentRef appointment;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("db/consult-schema.sql")
                .build();
        repository = new MeetingSessionRepository(new JdbcTemplate(database));
        clock = new MutableClock(T0.toInstant());
        appointment = new AppointmentRef(42L, "doc-1", "pat-1", T0, "scheduled");

        when(appointmentDirectory.refresh(42L)).thenReturn(Optional.of(appointment));
        when(signalingRelay.admit(any(), anyString())).thenReturn(Flux.never());

        metricsCollector = new ConsultMetricsCollector(new SimpleMeterRegistry());
        lifecycleService = new ConsultationLifecycleService(repository, appointmentDirectory, signalingRelay,
                new GracePolicy(new AppProperties()), metricsCollector, clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private RoomCapability doctor(SessionOperation operation) {
        return TestCapabilities.doctor(ROOM, appointment, operation);
    }

    private RoomCapability patient(SessionOperation operation) {
        return TestCapabilities.patient(ROOM, appointment, operation);
    }

    private MeetingSession stored() {
        return repository.findByRoomId(ROOM).orElseThrow();
    }

    private ParticipantDisconnectedEvent disconnect(ParticipantRole role, String userId) {
        return new ParticipantDisconnectedEvent(this, ROOM, role, userId, "conn-" + role, OffsetDateTime.now(clock));
    }

    @Test
    @DisplayName("Should create the room in SCHEDULED when opened")
    void testOpen() {
        MeetingSession session = lifecycleService.open(patient(SessionOperation.OPEN));

        assertThat(session.getState()).isEqualTo(SessionState.SCHEDULED);
        assertThat(session.getAppointmentId()).isEqualTo(42L);
        assertThat(lifecycleService.mySessions(new CallerIdentity("doc-1", ParticipantRole.DOCTOR, "doctor")))
                .extracting(MeetingSession::getRoomId)
                .containsExactly(ROOM);
    }

    @Test
    @DisplayName("Should start a scheduled session and refuse a second start")
    void testStart() {
        MeetingSession started = lifecycleService.start(doctor(SessionOperation.START));

        assertThat(started.getState()).isEqualTo(SessionState.ACTIVE);
        assertThat(started.getStartedAt()).isEqualTo(T0);
        assertThat(metricsCollector.getCounterValue("consult.sessions.transitions", "to", "ACTIVE", "reason", "started")).isEqualTo(1);
        assertThatThrownBy(() -> lifecycleService.start(doctor(SessionOperation.START)))
                .isInstanceOfSatisfying(SessionConflictException.class,
                        ex -> assertThat(ex.getState()).isEqualTo("ALREADY_ACTIVE"));
    }

    @Test
    @DisplayName("Should let exactly one of two concurrent starts win")
    void testConcurrentStart() throws Exception {
        lifecycleService.open(doctor(SessionOperation.OPEN));
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch ready = new CountDownLatch(1);
        List<Future<MeetingSession>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                Callable<MeetingSession> task = () -> {
                    ready.await();
                    return lifecycleService.start(doctor(SessionOperation.START));
                };
                results.add(executor.submit(task));
            }
            ready.countDown();

            int winners = 0;
            int conflicts = 0;
            for (Future<MeetingSession> result : results) {
                try {
                    assertThat(result.get(10, TimeUnit.SECONDS).getState()).isEqualTo(SessionState.ACTIVE);
                    winners++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(SessionConflictException.class);
                    conflicts++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(conflicts).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should tell joiners to wait until the doctor starts")
    void testJoinBeforeStart() {
        assertThatThrownBy(() -> lifecycleService.join(patient(SessionOperation.JOIN), "p-1"))
                .isInstanceOf(NotYetStartedException.class);

        lifecycleService.open(patient(SessionOperation.OPEN));
        assertThatThrownBy(() -> lifecycleService.join(patient(SessionOperation.JOIN), "p-1"))
                .isInstanceOf(NotYetStartedException.class);
        assertThatThrownBy(() -> lifecycleService.join(doctor(SessionOperation.JOIN), "d-1"))
                .isInstanceOf(NotYetStartedException.class);
        verify(signalingRelay, never()).admit(any(), anyString());
    }

    @Test
    @DisplayName("Should hand admitted participants to the relay and stamp the patient as seen")
    void testJoinActive() {
        lifecycleService.start(doctor(SessionOperation.START));
        clock.advance(Duration.ofSeconds(30));

        lifecycleService.join(doctor(SessionOperation.JOIN), "d-1");
        lifecycleService.join(patient(SessionOperation.JOIN), "p-1");

        verify(signalingRelay, times(2)).admit(any(), anyString());
        assertThat(stored().getLastPatientSeenAt()).isEqualTo(T0.plusSeconds(30));
    }

    @Test
    @DisplayName("Should close the session for good once ended")
    void testEnd() {
        lifecycleService.start(doctor(SessionOperation.START));
        clock.advance(Duration.ofMinutes(20));

        MeetingSession ended = lifecycleService.end(doctor(SessionOperation.END));

        assertThat(ended.getState()).isEqualTo(SessionState.ENDED);
        assertThat(ended.getCloseReason()).isEqualTo(CloseReason.DOCTOR_ENDED);
        assertThat(ended.getDurationSeconds()).isEqualTo(1200L);
        verify(signalingRelay).closeRoom(ROOM, SessionState.ENDED, CloseReason.DOCTOR_ENDED);

        assertThatThrownBy(() -> lifecycleService.join(patient(SessionOperation.JOIN), "p-1"))
                .isInstanceOfSatisfying(SessionClosedException.class,
                        ex -> assertThat(ex.getState()).isEqualTo(SessionState.ENDED));
        assertThatThrownBy(() -> lifecycleService.start(doctor(SessionOperation.START)))
                .isInstanceOfSatisfying(SessionConflictException.class,
                        ex -> assertThat(ex.getState()).isEqualTo("ENDED"));

        MeetingSession again = lifecycleService.end(doctor(SessionOperation.END));
        assertThat(again.getState()).isEqualTo(SessionState.ENDED);
        assertThat(again.getEndedAt()).isEqualTo(ended.getEndedAt());
        verify(signalingRelay, times(1)).closeRoom(anyString(), any(), any());
    }

    @Test
    @DisplayName("Should refuse to end a session that never started")
    void testEndScheduled() {
        assertThatThrownBy(() -> lifecycleService.end(doctor(SessionOperation.END)))
                .isInstanceOf(SessionConflictException.class);

        lifecycleService.open(doctor(SessionOperation.OPEN));
        assertThatThrownBy(() -> lifecycleService.end(doctor(SessionOperation.END)))
                .isInstanceOfSatisfying(SessionConflictException.class,
                        ex -> assertThat(ex.getState()).isEqualTo("SCHEDULED"));
    }

    @Test
    @DisplayName("Should cancel a scheduled session and keep it cancelled")
    void testCancel() {
        MeetingSession cancelled = lifecycleService.cancel(doctor(SessionOperation.CANCEL));

        assertThat(cancelled.getState()).isEqualTo(SessionState.CANCELLED);
        assertThat(cancelled.getCloseReason()).isEqualTo(CloseReason.CANCELLED_BY_DOCTOR);
        assertThat(lifecycleService.cancel(doctor(SessionOperation.CANCEL)).getState()).isEqualTo(SessionState.CANCELLED);
        assertThatThrownBy(() -> lifecycleService.start(doctor(SessionOperation.START)))
                .isInstanceOf(SessionConflictException.class);
        assertThatThrownBy(() -> lifecycleService.join(patient(SessionOperation.JOIN), "p-1"))
                .isInstanceOf(SessionClosedException.class);
    }

    @Test
    @DisplayName("Should refuse to cancel a session in progress")
    void testCancelActive() {
        lifecycleService.start(doctor(SessionOperation.START));

        assertThatThrownBy(() -> lifecycleService.cancel(doctor(SessionOperation.CANCEL)))
                .isInstanceOfSatisfying(SessionConflictException.class,
                        ex -> assertThat(ex.getState()).isEqualTo("ACTIVE"));
    }

    @Test
    @DisplayName("Should cancel instead of starting when the appointment was cancelled")
    void testStartCancelledAppointment() {
        when(appointmentDirectory.refresh(42L)).thenReturn(Optional.of(
                new AppointmentRef(42L, "doc-1", "pat-1", T0, AppointmentRef.STATUS_CANCELLED)));

        assertThatThrownBy(() -> lifecycleService.start(doctor(SessionOperation.START)))
                .isInstanceOfSatisfying(SessionClosedException.class,
                        ex -> assertThat(ex.getState()).isEqualTo(SessionState.CANCELLED));
        assertThat(stored().getCloseReason()).isEqualTo(CloseReason.APPOINTMENT_CANCELLED);
    }

    @Test
    @DisplayName("Should let the patient back in within the grace window")
    void testPatientReconnectWithinGrace() {
        lifecycleService.start(doctor(SessionOperation.START));
        lifecycleService.join(patient(SessionOperation.JOIN), "p-1");
        clock.advance(Duration.ofMinutes(1));
        lifecycleService.handleParticipantDisconnect(disconnect(ParticipantRole.PATIENT, "pat-1"));

        clock.advance(Duration.ofMinutes(4));
        lifecycleService.join(patient(SessionOperation.JOIN), "p-2");

        assertThat(stored().getState()).isEqualTo(SessionState.ACTIVE);
        assertThat(lifecycleService.expireGrace(stored(), OffsetDateTime.now(clock))).isFalse();
        verify(signalingRelay, times(2)).admit(any(), anyString());
    }

    @Test
    @DisplayName("Should end the session when the patient returns after the grace window")
    void testPatientReconnectAfterGrace() {
        lifecycleService.start(doctor(SessionOperation.START));
        lifecycleService.join(patient(SessionOperation.JOIN), "p-1");
        lifecycleService.handleParticipantDisconnect(disconnect(ParticipantRole.PATIENT, "pat-1"));

        clock.advance(Duration.ofMinutes(6));

        assertThatThrownBy(() -> lifecycleService.join(patient(SessionOperation.JOIN), "p-2"))
                .isInstanceOfSatisfying(SessionClosedException.class,
                        ex -> assertThat(ex.getState()).isEqualTo(SessionState.ENDED));
        assertThat(stored().getCloseReason()).isEqualTo(CloseReason.PATIENT_GRACE_EXPIRED);
        verify(signalingRelay).closeRoom(ROOM, SessionState.ENDED, CloseReason.PATIENT_GRACE_EXPIRED);
        verify(signalingRelay, times(1)).admit(any(), anyString());
    }

    @Test
    @DisplayName("Should expire an abandoned session exactly once")
    void testExpireGraceOnce() {
        lifecycleService.start(doctor(SessionOperation.START));
        lifecycleService.handleParticipantDisconnect(disconnect(ParticipantRole.PATIENT, "pat-1"));
        MeetingSession candidate = stored();
        clock.advance(Duration.ofMinutes(10));
        OffsetDateTime now = OffsetDateTime.now(clock);

        assertThat(lifecycleService.expireGrace(candidate, now)).isTrue();
        assertThat(lifecycleService.expireGrace(candidate, now)).isFalse();
        assertThat(stored().getState()).isEqualTo(SessionState.ENDED);
        verify(signalingRelay, times(1)).closeRoom(ROOM, SessionState.ENDED, CloseReason.PATIENT_GRACE_EXPIRED);
    }

    @Test
    @DisplayName("Should not expire a session whose patient reconnected after the sweep read it")
    void testExpireGraceLosesToReconnect() {
        lifecycleService.start(doctor(SessionOperation.START));
        lifecycleService.handleParticipantDisconnect(disconnect(ParticipantRole.PATIENT, "pat-1"));
        MeetingSession staleCandidate = stored();
        clock.advance(Duration.ofMinutes(4));
        lifecycleService.join(patient(SessionOperation.JOIN), "p-2");
        clock.advance(Duration.ofMinutes(2));

        assertThat(lifecycleService.expireGrace(staleCandidate, OffsetDateTime.now(clock))).isFalse();
        assertThat(stored().getState()).isEqualTo(SessionState.ACTIVE);
    }

    @Test
    @DisplayName("Should end the session as no-show when the patient never arrives")
    void testNoShow() {
        lifecycleService.start(doctor(SessionOperation.START));
        clock.advance(Duration.ofMinutes(16));

        assertThat(lifecycleService.expireGrace(stored(), OffsetDateTime.now(clock))).isTrue();
        assertThat(stored().getCloseReason()).isEqualTo(CloseReason.PATIENT_NO_SHOW);
    }

    @Test
    @DisplayName("Should end the session when the doctor disconnects")
    void testDoctorDisconnect() {
        lifecycleService.start(doctor(SessionOperation.START));

        lifecycleService.handleParticipantDisconnect(disconnect(ParticipantRole.DOCTOR, "doc-1"));

        assertThat(stored().getState()).isEqualTo(SessionState.ENDED);
        assertThat(stored().getCloseReason()).isEqualTo(CloseReason.DOCTOR_DISCONNECTED);
        verify(signalingRelay).closeRoom(ROOM, SessionState.ENDED, CloseReason.DOCTOR_DISCONNECTED);
    }

    @Test
    @DisplayName("Should ignore a doctor disconnect when the doctor is already back")
    void testStaleDoctorDisconnect() {
        lifecycleService.start(doctor(SessionOperation.START));
        when(signalingRelay.isBound(ROOM, ParticipantRole.DOCTOR)).thenReturn(true);

        lifecycleService.handleParticipantDisconnect(disconnect(ParticipantRole.DOCTOR, "doc-1"));

        assertThat(stored().getState()).isEqualTo(SessionState.ACTIVE);
        verify(signalingRelay, never()).closeRoom(anyString(), any(), any());
    }

    @Test
    @DisplayName("Should refuse a capability minted for a different operation")
    void testCapabilityOperationMismatch() {
        assertThatThrownBy(() -> lifecycleService.start(patient(SessionOperation.JOIN)))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> lifecycleService.start(doctor(SessionOperation.JOIN)))
                .isInstanceOf(ForbiddenException.class);
        assertThat(repository.findByRoomId(ROOM)).isEmpty();

        lifecycleService.start(doctor(SessionOperation.START));
        assertThatThrownBy(() -> lifecycleService.end(doctor(SessionOperation.JOIN)))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> lifecycleService.end(patient(SessionOperation.END)))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> lifecycleService.join(patient(SessionOperation.STATUS), "p-1"))
                .isInstanceOf(ForbiddenException.class);
        assertThat(stored().getState()).isEqualTo(SessionState.ACTIVE);
        verify(signalingRelay, never()).admit(any(), anyString());
    }

    @Test
    @DisplayName("Should end the session when the doctor starts it but never joins")
    void testDoctorNoShow() {
        lifecycleService.start(doctor(SessionOperation.START));
        clock.advance(Duration.ofMinutes(9));
        assertThat(lifecycleService.expireDoctorNoShow(stored(), OffsetDateTime.now(clock))).isFalse();

        clock.advance(Duration.ofMinutes(2));
        MeetingSession candidate = stored();
        assertThat(lifecycleService.expireDoctorNoShow(candidate, OffsetDateTime.now(clock))).isTrue();
        assertThat(lifecycleService.expireDoctorNoShow(candidate, OffsetDateTime.now(clock))).isFalse();

        assertThat(stored().getState()).isEqualTo(SessionState.ENDED);
        assertThat(stored().getCloseReason()).isEqualTo(CloseReason.DOCTOR_NO_SHOW);
        verify(signalingRelay, times(1)).closeRoom(ROOM, SessionState.ENDED, CloseReason.DOCTOR_NO_SHOW);
        assertThat(metricsCollector.getCounterValue("consult.sessions.transitions",
                "to", "ENDED", "reason", "DOCTOR_NO_SHOW")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the session once the doctor has joined")
    void testDoctorJoinedIsNotNoShow() {
        lifecycleService.start(doctor(SessionOperation.START));
        MeetingSession beforeJoin = stored();
        clock.advance(Duration.ofMinutes(1));
        lifecycleService.join(doctor(SessionOperation.JOIN), "d-1");
        clock.advance(Duration.ofMinutes(1));
        lifecycleService.join(doctor(SessionOperation.JOIN), "d-2");

        assertThat(stored().getDoctorJoinedAt()).isEqualTo(T0.plusMinutes(1));

        clock.advance(Duration.ofMinutes(15));
        assertThat(lifecycleService.expireDoctorNoShow(stored(), OffsetDateTime.now(clock))).isFalse();
        assertThat(lifecycleService.expireDoctorNoShow(beforeJoin, OffsetDateTime.now(clock))).isFalse();
        assertThat(stored().getState()).isEqualTo(SessionState.ACTIVE);
        verify(signalingRelay, never()).closeRoom(anyString(), any(), any());
    }
}
