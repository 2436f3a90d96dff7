package com.example.consult.session.scheduler;

import com.example.consult.session.relay.SignalingRelay;
import com.example.consult.session.service.ConsultationLifecycleService;
import com.example.consult.session.service.GracePolicy;
import com.example.consult.shared.config.AppProperties;
import com.example.consult.shared.model.MeetingSession;
import com.example.consult.shared.repository.MeetingSessionRepository;
import com.example.consult.shared.util.Constants.ParticipantRole;
import com.example.consult.shared.util.Constants.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GraceWindowWatchdogTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final OffsetDateTime NOW_UTC = NOW.atOffset(ZoneOffset.UTC);

    @Mock
    private MeetingSessionRepository sessionRepository;

    @Mock
    private ConsultationLifecycleService lifecycleService;

    @Mock
    private SignalingRelay signalingRelay;

    private GraceWindowWatchdog watchdog;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        AppProperties properties = new AppProperties();
        properties.getSession().setWatchdogBatchSize(50);
        watchdog = new GraceWindowWatchdog(sessionRepository, lifecycleService, signalingRelay,
                new GracePolicy(properties), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private MeetingSession candidate(String roomId) {
        return MeetingSession.builder()
                .roomId(roomId)
                .state(SessionState.ACTIVE)
                .startedAt(NOW_UTC.minusMinutes(30))
                .lastPatientSeenAt(NOW_UTC.minusMinutes(10))
                .build();
    }

    @Test
    @DisplayName("Should query candidates with the grace and no-show cutoffs")
    void testCutoffs() {
        when(sessionRepository.findAbandonedCandidates(any(), any(), anyInt())).thenReturn(List.of());

        assertThat(watchdog.sweep()).isZero();

        verify(sessionRepository).findAbandonedCandidates(NOW_UTC.minusMinutes(5), NOW_UTC.minusMinutes(15), 50);
        verify(sessionRepository).findDoctorNoShowCandidates(NOW_UTC.minusMinutes(10), 50);
        verifyNoInteractions(lifecycleService);
    }

    @Test
    @DisplayName("Should expire abandoned sessions and count only the ones it ended")
    void testSweep() {
        MeetingSession first = candidate("room-1");
        MeetingSession second = candidate("room-2");
        when(sessionRepository.findAbandonedCandidates(any(), any(), anyInt())).thenReturn(List.of(first, second));
        when(lifecycleService.expireGrace(first, NOW_UTC)).thenReturn(true);
        when(lifecycleService.expireGrace(second, NOW_UTC)).thenReturn(false);

        assertThat(watchdog.sweep()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refresh rooms whose patient is connected to this instance instead of ending them")
    void testSkipsLocallyConnectedPatient() {
        MeetingSession connected = candidate("room-1");
        when(sessionRepository.findAbandonedCandidates(any(), any(), anyInt())).thenReturn(List.of(connected));
        when(signalingRelay.isBound("room-1", ParticipantRole.PATIENT)).thenReturn(true);

        assertThat(watchdog.sweep()).isZero();

        verify(sessionRepository).touchPatientSeen("room-1", NOW_UTC);
        verify(lifecycleService, never()).expireGrace(any(), any());
    }

    @Test
    @DisplayName("Should keep sweeping when one room fails")
    void testContinuesAfterFailure() {
        MeetingSession broken = candidate("room-1");
        MeetingSession healthy = candidate("room-2");
        when(sessionRepository.findAbandonedCandidates(any(), any(), anyInt())).thenReturn(List.of(broken, healthy));
        when(lifecycleService.expireGrace(eq(broken), any())).thenThrow(new DataAccessResourceFailureException("connection lost"));
        when(lifecycleService.expireGrace(eq(healthy), any())).thenReturn(true);

        assertThat(watchdog.sweep()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should end sessions whose doctor started but never joined")
    void testDoctorNoShow() {
        MeetingSession absent = candidate("room-1");
        when(sessionRepository.findDoctorNoShowCandidates(any(), anyInt())).thenReturn(List.of(absent));
        when(lifecycleService.expireDoctorNoShow(absent, NOW_UTC)).thenReturn(true);

        assertThat(watchdog.sweep()).isEqualTo(1);

        verify(lifecycleService).expireDoctorNoShow(absent, NOW_UTC);
    }

    @Test
    @DisplayName("Should stamp the doctor as joined when connected to this instance instead of ending the room")
    void testSkipsLocallyConnectedDoctor() {
        MeetingSession connected = candidate("room-1");
        when(sessionRepository.findDoctorNoShowCandidates(any(), anyInt())).thenReturn(List.of(connected));
        when(signalingRelay.isBound("room-1", ParticipantRole.DOCTOR)).thenReturn(true);

        assertThat(watchdog.sweep()).isZero();

        verify(sessionRepository).markDoctorJoined("room-1", NOW_UTC);
        verify(lifecycleService, never()).expireDoctorNoShow(any(), any());
    }
}
