package com.example.consult.session.scheduler;

import com.example.consult.session.relay.SignalingRelay;
import com.example.consult.session.service.ConsultationLifecycleService;
import com.example.consult.session.service.GracePolicy;
import com.example.consult.shared.config.AppProperties;
import com.example.consult.shared.model.MeetingSession;
import com.example.consult.shared.repository.MeetingSessionRepository;
import com.example.consult.shared.util.Constants.ParticipantRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Ends active consultations whose patient left and did not come back within the grace window, whose
 * patient never showed up, or whose doctor started them but never joined the call. The SchedulerLock keeps the sweep on one node at a time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GraceWindowWatchdog {

    private final MeetingSessionRepository sessionRepository;
    private final ConsultationLifecycleService lifecycleService;
    private final SignalingRelay signalingRelay;
    private final GracePolicy gracePolicy;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${consult.session.watchdog-interval-ms:30000}")
    @SchedulerLock(name = "consultGraceWindowSweep", lockAtLeastFor = "PT5S", lockAtMostFor = "PT2M")
    public void sweepAbandonedSessions() {
        int expired = sweep();
        if (expired > 0) {
            log.info("Grace window sweep ended {} abandoned consultation(s)", expired);
        }
    }

    /**
     * @return number of sessions ended by this pass
     */
    public int sweep() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return sweepDoctorNoShows(now) + sweepPatients(now);
    }

    private int sweepDoctorNoShows(OffsetDateTime now) {
        List<MeetingSession> candidates = sessionRepository.findDoctorNoShowCandidates(
                gracePolicy.doctorNoShowCutoff(now),
                appProperties.getSession().getWatchdogBatchSize());
        int expired = 0;
        for (MeetingSession candidate : candidates) {
            try {
                if (signalingRelay.isBound(candidate.getRoomId(), ParticipantRole.DOCTOR)) {
                    sessionRepository.markDoctorJoined(candidate.getRoomId(), now);
                    continue;
                }
                if (lifecycleService.expireDoctorNoShow(candidate, now)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire doctor no-show in room {}: {}", candidate.getRoomId(), e.getMessage(), e);
            }
        }
        return expired;
    }

    private int sweepPatients(OffsetDateTime now) {
        List<MeetingSession> candidates = sessionRepository.findAbandonedCandidates(
                gracePolicy.graceCutoff(now),
                gracePolicy.noShowCutoff(now),
                appProperties.getSession().getWatchdogBatchSize());
        if (candidates.isEmpty()) {
            return 0;
        }
        log.debug("Grace window sweep found {} candidate(s)", candidates.size());

        int expired = 0;
        for (MeetingSession candidate : candidates) {
            try {
                if (signalingRelay.isBound(candidate.getRoomId(), ParticipantRole.PATIENT)) {
                    // Connected here but the heartbeat stamp has not landed yet
                    sessionRepository.touchPatientSeen(candidate.getRoomId(), now);
                    continue;
                }
                if (lifecycleService.expireGrace(candidate, now)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire room {}: {}", candidate.getRoomId(), e.getMessage(), e);
            }
        }
        return expired;
    }
}
