package com.example.consult.shared.util;

import java.util.EnumSet;
import java.util.Set;

public final class Constants {

    // Private constructor to prevent instantiation
    private Constants() {}

    public static final String ROOM_ID_PREFIX = "apt-";
    public static final String AUDIT_LOGGER = "AUDIT";

    public enum SessionState {
        SCHEDULED,
        ACTIVE,
        ENDED,
        CANCELLED;

        public boolean isTerminal() {
            return this == ENDED || this == CANCELLED;
        }
    }

    public enum ParticipantRole {
        DOCTOR,
        PATIENT;

        public ParticipantRole peer() {
            return this == DOCTOR ? PATIENT : DOCTOR;
        }

        /**
         * Parses the role claimed by the upstream auth context ("doctor", "PATIENT", ...).
         * Roles that can never take part in a consultation (lab, admin) yield null.
         */
        public static ParticipantRole fromClaim(String claim) {
            if (claim == null) {
                return null;
            }
            for (ParticipantRole role : values()) {
                if (role.name().equalsIgnoreCase(claim.trim())) {
                    return role;
                }
            }
            return null;
        }
    }

    public enum CloseReason {
        DOCTOR_ENDED,
        DOCTOR_DISCONNECTED,
        PATIENT_GRACE_EXPIRED,
        PATIENT_NO_SHOW,
        DOCTOR_NO_SHOW,
        CANCELLED_BY_DOCTOR,
        APPOINTMENT_CANCELLED
    }

    /**
     * Operations gated by the ownership check, with the participant roles allowed to perform them.
     */
    public enum SessionOperation {
        OPEN(EnumSet.allOf(ParticipantRole.class)),
        LIST(EnumSet.allOf(ParticipantRole.class)),
        START(EnumSet.of(ParticipantRole.DOCTOR)),
        JOIN(EnumSet.allOf(ParticipantRole.class)),
        STATUS(EnumSet.allOf(ParticipantRole.class)),
        SIGNAL(EnumSet.allOf(ParticipantRole.class)),
        LEAVE(EnumSet.allOf(ParticipantRole.class)),
        END(EnumSet.of(ParticipantRole.DOCTOR)),
        CANCEL(EnumSet.of(ParticipantRole.DOCTOR));

        private final Set<ParticipantRole> allowedRoles;

        SessionOperation(Set<ParticipantRole> allowedRoles) {
            this.allowedRoles = allowedRoles;
        }

        public boolean permits(ParticipantRole role) {
            return allowedRoles.contains(role);
        }
    }

    public enum AuditOutcome {
        GRANTED,
        UNAUTHENTICATED,
        FORBIDDEN
    }

    public enum RelayEventType {
        CONNECTED,
        PEER_JOINED,
        PEER_LEFT,
        HEARTBEAT,
        REPLACED,
        SESSION_ENDED,
        SERVER_SHUTDOWN
    }

    /**
     * Conflict markers returned to callers that lost a transition. ALREADY_ACTIVE is reported
     * instead of ACTIVE when a start hits a running session.
     */
    public static final String CONFLICT_ALREADY_ACTIVE = "ALREADY_ACTIVE";
}
