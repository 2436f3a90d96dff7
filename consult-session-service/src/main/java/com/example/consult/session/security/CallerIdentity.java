package com.example.consult.session.security;

import com.example.consult.shared.util.Constants.ParticipantRole;

/**
 * Identity asserted by the upstream gateway. {@code role} is null for roles that never take part in
 * a consultation (lab staff, admins).
 */
public record CallerIdentity(String userId, ParticipantRole role, String claimedRole) {
}
