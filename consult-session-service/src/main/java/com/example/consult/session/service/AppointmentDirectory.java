package com.example.consult.session.service;

import com.example.consult.shared.model.AppointmentRef;

import java.util.Optional;

/**
 * Lookup of appointments owned by the scheduling system.
 */
public interface AppointmentDirectory {

    Optional<AppointmentRef> find(long appointmentId);

    /**
     * Bypasses any cached copy. Used where the appointment status matters (it can change after booking).
     */
    Optional<AppointmentRef> refresh(long appointmentId);
}
