package com.example.consult.session.service;

import com.example.consult.shared.model.AppointmentRef;
import com.example.consult.shared.repository.AppointmentRepository;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Caches appointment participants, which never change once booked. Unknown ids are not cached so an
 * appointment created after a miss is found on the next call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CachedAppointmentDirectory implements AppointmentDirectory {

    private final AppointmentRepository appointmentRepository;
    private final Cache<Long, AppointmentRef> appointmentCache;

    @Override
    public Optional<AppointmentRef> find(long appointmentId) {
        AppointmentRef cached = appointmentCache.getIfPresent(appointmentId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<AppointmentRef> loaded = appointmentRepository.findById(appointmentId);
        loaded.ifPresent(appointment -> appointmentCache.put(appointmentId, appointment));
        log.debug("Appointment {} loaded from database (found: {})", appointmentId, loaded.isPresent());
        return loaded;
    }

    @Override
    public Optional<AppointmentRef> refresh(long appointmentId) {
        appointmentCache.invalidate(appointmentId);
        return find(appointmentId);
    }
}
