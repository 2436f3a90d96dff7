package com.example.consult.session.relay;

import com.example.consult.shared.util.Constants.ParticipantRole;

import java.util.ArrayList;
import java.util.List;

/**
 * The two participant slots of a room. Mutated only inside {@code ConcurrentHashMap.compute} on the
 * room key; reads from other threads see the latest published binding.
 */
class RoomChannel {

    private final String roomId;
    private volatile ParticipantBinding doctor;
    private volatile ParticipantBinding patient;

    RoomChannel(String roomId) {
        this.roomId = roomId;
    }

    String roomId() {
        return roomId;
    }

    ParticipantBinding get(ParticipantRole role) {
        return role == ParticipantRole.DOCTOR ? doctor : patient;
    }

    /**
     * @return the binding previously holding the slot, if any
     */
    ParticipantBinding bind(ParticipantBinding binding) {
        ParticipantBinding previous = get(binding.getRole());
        if (binding.getRole() == ParticipantRole.DOCTOR) {
            doctor = binding;
        } else {
            patient = binding;
        }
        return previous;
    }

    void clear(ParticipantRole role) {
        if (role == ParticipantRole.DOCTOR) {
            doctor = null;
        } else {
            patient = null;
        }
    }

    boolean isEmpty() {
        return doctor == null && patient == null;
    }

    List<ParticipantBinding> bindings() {
        List<ParticipantBinding> bindings = new ArrayList<>(2);
        ParticipantBinding d = doctor;
        ParticipantBinding p = patient;
        if (d != null) {
            bindings.add(d);
        }
        if (p != null) {
            bindings.add(p);
        }
        return bindings;
    }
}
