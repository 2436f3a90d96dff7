package com.example.consult.session.relay;

public record RelayStats(int activeRooms, int doctorConnections, int patientConnections) {

    public int totalConnections() {
        return doctorConnections + patientConnections;
    }
}
