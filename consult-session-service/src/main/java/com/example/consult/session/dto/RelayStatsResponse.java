package com.example.consult.session.dto;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class RelayStatsResponse {
    private String podName;
    private int activeRooms;
    private int doctorConnections;
    private int patientConnections;
    private int totalConnections;
    private OffsetDateTime timestamp;
}
