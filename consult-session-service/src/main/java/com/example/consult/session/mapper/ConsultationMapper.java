package com.example.consult.session.mapper;

import com.example.consult.session.dto.MeetingSessionResponse;
import com.example.consult.session.dto.RelayStatsResponse;
import com.example.consult.session.dto.TransitionResponse;
import com.example.consult.session.relay.RelayStats;
import com.example.consult.shared.model.MeetingSession;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper(componentModel = "spring")
public interface ConsultationMapper {

    MeetingSessionResponse toResponse(MeetingSession session);

    List<MeetingSessionResponse> toResponses(List<MeetingSession> sessions);

    TransitionResponse toTransitionResponse(MeetingSession session);

    @Mapping(target = "podName", source = "podName")
    @Mapping(target = "timestamp", source = "timestamp")
    @Mapping(target = "totalConnections", expression = "java(stats.totalConnections())")
    RelayStatsResponse toStatsResponse(RelayStats stats, String podName, OffsetDateTime timestamp);
}
