package com.example.consult.session.dto;

import com.example.consult.session.relay.SignalType;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignalRequest {

    @NotBlank(message = "connectionId is required")
    private String connectionId;

    @NotNull(message = "type must be one of offer, answer, ice_candidate")
    private SignalType type;

    @NotNull(message = "payload is required")
    private JsonNode payload;
}
