package com.example.consult.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One authorization decision taken by the ownership gate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("session_audit_log")
public class SessionAuditRecord {
    @Id
    private Long id;
    private OffsetDateTime occurredAt;
    private String userId;
    private String userRole;
    private String roomId;
    private String operation;
    private String outcome;
    private String detail;
}
