package com.example.consult.shared.repository;

import com.example.consult.shared.model.SessionAuditRecord;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SessionAuditRepository extends CrudRepository<SessionAuditRecord, Long> {

    List<SessionAuditRecord> findByRoomIdOrderByOccurredAtAsc(String roomId);
}
