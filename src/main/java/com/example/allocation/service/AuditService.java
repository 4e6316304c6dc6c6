package com.example.allocation.service;

import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.allocation.domain.AuditEvent;
import com.example.allocation.domain.Company;
import com.example.allocation.repository.AuditEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes the audit trail. Events join the caller's transaction, so an allocation that rolls back
 * leaves no audit rows behind.
 */
@Service
@Transactional
public class AuditService {

  private final AuditEventRepository auditEventRepository;
  private final ObjectMapper objectMapper;

  public AuditService(AuditEventRepository auditEventRepository, ObjectMapper objectMapper) {
    this.auditEventRepository = auditEventRepository;
    this.objectMapper = objectMapper;
  }

  public AuditEvent logEvent(
      Company company, String eventType, String entityType, Long entityId, String summary) {
    return logEvent(company, eventType, entityType, entityId, summary, Map.of());
  }

  /**
   * Records an audit event with structured details.
   *
   * @param details key/value pairs serialized to JSON alongside the summary
   */
  public AuditEvent logEvent(
      Company company,
      String eventType,
      String entityType,
      Long entityId,
      String summary,
      Map<String, Object> details) {
    AuditEvent event = new AuditEvent(company, eventType, entityType, entityId, summary);
    if (details != null && !details.isEmpty()) {
      try {
        event.setDetailsJson(objectMapper.writeValueAsString(details));
      } catch (JsonProcessingException e) {
        throw new IllegalStateException("Could not serialize audit details for " + eventType, e);
      }
    }
    return auditEventRepository.save(event);
  }
}
