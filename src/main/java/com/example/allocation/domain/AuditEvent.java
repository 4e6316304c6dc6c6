package com.example.allocation.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** An append-only audit trail row for a state change in the allocation engine. */
@Entity
@Table(
    name = "audit_event",
    indexes = {@Index(name = "idx_audit_entity", columnList = "entity_type, entity_id")})
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id")
  private Company company;

  @NotBlank
  @Size(max = 50)
  @Column(name = "event_type", nullable = false, length = 50)
  private String eventType;

  @Size(max = 50)
  @Column(name = "entity_type", length = 50)
  private String entityType;

  @Column(name = "entity_id")
  private Long entityId;

  @Size(max = 500)
  @Column(length = 500)
  private String summary;

  @Lob
  @Column(name = "details_json")
  private String detailsJson;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public AuditEvent() {}

  public AuditEvent(
      Company company, String eventType, String entityType, Long entityId, String summary) {
    this.company = company;
    this.eventType = eventType;
    this.entityType = entityType;
    this.entityId = entityId;
    this.summary = summary;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public Company getCompany() {
    return company;
  }

  public String getEventType() {
    return eventType;
  }

  public String getEntityType() {
    return entityType;
  }

  public Long getEntityId() {
    return entityId;
  }

  public String getSummary() {
    return summary;
  }

  public String getDetailsJson() {
    return detailsJson;
  }

  public void setDetailsJson(String detailsJson) {
    this.detailsJson = detailsJson;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
