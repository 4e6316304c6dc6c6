package com.example.allocation.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Money applied against one document. Settlements are append-only: a reversal voids the row
 * rather than deleting it, so the original amount stays inspectable. Only live (non-void)
 * settlements count toward a document's settled amount.
 *
 * <p>Settlements recorded outside an allocation have no allocation record.
 */
@Entity
@Table(
    name = "document_settlement",
    indexes = {@Index(name = "idx_settlement_document", columnList = "document_id, voided")})
public class DocumentSettlement {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "document_id", nullable = false)
  private Document document;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @NotNull
  @Column(name = "settlement_date", nullable = false)
  private LocalDate settlementDate;

  @OneToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "allocation_record_id", unique = true)
  private AllocationRecord allocationRecord;

  @Column(nullable = false)
  private boolean voided = false;

  @Column(name = "voided_at")
  private Instant voidedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public DocumentSettlement() {}

  public DocumentSettlement(Document document, BigDecimal amount, LocalDate settlementDate) {
    if (document == null) {
      throw new IllegalArgumentException("Settlement must reference a document");
    }
    if (amount == null || amount.signum() <= 0) {
      throw new IllegalArgumentException("Settlement amount must be positive");
    }
    this.document = document;
    this.amount = amount;
    this.settlementDate = settlementDate;
  }

  public void markVoided() {
    if (voided) {
      throw new IllegalStateException("Settlement " + id + " is already void");
    }
    this.voided = true;
    this.voidedAt = Instant.now();
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Document getDocument() {
    return document;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public LocalDate getSettlementDate() {
    return settlementDate;
  }

  public AllocationRecord getAllocationRecord() {
    return allocationRecord;
  }

  public void setAllocationRecord(AllocationRecord allocationRecord) {
    this.allocationRecord = allocationRecord;
  }

  public boolean isVoided() {
    return voided;
  }

  public Instant getVoidedAt() {
    return voidedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
