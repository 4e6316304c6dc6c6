package com.example.allocation.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Links a reversed voucher to the compensating voucher that undid its ledger effect. The original
 * keeps its legs and amount, so the pair remains a complete audit trail of the reversal.
 */
@Entity
@Table(
    name = "reversal_link",
    indexes = {
      @Index(name = "idx_reversal_link_original", columnList = "original_voucher_id"),
      @Index(name = "idx_reversal_link_reversing", columnList = "reversing_voucher_id")
    },
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_reversal_link_original", columnNames = "original_voucher_id")
    })
public class ReversalLink {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "original_voucher_id", nullable = false)
  private Voucher originalVoucher;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "reversing_voucher_id", nullable = false)
  private Voucher reversingVoucher;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(length = 500)
  private String reason;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  protected ReversalLink() {}

  public ReversalLink(Voucher originalVoucher, Voucher reversingVoucher, String reason) {
    this.originalVoucher = originalVoucher;
    this.reversingVoucher = reversingVoucher;
    this.reason = reason;
  }

  // Getters
  public Long getId() {
    return id;
  }

  public Voucher getOriginalVoucher() {
    return originalVoucher;
  }

  public Voucher getReversingVoucher() {
    return reversingVoucher;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public String getReason() {
    return reason;
  }
}
