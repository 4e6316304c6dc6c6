package com.example.allocation.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * The tenant that owns accounts, counterparties, documents and allocations. Carries the default
 * counter-accounts used when a lump-sum receipt or payment is posted to the ledger.
 */
@Entity
@Table(name = "company")
public class Company {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 100)
  @Column(nullable = false, length = 100)
  private String name;

  @NotBlank
  @Size(max = 3)
  @Column(nullable = false, length = 3)
  private String currency;

  /** Credit leg for receipts. When null the configured receivable account code is looked up. */
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "receivable_account_id")
  private Account receivableAccount;

  /** Debit leg for payments. When null the configured payable account code is looked up. */
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "payable_account_id")
  private Account payableAccount;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public Company() {}

  public Company(String name, String currency) {
    this.name = name;
    this.currency = currency;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public Account getReceivableAccount() {
    return receivableAccount;
  }

  public void setReceivableAccount(Account receivableAccount) {
    this.receivableAccount = receivableAccount;
  }

  public Account getPayableAccount() {
    return payableAccount;
  }

  public void setPayableAccount(Account payableAccount) {
    this.payableAccount = payableAccount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
