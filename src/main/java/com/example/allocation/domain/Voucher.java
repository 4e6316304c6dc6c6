package com.example.allocation.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A balanced ledger posting with exactly one debit leg and one credit leg of the same amount.
 * Status moves PENDING → POSTED → REVERSED and never back. A reversed voucher keeps its original
 * legs and amount; the ledger effect is undone by a separate compensating voucher.
 */
@Entity
@Table(
    name = "voucher",
    uniqueConstraints = {@UniqueConstraint(columnNames = {"company_id", "voucher_number"})},
    indexes = {@Index(name = "idx_voucher_company_date", columnList = "company_id, transaction_date")})
public class Voucher {

  public enum Status {
    PENDING, // Built, not on the ledger
    POSTED, // Ledger entries written
    REVERSED // Compensated by a reversing voucher, terminal
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @Size(max = 20)
  @Column(name = "voucher_number", length = 20)
  private String voucherNumber;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "voucher_type", nullable = false, length = 10)
  private VoucherType type;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "debit_account_id", nullable = false)
  private Account debitAccount;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "credit_account_id", nullable = false)
  private Account creditAccount;

  @NotNull
  @Column(name = "transaction_date", nullable = false)
  private LocalDate transactionDate;

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @Size(max = 255)
  @Column(length = 255)
  private String reference;

  @Size(max = 100)
  @Column(name = "beneficiary_name", length = 100)
  private String beneficiaryName;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private Status status = Status.PENDING;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "posted_at")
  private Instant postedAt;

  @Column(name = "reversed_at")
  private Instant reversedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public Voucher() {}

  public Voucher(
      Company company,
      VoucherType type,
      BigDecimal amount,
      Account debitAccount,
      Account creditAccount,
      LocalDate transactionDate) {
    this.company = company;
    this.type = type;
    this.amount = amount;
    this.debitAccount = debitAccount;
    this.creditAccount = creditAccount;
    this.transactionDate = transactionDate;
  }

  // State transitions
  public void markPosted() {
    if (status != Status.PENDING) {
      throw new IllegalStateException("Voucher " + voucherNumber + " is not pending: " + status);
    }
    this.status = Status.POSTED;
    this.postedAt = Instant.now();
  }

  public void markReversed() {
    if (status != Status.POSTED) {
      throw new IllegalStateException("Voucher " + voucherNumber + " is not posted: " + status);
    }
    this.status = Status.REVERSED;
    this.reversedAt = Instant.now();
  }

  public boolean isPending() {
    return status == Status.PENDING;
  }

  public boolean isPosted() {
    return status == Status.POSTED;
  }

  public boolean isReversed() {
    return status == Status.REVERSED;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Company getCompany() {
    return company;
  }

  public String getVoucherNumber() {
    return voucherNumber;
  }

  public void setVoucherNumber(String voucherNumber) {
    this.voucherNumber = voucherNumber;
  }

  public VoucherType getType() {
    return type;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public Account getDebitAccount() {
    return debitAccount;
  }

  public Account getCreditAccount() {
    return creditAccount;
  }

  public LocalDate getTransactionDate() {
    return transactionDate;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getReference() {
    return reference;
  }

  public void setReference(String reference) {
    this.reference = reference;
  }

  public String getBeneficiaryName() {
    return beneficiaryName;
  }

  public void setBeneficiaryName(String beneficiaryName) {
    this.beneficiaryName = beneficiaryName;
  }

  public Status getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getPostedAt() {
    return postedAt;
  }

  public Instant getReversedAt() {
    return reversedAt;
  }
}
