package com.example.allocation.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Represents an immutable ledger entry created when a voucher is posted. Each posted voucher
 * produces one debit entry and one credit entry of equal amount. Entries are never modified;
 * corrections go through a reversing voucher.
 */
@Entity
@Table(
    name = "ledger_entry",
    indexes = {
      @Index(name = "idx_ledger_company_date", columnList = "company_id, entry_date"),
      @Index(name = "idx_ledger_account", columnList = "account_id"),
      @Index(name = "idx_ledger_voucher", columnList = "voucher_id")
    })
public class LedgerEntry {

  public enum Direction {
    DEBIT,
    CREDIT
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "voucher_id", nullable = false)
  private Voucher voucher;

  @NotNull
  @Column(name = "entry_date", nullable = false)
  private LocalDate entryDate;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "account_id", nullable = false)
  private Account account;

  @NotNull
  @Column(name = "amount_dr", nullable = false, precision = 19, scale = 2)
  private BigDecimal amountDr = BigDecimal.ZERO;

  @NotNull
  @Column(name = "amount_cr", nullable = false, precision = 19, scale = 2)
  private BigDecimal amountCr = BigDecimal.ZERO;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  protected LedgerEntry() {}

  public LedgerEntry(Voucher voucher, Direction direction) {
    this.company = voucher.getCompany();
    this.voucher = voucher;
    this.entryDate = voucher.getTransactionDate();

    if (direction == Direction.DEBIT) {
      this.account = voucher.getDebitAccount();
      this.amountDr = voucher.getAmount();
      this.amountCr = BigDecimal.ZERO;
    } else {
      this.account = voucher.getCreditAccount();
      this.amountDr = BigDecimal.ZERO;
      this.amountCr = voucher.getAmount();
    }
  }

  // Getters only - ledger entries are immutable after creation
  public Long getId() {
    return id;
  }

  public Company getCompany() {
    return company;
  }

  public Voucher getVoucher() {
    return voucher;
  }

  public LocalDate getEntryDate() {
    return entryDate;
  }

  public Account getAccount() {
    return account;
  }

  public BigDecimal getAmountDr() {
    return amountDr;
  }

  public BigDecimal getAmountCr() {
    return amountCr;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean isDebit() {
    return amountDr.signum() > 0;
  }

  // Helper method to get net amount (debit positive, credit negative)
  public BigDecimal getNetAmount() {
    return amountDr.subtract(amountCr);
  }
}
