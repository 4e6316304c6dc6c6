package com.example.allocation.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A single lump-sum receipt or payment spread across several documents of one counterparty.
 * Lifecycle: DRAFT → POSTED → REVERSED. The group owns its records and the one voucher that
 * carries the aggregate cash movement to the ledger.
 */
@Entity
@Table(
    name = "allocation_group",
    indexes = {@Index(name = "idx_allocation_group_contact", columnList = "contact_id, created_at")})
public class AllocationGroup {

  public enum Status {
    DRAFT, // Built and validated, nothing posted yet
    POSTED, // Voucher posted and settlements recorded
    REVERSED // Settlements voided and voucher reversed, terminal
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private AllocationDirection direction;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private AllocationStrategy strategy;

  @NotNull
  @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
  private BigDecimal totalAmount;

  @NotNull
  @Column(name = "allocated_amount", nullable = false, precision = 19, scale = 2)
  private BigDecimal allocatedAmount = BigDecimal.ZERO;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "contact_id", nullable = false)
  private Contact contact;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "cash_account_id", nullable = false)
  private Account cashAccount;

  // Receivable or payable side of the voucher, resolved from tenant configuration
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "counter_account_id")
  private Account counterAccount;

  @NotNull
  @Column(name = "payment_date", nullable = false)
  private LocalDate paymentDate;

  @Size(max = 3)
  @Column(length = 3)
  private String currency;

  @Column(name = "exchange_rate", precision = 19, scale = 6)
  private BigDecimal exchangeRate = BigDecimal.ONE;

  @Size(max = 255)
  @Column(length = 255)
  private String reference;

  @Size(max = 500)
  @Column(length = 500)
  private String notes;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private Status status = Status.DRAFT;

  @OneToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "voucher_id", unique = true)
  private Voucher voucher;

  @OneToMany(mappedBy = "group", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("id ASC")
  private List<AllocationRecord> records = new ArrayList<>();

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
  protected AllocationGroup() {}

  public AllocationGroup(
      Company company,
      AllocationDirection direction,
      AllocationStrategy strategy,
      BigDecimal totalAmount,
      Contact contact,
      Account cashAccount,
      LocalDate paymentDate) {
    this.company = company;
    this.direction = direction;
    this.strategy = strategy;
    this.totalAmount = totalAmount;
    this.contact = contact;
    this.cashAccount = cashAccount;
    this.paymentDate = paymentDate;
  }

  // Helper methods
  public void addRecord(AllocationRecord record) {
    if (status != Status.DRAFT) {
      throw new IllegalStateException("Records can only be added to a draft allocation");
    }
    records.add(record);
    record.setGroup(this);
  }

  /** Sum of the record amounts; the running allocated amount. */
  public BigDecimal sumRecordAmounts() {
    BigDecimal sum = BigDecimal.ZERO;
    for (AllocationRecord record : records) {
      if (record.getAmount() != null) {
        sum = sum.add(record.getAmount());
      }
    }
    return sum;
  }

  /**
   * Marks the group posted once its voucher is on the ledger.
   *
   * @param tolerance the largest accepted gap between allocated and total amount
   * @throws IllegalStateException if not a draft or the records do not cover the total
   */
  public void markPosted(Voucher postedVoucher, BigDecimal tolerance) {
    if (status != Status.DRAFT) {
      throw new IllegalStateException("Allocation " + id + " is not a draft: " + status);
    }
    BigDecimal allocated = sumRecordAmounts();
    if (allocated.subtract(totalAmount).abs().compareTo(tolerance) > 0) {
      throw new IllegalStateException(
          "Allocated amount " + allocated + " does not match total " + totalAmount);
    }
    this.allocatedAmount = allocated;
    this.voucher = postedVoucher;
    this.status = Status.POSTED;
    this.postedAt = Instant.now();
  }

  public void markReversed() {
    if (status != Status.POSTED) {
      throw new IllegalStateException("Only posted allocations can be reversed: " + status);
    }
    this.status = Status.REVERSED;
    this.reversedAt = Instant.now();
  }

  public boolean isDraft() {
    return status == Status.DRAFT;
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

  public AllocationDirection getDirection() {
    return direction;
  }

  public AllocationStrategy getStrategy() {
    return strategy;
  }

  public BigDecimal getTotalAmount() {
    return totalAmount;
  }

  public BigDecimal getAllocatedAmount() {
    return allocatedAmount;
  }

  public Contact getContact() {
    return contact;
  }

  public Account getCashAccount() {
    return cashAccount;
  }

  public Account getCounterAccount() {
    return counterAccount;
  }

  public void setCounterAccount(Account counterAccount) {
    this.counterAccount = counterAccount;
  }

  public LocalDate getPaymentDate() {
    return paymentDate;
  }

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public BigDecimal getExchangeRate() {
    return exchangeRate;
  }

  public void setExchangeRate(BigDecimal exchangeRate) {
    this.exchangeRate = exchangeRate;
  }

  public String getReference() {
    return reference;
  }

  public void setReference(String reference) {
    this.reference = reference;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  public Status getStatus() {
    return status;
  }

  public Voucher getVoucher() {
    return voucher;
  }

  public List<AllocationRecord> getRecords() {
    return Collections.unmodifiableList(records);
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
