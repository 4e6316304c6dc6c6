package com.example.allocation.domain;

import java.time.Instant;
import java.util.Locale;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A ledger account in the chart of accounts. The classification drives which voucher legs the
 * account may appear on. Balances are never stored here; they are derived from ledger entries.
 */
@Entity
@Table(
    name = "account",
    uniqueConstraints = {@UniqueConstraint(columnNames = {"company_id", "code"})})
public class Account {

  public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    INCOME,
    EXPENSE;

    /**
     * Parses an account classification as supplied by callers. Older clients send {@code REVENUE},
     * which is the same classification as {@link #INCOME}.
     */
    public static AccountType fromInput(String value) {
      if (value == null || value.isBlank()) {
        throw new IllegalArgumentException("Account type is required");
      }
      String normalized = value.trim().toUpperCase(Locale.ROOT);
      if ("REVENUE".equals(normalized)) {
        return INCOME;
      }
      try {
        return AccountType.valueOf(normalized);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown account type: " + value, e);
      }
    }
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @NotBlank
  @Size(max = 20)
  @Column(nullable = false, length = 20)
  private String code;

  @NotBlank
  @Size(max = 100)
  @Column(nullable = false, length = 100)
  private String name;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private AccountType type;

  @Column(nullable = false)
  private boolean active = true;

  // Bank and cash accounts may be used as the cash leg of an allocation
  @Column(name = "bank_account", nullable = false)
  private boolean bankAccount = false;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public Account() {}

  public Account(Company company, String code, String name, AccountType type) {
    this.company = company;
    this.code = code;
    this.name = name;
    this.type = type;
  }

  public boolean isOfType(AccountType other) {
    return type == other;
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

  public void setCompany(Company company) {
    this.company = company;
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public AccountType getType() {
    return type;
  }

  public void setType(AccountType type) {
    this.type = type;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public boolean isBankAccount() {
    return bankAccount;
  }

  public void setBankAccount(boolean bankAccount) {
    this.bankAccount = bankAccount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
