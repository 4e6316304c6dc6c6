package com.example.allocation.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import com.example.allocation.domain.Account.AccountType;

/**
 * The closed set of voucher kinds. Each kind carries the account classifications allowed on its
 * debit and credit legs:
 *
 * <pre>
 *   PAYMENT  debit EXPENSE | LIABILITY   credit ASSET
 *   RECEIPT  debit ASSET                 credit INCOME | ASSET
 *   CONTRA   debit ASSET                 credit ASSET
 *   JOURNAL  debit any                   credit any
 * </pre>
 *
 * For every kind the two legs must be different accounts.
 */
public enum VoucherType {
  PAYMENT(
      "PV",
      EnumSet.of(AccountType.EXPENSE, AccountType.LIABILITY),
      EnumSet.of(AccountType.ASSET)),
  RECEIPT(
      "RV", EnumSet.of(AccountType.ASSET), EnumSet.of(AccountType.INCOME, AccountType.ASSET)),
  CONTRA("CV", EnumSet.of(AccountType.ASSET), EnumSet.of(AccountType.ASSET)),
  JOURNAL("JV", EnumSet.allOf(AccountType.class), EnumSet.allOf(AccountType.class));

  /** Tag sent by older clients for what is now a receipt. Accepted on input, never produced. */
  public static final String LEGACY_DEPOSIT = "DEPOSIT";

  private final String numberPrefix;
  private final Set<AccountType> debitTypes;
  private final Set<AccountType> creditTypes;

  VoucherType(String numberPrefix, Set<AccountType> debitTypes, Set<AccountType> creditTypes) {
    this.numberPrefix = numberPrefix;
    this.debitTypes = Collections.unmodifiableSet(debitTypes);
    this.creditTypes = Collections.unmodifiableSet(creditTypes);
  }

  /**
   * Normalizes a voucher type received from a caller. The legacy {@code DEPOSIT} tag maps to
   * {@link #RECEIPT}; this runs before any validation or persistence.
   *
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static VoucherType fromInput(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Voucher type is required");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if (LEGACY_DEPOSIT.equals(normalized)) {
      return RECEIPT;
    }
    try {
      return VoucherType.valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown voucher type: " + value, e);
    }
  }

  public boolean permitsDebit(AccountType type) {
    return debitTypes.contains(type);
  }

  public boolean permitsCredit(AccountType type) {
    return creditTypes.contains(type);
  }

  public Set<AccountType> getDebitTypes() {
    return debitTypes;
  }

  public Set<AccountType> getCreditTypes() {
    return creditTypes;
  }

  public String getNumberPrefix() {
    return numberPrefix;
  }
}
