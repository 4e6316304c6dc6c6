package com.example.allocation.api.dto;

import java.math.BigDecimal;

import com.example.allocation.domain.Account;

/** A ledger account with its classification and derived balance (debits minus credits). */
public record AccountResponse(
    Long id,
    String code,
    String name,
    Account.AccountType type,
    boolean active,
    boolean bankAccount,
    BigDecimal balance) {

  public static AccountResponse from(Account account, BigDecimal balance) {
    return new AccountResponse(
        account.getId(),
        account.getCode(),
        account.getName(),
        account.getType(),
        account.isActive(),
        account.isBankAccount(),
        balance);
  }
}
