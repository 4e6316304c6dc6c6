package com.example.allocation.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.allocation.domain.Account;
import com.example.allocation.domain.AllocationDirection;
import com.example.allocation.domain.Company;
import com.example.allocation.domain.VoucherType;
import com.example.allocation.repository.AccountRepository;
import com.example.allocation.service.exception.FatalConfigurationException;

/**
 * Finds the receivable or payable account that sits opposite the cash account on an allocation
 * voucher. The tenant's explicit setting wins; otherwise the account with the configured default
 * code is used. Anything missing or misclassified is a setup problem, not a request error.
 */
@Service
@Transactional(readOnly = true)
public class CounterAccountResolver {

  private final AccountRepository accountRepository;

  @Value("${ledger.allocation.receivable-account-code:1200}")
  private String receivableAccountCode;

  @Value("${ledger.allocation.payable-account-code:2100}")
  private String payableAccountCode;

  public CounterAccountResolver(AccountRepository accountRepository) {
    this.accountRepository = accountRepository;
  }

  /**
   * @throws FatalConfigurationException if no usable counter-account is configured
   */
  public Account resolve(Company company, AllocationDirection direction) {
    Account account =
        direction == AllocationDirection.RECEIPT
            ? company.getReceivableAccount()
            : company.getPayableAccount();
    if (account == null) {
      String code =
          direction == AllocationDirection.RECEIPT ? receivableAccountCode : payableAccountCode;
      account =
          accountRepository
              .findByCompanyAndCode(company, code)
              .orElseThrow(
                  () ->
                      new FatalConfigurationException(
                          "No "
                              + describe(direction)
                              + " account configured for "
                              + company.getName()
                              + " (expected account code "
                              + code
                              + ")"));
    }

    if (!isUsable(account, direction)) {
      throw new FatalConfigurationException(
          "Configured "
              + describe(direction)
              + " account "
              + account.getCode()
              + " is a "
              + account.getType()
              + " account or inactive");
    }
    return account;
  }

  /** Whether the account may sit opposite the cash leg for the given direction. */
  public static boolean isUsable(Account account, AllocationDirection direction) {
    if (!account.isActive()) {
      return false;
    }
    VoucherType type = direction.voucherType();
    return direction == AllocationDirection.RECEIPT
        ? type.permitsCredit(account.getType())
        : type.permitsDebit(account.getType());
  }

  private static String describe(AllocationDirection direction) {
    return direction == AllocationDirection.RECEIPT ? "receivable" : "payable";
  }
}
