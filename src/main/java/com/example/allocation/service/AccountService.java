package com.example.allocation.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.allocation.domain.Account;
import com.example.allocation.domain.Company;
import com.example.allocation.repository.AccountRepository;
import com.example.allocation.repository.LedgerEntryRepository;
import com.example.allocation.service.exception.ResourceNotFoundException;

/**
 * The ledger account directory. Accounts are looked up and classified here; balances are derived
 * from posted ledger entries and never written directly.
 */
@Service
@Transactional
public class AccountService {

  private final AccountRepository accountRepository;
  private final LedgerEntryRepository ledgerEntryRepository;
  private final AuditService auditService;

  public AccountService(
      AccountRepository accountRepository,
      LedgerEntryRepository ledgerEntryRepository,
      AuditService auditService) {
    this.accountRepository = accountRepository;
    this.ledgerEntryRepository = ledgerEntryRepository;
    this.auditService = auditService;
  }

  /**
   * Creates a new account.
   *
   * @throws IllegalArgumentException if code already exists
   */
  public Account createAccount(
      Company company, String code, String name, Account.AccountType type, boolean bankAccount) {
    if (accountRepository.existsByCompanyAndCode(company, code)) {
      throw new IllegalArgumentException("Account code already exists: " + code);
    }
    Account account = new Account(company, code, name, type);
    account.setBankAccount(bankAccount);
    account = accountRepository.save(account);

    auditService.logEvent(
        company,
        "ACCOUNT_CREATED",
        "Account",
        account.getId(),
        "Created account: " + code + " - " + name);

    return account;
  }

  @Transactional(readOnly = true)
  public Account getAccount(Long id) {
    if (id == null) {
      throw new ResourceNotFoundException("Account", null);
    }
    return accountRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Account", id));
  }

  @Transactional(readOnly = true)
  public Optional<Account> findByCompanyAndCode(Company company, String code) {
    return accountRepository.findByCompanyAndCode(company, code);
  }

  @Transactional(readOnly = true)
  public List<Account> findByCompany(Company company) {
    return accountRepository.findByCompanyOrderByCode(company);
  }

  /**
   * Current balance of an account as debits minus credits over all posted ledger entries.
   * Liability, equity and income accounts therefore usually carry a negative figure.
   */
  @Transactional(readOnly = true)
  public BigDecimal getBalance(Account account) {
    BigDecimal net = ledgerEntryRepository.netBalanceByAccount(account);
    return net != null ? net : BigDecimal.ZERO;
  }
}
