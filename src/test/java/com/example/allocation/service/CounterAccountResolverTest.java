package com.example.allocation.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.example.allocation.domain.Account;
import com.example.allocation.domain.AllocationDirection;
import com.example.allocation.domain.Company;
import com.example.allocation.repository.AccountRepository;
import com.example.allocation.service.exception.FatalConfigurationException;

@ExtendWith(MockitoExtension.class)
class CounterAccountResolverTest {

  @Mock private AccountRepository accountRepository;

  private CounterAccountResolver resolver;
  private Company company;

  @BeforeEach
  void setUp() {
    resolver = new CounterAccountResolver(accountRepository);
    ReflectionTestUtils.setField(resolver, "receivableAccountCode", "1200");
    ReflectionTestUtils.setField(resolver, "payableAccountCode", "2100");

    company = new Company("Test Company", "USD");
    company.setId(1L);
  }

  @Test
  void resolve_ExplicitTenantAccount_Wins() {
    Account custom = new Account(company, "1210", "Trade Debtors", Account.AccountType.ASSET);
    company.setReceivableAccount(custom);

    assertSame(custom, resolver.resolve(company, AllocationDirection.RECEIPT));
    verifyNoInteractions(accountRepository);
  }

  @Test
  void resolve_NoTenantSetting_FallsBackToConfiguredCode() {
    Account ap = new Account(company, "2100", "Accounts Payable", Account.AccountType.LIABILITY);
    when(accountRepository.findByCompanyAndCode(company, "2100")).thenReturn(Optional.of(ap));

    assertSame(ap, resolver.resolve(company, AllocationDirection.PAYMENT));
  }

  @Test
  void resolve_NothingConfigured_FatalConfiguration() {
    when(accountRepository.findByCompanyAndCode(company, "1200")).thenReturn(Optional.empty());

    FatalConfigurationException ex =
        assertThrows(
            FatalConfigurationException.class,
            () -> resolver.resolve(company, AllocationDirection.RECEIPT));
    assertTrue(ex.getMessage().contains("1200"));
  }

  @Test
  void resolve_PayableIsAnAsset_FatalConfiguration() {
    Account wrong = new Account(company, "1500", "Inventory", Account.AccountType.ASSET);
    company.setPayableAccount(wrong);

    assertThrows(
        FatalConfigurationException.class,
        () -> resolver.resolve(company, AllocationDirection.PAYMENT));
  }

  @Test
  void resolve_InactiveAccount_FatalConfiguration() {
    Account ar = new Account(company, "1200", "Accounts Receivable", Account.AccountType.ASSET);
    ar.setActive(false);
    when(accountRepository.findByCompanyAndCode(company, "1200")).thenReturn(Optional.of(ar));

    assertThrows(
        FatalConfigurationException.class,
        () -> resolver.resolve(company, AllocationDirection.RECEIPT));
  }
}
