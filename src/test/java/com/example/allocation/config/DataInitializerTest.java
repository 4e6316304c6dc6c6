package com.example.allocation.config;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.allocation.domain.Account;
import com.example.allocation.domain.AllocationDirection;
import com.example.allocation.domain.Company;
import com.example.allocation.domain.Contact;
import com.example.allocation.domain.Document;
import com.example.allocation.repository.CompanyRepository;
import com.example.allocation.repository.ContactRepository;
import com.example.allocation.repository.DocumentRepository;
import com.example.allocation.service.AccountService;

@ExtendWith(MockitoExtension.class)
class DataInitializerTest {

  @Mock private CompanyRepository companyRepository;

  @Mock private ContactRepository contactRepository;

  @Mock private DocumentRepository documentRepository;

  @Mock private AccountService accountService;

  private DataInitializer initializer;

  @BeforeEach
  void setUp() {
    initializer =
        new DataInitializer(companyRepository, contactRepository, documentRepository, accountService);
  }

  @Test
  void run_DemoCompanyExists_CreatesNothing() {
    // Given
    when(companyRepository.findByName(DataInitializer.DEMO_COMPANY))
        .thenReturn(Optional.of(new Company(DataInitializer.DEMO_COMPANY, "USD")));

    // When
    initializer.run(null);

    // Then
    verify(companyRepository, never()).save(any());
    verifyNoInteractions(accountService, contactRepository, documentRepository);
  }

  @Test
  void run_EmptyDatabase_SeedsAccountsCounterpartiesAndOpenDocuments() {
    // Given
    when(companyRepository.findByName(DataInitializer.DEMO_COMPANY)).thenReturn(Optional.empty());
    when(companyRepository.save(any(Company.class))).thenAnswer(inv -> inv.getArgument(0));
    when(contactRepository.save(any(Contact.class))).thenAnswer(inv -> inv.getArgument(0));
    when(accountService.createAccount(
            any(Company.class),
            anyString(),
            anyString(),
            any(Account.AccountType.class),
            anyBoolean()))
        .thenAnswer(
            inv ->
                new Account(
                    inv.getArgument(0), inv.getArgument(1), inv.getArgument(2), inv.getArgument(3)));

    // When
    initializer.run(null);

    // Then
    ArgumentCaptor<Company> company = ArgumentCaptor.forClass(Company.class);
    verify(companyRepository, times(2)).save(company.capture());
    assertEquals("1200", company.getValue().getReceivableAccount().getCode());
    assertEquals("2100", company.getValue().getPayableAccount().getCode());
    verify(accountService, times(5))
        .createAccount(any(), anyString(), anyString(), any(), anyBoolean());
    verify(accountService)
        .createAccount(any(), eq("1000"), eq("Bank"), eq(Account.AccountType.ASSET), eq(true));

    ArgumentCaptor<Document> documents = ArgumentCaptor.forClass(Document.class);
    verify(documentRepository, times(5)).save(documents.capture());
    List<Document> saved = documents.getAllValues();
    assertEquals(
        3,
        saved.stream()
            .filter(d -> d.getSettlingDirection() == AllocationDirection.RECEIPT)
            .count());
    for (Document document : saved) {
      assertEquals("USD", document.getCurrency());
      assertEquals(Document.SettlementStatus.OPEN, document.getStatus());
    }
  }
}
