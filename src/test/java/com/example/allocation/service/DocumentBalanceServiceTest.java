package com.example.allocation.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.example.allocation.domain.*;
import com.example.allocation.repository.DocumentRepository;
import com.example.allocation.repository.DocumentSettlementRepository;
import com.example.allocation.service.exception.ResourceNotFoundException;

import jakarta.persistence.EntityManager;

@ExtendWith(MockitoExtension.class)
class DocumentBalanceServiceTest {

  @Mock private DocumentRepository documentRepository;
  @Mock private DocumentSettlementRepository settlementRepository;
  @Mock private EntityManager entityManager;

  private DocumentBalanceService balanceService;

  private Company company;
  private Contact customer;
  private SalesInvoice invoice;

  @BeforeEach
  void setUp() {
    balanceService = new DocumentBalanceService(documentRepository, settlementRepository);
    ReflectionTestUtils.setField(balanceService, "entityManager", entityManager);

    company = new Company("Test Company", "USD");
    company.setId(1L);
    customer = new Contact(company, "CUST001", "Test Customer", Contact.ContactType.CUSTOMER);
    customer.setId(10L);

    invoice =
        new SalesInvoice(
            company, customer, "INV-001", LocalDate.of(2026, 1, 10), new BigDecimal("300.00"));
    invoice.setId(1L);
  }

  @Test
  void amountDue_ComputedFromLiveSettlements() {
    // Given - the cached figure says nothing is settled, storage says 120
    when(settlementRepository.sumActiveByDocument(invoice)).thenReturn(new BigDecimal("120.00"));

    // When / Then
    assertEquals(new BigDecimal("180.00"), balanceService.amountDue(invoice));
  }

  @Test
  void amountDue_ManySmallSettlements_NoDrift() {
    // 300 settlements of 0.01 summed in decimal
    BigDecimal settled = BigDecimal.ZERO;
    for (int i = 0; i < 300; i++) {
      settled = settled.add(new BigDecimal("0.01"));
    }
    when(settlementRepository.sumActiveByDocument(invoice)).thenReturn(settled);

    assertEquals(0, new BigDecimal("297.00").compareTo(balanceService.amountDue(invoice)));
  }

  @Test
  void recordSettlement_LinksRecordAndRefreshesStatus() {
    // Given
    AllocationRecord record = new AllocationRecord(invoice, new BigDecimal("100.00"), null);
    when(settlementRepository.save(any(DocumentSettlement.class))).thenAnswer(i -> i.getArgument(0));
    when(settlementRepository.sumActiveByDocument(invoice)).thenReturn(new BigDecimal("100.00"));
    when(documentRepository.save(invoice)).thenReturn(invoice);

    // When
    DocumentSettlement settlement =
        balanceService.recordSettlement(
            invoice, new BigDecimal("100.00"), LocalDate.of(2026, 1, 15), record);

    // Then
    assertSame(record, settlement.getAllocationRecord());
    assertSame(settlement, record.getSettlement());
    assertEquals(Document.SettlementStatus.PARTIALLY_SETTLED, invoice.getStatus());
    assertEquals(new BigDecimal("100.00"), invoice.getAmountSettled());
    assertEquals(new BigDecimal("200.00"), invoice.getAmountDue());
  }

  @Test
  void recordSettlement_WithoutRecord_LegacySettlement() {
    when(settlementRepository.save(any(DocumentSettlement.class))).thenAnswer(i -> i.getArgument(0));
    when(settlementRepository.sumActiveByDocument(invoice)).thenReturn(new BigDecimal("300.00"));
    when(documentRepository.save(invoice)).thenReturn(invoice);

    DocumentSettlement settlement =
        balanceService.recordSettlement(invoice, new BigDecimal("300.00"), LocalDate.now(), null);

    assertNull(settlement.getAllocationRecord());
    assertTrue(invoice.isSettled());
  }

  @Test
  void voidSettlement_ReopensDocument() {
    // Given - fully settled invoice
    invoice.applySettledAmount(new BigDecimal("300.00"));
    DocumentSettlement settlement =
        new DocumentSettlement(invoice, new BigDecimal("300.00"), LocalDate.now());
    when(settlementRepository.sumActiveByDocument(invoice)).thenReturn(BigDecimal.ZERO);
    when(documentRepository.save(invoice)).thenReturn(invoice);

    // When
    balanceService.voidSettlement(settlement);

    // Then
    assertTrue(settlement.isVoided());
    assertEquals(Document.SettlementStatus.OPEN, invoice.getStatus());
    verify(settlementRepository).save(settlement);
  }

  @Test
  void listOutstanding_Receipt_FiltersFullySettledInvoices() {
    SalesInvoice settled =
        new SalesInvoice(
            company, customer, "INV-002", LocalDate.of(2026, 1, 5), new BigDecimal("50.00"));
    settled.setId(2L);
    when(documentRepository.findInvoicesByContact(customer)).thenReturn(List.of(settled, invoice));
    when(settlementRepository.sumActiveByDocument(settled)).thenReturn(new BigDecimal("50.00"));
    when(settlementRepository.sumActiveByDocument(invoice)).thenReturn(BigDecimal.ZERO);

    List<Document> outstanding =
        balanceService.listOutstanding(customer, AllocationDirection.RECEIPT);

    assertEquals(List.of(invoice), outstanding);
    verify(documentRepository, never()).findBillsByContact(any());
  }

  @Test
  void lockDocument_Unknown_NotFound() {
    when(documentRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

    assertThrows(ResourceNotFoundException.class, () -> balanceService.lockDocument(99L));
  }

  @Test
  void lockDocument_ReloadsInstanceAfterLocking() {
    // Given
    when(documentRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(invoice));

    // When
    Document locked = balanceService.lockDocument(1L);

    // Then - the copy already held by the caller is reloaded once the row lock is held
    assertSame(invoice, locked);
    InOrder order = inOrder(documentRepository, entityManager);
    order.verify(documentRepository).findByIdForUpdate(1L);
    order.verify(entityManager).refresh(invoice);
  }
}
